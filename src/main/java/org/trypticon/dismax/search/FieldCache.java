/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
*/
package org.trypticon.dismax.search;

import java.io.IOException;

import org.trypticon.dismax.InfoStream;
import org.trypticon.dismax.index.IndexReader;

/**
 * Expert: Maintains caches of term values, one value per document.
 *
 * <p>Each array is indexed by document number within the reader it was
 * built from. A document without a term in the field gets the type's zero.
 * When a document has several terms in the field, the greatest term (in term
 * order) wins. Entries are dropped when their reader is closed.
 */
public interface FieldCache {

  /**
   * Marker interface as super-interface to all parsers.
   */
  public interface Parser {
  }

  /** Interface to parse bytes from document fields.
   * @see FieldCache#getBytes(IndexReader, String, FieldCache.ByteParser)
   */
  public interface ByteParser extends Parser {
    /** Return a single Byte representation of this field's value. */
    public byte parseByte(String string);
  }

  /** Interface to parse shorts from document fields.
   * @see FieldCache#getShorts(IndexReader, String, FieldCache.ShortParser)
   */
  public interface ShortParser extends Parser {
    /** Return a short representation of this field's value. */
    public short parseShort(String string);
  }

  /** Interface to parse ints from document fields.
   * @see FieldCache#getInts(IndexReader, String, FieldCache.IntParser)
   */
  public interface IntParser extends Parser {
    /** Return an integer representation of this field's value. */
    public int parseInt(String string);
  }

  /** Interface to parse floats from document fields.
   * @see FieldCache#getFloats(IndexReader, String, FieldCache.FloatParser)
   */
  public interface FloatParser extends Parser {
    /** Return an float representation of this field's value. */
    public float parseFloat(String string);
  }

  /** Interface to parse long from document fields.
   * @see FieldCache#getLongs(IndexReader, String, FieldCache.LongParser)
   */
  public interface LongParser extends Parser {
    /** Return an long representation of this field's value. */
    public long parseLong(String string);
  }

  /** Interface to parse doubles from document fields.
   * @see FieldCache#getDoubles(IndexReader, String, FieldCache.DoubleParser)
   */
  public interface DoubleParser extends Parser {
    /** Return an double representation of this field's value. */
    public double parseDouble(String string);
  }

  /** Expert: The cache used internally by sorting and range query classes. */
  public static final FieldCache DEFAULT = new FieldCacheImpl();

  /** The default parser for byte values, which are encoded by {@link Byte#toString(byte)} */
  public static final ByteParser DEFAULT_BYTE_PARSER = new ByteParser() {
    @Override
    public byte parseByte(String value) {
      return Byte.parseByte(value);
    }
    @Override
    public String toString() {
      return FieldCache.class.getName()+".DEFAULT_BYTE_PARSER";
    }
  };

  /** The default parser for short values, which are encoded by {@link Short#toString(short)} */
  public static final ShortParser DEFAULT_SHORT_PARSER = new ShortParser() {
    @Override
    public short parseShort(String value) {
      return Short.parseShort(value);
    }
    @Override
    public String toString() {
      return FieldCache.class.getName()+".DEFAULT_SHORT_PARSER";
    }
  };

  /** The default parser for int values, which are encoded by {@link Integer#toString(int)} */
  public static final IntParser DEFAULT_INT_PARSER = new IntParser() {
    @Override
    public int parseInt(String value) {
      return Integer.parseInt(value);
    }
    @Override
    public String toString() {
      return FieldCache.class.getName()+".DEFAULT_INT_PARSER";
    }
  };

  /** The default parser for float values, which are encoded by {@link Float#toString(float)} */
  public static final FloatParser DEFAULT_FLOAT_PARSER = new FloatParser() {
    @Override
    public float parseFloat(String value) {
      return Float.parseFloat(value);
    }
    @Override
    public String toString() {
      return FieldCache.class.getName()+".DEFAULT_FLOAT_PARSER";
    }
  };

  /** The default parser for long values, which are encoded by {@link Long#toString(long)} */
  public static final LongParser DEFAULT_LONG_PARSER = new LongParser() {
    @Override
    public long parseLong(String value) {
      return Long.parseLong(value);
    }
    @Override
    public String toString() {
      return FieldCache.class.getName()+".DEFAULT_LONG_PARSER";
    }
  };

  /** The default parser for double values, which are encoded by {@link Double#toString(double)} */
  public static final DoubleParser DEFAULT_DOUBLE_PARSER = new DoubleParser() {
    @Override
    public double parseDouble(String value) {
      return Double.parseDouble(value);
    }
    @Override
    public String toString() {
      return FieldCache.class.getName()+".DEFAULT_DOUBLE_PARSER";
    }
  };

  /** Checks the internal cache for an appropriate entry, and if none is
   * found, reads the terms in <code>field</code> as a single byte and returns an array
   * of size <code>reader.maxDoc()</code> of the value each document
   * has in the given field.
   * @param reader  Used to get field values.
   * @param field   Which field contains the single byte values.
   * @return The values in the given field for each document.
   * @throws IOException  If any error occurs.
   * @throws NumberFormatException if a term is not a valid byte.
   */
  public byte[] getBytes (IndexReader reader, String field)
  throws IOException;

  /** As {@link #getBytes(IndexReader, String)}, using the given parser;
   * a null parser means {@link #DEFAULT_BYTE_PARSER}. */
  public byte[] getBytes (IndexReader reader, String field, ByteParser parser)
  throws IOException;

  /** Reads the terms in <code>field</code> as shorts.
   * @see #getBytes(IndexReader, String) */
  public short[] getShorts (IndexReader reader, String field)
  throws IOException;

  public short[] getShorts (IndexReader reader, String field, ShortParser parser)
  throws IOException;

  /** Reads the terms in <code>field</code> as integers.
   * @see #getBytes(IndexReader, String) */
  public int[] getInts (IndexReader reader, String field)
  throws IOException;

  public int[] getInts (IndexReader reader, String field, IntParser parser)
  throws IOException;

  /** Reads the terms in <code>field</code> as floats.
   * @see #getBytes(IndexReader, String) */
  public float[] getFloats (IndexReader reader, String field)
  throws IOException;

  public float[] getFloats (IndexReader reader, String field,
                            FloatParser parser) throws IOException;

  /** Reads the terms in <code>field</code> as longs.
   * @see #getBytes(IndexReader, String) */
  public long[] getLongs(IndexReader reader, String field)
          throws IOException;

  public long[] getLongs(IndexReader reader, String field, LongParser parser)
          throws IOException;

  /** Reads the terms in <code>field</code> as doubles.
   * @see #getBytes(IndexReader, String) */
  public double[] getDoubles(IndexReader reader, String field)
          throws IOException;

  public double[] getDoubles(IndexReader reader, String field, DoubleParser parser)
          throws IOException;

  /**
   * EXPERT: Instructs the FieldCache to forcibly expunge all entries
   * from the underlying caches.
   */
  public abstract void purgeAllCaches();

  /**
   * Expert: drops all cache entries associated with this
   * reader.
   */
  public abstract void purge(IndexReader r);

  /**
   * If non-null, FieldCacheImpl will report every cache fill
   * to this stream under the component {@code "FC"}.
   */
  public void setInfoStream(InfoStream stream);

  /** counterpart of {@link #setInfoStream(InfoStream)} */
  public InfoStream getInfoStream();
}
