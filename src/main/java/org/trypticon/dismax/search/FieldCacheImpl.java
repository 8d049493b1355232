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
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;

import org.trypticon.dismax.InfoStream;
import org.trypticon.dismax.index.IndexReader;
import org.trypticon.dismax.index.Term;
import org.trypticon.dismax.index.TermDocs;
import org.trypticon.dismax.index.TermEnum;

/**
 * Expert: The default cache implementation, storing all values in memory.
 * A WeakHashMap keyed on {@link IndexReader#getCoreCacheKey()} is used for storage,
 * and entries are purged eagerly when their reader is closed.
 */
class FieldCacheImpl implements FieldCache {
  private static final String COMPONENT = "FC";

  private Map<Class<?>,Cache<?>> caches;
  private final Set<IndexReader> listenedReaders =
      Collections.newSetFromMap(new WeakHashMap<IndexReader, Boolean>());
  private final IndexReader.ReaderClosedListener purgeListener = new IndexReader.ReaderClosedListener() {
    @Override
    public void onClose(IndexReader reader) {
      purge(reader);
    }
  };
  private volatile InfoStream infoStream = InfoStream.NO_OUTPUT;

  FieldCacheImpl() {
    init();
  }

  private synchronized void init() {
    Map<Class<?>,Cache<?>> caches = new HashMap<Class<?>,Cache<?>>(9);
    caches.put(Byte.TYPE, new ByteCache(this));
    caches.put(Short.TYPE, new ShortCache(this));
    caches.put(Integer.TYPE, new IntCache(this));
    caches.put(Float.TYPE, new FloatCache(this));
    caches.put(Long.TYPE, new LongCache(this));
    caches.put(Double.TYPE, new DoubleCache(this));
    this.caches = caches;
  }

  @Override
  public synchronized void purgeAllCaches() {
    init();
  }

  @Override
  public synchronized void purge(IndexReader r) {
    for(Cache<?> c : caches.values()) {
      c.purge(r);
    }
  }

  @Override
  public void setInfoStream(InfoStream stream) {
    infoStream = stream == null ? InfoStream.NO_OUTPUT : stream;
  }

  @Override
  public InfoStream getInfoStream() {
    return infoStream;
  }

  private synchronized <T> Cache<T> cache(Class<?> type) {
    @SuppressWarnings("unchecked")
    Cache<T> cache = (Cache<T>) caches.get(type);
    return cache;
  }

  // Purges the reader's entries when it closes; registers once per reader.
  private void listenForClose(IndexReader reader) {
    synchronized (listenedReaders) {
      if (listenedReaders.add(reader)) {
        reader.addReaderClosedListener(purgeListener);
      }
    }
  }

  /** Receives each term of a field with the postings of that term. */
  interface TermVisitor {
    void visit(String text, TermDocs termDocs) throws IOException;
  }

  /** Calls the visitor for every term in <code>field</code>, in term order. */
  static void visitTerms(IndexReader reader, String field, TermVisitor visitor) throws IOException {
    TermEnum termEnum = reader.terms(new Term(field));
    try {
      for (Term term = termEnum.term(); term != null && term.field().equals(field);
           term = termEnum.next() ? termEnum.term() : null) {
        TermDocs termDocs = reader.termDocs(term);
        try {
          visitor.visit(term.text(), termDocs);
        } finally {
          termDocs.close();
        }
      }
    } finally {
      termEnum.close();
    }
  }

  /** Expert: Internal cache. */
  abstract static class Cache<T> {
    final FieldCacheImpl wrapper;
    final Map<Object,Map<Entry,Object>> readerCache = new WeakHashMap<Object,Map<Entry,Object>>();

    Cache(FieldCacheImpl wrapper) {
      this.wrapper = wrapper;
    }

    protected abstract T createValue(IndexReader reader, Entry key)
        throws IOException;

    /** Remove this reader from the cache, if present. */
    void purge(IndexReader r) {
      Object readerKey = r.getCoreCacheKey();
      synchronized(readerCache) {
        readerCache.remove(readerKey);
      }
    }

    @SuppressWarnings("unchecked")
    public T get(IndexReader reader, Entry key) throws IOException {
      Map<Entry,Object> innerCache;
      Object value;
      final Object readerKey = reader.getCoreCacheKey();
      synchronized (readerCache) {
        innerCache = readerCache.get(readerKey);
        if (innerCache == null) {
          innerCache = new HashMap<Entry,Object>();
          readerCache.put(readerKey, innerCache);
          value = null;
        } else {
          value = innerCache.get(key);
        }
        if (value == null) {
          value = new CreationPlaceholder();
          innerCache.put(key, value);
        }
      }
      if (value instanceof CreationPlaceholder) {
        synchronized (value) {
          CreationPlaceholder progress = (CreationPlaceholder) value;
          if (progress.value == null) {
            wrapper.listenForClose(reader);
            try {
              progress.value = createValue(reader, key);
            } catch (IOException | RuntimeException e) {
              // don't leave a placeholder behind for a failed fill
              synchronized (readerCache) {
                innerCache.remove(key);
              }
              throw e;
            }
            synchronized (readerCache) {
              innerCache.put(key, progress.value);
            }
            InfoStream infoStream = wrapper.getInfoStream();
            if (infoStream.isEnabled(COMPONENT)) {
              infoStream.message(COMPONENT, "filled " + getClass().getSimpleName() + " for field '"
                  + key.field + "' with " + reader.maxDoc() + " docs of " + reader);
            }
          }
          return (T) progress.value;
        }
      }
      return (T) value;
    }
  }

  static final class CreationPlaceholder {
    Object value;
  }

  /** Expert: Every composite-key in the internal cache is of this type. */
  static class Entry {
    final String field;        // which field
    final Object custom;       // which parser

    /** Creates one of these objects for a custom parser. */
    Entry (String field, Object custom) {
      this.field = field;
      this.custom = custom;
    }

    /** Two of these are equal iff they reference the same field and parser. */
    @Override
    public boolean equals (Object o) {
      if (o instanceof Entry) {
        Entry other = (Entry) o;
        if (other.field.equals(field)) {
          if (other.custom == null) {
            if (custom == null) return true;
          } else if (other.custom.equals (custom)) {
            return true;
          }
        }
      }
      return false;
    }

    /** Composes a hashcode based on the field and parser. */
    @Override
    public int hashCode() {
      return field.hashCode() ^ (custom==null ? 0 : custom.hashCode());
    }
  }

  // inherit javadocs
  @Override
  public byte[] getBytes (IndexReader reader, String field) throws IOException {
    return getBytes(reader, field, null);
  }

  // inherit javadocs
  @Override
  public byte[] getBytes(IndexReader reader, String field, ByteParser parser)
      throws IOException {
    return this.<byte[]>cache(Byte.TYPE).get(reader, new Entry(field, parser));
  }

  static final class ByteCache extends Cache<byte[]> {
    ByteCache(FieldCacheImpl wrapper) {
      super(wrapper);
    }
    @Override
    protected byte[] createValue(IndexReader reader, Entry entry)
        throws IOException {
      final ByteParser parser = (ByteParser) entry.custom;
      if (parser == null) {
        return wrapper.getBytes(reader, entry.field, FieldCache.DEFAULT_BYTE_PARSER);
      }
      final byte[] retArray = new byte[reader.maxDoc()];
      visitTerms(reader, entry.field, (text, termDocs) -> {
        byte termval = parser.parseByte(text);
        while (termDocs.next()) {
          retArray[termDocs.doc()] = termval;
        }
      });
      return retArray;
    }
  }

  // inherit javadocs
  @Override
  public short[] getShorts (IndexReader reader, String field) throws IOException {
    return getShorts(reader, field, null);
  }

  // inherit javadocs
  @Override
  public short[] getShorts(IndexReader reader, String field, ShortParser parser)
      throws IOException {
    return this.<short[]>cache(Short.TYPE).get(reader, new Entry(field, parser));
  }

  static final class ShortCache extends Cache<short[]> {
    ShortCache(FieldCacheImpl wrapper) {
      super(wrapper);
    }

    @Override
    protected short[] createValue(IndexReader reader, Entry entry)
        throws IOException {
      final ShortParser parser = (ShortParser) entry.custom;
      if (parser == null) {
        return wrapper.getShorts(reader, entry.field, FieldCache.DEFAULT_SHORT_PARSER);
      }
      final short[] retArray = new short[reader.maxDoc()];
      visitTerms(reader, entry.field, (text, termDocs) -> {
        short termval = parser.parseShort(text);
        while (termDocs.next()) {
          retArray[termDocs.doc()] = termval;
        }
      });
      return retArray;
    }
  }

  // inherit javadocs
  @Override
  public int[] getInts (IndexReader reader, String field) throws IOException {
    return getInts(reader, field, null);
  }

  // inherit javadocs
  @Override
  public int[] getInts(IndexReader reader, String field, IntParser parser)
      throws IOException {
    return this.<int[]>cache(Integer.TYPE).get(reader, new Entry(field, parser));
  }

  static final class IntCache extends Cache<int[]> {
    IntCache(FieldCacheImpl wrapper) {
      super(wrapper);
    }

    @Override
    protected int[] createValue(IndexReader reader, Entry entry)
        throws IOException {
      final IntParser parser = (IntParser) entry.custom;
      if (parser == null) {
        return wrapper.getInts(reader, entry.field, FieldCache.DEFAULT_INT_PARSER);
      }
      final int[] retArray = new int[reader.maxDoc()];
      visitTerms(reader, entry.field, (text, termDocs) -> {
        int termval = parser.parseInt(text);
        while (termDocs.next()) {
          retArray[termDocs.doc()] = termval;
        }
      });
      return retArray;
    }
  }

  // inherit javadocs
  @Override
  public float[] getFloats (IndexReader reader, String field)
    throws IOException {
    return getFloats(reader, field, null);
  }

  // inherit javadocs
  @Override
  public float[] getFloats(IndexReader reader, String field, FloatParser parser)
    throws IOException {
    return this.<float[]>cache(Float.TYPE).get(reader, new Entry(field, parser));
  }

  static final class FloatCache extends Cache<float[]> {
    FloatCache(FieldCacheImpl wrapper) {
      super(wrapper);
    }

    @Override
    protected float[] createValue(IndexReader reader, Entry entry)
        throws IOException {
      final FloatParser parser = (FloatParser) entry.custom;
      if (parser == null) {
        return wrapper.getFloats(reader, entry.field, FieldCache.DEFAULT_FLOAT_PARSER);
      }
      final float[] retArray = new float[reader.maxDoc()];
      visitTerms(reader, entry.field, (text, termDocs) -> {
        float termval = parser.parseFloat(text);
        while (termDocs.next()) {
          retArray[termDocs.doc()] = termval;
        }
      });
      return retArray;
    }
  }

  // inherit javadocs
  @Override
  public long[] getLongs(IndexReader reader, String field) throws IOException {
    return getLongs(reader, field, null);
  }

  // inherit javadocs
  @Override
  public long[] getLongs(IndexReader reader, String field, LongParser parser)
      throws IOException {
    return this.<long[]>cache(Long.TYPE).get(reader, new Entry(field, parser));
  }

  static final class LongCache extends Cache<long[]> {
    LongCache(FieldCacheImpl wrapper) {
      super(wrapper);
    }

    @Override
    protected long[] createValue(IndexReader reader, Entry entry)
        throws IOException {
      final LongParser parser = (LongParser) entry.custom;
      if (parser == null) {
        return wrapper.getLongs(reader, entry.field, FieldCache.DEFAULT_LONG_PARSER);
      }
      final long[] retArray = new long[reader.maxDoc()];
      visitTerms(reader, entry.field, (text, termDocs) -> {
        long termval = parser.parseLong(text);
        while (termDocs.next()) {
          retArray[termDocs.doc()] = termval;
        }
      });
      return retArray;
    }
  }

  // inherit javadocs
  @Override
  public double[] getDoubles(IndexReader reader, String field)
    throws IOException {
    return getDoubles(reader, field, null);
  }

  // inherit javadocs
  @Override
  public double[] getDoubles(IndexReader reader, String field, DoubleParser parser)
      throws IOException {
    return this.<double[]>cache(Double.TYPE).get(reader, new Entry(field, parser));
  }

  static final class DoubleCache extends Cache<double[]> {
    DoubleCache(FieldCacheImpl wrapper) {
      super(wrapper);
    }

    @Override
    protected double[] createValue(IndexReader reader, Entry entry)
        throws IOException {
      final DoubleParser parser = (DoubleParser) entry.custom;
      if (parser == null) {
        return wrapper.getDoubles(reader, entry.field, FieldCache.DEFAULT_DOUBLE_PARSER);
      }
      final double[] retArray = new double[reader.maxDoc()];
      visitTerms(reader, entry.field, (text, termDocs) -> {
        double termval = parser.parseDouble(text);
        while (termDocs.next()) {
          retArray[termDocs.doc()] = termval;
        }
      });
      return retArray;
    }
  }
}
