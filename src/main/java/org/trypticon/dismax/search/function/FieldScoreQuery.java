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
package org.trypticon.dismax.search.function;

/**
 * A query that scores each document as the value of the numeric input field.
 * <p>
 * The query matches all documents, and scores each document according to the numeric
 * value of that field.
 * <p>
 * It is assumed, and expected, that:
 * <ul>
 *  <li>The field used here is indexed, and has exactly
 *      one token in every scored document.</li>
 *  <li>Best if this field is un_tokenized.</li>
 *  <li>That token is parseable to the selected type.</li>
 * </ul>
 * <p>
 * Combining this query in a DisjunctionMaxQuery allows much freedom to affect
 * document scores.
 * <p>
 * <b>Note</b>: The internal {@link org.trypticon.dismax.search.FieldCache FieldCache}
 * is used for loading the values, so they are loaded once per reader.
 */
public class FieldScoreQuery extends ValueSourceQuery {

  /**
   * Type of score field, indicating how field values are interpreted/parsed.
   */
  public enum Type {
    /** field values are interpreted as numeric byte values. */
    BYTE,

    /** field values are interpreted as numeric short values. */
    SHORT,

    /** field values are interpreted as numeric int values. */
    INT,

    /** field values are interpreted as numeric float values. */
    FLOAT;

    // create the appropriate (cached) field value source.
    ValueSource createValueSource(String field) {
      switch (this) {
        case BYTE:
          return new ByteFieldSource(field);
        case SHORT:
          return new ShortFieldSource(field);
        case INT:
          return new IntFieldSource(field);
        case FLOAT:
          return new FloatFieldSource(field);
        default:
          throw new IllegalArgumentException(this + " is not a known Field Score Query Type!");
      }
    }
  }

  /**
   * Create a FieldScoreQuery - a query that scores each document as the value of the numeric input field.
   * @param field the numeric field to be used.
   * @param type the type of the field: either
   * {@link Type#BYTE}, {@link Type#SHORT}, {@link Type#INT}, or {@link Type#FLOAT}.
   */
  public FieldScoreQuery(String field, Type type) {
    super(type.createValueSource(field));
  }

}
