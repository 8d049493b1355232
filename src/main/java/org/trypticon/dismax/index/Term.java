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
package org.trypticon.dismax.index;

import java.util.Objects;

/**
  A Term represents a word from text.  This is the unit of search.  It is
  composed of two elements, the text of the word, as a string, and the name of
  the field that the text occurred in.
  <p>
  Terms sort by field name first, then by text.
  */
public final class Term implements Comparable<Term> {
  private final String field;
  private final String text;

  /** Constructs a Term with the given field and text. */
  public Term(String fld, String txt) {
    field = Objects.requireNonNull(fld, "field");
    text = Objects.requireNonNull(txt, "text");
  }

  /** Constructs a Term with the given field and empty text.
   * This serves two purposes: 1) reuse of a Term with the same field.
   * 2) pattern for a query, e.g. as the starting point of
   * {@link IndexReader#terms(Term)}.
   */
  public Term(String fld) {
    this(fld, "");
  }

  /** Returns the field of this term. */
  public String field() { return field; }

  /** Returns the text of this term. */
  public String text() { return text; }

  /** Creates a new Term with the same field as this one and the given text. */
  public Term createTerm(String text) {
    return new Term(field, text);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Term other = (Term) obj;
    return field.equals(other.field) && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + field.hashCode();
    result = prime * result + text.hashCode();
    return result;
  }

  @Override
  public int compareTo(Term other) {
    int cmp = field.compareTo(other.field);
    return cmp != 0 ? cmp : text.compareTo(other.text);
  }

  @Override
  public String toString() { return field + ":" + text; }
}
