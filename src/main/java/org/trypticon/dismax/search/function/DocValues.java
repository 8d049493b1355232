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

import org.trypticon.dismax.search.Explanation;

/**
 * Expert: represents field values as different types.
 * Normally created via a {@link ValueSource} for a particular field and reader.
 */
public abstract class DocValues {
  /*
   * DocValues is distinct from ValueSource because
   * there needs to be an object created at query evaluation time that
   * is not referenced by the query itself because:
   * - Query objects should be MT safe
   * - For caching, Query objects are often used as keys... you don't
   *   want the Query carrying around big objects
   */

  /**
   * Return doc value as a float.
   * <P>Mandatory: every DocValues implementation must implement at least this method.
   * @param doc document whose float value is requested.
   */
  public abstract float floatVal(int doc);

  /**
   * Return doc value as an int.
   * <P>Optional: DocValues implementation can (but don't have to) override this method.
   * @param doc document whose int value is requested.
   */
  public int intVal(int doc) {
    return (int) floatVal(doc);
  }

  /**
   * Return doc value as a long.
   * @param doc document whose long value is requested.
   */
  public long longVal(int doc) {
    return (long) floatVal(doc);
  }

  /**
   * Return doc value as a double.
   * @param doc document whose double value is requested.
   */
  public double doubleVal(int doc) {
    return floatVal(doc);
  }

  /**
   * Return doc value as a string.
   * @param doc document whose string value is requested.
   */
  public String strVal(int doc) {
    return Float.toString(floatVal(doc));
  }

  /**
   * Return a string representation of a doc value, as required for Explanations.
   */
  public abstract String toString(int doc);

  /**
   * Explain the scoring value for the input doc.
   */
  public Explanation explain(int doc) {
    return new Explanation(floatVal(doc), toString(doc));
  }

  /**
   * Expert: for test purposes only, return the inner array of values, or null if not applicable.
   */
  Object getInnerArray() {
    throw new UnsupportedOperationException("this optional method is for test purposes only");
  }
}
