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

/**
 * This abstract class defines methods to iterate over a set of increasing
 * doc ids. {@link #NO_MORE_DOCS} is used as a sentinel once the iterator is
 * exhausted, so implementations must consider {@link Integer#MAX_VALUE} an
 * invalid doc id.
 * <p>
 * An iterator only ever moves forward: it starts unpositioned ({@link #docID()}
 * returns -1), then goes through strictly increasing doc ids until it returns
 * {@link #NO_MORE_DOCS}, which it keeps returning from then on.
 */
public abstract class DocIdSetIterator {

  /**
   * When returned by {@link #nextDoc()}, {@link #advance(int)} and
   * {@link #docID()} it means there are no more docs in the iterator.
   */
  public static final int NO_MORE_DOCS = Integer.MAX_VALUE;

  /**
   * Returns the following:
   * <ul>
   * <li>-1 if {@link #nextDoc()} or {@link #advance(int)} were not called yet.
   * <li>{@link #NO_MORE_DOCS} if the iterator has exhausted.
   * <li>Otherwise the doc ID it is currently on.
   * </ul>
   */
  public abstract int docID();

  /**
   * Advances to the next document in the set and returns the doc it is
   * currently on, or {@link #NO_MORE_DOCS} if there are no more docs in the
   * set. Once exhausted, every further call returns {@link #NO_MORE_DOCS}.
   */
  public abstract int nextDoc() throws IOException;

  /**
   * Advances to the first document whose number is greater than or equal to
   * <i>target</i>, and returns it, or {@link #NO_MORE_DOCS} if there is none.
   * <p>
   * Behaves as if written:
   *
   * <pre>
   * int advance(int target) {
   *   int doc;
   *   while ((doc = nextDoc()) &lt; target) {
   *   }
   *   return doc;
   * }
   * </pre>
   *
   * Some implementations are considerably more efficient than that.
   * Callers should only pass a target greater than the current doc.
   */
  public abstract int advance(int target) throws IOException;

}
