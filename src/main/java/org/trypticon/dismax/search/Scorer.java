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
 * Expert: Common scoring functionality for different types of queries.
 *
 * <p>
 * A <code>Scorer</code> iterates over documents matching a
 * query in increasing order of doc Id.
 * </p>
 * <p>
 * {@link #score()} is only valid while the scorer is positioned on a document,
 * that is after {@link #nextDoc()} or {@link #advance(int)} returned a doc id
 * other than {@link #NO_MORE_DOCS}. Calling it more than once for the same
 * document returns the same value.
 * </p>
 */
public abstract class Scorer extends DocIdSetIterator {
  protected final Weight weight;

  /**
   * Constructs a Scorer.
   * @param weight The scorer's parent Weight. May be null for scorers built
   *   outside of a query, e.g. in tests.
   */
  protected Scorer(Weight weight) {
    this.weight = weight;
  }

  /** Returns the parent Weight, or null. */
  public Weight getWeight() {
    return weight;
  }

  /** Scores and collects all matching documents.
   * @param collector The collector to which all matching documents are passed.
   */
  public void score(Collector collector) throws IOException {
    collector.setScorer(this);
    int doc;
    while ((doc = nextDoc()) != NO_MORE_DOCS) {
      collector.collect(doc);
    }
  }

  /** Returns the score of the current document matching the query. */
  public abstract float score() throws IOException;

  /** Returns number of matches for the current document. */
  public float freq() throws IOException {
    throw new UnsupportedOperationException(this + " does not implement freq()");
  }
}
