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
 * The Scorer for DisjunctionMaxQuery.  The union of all documents generated by the the subquery scorers
 * is generated in document number order.  The score for each document is the maximum of the scores computed
 * by the subquery scorers that generate that document, plus tieBreakerMultiplier times the sum of the scores
 * for the other subqueries that generate the document.
 */
public class DisjunctionMaxScorer extends Scorer {
  /* The scorers for subqueries that have remaining docs, kept as a min heap by number of next doc. */
  private final ScorerHeap subScorers;
  /* Multiplier applied to non-maximum-scoring subqueries for a document as they are summed into the result. */
  private final float tieBreakerMultiplier;
  private int doc = -1;

  /* Used when scoring currently matching doc. */
  private float scoreSum;
  private float scoreMax;

  /**
   * Creates a new instance of DisjunctionMaxScorer
   *
   * @param weight
   *          The Weight to be used. May be null.
   * @param tieBreakerMultiplier
   *          Multiplier applied to non-maximum-scoring subqueries for a
   *          document as they are summed into the result.
   * @param subScorers
   *          The sub scorers this Scorer should iterate on. Only scorers which
   *          have documents may be passed, and their nextDoc() must already
   *          have been called.
   * @param numScorers
   *          The actual number of scorers to iterate on. Note that the array's
   *          length may be larger than the actual number of scorers.
   */
  public DisjunctionMaxScorer(Weight weight, float tieBreakerMultiplier,
      Scorer[] subScorers, int numScorers) {
    super(weight);
    this.tieBreakerMultiplier = tieBreakerMultiplier;
    this.subScorers = new ScorerHeap(subScorers, numScorers);
  }

  @Override
  public int nextDoc() throws IOException {
    return doc = subScorers.nextDoc(doc);
  }

  @Override
  public int docID() {
    return doc;
  }

  @Override
  public int advance(int target) throws IOException {
    return doc = subScorers.advance(target);
  }

  /** Determine the current document score.  Initially invalid, until {@link #nextDoc()} is called the first time.
   * @return the score of the current generated document
   */
  @Override
  public float score() throws IOException {
    assert doc != -1 && doc != NO_MORE_DOCS;
    int doc = subScorers.top().docID();
    scoreSum = scoreMax = subScorers.top().score();
    int size = subScorers.size();
    scoreAll(1, size, doc);
    scoreAll(2, size, doc);
    return scoreMax + (scoreSum - scoreMax) * tieBreakerMultiplier;
  }

  // Recursively iterate all subScorers that generated last doc computing sum and max
  private void scoreAll(int root, int size, int doc) throws IOException {
    if (root < size && subScorers.get(root).docID() == doc) {
      float sub = subScorers.get(root).score();
      scoreSum += sub;
      scoreMax = Math.max(scoreMax, sub);
      scoreAll((root<<1)+1, size, doc);
      scoreAll((root<<1)+2, size, doc);
    }
  }

  @Override
  public float freq() throws IOException {
    assert doc != -1 && doc != NO_MORE_DOCS;
    int doc = subScorers.top().docID();
    int size = subScorers.size();
    return 1 + freq(1, size, doc) + freq(2, size, doc);
  }

  // Recursively count the subScorers that generated last doc
  private int freq(int root, int size, int doc) throws IOException {
    int freq = 0;
    if (root < size && subScorers.get(root).docID() == doc) {
      freq++;
      freq += freq((root<<1)+1, size, doc);
      freq += freq((root<<1)+2, size, doc);
    }
    return freq;
  }

  /** Number of sub-scorers which still have documents. */
  int numScorers() {
    return subScorers.size();
  }

  @Override
  public String toString() {
    return "DisjunctionMaxScorer(" + weight + ")";
  }
}
