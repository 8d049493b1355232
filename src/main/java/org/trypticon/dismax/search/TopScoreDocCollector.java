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

import org.trypticon.dismax.index.IndexReader;

/**
 * A {@link Collector} implementation that collects the top-scoring hits,
 * returning them as a {@link TopDocs}. Hits are sorted by score descending
 * and then (when the scores are tied) docID ascending.
 *
 * <p><b>NOTE</b>: This collector cannot handle scores that are NaN or
 * negative infinity.
 */
public final class TopScoreDocCollector extends Collector {

  private final HitQueue pq;
  private final int numHits;
  private int totalHits;
  private int docBase;
  private Scorer scorer;

  /**
   * Creates a new {@link TopScoreDocCollector} given the number of hits to
   * collect.
   *
   * @throws IllegalArgumentException if numHits is not positive
   */
  public static TopScoreDocCollector create(int numHits) {
    if (numHits <= 0) {
      throw new IllegalArgumentException("numHits must be > 0");
    }
    return new TopScoreDocCollector(numHits);
  }

  private TopScoreDocCollector(int numHits) {
    this.numHits = numHits;
    pq = new HitQueue(numHits);
  }

  @Override
  public void setScorer(Scorer scorer) {
    this.scorer = scorer;
  }

  @Override
  public void setNextReader(IndexReader reader, int base) {
    docBase = base;
  }

  @Override
  public void collect(int doc) throws IOException {
    float score = scorer.score();

    // This collector cannot handle these scores:
    assert score != Float.NEGATIVE_INFINITY;
    assert !Float.isNaN(score);

    totalHits++;
    if (pq.size() == numHits) {
      ScoreDoc top = pq.top();
      // Docs arrive in increasing order, so an equal score cannot compete.
      if (score <= top.score) {
        return;
      }
      top.doc = doc + docBase;
      top.score = score;
      pq.updateTop();
    } else {
      pq.add(new ScoreDoc(doc + docBase, score));
    }
  }

  /** The total number of documents that matched this query. */
  public int getTotalHits() {
    return totalHits;
  }

  /** Returns the collected hits, best first. Drains the collector. */
  public TopDocs topDocs() {
    if (pq.size() == 0) {
      return new TopDocs(totalHits, new ScoreDoc[0], Float.NaN);
    }
    ScoreDoc[] results = new ScoreDoc[pq.size()];
    for (int i = results.length - 1; i >= 0; i--) {
      results[i] = pq.pop();
    }
    return new TopDocs(totalHits, results, results[0].score);
  }
}
