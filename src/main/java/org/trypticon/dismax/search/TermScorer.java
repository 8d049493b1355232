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

import org.trypticon.dismax.index.TermDocs;

/** Expert: A <code>Scorer</code> for documents matching a <code>Term</code>.
 */
final class TermScorer extends Scorer {
  private final TermDocs termDocs;
  private final Similarity similarity;
  private final float weightValue;
  private int doc = -1;
  private int freq;

  /**
   * Construct a <code>TermScorer</code>.
   *
   * @param weight
   *          The weight of the <code>Term</code> in the query.
   * @param td
   *          An iterator over the documents matching the <code>Term</code>.
   * @param similarity
   *          The <code>Similarity</code> implementation to be used for score
   *          computations.
   */
  TermScorer(Weight weight, TermDocs td, Similarity similarity) {
    super(weight);
    this.termDocs = td;
    this.similarity = similarity;
    this.weightValue = weight.getValue();
  }

  @Override
  public int docID() {
    return doc;
  }

  @Override
  public float freq() {
    return freq;
  }

  @Override
  public int nextDoc() throws IOException {
    if (doc == NO_MORE_DOCS) {
      return doc;
    }
    if (!termDocs.next()) {
      termDocs.close();
      return doc = NO_MORE_DOCS;
    }
    doc = termDocs.doc();
    freq = termDocs.freq();
    return doc;
  }

  @Override
  public float score() {
    assert doc != -1 && doc != NO_MORE_DOCS;
    return similarity.tf(freq) * weightValue;
  }

  @Override
  public int advance(int target) throws IOException {
    if (doc == NO_MORE_DOCS || (doc != -1 && doc >= target)) {
      return doc;
    }
    if (!termDocs.skipTo(target)) {
      termDocs.close();
      return doc = NO_MORE_DOCS;
    }
    doc = termDocs.doc();
    freq = termDocs.freq();
    return doc;
  }

  @Override
  public String toString() { return "scorer(" + weight + ")"; }
}
