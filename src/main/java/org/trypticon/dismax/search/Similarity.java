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

/**
 * Expert: Scoring API.
 *
 * <p>Similarity defines the factors leaf scorers multiply together, such as
 * {@link #tf(float)} and {@link #idf(int, int)}, plus the {@link #queryNorm(float)}
 * applied to a query's weights. How sub-scores are combined is left to the
 * combining scorers.
 *
 * @see DefaultSimilarity
 */
public abstract class Similarity {

  /** Computes the normalization value for a query given the sum of the squared
   * weights of each of the query terms.
   */
  public abstract float queryNorm(float sumOfSquaredWeights);

  /** Computes a score factor based on a term or phrase's frequency in a
   * document.
   */
  public float tf(int freq) {
    return tf((float)freq);
  }

  /** Computes a score factor based on a term or phrase's frequency in a
   * document.
   */
  public abstract float tf(float freq);

  /** Computes a score factor based on a term's document frequency (the number
   * of documents which contain the term).
   *
   * @param docFreq the number of documents which contain the term
   * @param numDocs the total number of documents in the collection
   * @return a score factor based on the term's document frequency
   */
  public abstract float idf(int docFreq, int numDocs);
}
