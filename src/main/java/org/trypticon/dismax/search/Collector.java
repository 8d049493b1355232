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
 * Expert: Collectors are primarily meant to be used to
 * gather raw results from a search, and implement sorting
 * or custom result filtering, collation, etc.
 *
 * <p>{@link IndexSearcher} calls {@link #setNextReader} once per reader
 * it searches, then {@link #setScorer} with the top-level scorer, then
 * {@link #collect} for every matching document, in increasing doc order.</p>
 */
public abstract class Collector {

  /**
   * Called before successive calls to {@link #collect(int)}. Implementations
   * that need the score of the current document should keep the passed-in
   * scorer and call {@link Scorer#score()} from {@link #collect(int)}.
   */
  public abstract void setScorer(Scorer scorer) throws IOException;

  /**
   * Called once for every document matching a query, with the unbased document
   * number.
   */
  public abstract void collect(int doc) throws IOException;

  /**
   * Called before collecting from each reader. All doc ids in
   * {@link #collect(int)} will correspond to this reader; add docBase to get
   * the id in the searcher's overall doc space.
   *
   * @param reader the next reader
   * @param docBase the doc base of that reader
   */
  public abstract void setNextReader(IndexReader reader, int docBase) throws IOException;

}
