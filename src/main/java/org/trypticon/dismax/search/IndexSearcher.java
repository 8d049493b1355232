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
import java.util.Locale;

import org.trypticon.dismax.InfoStream;
import org.trypticon.dismax.index.IndexReader;
import org.trypticon.dismax.index.Term;

/** Implements search over one or more IndexReaders.
 *
 * <p>Applications usually need only call the inherited
 * {@link #search(Query,int)} method. Sub-readers are searched one after
 * another; document numbers returned are offset by each sub-reader's
 * position, so they are unique across the whole searcher.
 *
 * <p>Collection statistics ({@link #docFreq(Term)}, {@link #maxDoc()}) are
 * summed across the sub-readers so scores are comparable between them.
 */
public class IndexSearcher {
  private static final String COMPONENT = "IS";

  protected final IndexReader[] subReaders;
  protected final int[] docStarts;
  private final int maxDoc;

  private Similarity similarity = new DefaultSimilarity();
  private InfoStream infoStream = InfoStream.NO_OUTPUT;

  /** Creates a searcher searching the provided index. */
  public IndexSearcher(IndexReader r) {
    this(new IndexReader[] { r });
  }

  /** Creates a searcher over the given sub-readers, in order. The first
   * sub-reader's documents are numbered from 0, the next one's from the
   * first's maxDoc, and so on. */
  public IndexSearcher(IndexReader[] subReaders) {
    if (subReaders.length == 0) {
      throw new IllegalArgumentException("at least one reader is required");
    }
    this.subReaders = subReaders.clone();
    this.docStarts = new int[subReaders.length];
    int maxDoc = 0;
    for (int i = 0; i < subReaders.length; i++) {
      docStarts[i] = maxDoc;
      maxDoc += subReaders[i].maxDoc();
    }
    this.maxDoc = maxDoc;
  }

  /** Returns the sub-readers searched, in doc id order. */
  public IndexReader[] getSubReaders() {
    return subReaders.clone();
  }

  /** Expert: Set the Similarity implementation used by this Searcher. */
  public void setSimilarity(Similarity similarity) {
    this.similarity = similarity;
  }

  /** Expert: Return the Similarity implementation used by this Searcher. */
  public Similarity getSimilarity() {
    return similarity;
  }

  /** Sets the stream that per-search diagnostics are written to. */
  public void setInfoStream(InfoStream infoStream) {
    this.infoStream = infoStream == null ? InfoStream.NO_OUTPUT : infoStream;
  }

  public InfoStream getInfoStream() {
    return infoStream;
  }

  /** Expert: Returns one greater than the largest possible document number. */
  public int maxDoc() {
    return maxDoc;
  }

  /** Expert: Returns the number of documents containing <code>term</code>,
   * across every sub-reader. */
  public int docFreq(Term term) throws IOException {
    int docFreq = 0;
    for (IndexReader subReader : subReaders) {
      docFreq += subReader.docFreq(term);
    }
    return docFreq;
  }

  /** Finds the top <code>n</code> hits for <code>query</code>.
   *
   * @throws IllegalArgumentException if n is not positive
   */
  public TopDocs search(Query query, int n) throws IOException {
    return search(createNormalizedWeight(query), n);
  }

  /** Lower-level search API.
   *
   * <p>{@link Collector#collect(int)} is called for every matching document.
   */
  public void search(Query query, Collector results) throws IOException {
    search(createNormalizedWeight(query), results);
  }

  /** Expert: Low-level search implementation. Each sub-reader is collected
   * separately and the per-reader hits are merged. */
  public TopDocs search(Weight weight, int nDocs) throws IOException {
    if (nDocs <= 0) {
      throw new IllegalArgumentException("nDocs must be > 0");
    }
    long start = System.nanoTime();
    TopDocs[] perReader = new TopDocs[subReaders.length];
    for (int i = 0; i < subReaders.length; i++) {
      int limit = Math.max(1, Math.min(nDocs, subReaders[i].maxDoc()));
      TopScoreDocCollector collector = TopScoreDocCollector.create(limit);
      collect(weight, i, collector);
      perReader[i] = collector.topDocs();
    }
    TopDocs topDocs = perReader.length == 1 ? perReader[0] : TopDocs.merge(nDocs, perReader);
    if (infoStream.isEnabled(COMPONENT)) {
      infoStream.message(COMPONENT, String.format(Locale.ROOT,
          "%s: %d total hits in %d readers, returned %d (%.1f ms)",
          weight.getQuery(), topDocs.totalHits, subReaders.length, topDocs.scoreDocs.length,
          (System.nanoTime() - start) / 1000000.0));
    }
    return topDocs;
  }

  /** Lower-level search API, feeding every sub-reader's hits to one collector. */
  public void search(Weight weight, Collector collector) throws IOException {
    for (int i = 0; i < subReaders.length; i++) { // search each subreader
      collect(weight, i, collector);
    }
  }

  private void collect(Weight weight, int readerIndex, Collector collector) throws IOException {
    IndexReader reader = subReaders[readerIndex];
    collector.setNextReader(reader, docStarts[readerIndex]);
    Scorer scorer = weight.scorer(reader);
    if (scorer == null) {
      if (infoStream.isEnabled(COMPONENT)) {
        infoStream.message(COMPONENT, "no scorer for reader " + readerIndex + ", skipping");
      }
      return;
    }
    scorer.score(collector);
  }

  /** Expert: called to re-write queries into primitive queries. */
  public Query rewrite(Query original) throws IOException {
    Query query = original;
    for (Query rewrittenQuery = query.rewrite(this); rewrittenQuery != query;
         rewrittenQuery = query.rewrite(this)) {
      query = rewrittenQuery;
    }
    return query;
  }

  /** Returns an Explanation that describes how <code>doc</code> scored against
   * <code>query</code>.
   *
   * <p>This is intended to be used in developing Similarity implementations,
   * and, for good performance, should not be displayed with every hit.
   * Computing an explanation is as expensive as executing the query over the
   * entire index.
   */
  public Explanation explain(Query query, int doc) throws IOException {
    return explain(createNormalizedWeight(query), doc);
  }

  /** Expert: low-level implementation method. */
  public Explanation explain(Weight weight, int doc) throws IOException {
    if (doc < 0 || doc >= maxDoc) {
      throw new IllegalArgumentException("doc " + doc + " is out of range [0, " + maxDoc + ")");
    }
    int n = subIndex(doc);
    int deBasedDoc = doc - docStarts[n];
    return weight.explain(subReaders[n], deBasedDoc);
  }

  /**
   * Creates a normalized weight for a top-level {@link Query}.
   * The query is rewritten by this method and {@link Query#createWeight} called,
   * afterwards the {@link Weight} is normalized. The returned {@code Weight}
   * can then directly be used to get a {@link Scorer}.
   */
  public Weight createNormalizedWeight(Query query) throws IOException {
    query = rewrite(query);
    Weight weight = query.createWeight(this);
    float sum = weight.sumOfSquaredWeights();
    float norm = query.getSimilarity(this).queryNorm(sum);
    if (Float.isInfinite(norm) || Float.isNaN(norm))
      norm = 1.0f;
    weight.normalize(norm);
    return weight;
  }

  // Index of the last sub-reader whose start is <= doc; empty readers share a start.
  private int subIndex(int doc) {
    int lo = 0;
    int hi = docStarts.length - 1;
    while (hi >= lo) {
      int mid = (lo + hi) >>> 1;
      int midValue = docStarts[mid];
      if (doc < midValue)
        hi = mid - 1;
      else if (doc > midValue)
        lo = mid + 1;
      else { // found a match
        while (mid + 1 < docStarts.length && docStarts[mid + 1] == midValue) {
          mid++; // scan to last match
        }
        return mid;
      }
    }
    return hi;
  }

  @Override
  public String toString() {
    return "IndexSearcher(" + subReaders.length + " readers, maxDoc=" + maxDoc + ")";
  }
}
