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

import java.io.IOException;
import java.util.Set;

import org.trypticon.dismax.index.IndexReader;
import org.trypticon.dismax.index.Term;
import org.trypticon.dismax.index.TermDocs;
import org.trypticon.dismax.search.ComplexExplanation;
import org.trypticon.dismax.search.Explanation;
import org.trypticon.dismax.search.IndexSearcher;
import org.trypticon.dismax.search.Query;
import org.trypticon.dismax.search.Scorer;
import org.trypticon.dismax.search.Weight;
import org.trypticon.dismax.util.ToStringUtils;

/**
 * Expert: A Query that sets the scores of document to the
 * values obtained from a {@link org.trypticon.dismax.search.function.ValueSource ValueSource}.
 * <p>
 * This query provides a score for <em>each and every</em> undeleted document in the index.
 * <p>
 * The value source can be based on a (cached) value of an indexed field, but it
 * can also be based on an external source, e.g. values read from an external database.
 * <p>
 * Score is set as: Score(doc,query) = queryWeight * valueSource(doc), where queryWeight is the normalized boost.
 */
public class ValueSourceQuery extends Query {
  private final ValueSource valSrc;

  /**
   * Create a value source query
   * @param valSrc provides the values defines the function to be used for scoring
   */
  public ValueSourceQuery(ValueSource valSrc) {
    this.valSrc=valSrc;
  }

  /** Returns the source of the values used for scoring. */
  public ValueSource getValueSource() {
    return valSrc;
  }

  @Override
  public void extractTerms(Set<Term> terms) {
    // no terms involved here
  }

  class ValueSourceWeight extends Weight {
    float queryNorm;
    float queryWeight;

    @Override
    public Query getQuery() {
      return ValueSourceQuery.this;
    }

    @Override
    public float getValue() {
      return queryWeight;
    }

    @Override
    public float sumOfSquaredWeights() {
      queryWeight = getBoost();
      return queryWeight * queryWeight;
    }

    @Override
    public void normalize(float norm) {
      this.queryNorm = norm;
      queryWeight *= this.queryNorm;
    }

    @Override
    public Scorer scorer(IndexReader reader) throws IOException {
      return new ValueSourceScorer(reader, this);
    }

    @Override
    public Explanation explain(IndexReader reader, int doc) throws IOException {
      DocValues vals = valSrc.getValues(reader);
      float sc = queryWeight * vals.floatVal(doc);

      Explanation result = new ComplexExplanation(
        !reader.isDeleted(doc), sc, ValueSourceQuery.this.toString() + ", product of:");

      result.addDetail(vals.explain(doc));
      result.addDetail(new Explanation(getBoost(), "boost"));
      result.addDetail(new Explanation(queryNorm,"queryNorm"));
      return result;
    }
  }

  /**
   * A scorer that (simply) matches all documents, and scores each document with
   * the value of the value source in effect.
   */
  private class ValueSourceScorer extends Scorer {
    private final float qWeight;
    private final DocValues vals;
    private final TermDocs termDocs;
    private int doc = -1;

    private ValueSourceScorer(IndexReader reader, ValueSourceWeight w) throws IOException {
      super(w);
      qWeight = w.getValue();
      // this is when/where the values are first created.
      vals = valSrc.getValues(reader);
      termDocs = reader.termDocs();
    }

    @Override
    public int nextDoc() throws IOException {
      if (doc == NO_MORE_DOCS) {
        return doc;
      }
      return doc = termDocs.next() ? termDocs.doc() : exhausted();
    }

    @Override
    public int docID() {
      return doc;
    }

    @Override
    public int advance(int target) throws IOException {
      if (doc == NO_MORE_DOCS || (doc != -1 && doc >= target)) {
        return doc;
      }
      return doc = termDocs.skipTo(target) ? termDocs.doc() : exhausted();
    }

    private int exhausted() throws IOException {
      termDocs.close();
      return NO_MORE_DOCS;
    }

    @Override
    public float score() {
      return qWeight * vals.floatVal(doc);
    }
  }

  @Override
  public Weight createWeight(IndexSearcher searcher) {
    return new ValueSourceQuery.ValueSourceWeight();
  }

  @Override
  public String toString(String field) {
    return valSrc.toString() + ToStringUtils.boost(getBoost());
  }

  /** Returns true if <code>o</code> is equal to this. */
  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!super.equals(o))
      return false;
    ValueSourceQuery other = (ValueSourceQuery)o;
    return this.valSrc.equals(other.valSrc);
  }

  /** Returns a hash code value for this object. */
  @Override
  public int hashCode() {
    return (getClass().hashCode() + valSrc.hashCode()) ^ Float.floatToIntBits(getBoost());
  }

}
