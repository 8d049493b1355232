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
package org.trypticon.dismax.index;

import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.apache.lucene.util.FixedBitSet;
import org.trypticon.dismax.document.Document;
import org.trypticon.dismax.document.Field;

/**
 * An {@link IndexReader} over documents held entirely in memory. Document
 * numbers are assigned in the order the documents are given, starting at 0.
 * <p>
 * Every field value is indexed verbatim as one term. Deleting documents is
 * supported; deleted documents keep counting toward {@link #docFreq(Term)}.
 */
public final class MemoryIndexReader extends IndexReader {
  private static final Postings EMPTY = new Postings(new int[0], new int[0]);

  private final int maxDoc;
  private final TreeMap<Term,Postings> postings;
  private final FixedBitSet deletedDocs;
  private int numDeleted;

  private MemoryIndexReader(int maxDoc, TreeMap<Term,Postings> postings) {
    this.maxDoc = maxDoc;
    this.postings = postings;
    this.deletedDocs = new FixedBitSet(Math.max(1, maxDoc));
  }

  /** Indexes the given documents. */
  public static MemoryIndexReader open(Document... documents) {
    return open(Arrays.asList(documents));
  }

  /** Indexes the given documents. */
  public static MemoryIndexReader open(List<Document> documents) {
    // docs are visited in increasing order, so each per-term map stays sorted
    Map<Term,Map<Integer,Integer>> building = new TreeMap<Term,Map<Integer,Integer>>();
    for (int doc = 0; doc < documents.size(); doc++) {
      for (Field field : documents.get(doc).getFields()) {
        Term term = new Term(field.name(), field.value());
        building.computeIfAbsent(term, t -> new LinkedHashMap<Integer,Integer>())
            .merge(doc, 1, Integer::sum);
      }
    }

    TreeMap<Term,Postings> postings = new TreeMap<Term,Postings>();
    for (Map.Entry<Term,Map<Integer,Integer>> entry : building.entrySet()) {
      Map<Integer,Integer> freqsByDoc = entry.getValue();
      int[] docs = new int[freqsByDoc.size()];
      int[] freqs = new int[freqsByDoc.size()];
      int i = 0;
      for (Map.Entry<Integer,Integer> posting : freqsByDoc.entrySet()) {
        docs[i] = posting.getKey();
        freqs[i] = posting.getValue();
        i++;
      }
      postings.put(entry.getKey(), new Postings(docs, freqs));
    }
    return new MemoryIndexReader(documents.size(), postings);
  }

  /** Marks a document as deleted. Deleting a document twice is a no-op. */
  public synchronized void deleteDocument(int docNum) {
    ensureOpen();
    Objects.checkIndex(docNum, maxDoc);
    if (!deletedDocs.getAndSet(docNum)) {
      numDeleted++;
    }
  }

  @Override
  public int maxDoc() {
    return maxDoc;
  }

  @Override
  public synchronized int numDocs() {
    return maxDoc - numDeleted;
  }

  @Override
  public synchronized boolean isDeleted(int n) {
    return deletedDocs.get(n);
  }

  @Override
  public int docFreq(Term t) {
    ensureOpen();
    Postings p = postings.get(t);
    return p == null ? 0 : p.docs.length;
  }

  @Override
  public TermEnum terms(Term t) {
    ensureOpen();
    return new MemoryTermEnum(t);
  }

  @Override
  public TermDocs termDocs(Term term) {
    ensureOpen();
    if (term == null) {
      return new AllTermDocs();
    }
    Postings p = postings.get(term);
    return new PostingsTermDocs(p == null ? EMPTY : p);
  }

  @Override
  protected void doClose() {
    // nothing to release
  }

  private static final class Postings {
    final int[] docs;
    final int[] freqs;

    Postings(int[] docs, int[] freqs) {
      this.docs = docs;
      this.freqs = freqs;
    }
  }

  private final class PostingsTermDocs implements TermDocs {
    private final Postings postings;
    private int pos = -1;

    PostingsTermDocs(Postings postings) {
      this.postings = postings;
    }

    @Override
    public int doc() {
      return postings.docs[pos];
    }

    @Override
    public int freq() {
      return postings.freqs[pos];
    }

    @Override
    public boolean next() {
      do {
        pos++;
      } while (pos < postings.docs.length && isDeleted(postings.docs[pos]));
      return pos < postings.docs.length;
    }

    @Override
    public boolean skipTo(int target) {
      int from = pos + 1;
      if (from >= postings.docs.length) {
        pos = postings.docs.length;
        return false;
      }
      int found = Arrays.binarySearch(postings.docs, from, postings.docs.length, target);
      // land one before the first candidate so that next() skips deletions
      pos = (found >= 0 ? found : -found - 1) - 1;
      return next();
    }

    @Override
    public void close() {
    }
  }

  private final class AllTermDocs implements TermDocs {
    private int doc = -1;

    @Override
    public int doc() {
      return doc;
    }

    @Override
    public int freq() {
      return 1;
    }

    @Override
    public boolean next() {
      do {
        doc++;
      } while (doc < maxDoc && isDeleted(doc));
      return doc < maxDoc;
    }

    @Override
    public boolean skipTo(int target) {
      doc = Math.max(doc, target - 1);
      return next();
    }

    @Override
    public void close() {
    }
  }

  private final class MemoryTermEnum extends TermEnum {
    private final Iterator<Map.Entry<Term,Postings>> iterator;
    private Map.Entry<Term,Postings> current;

    MemoryTermEnum(Term from) {
      iterator = postings.tailMap(from, true).entrySet().iterator();
      advance();
    }

    private boolean advance() {
      current = iterator.hasNext() ? iterator.next() : null;
      return current != null;
    }

    @Override
    public boolean next() {
      return advance();
    }

    @Override
    public Term term() {
      return current == null ? null : current.getKey();
    }

    @Override
    public int docFreq() {
      return current.getValue().docs.length;
    }

    @Override
    public void close() {
    }
  }
}
