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

import static org.trypticon.dismax.search.DocIdSetIterator.NO_MORE_DOCS;

/**
 * A binary min-heap of {@link Scorer}s ordered by their current doc id, so that
 * the scorer positioned on the smallest document is always at the top.
 * <p>
 * The heap is laid out in an array: the children of slot {@code i} live at
 * {@code 2i+1} and {@code 2i+2}. Only the first {@link #size()} slots are live;
 * slots past that are left as they are and must not be read.
 * <p>
 * All sub-scorers must already be positioned on their first document when they
 * are handed over. Once every sub-scorer is exhausted the heap is empty and
 * {@link #nextDoc(int)} and {@link #advance(int)} keep returning
 * {@link DocIdSetIterator#NO_MORE_DOCS}.
 */
public final class ScorerHeap {
  private final Scorer[] heap;
  private int size;

  /**
   * Takes ownership of the first {@code size} scorers of the array and
   * arranges them into a heap.
   *
   * @param scorers the positioned sub-scorers. The array may be longer than {@code size}.
   * @param size the number of live scorers in the array.
   */
  public ScorerHeap(Scorer[] scorers, int size) {
    if (size < 0 || size > scorers.length) {
      throw new IllegalArgumentException("size must be between 0 and " + scorers.length + ", was " + size);
    }
    this.heap = scorers;
    this.size = size;
    heapify();
  }

  /** Number of scorers that still have documents. */
  public int size() {
    return size;
  }

  /** Capacity of the underlying array. */
  public int capacity() {
    return heap.length;
  }

  /** The scorer on the smallest document. Must not be called on an empty heap. */
  public Scorer top() {
    assert size > 0;
    return heap[0];
  }

  /** The scorer in heap slot {@code i}, which must be below {@link #size()}. */
  public Scorer get(int i) {
    assert i < size;
    return heap[i];
  }

  /**
   * Moves every scorer positioned on {@code doc} to its next document, and
   * returns the new smallest doc id, or {@code NO_MORE_DOCS} once the heap is empty.
   */
  public int nextDoc(int doc) throws IOException {
    if (size == 0) {
      return NO_MORE_DOCS;
    }
    while (heap[0].docID() == doc) {
      if (heap[0].nextDoc() != NO_MORE_DOCS) {
        siftDown(0);
      } else {
        removeRoot();
        if (size == 0) {
          return NO_MORE_DOCS;
        }
      }
    }
    return heap[0].docID();
  }

  /**
   * Advances every scorer positioned before {@code target}, and returns the new
   * smallest doc id, or {@code NO_MORE_DOCS} once the heap is empty.
   */
  public int advance(int target) throws IOException {
    if (size == 0) {
      return NO_MORE_DOCS;
    }
    while (heap[0].docID() < target) {
      if (heap[0].advance(target) != NO_MORE_DOCS) {
        siftDown(0);
      } else {
        removeRoot();
        if (size == 0) {
          return NO_MORE_DOCS;
        }
      }
    }
    return heap[0].docID();
  }

  /** Organizes the live scorers into a min heap with the earliest document on top. */
  void heapify() {
    for (int i = (size >> 1) - 1; i >= 0; i--) {
      siftDown(i);
    }
  }

  /*
   * The subtree at root is a heap except possibly for its root element.
   * Bubble the root down as required to make the subtree a heap.
   */
  void siftDown(int root) {
    Scorer scorer = heap[root];
    int doc = scorer.docID();
    int i = root;
    while (i <= (size >> 1) - 1) {
      int lchild = (i << 1) + 1;
      Scorer lscorer = heap[lchild];
      int ldoc = lscorer.docID();
      int rdoc = Integer.MAX_VALUE, rchild = (i << 1) + 2;
      Scorer rscorer = null;
      if (rchild < size) {
        rscorer = heap[rchild];
        rdoc = rscorer.docID();
      }
      if (ldoc < doc) {
        if (rdoc < ldoc) {
          heap[i] = rscorer;
          heap[rchild] = scorer;
          i = rchild;
        } else {
          heap[i] = lscorer;
          heap[lchild] = scorer;
          i = lchild;
        }
      } else if (rdoc < doc) {
        heap[i] = rscorer;
        heap[rchild] = scorer;
        i = rchild;
      } else {
        return;
      }
    }
  }

  /** Removes the root scorer and re-establishes the heap. */
  void removeRoot() {
    if (size == 1) {
      size = 0;
    } else {
      heap[0] = heap[size - 1];
      --size;
      siftDown(0);
    }
  }
}
