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

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.lucene.store.AlreadyClosedException;

/** IndexReader is an abstract class, providing an interface for accessing an
 index.  Search of an index is done entirely through this abstract interface,
 so that any subclass which implements it is searchable.

 <p> Documents are identified by a non-negative integer below {@link #maxDoc()}.
 Deleted documents keep their number but are never returned by
 {@link #termDocs(Term)} or {@link #termDocs()}.

 <p> Readers are not thread-safe for concurrent mutation (deletions), but may be
 searched by several threads as long as each search uses its own scorers.
*/
public abstract class IndexReader implements Closeable {

  /**
   * A listener called when a reader is closed, e.g. to evict cached data
   * keyed on it.
   */
  public interface ReaderClosedListener {
    void onClose(IndexReader reader);
  }

  private final Set<ReaderClosedListener> readerClosedListeners =
      Collections.synchronizedSet(new LinkedHashSet<ReaderClosedListener>());

  private volatile boolean closed;

  protected IndexReader() {
  }

  /** Adds a listener which will be called when this reader is closed. */
  public final void addReaderClosedListener(ReaderClosedListener listener) {
    ensureOpen();
    readerClosedListeners.add(listener);
  }

  /** Removes a previously added listener. */
  public final void removeReaderClosedListener(ReaderClosedListener listener) {
    ensureOpen();
    readerClosedListeners.remove(listener);
  }

  private void notifyReaderClosedListeners() {
    synchronized(readerClosedListeners) {
      for(ReaderClosedListener listener : readerClosedListeners) {
        listener.onClose(this);
      }
    }
  }

  /**
   * @throws AlreadyClosedException if this IndexReader is closed
   */
  protected final void ensureOpen() throws AlreadyClosedException {
    if (closed) {
      throw new AlreadyClosedException("this IndexReader is closed");
    }
  }

  /** Returns one greater than the largest possible document number.
   * This may be used to, e.g., determine how big to allocate an array which
   * will have an element for every document number in an index.
   */
  public abstract int maxDoc();

  /** Returns the number of documents in this index, not counting deletions. */
  public abstract int numDocs();

  /** Returns true if document <i>n</i> has been deleted */
  public abstract boolean isDeleted(int n);

  /** Returns true if any documents have been deleted */
  public boolean hasDeletions() {
    return numDocs() < maxDoc();
  }

  /** Returns the number of documents containing the term <code>t</code>.
   * Deleted documents are still counted until they are merged away.
   */
  public abstract int docFreq(Term t) throws IOException;

  /** Returns an enumeration of the terms starting at the first term greater
   * than or equal to <code>t</code>, across fields in field order.
   */
  public abstract TermEnum terms(Term t) throws IOException;

  /** Returns an enumeration of all the documents which contain
   * <code>term</code>. The enumeration is empty if the term does not exist.
   * If <code>term</code> is null, it enumerates every non-deleted document
   * with a frequency of 1.
   */
  public abstract TermDocs termDocs(Term term) throws IOException;

  /** Returns an enumeration over every non-deleted document. */
  public TermDocs termDocs() throws IOException {
    return termDocs(null);
  }

  /**
   * Expert: the key cached data for this reader is stored under. Two readers
   * sharing the same underlying index data may return the same key.
   */
  public Object getCoreCacheKey() {
    return this;
  }

  /**
   * Closes files associated with this index, and notifies the
   * {@link ReaderClosedListener}s. Closing twice is a no-op.
   */
  @Override
  public final synchronized void close() throws IOException {
    if (!closed) {
      closed = true;
      doClose();
      notifyReaderClosedListeners();
    }
  }

  /** Implements close. */
  protected abstract void doClose() throws IOException;

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(maxDoc=" + maxDoc() + ")";
  }
}
