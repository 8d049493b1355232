package org.trypticon.dismax.search;

import org.trypticon.dismax.index.IndexReader;
import org.trypticon.dismax.index.Term;
import org.trypticon.dismax.index.TermDocs;
import org.trypticon.dismax.index.TermEnum;

import java.io.IOException;

/**
 * Reader delegating to another one but reporting a cache key of our choosing,
 * like two readers opened over the same index data.
 */
class SharedKeyReader extends IndexReader {
    private final IndexReader delegate;
    private final Object coreCacheKey;

    SharedKeyReader(IndexReader delegate, Object coreCacheKey) {
        this.delegate = delegate;
        this.coreCacheKey = coreCacheKey;
    }

    @Override
    public int maxDoc() {
        return delegate.maxDoc();
    }

    @Override
    public int numDocs() {
        return delegate.numDocs();
    }

    @Override
    public boolean isDeleted(int n) {
        return delegate.isDeleted(n);
    }

    @Override
    public int docFreq(Term t) throws IOException {
        return delegate.docFreq(t);
    }

    @Override
    public TermEnum terms(Term t) throws IOException {
        return delegate.terms(t);
    }

    @Override
    public TermDocs termDocs(Term term) throws IOException {
        return delegate.termDocs(term);
    }

    @Override
    public Object getCoreCacheKey() {
        return coreCacheKey;
    }

    @Override
    protected void doClose() {
        // the delegate stays open for the other readers sharing it
    }
}
