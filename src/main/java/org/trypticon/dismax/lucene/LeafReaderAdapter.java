package org.trypticon.dismax.lucene;

import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.IndexOptions;
import org.apache.lucene.index.IndexReader.CacheHelper;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.index.PostingsEnum;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.util.Bits;
import org.apache.lucene.util.BytesRef;
import org.trypticon.dismax.index.IndexReader;
import org.trypticon.dismax.index.Term;
import org.trypticon.dismax.index.TermDocs;
import org.trypticon.dismax.index.TermEnum;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reads one segment of a Lucene index through our own reader API.
 * Terms are compared as strings, so fields and texts come back in the order {@link Term} sorts them.
 * Closing the adapter does not close the underlying leaf reader; whoever opened that closes it.
 */
public class LeafReaderAdapter extends IndexReader {
    private final LeafReader delegate;
    private final SortedSet<String> indexedFields = new TreeSet<>();

    /**
     * Constructs the adapter.
     *
     * @param delegate the Lucene leaf reader to read from.
     */
    public LeafReaderAdapter(@Nonnull LeafReader delegate) {
        this.delegate = delegate;
        for (FieldInfo fieldInfo : delegate.getFieldInfos()) {
            if (fieldInfo.getIndexOptions() != IndexOptions.NONE) {
                indexedFields.add(fieldInfo.name);
            }
        }
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
        Bits liveDocs = delegate.getLiveDocs();
        return liveDocs != null && !liveDocs.get(n);
    }

    @Override
    public int docFreq(Term t) throws IOException {
        ensureOpen();
        return delegate.docFreq(toLucene(t));
    }

    @Override
    public TermEnum terms(Term t) throws IOException {
        ensureOpen();
        return new TermEnumAdapter(t);
    }

    @Override
    public TermDocs termDocs(Term term) throws IOException {
        ensureOpen();
        if (term == null) {
            return new LiveDocsTermDocs();
        }
        PostingsEnum postings = delegate.postings(toLucene(term), PostingsEnum.FREQS);
        return new PostingsTermDocs(postings);
    }

    @Override
    public Object getCoreCacheKey() {
        CacheHelper cacheHelper = delegate.getCoreCacheHelper();
        return cacheHelper == null ? this : cacheHelper.getKey();
    }

    @Override
    protected void doClose() {
        // the leaf reader belongs to its top-level reader
    }

    @Override
    public String toString() {
        return "LeafReaderAdapter(" + delegate + ")";
    }

    private static org.apache.lucene.index.Term toLucene(Term term) {
        return new org.apache.lucene.index.Term(term.field(), term.text());
    }

    /**
     * Postings of one term, skipping deleted documents, which Lucene's postings still contain.
     */
    private class PostingsTermDocs implements TermDocs {
        private final PostingsEnum postings;
        private final Bits liveDocs;
        private int doc = -1;
        private int freq;

        PostingsTermDocs(PostingsEnum postings) {
            this.postings = postings;
            this.liveDocs = delegate.getLiveDocs();
        }

        @Override
        public int doc() {
            return doc;
        }

        @Override
        public int freq() {
            return freq;
        }

        @Override
        public boolean next() throws IOException {
            if (postings == null || doc == PostingsEnum.NO_MORE_DOCS) {
                return false;
            }
            return skipDeleted(postings.nextDoc());
        }

        @Override
        public boolean skipTo(int target) throws IOException {
            if (postings == null || doc == PostingsEnum.NO_MORE_DOCS) {
                return false;
            }
            // always moves forward, even when already at or past target
            int next = target > doc ? postings.advance(target) : postings.nextDoc();
            return skipDeleted(next);
        }

        private boolean skipDeleted(int next) throws IOException {
            while (next != PostingsEnum.NO_MORE_DOCS && liveDocs != null && !liveDocs.get(next)) {
                next = postings.nextDoc();
            }
            doc = next;
            if (next == PostingsEnum.NO_MORE_DOCS) {
                return false;
            }
            freq = postings.freq();
            return true;
        }

        @Override
        public void close() {
            // nothing to release
        }
    }

    /**
     * Every live document, each with a frequency of 1.
     */
    private class LiveDocsTermDocs implements TermDocs {
        private final Bits liveDocs = delegate.getLiveDocs();
        private final int maxDoc = delegate.maxDoc();
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
            return skipTo(doc + 1);
        }

        @Override
        public boolean skipTo(int target) {
            int next = Math.max(target, doc + 1);
            while (next < maxDoc && liveDocs != null && !liveDocs.get(next)) {
                next++;
            }
            doc = Math.min(next, maxDoc);
            return doc < maxDoc;
        }

        @Override
        public void close() {
            // nothing to release
        }
    }

    /**
     * Walks the terms of every indexed field, field by field.
     */
    private class TermEnumAdapter extends TermEnum {
        private final Iterator<String> fields;
        private String field;
        private TermsEnum termsEnum;
        private Term term;
        private int docFreq;

        TermEnumAdapter(Term from) throws IOException {
            fields = indexedFields.tailSet(from.field()).iterator();
            if (nextField() && field.equals(from.field())) {
                BytesRef text = new BytesRef(from.text());
                while (termsEnum != null) {
                    if (termsEnum.seekCeil(text) != TermsEnum.SeekStatus.END) {
                        setTerm(termsEnum.term());
                        return;
                    }
                    if (!nextField()) {
                        return;
                    }
                    text = new BytesRef();
                }
            } else {
                advanceTerm();
            }
        }

        // Moves to the next field that has terms; false when there is none.
        private boolean nextField() throws IOException {
            while (fields.hasNext()) {
                field = fields.next();
                Terms terms = delegate.terms(field);
                if (terms != null) {
                    termsEnum = terms.iterator();
                    return true;
                }
            }
            field = null;
            termsEnum = null;
            return false;
        }

        // Takes the next term of the current field, moving through later fields as they run out.
        private boolean advanceTerm() throws IOException {
            while (termsEnum != null) {
                BytesRef next = termsEnum.next();
                if (next != null) {
                    setTerm(next);
                    return true;
                }
                nextField();
            }
            term = null;
            return false;
        }

        private void setTerm(BytesRef text) throws IOException {
            term = new Term(field, text.utf8ToString());
            docFreq = termsEnum.docFreq();
        }

        @Override
        public boolean next() throws IOException {
            return advanceTerm();
        }

        @Override
        public Term term() {
            return term;
        }

        @Override
        public int docFreq() {
            return term == null ? 0 : docFreq;
        }

        @Override
        public void close() {
            // nothing to release
        }
    }
}
