package org.trypticon.dismax.index;

import org.apache.lucene.store.AlreadyClosedException;
import org.junit.Before;
import org.junit.Test;
import org.trypticon.dismax.document.Document;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThrows;

/**
 * Tests for {@link MemoryIndexReader}.
 */
public class MemoryIndexReaderTests {
    private MemoryIndexReader reader;

    @Before
    public void setUp() {
        reader = MemoryIndexReader.open(
                new Document().add("title", "apple").add("body", "apple"),
                new Document().add("title", "apple"),
                new Document().add("body", "apple").add("body", "apple"),
                new Document().add("title", "banana"));
    }

    @Test
    public void testCounts() throws Exception {
        assertThat(reader.maxDoc(), is(4));
        assertThat(reader.numDocs(), is(4));
        assertThat(reader.hasDeletions(), is(false));
        assertThat(reader.docFreq(new Term("title", "apple")), is(2));
        assertThat(reader.docFreq(new Term("title", "cherry")), is(0));
    }

    @Test
    public void testTermDocs() throws Exception {
        assertThat(postings(reader.termDocs(new Term("body", "apple"))), contains("0x1", "2x2"));
        assertThat(postings(reader.termDocs(new Term("body", "cherry"))).isEmpty(), is(true));
        assertThat(postings(reader.termDocs()), contains("0x1", "1x1", "2x1", "3x1"));
    }

    @Test
    public void testSkipTo() throws Exception {
        TermDocs termDocs = reader.termDocs(new Term("title", "apple"));

        assertThat(termDocs.skipTo(1), is(true));
        assertThat(termDocs.doc(), is(1));
        assertThat(termDocs.skipTo(1), is(false));
    }

    @Test
    public void testDeletions() throws Exception {
        reader.deleteDocument(0);
        reader.deleteDocument(0);

        assertThat(reader.numDocs(), is(3));
        assertThat(reader.isDeleted(0), is(true));
        assertThat(reader.docFreq(new Term("title", "apple")), is(2));
        assertThat(postings(reader.termDocs(new Term("title", "apple"))), contains("1x1"));
        assertThat(postings(reader.termDocs()), contains("1x1", "2x1", "3x1"));
        assertThrows(IndexOutOfBoundsException.class, () -> reader.deleteDocument(4));
    }

    @Test
    public void testTermsInOrder() throws Exception {
        List<String> terms = new ArrayList<>();
        TermEnum termEnum = reader.terms(new Term("body", "b"));
        for (Term term = termEnum.term(); term != null; term = termEnum.next() ? termEnum.term() : null) {
            terms.add(term + "/" + termEnum.docFreq());
        }

        assertThat(terms, contains("title:apple/2", "title:banana/1"));
        assertThat(reader.terms(new Term("zzz")).term(), is(nullValue()));
    }

    @Test
    public void testEmptyIndex() throws Exception {
        MemoryIndexReader empty = MemoryIndexReader.open(new ArrayList<Document>());

        assertThat(empty.maxDoc(), is(0));
        assertThat(empty.termDocs().next(), is(false));
    }

    @Test
    public void testCloseNotifiesListenersOnce() throws Exception {
        AtomicInteger closes = new AtomicInteger();
        reader.addReaderClosedListener(closed -> closes.incrementAndGet());

        reader.close();
        reader.close();

        assertThat(closes.get(), is(1));
        assertThrows(AlreadyClosedException.class, () -> reader.termDocs(new Term("title", "apple")));
    }

    private static List<String> postings(TermDocs termDocs) throws IOException {
        List<String> postings = new ArrayList<>();
        try {
            while (termDocs.next()) {
                postings.add(termDocs.doc() + "x" + termDocs.freq());
            }
        } finally {
            termDocs.close();
        }
        return postings;
    }
}
