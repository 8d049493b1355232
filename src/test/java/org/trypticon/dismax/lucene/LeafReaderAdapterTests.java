package org.trypticon.dismax.lucene;

import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.trypticon.dismax.TestIndices;
import org.trypticon.dismax.index.Term;
import org.trypticon.dismax.index.TermDocs;
import org.trypticon.dismax.index.TermEnum;
import org.trypticon.dismax.search.FieldCache;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

/**
 * Tests for {@link LeafReaderAdapter}.
 */
public class LeafReaderAdapterTests {
    private Directory directory;
    private DirectoryReader reader;

    @Before
    public void setUp() throws Exception {
        directory = new ByteBuffersDirectory();
        TestIndices.writeIndex(directory, TestIndices.corpus(), Integer.MAX_VALUE);
    }

    @After
    public void tearDown() throws Exception {
        if (reader != null) {
            reader.close();
        }
        directory.close();
    }

    private LeafReaderAdapter open() throws IOException {
        reader = DirectoryReader.open(directory);
        assertThat(reader.leaves().size(), is(1));
        return new LeafReaderAdapter(reader.leaves().get(0).reader());
    }

    @Test
    public void testDocCountsAndFrequencies() throws Exception {
        LeafReaderAdapter adapter = open();

        assertThat(adapter.maxDoc(), is(6));
        assertThat(adapter.numDocs(), is(6));
        assertThat(adapter.hasDeletions(), is(false));
        assertThat(adapter.docFreq(new Term("title", "apple")), is(2));
        assertThat(adapter.docFreq(new Term("body", "apple")), is(3));
        assertThat(adapter.docFreq(new Term("title", "durian")), is(0));
        assertThat(adapter.docFreq(new Term("nosuchfield", "apple")), is(0));
    }

    @Test
    public void testTermDocs() throws Exception {
        LeafReaderAdapter adapter = open();

        assertThat(postings(adapter.termDocs(new Term("body", "apple"))), contains("0x1", "2x2", "4x1"));
        assertThat(postings(adapter.termDocs(new Term("title", "durian"))).isEmpty(), is(true));
    }

    @Test
    public void testSkipTo() throws Exception {
        LeafReaderAdapter adapter = open();
        TermDocs termDocs = adapter.termDocs(new Term("body", "apple"));

        assertThat(termDocs.skipTo(1), is(true));
        assertThat(termDocs.doc(), is(2));
        assertThat(termDocs.freq(), is(2));
        assertThat(termDocs.skipTo(2), is(true));
        assertThat(termDocs.doc(), is(4));
        assertThat(termDocs.skipTo(5), is(false));
        assertThat(termDocs.next(), is(false));
    }

    @Test
    public void testDeletedDocumentsAreSkipped() throws Exception {
        TestIndices.deleteDocuments(directory, 2, 5);
        LeafReaderAdapter adapter = open();

        assertThat(adapter.numDocs(), is(4));
        assertThat(adapter.isDeleted(2), is(true));
        assertThat(adapter.isDeleted(3), is(false));
        assertThat(adapter.docFreq(new Term("body", "apple")), is(3));
        assertThat(postings(adapter.termDocs(new Term("body", "apple"))), contains("0x1", "4x1"));
        assertThat(postings(adapter.termDocs()), contains("0x1", "1x1", "3x1", "4x1"));
    }

    @Test
    public void testAllDocsSkipTo() throws Exception {
        LeafReaderAdapter adapter = open();
        TermDocs termDocs = adapter.termDocs();

        assertThat(termDocs.skipTo(4), is(true));
        assertThat(termDocs.doc(), is(4));
        assertThat(termDocs.skipTo(9), is(false));
    }

    @Test
    public void testTermsWalkEveryField() throws Exception {
        LeafReaderAdapter adapter = open();

        assertThat(terms(adapter.terms(new Term("body"))), contains(
                "body:apple/3", "body:banana/1",
                "id:0/1", "id:1/1", "id:2/1", "id:3/1", "id:4/1", "id:5/1",
                "title:apple/2", "title:banana/2", "title:cherry/1"));
    }

    @Test
    public void testTermsStartWithinField() throws Exception {
        LeafReaderAdapter adapter = open();

        assertThat(terms(adapter.terms(new Term("title", "b"))), contains("title:banana/2", "title:cherry/1"));
        assertThat(terms(adapter.terms(new Term("id", "6"))).get(0), is("title:apple/2"));
        assertThat(adapter.terms(new Term("title", "zebra")).term(), is(nullValue()));
        assertThat(adapter.terms(new Term("zzz")).term(), is(nullValue()));
    }

    @Test
    public void testFieldCacheReadsThroughAdapter() throws Exception {
        LeafReaderAdapter adapter = open();

        assertThat(FieldCache.DEFAULT.getInts(adapter, "id"), is(new int[] { 0, 1, 2, 3, 4, 5 }));
    }

    @Test
    public void testAdaptersOfOneSegmentShareCacheKey() throws Exception {
        LeafReaderAdapter adapter = open();
        LeafReader leaf = reader.leaves().get(0).reader();

        assertThat(new LeafReaderAdapter(leaf).getCoreCacheKey(), is(adapter.getCoreCacheKey()));
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

    private static List<String> terms(TermEnum termEnum) throws IOException {
        List<String> terms = new ArrayList<>();
        try {
            for (Term term = termEnum.term(); term != null; term = termEnum.next() ? termEnum.term() : null) {
                terms.add(term + "/" + termEnum.docFreq());
            }
        } finally {
            termEnum.close();
        }
        return terms;
    }
}
