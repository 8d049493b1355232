package org.trypticon.dismax.search;

import org.junit.Test;
import org.trypticon.dismax.PrintStreamInfoStream;
import org.trypticon.dismax.document.Document;
import org.trypticon.dismax.index.IndexReader;
import org.trypticon.dismax.index.MemoryIndexReader;
import org.trypticon.dismax.index.Term;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

/**
 * Tests for {@link IndexSearcher}.
 */
public class IndexSearcherTests {
    private static final double EPSILON = 1e-5;

    private static Document doc(String title, String body) {
        Document document = new Document();
        if (title != null) {
            document.add("title", title);
        }
        if (body != null) {
            document.add("body", body);
        }
        return document;
    }

    private static List<Document> corpus() {
        List<Document> documents = new ArrayList<>();
        documents.add(doc("apple", "apple"));
        documents.add(doc("apple", null));
        documents.add(doc(null, "apple"));
        documents.add(doc("banana", "banana"));
        documents.add(doc("banana", "apple"));
        documents.add(doc("cherry", null));
        return documents;
    }

    private static DisjunctionMaxQuery query(String text, float tieBreaker) {
        DisjunctionMaxQuery query = new DisjunctionMaxQuery(tieBreaker);
        query.add(new TermQuery(new Term("title", text)));
        query.add(new TermQuery(new Term("body", text)));
        return query;
    }

    @Test
    public void testSplitReadersScoreLikeOneReader() throws Exception {
        List<Document> documents = corpus();
        IndexSearcher single = new IndexSearcher(MemoryIndexReader.open(documents));
        IndexSearcher split = new IndexSearcher(new IndexReader[] {
                MemoryIndexReader.open(documents.subList(0, 2)),
                MemoryIndexReader.open(documents.subList(2, 5)),
                MemoryIndexReader.open(documents.subList(5, 6)),
        });

        for (float tieBreaker : new float[] { 0.0f, 0.3f, 1.0f }) {
            TopDocs expected = single.search(query("apple", tieBreaker), 10);
            TopDocs actual = split.search(query("apple", tieBreaker), 10);

            assertThat(actual.totalHits, is(expected.totalHits));
            assertThat(actual.scoreDocs.length, is(expected.scoreDocs.length));
            for (int i = 0; i < expected.scoreDocs.length; i++) {
                assertThat(actual.scoreDocs[i].doc, is(expected.scoreDocs[i].doc));
                assertThat((double) actual.scoreDocs[i].score, closeTo(expected.scoreDocs[i].score, EPSILON));
            }
        }
    }

    @Test
    public void testStatisticsAreSummedOverReaders() throws Exception {
        List<Document> documents = corpus();
        IndexReader first = MemoryIndexReader.open(documents.subList(0, 3));
        IndexReader second = MemoryIndexReader.open(documents.subList(3, 6));
        IndexSearcher split = new IndexSearcher(new IndexReader[] { first, second });

        IndexReader[] subReaders = split.getSubReaders();
        assertThat(subReaders, is(arrayContaining(first, second)));
        subReaders[0] = second;
        assertThat(split.getSubReaders()[0], is(sameInstance(first)));
        assertThat(split.maxDoc(), is(6));
        assertThat(split.docFreq(new Term("body", "apple")), is(3));
        assertThat(split.docFreq(new Term("title", "durian")), is(0));
    }

    @Test
    public void testEmptySubReaderIsSkipped() throws Exception {
        List<Document> documents = corpus();
        IndexSearcher split = new IndexSearcher(new IndexReader[] {
                MemoryIndexReader.open(documents.subList(0, 3)),
                MemoryIndexReader.open(new ArrayList<Document>()),
                MemoryIndexReader.open(documents.subList(3, 6)),
        });

        TopDocs topDocs = split.search(query("banana", 0.0f), 10);

        assertThat(topDocs.totalHits, is(2));
        assertThat(topDocs.scoreDocs[0].doc, is(3));
        assertThat(topDocs.scoreDocs[1].doc, is(4));
        assertThat(split.explain(query("banana", 0.0f), 4).isMatch(), is(true));
    }

    @Test
    public void testSearchWithCollectorSeesGlobalDocIds() throws Exception {
        List<Document> documents = corpus();
        IndexSearcher split = new IndexSearcher(new IndexReader[] {
                MemoryIndexReader.open(documents.subList(0, 3)),
                MemoryIndexReader.open(documents.subList(3, 6)),
        });
        TopScoreDocCollector collector = TopScoreDocCollector.create(2);

        split.search(query("apple", 0.0f), collector);

        assertThat(collector.getTotalHits(), is(4));
        TopDocs topDocs = collector.topDocs();
        assertThat(topDocs.scoreDocs.length, is(2));
        assertThat(topDocs.scoreDocs[0].score >= topDocs.scoreDocs[1].score, is(true));
    }

    @Test
    public void testInvalidArguments() {
        IndexSearcher searcher = new IndexSearcher(MemoryIndexReader.open(corpus()));

        assertThrows(IllegalArgumentException.class, () -> new IndexSearcher(new IndexReader[0]));
        assertThrows(IllegalArgumentException.class, () -> searcher.search(query("apple", 0.0f), 0));
        assertThrows(IllegalArgumentException.class, () -> searcher.explain(query("apple", 0.0f), -1));
        assertThrows(IllegalArgumentException.class, () -> TopScoreDocCollector.create(0));
    }

    @Test
    public void testSearchIsLogged() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        IndexSearcher searcher = new IndexSearcher(MemoryIndexReader.open(corpus()));
        searcher.setInfoStream(new PrintStreamInfoStream(new PrintStream(out, true, "UTF-8")));

        searcher.search(query("apple", 0.0f), 10);

        String log = new String(out.toByteArray(), StandardCharsets.UTF_8);
        assertThat(log, containsString("IS: (title:apple | body:apple): 4 total hits in 1 readers, returned 4"));
    }

    @Test
    public void testMergeBreaksTiesByShard() {
        TopDocs first = new TopDocs(2, new ScoreDoc[] { new ScoreDoc(1, 2.0f), new ScoreDoc(0, 1.0f) }, 2.0f);
        TopDocs second = new TopDocs(3, new ScoreDoc[] { new ScoreDoc(5, 3.0f), new ScoreDoc(4, 1.0f) }, 3.0f);

        TopDocs merged = TopDocs.merge(3, new TopDocs[] { first, second });

        assertThat(merged.totalHits, is(5));
        assertThat(merged.getMaxScore(), is(3.0f));
        assertThat(merged.scoreDocs.length, is(3));
        assertThat(merged.scoreDocs[0].doc, is(5));
        assertThat(merged.scoreDocs[1].doc, is(1));
        assertThat(merged.scoreDocs[2].doc, is(0));
    }

    @Test
    public void testCollectorKeepsEarlierDocOnTie() throws Exception {
        TopScoreDocCollector collector = TopScoreDocCollector.create(2);
        collector.setNextReader(null, 10);
        ArrayScorer scores = new ArrayScorer(new int[] { 0, 1, 2 }, new float[] { 1.0f, 1.0f, 1.0f });
        collector.setScorer(scores);
        while (scores.nextDoc() != DocIdSetIterator.NO_MORE_DOCS) {
            collector.collect(scores.docID());
        }

        TopDocs topDocs = collector.topDocs();

        assertThat(topDocs.totalHits, is(3));
        assertThat(topDocs.scoreDocs[0].doc, is(10));
        assertThat(topDocs.scoreDocs[1].doc, is(11));
    }

    @Test
    public void testToString() {
        IndexSearcher searcher = new IndexSearcher(MemoryIndexReader.open(corpus()));

        assertThat(searcher.toString(), is("IndexSearcher(1 readers, maxDoc=6)"));
    }
}
