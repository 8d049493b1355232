package org.trypticon.dismax.search.function;

import org.junit.Before;
import org.junit.Test;
import org.trypticon.dismax.document.Document;
import org.trypticon.dismax.index.MemoryIndexReader;
import org.trypticon.dismax.search.DisjunctionMaxQuery;
import org.trypticon.dismax.search.Explanation;
import org.trypticon.dismax.search.FieldCache;
import org.trypticon.dismax.search.IndexSearcher;
import org.trypticon.dismax.search.TopDocs;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for {@link FieldScoreQuery}.
 */
public class FieldScoreQueryTests {
    private static final double EPSILON = 1e-6;

    private MemoryIndexReader reader;
    private IndexSearcher searcher;

    @Before
    public void setUp() {
        reader = MemoryIndexReader.open(
                new Document().add("rank", "3").add("price", "1.5"),
                new Document().add("rank", "-7"),
                new Document().add("price", "2.25"),
                new Document().add("rank", "120").add("price", "0"));
        searcher = new IndexSearcher(reader);
    }

    @Test
    public void testScoreIsFieldValue() throws Exception {
        TopDocs topDocs = searcher.search(new FieldScoreQuery("price", FieldScoreQuery.Type.FLOAT), 10);

        assertThat(topDocs.totalHits, is(4));
        assertThat(topDocs.scoreDocs[0].doc, is(2));
        assertThat((double) topDocs.scoreDocs[0].score, closeTo(2.25, EPSILON));
        assertThat(topDocs.scoreDocs[1].doc, is(0));
        assertThat((double) topDocs.scoreDocs[1].score, closeTo(1.5, EPSILON));
        assertThat(topDocs.scoreDocs[2].doc, is(1));
        assertThat(topDocs.scoreDocs[2].score, is(0.0f));
        assertThat(topDocs.scoreDocs[3].doc, is(3));
    }

    @Test
    public void testEveryTypeReadsTheSameIntegers() throws Exception {
        for (FieldScoreQuery.Type type : FieldScoreQuery.Type.values()) {
            TopDocs topDocs = searcher.search(new FieldScoreQuery("rank", type), 1);

            assertThat(type.toString(), topDocs.scoreDocs[0].doc, is(3));
            assertThat(type.toString(), (double) topDocs.scoreDocs[0].score, closeTo(120.0, EPSILON));
        }
    }

    @Test
    public void testDeletedDocumentsDoNotMatch() throws Exception {
        reader.deleteDocument(2);

        TopDocs topDocs = searcher.search(new FieldScoreQuery("price", FieldScoreQuery.Type.FLOAT), 10);

        assertThat(topDocs.totalHits, is(3));
        assertThat(topDocs.scoreDocs[0].doc, is(0));
    }

    @Test
    public void testDisjunctionTakesBestValue() throws Exception {
        DisjunctionMaxQuery query = new DisjunctionMaxQuery(0.0f);
        query.add(new FieldScoreQuery("rank", FieldScoreQuery.Type.INT));
        query.add(new FieldScoreQuery("price", FieldScoreQuery.Type.FLOAT));

        TopDocs topDocs = searcher.search(query, 10);

        assertThat(topDocs.totalHits, is(4));
        int[] expectedDocs = { 3, 0, 2, 1 };
        double[] expectedScores = { 120.0, 3.0, 2.25, 0.0 };
        for (int i = 0; i < expectedDocs.length; i++) {
            assertThat(topDocs.scoreDocs[i].doc, is(expectedDocs[i]));
            assertThat((double) topDocs.scoreDocs[i].score, closeTo(expectedScores[i], EPSILON));
        }
    }

    @Test
    public void testExplain() throws Exception {
        Explanation explanation = searcher.explain(new FieldScoreQuery("price", FieldScoreQuery.Type.FLOAT), 2);

        assertThat(explanation.isMatch(), is(true));
        assertThat((double) explanation.getValue(), closeTo(2.25, EPSILON));
        assertThat(explanation.getDescription(), is("float(price), product of:"));
        assertThat(explanation.getDetails()[0].getDescription(), is("float(price)=2.25"));
    }

    @Test
    public void testValuesComeFromFieldCache() throws Exception {
        DocValues values = new IntFieldSource("rank").getValues(reader);

        assertThat(values.getInnerArray(), is(sameInstance((Object) FieldCache.DEFAULT.getInts(reader, "rank"))));
        assertThat(values.intVal(3), is(120));
        assertThat(values.strVal(1), is("-7.0"));
        assertThat(values.toString(1), is("int(rank)=-7"));
    }

    @Test
    public void testEqualsAndToString() {
        FieldScoreQuery query = new FieldScoreQuery("rank", FieldScoreQuery.Type.INT);

        assertThat(query, is(new FieldScoreQuery("rank", FieldScoreQuery.Type.INT)));
        assertThat(query.hashCode(), is(new FieldScoreQuery("rank", FieldScoreQuery.Type.INT).hashCode()));
        assertThat(query, is(not(new FieldScoreQuery("rank", FieldScoreQuery.Type.SHORT))));
        assertThat(query, is(not(new FieldScoreQuery("price", FieldScoreQuery.Type.INT))));
        assertThat(query.toString(), is("int(rank)"));
    }
}
