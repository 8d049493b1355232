package org.trypticon.dismax.lucene;

import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.trypticon.dismax.InfoStream;
import org.trypticon.dismax.index.IndexReader;
import org.trypticon.dismax.search.IndexSearcher;
import org.trypticon.dismax.search.Query;
import org.trypticon.dismax.search.ScoreDoc;
import org.trypticon.dismax.search.TopDocs;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs queries against Lucene indexes on disk or already open.
 */
public class LuceneIndexes {
    private static final String COMPONENT = "LI";

    private LuceneIndexes() {
    }

    /**
     * Searches the Lucene index in a directory.
     *
     * @param path the directory containing the index.
     * @param query the query to run.
     * @param n the maximum number of hits to return.
     * @param infoStream the stream to log diagnostics to.
     * @return the top hits, with doc IDs numbered across the whole index.
     * @throws IOException if an I/O error occurs reading the index.
     */
    public static TopDocs search(@Nonnull Path path, @Nonnull Query query, int n,
                                 @Nonnull InfoStream infoStream) throws IOException {
        try (Directory directory = FSDirectory.open(path);
             DirectoryReader reader = DirectoryReader.open(directory)) {
            if (infoStream.isEnabled(COMPONENT)) {
                infoStream.message(COMPONENT, "opened " + path + " with " + reader.leaves().size() +
                        " segments and " + reader.numDocs() + " live docs");
            }
            return search(reader, query, n, infoStream);
        }
    }

    /**
     * Searches an open Lucene index, one segment after another.
     *
     * @param reader the Lucene reader. Left open.
     * @param query the query to run.
     * @param n the maximum number of hits to return.
     * @param infoStream the stream to log diagnostics to.
     * @return the top hits, with doc IDs numbered across the whole index.
     * @throws IOException if an I/O error occurs reading the index.
     */
    public static TopDocs search(@Nonnull DirectoryReader reader, @Nonnull Query query, int n,
                                 @Nonnull InfoStream infoStream) throws IOException {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0, was: " + n);
        }
        List<LeafReaderContext> leaves = reader.leaves();
        if (leaves.isEmpty()) {
            return new TopDocs(0, new ScoreDoc[0], Float.NaN);
        }

        IndexReader[] adapters = new IndexReader[leaves.size()];
        for (int i = 0; i < adapters.length; i++) {
            adapters[i] = new LeafReaderAdapter(leaves.get(i).reader());
        }
        try {
            IndexSearcher searcher = new IndexSearcher(adapters);
            searcher.setInfoStream(infoStream);
            return searcher.search(query, n);
        } finally {
            // drops anything the field cache holds for these segments
            for (IndexReader adapter : adapters) {
                adapter.close();
            }
        }
    }
}
