package org.trypticon.dismax.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.trypticon.dismax.InfoStream;
import org.trypticon.dismax.PrintStreamInfoStream;
import org.trypticon.dismax.index.Term;
import org.trypticon.dismax.lucene.LuceneIndexes;
import org.trypticon.dismax.search.DisjunctionMaxQuery;
import org.trypticon.dismax.search.Query;
import org.trypticon.dismax.search.ScoreDoc;
import org.trypticon.dismax.search.TermQuery;
import org.trypticon.dismax.search.TopDocs;

/**
 * Command to run a disjunction-max query against a text index.
 */
class SearchCommand extends Command {
    static final int MAX_HITS = 10;

    SearchCommand() {
        super("search", "Searches a text index for the best match of several terms",
                "[--verbose] <index dir> <tie breaker> <field:term>...");
    }

    @Override
    int run(List<String> args, PrintStream out, PrintStream err) {
        List<String> remaining = new ArrayList<>(args);
        boolean verbose = !remaining.isEmpty() && remaining.get(0).equals("--verbose");
        if (verbose) {
            remaining.remove(0);
        }
        if (remaining.size() < 3) {
            usage(err);
            return 1;
        }

        Path directory = Path.of(remaining.get(0));
        float tieBreaker;
        try {
            tieBreaker = Float.parseFloat(remaining.get(1));
        } catch (NumberFormatException e) {
            err.println("Not a number: " + remaining.get(1));
            return 1;
        }

        DisjunctionMaxQuery query = new DisjunctionMaxQuery(tieBreaker);
        for (String clause : remaining.subList(2, remaining.size())) {
            Query termQuery = parseClause(clause);
            if (termQuery == null) {
                err.println("Not a field:term clause: " + clause);
                return 1;
            }
            query.add(termQuery);
        }

        InfoStream infoStream = verbose ? new PrintStreamInfoStream(err) : InfoStream.NO_OUTPUT;
        try {
            TopDocs topDocs = LuceneIndexes.search(directory, query, MAX_HITS, infoStream);
            out.println(topDocs.totalHits + " total hits");
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                out.println(scoreDoc);
            }
            return 0;
        } catch (IOException e) {
            err.println("Error searching Lucene index at: " + directory);
            printErrorSummary(err, e);
            return 1;
        }
    }

    private static Query parseClause(String clause) {
        int colon = clause.indexOf(':');
        if (colon <= 0 || colon == clause.length() - 1) {
            return null;
        }
        return new TermQuery(new Term(clause.substring(0, colon), clause.substring(colon + 1)));
    }
}
