package org.trypticon.dismax.search;

import java.io.IOException;

/**
 * Scorer over fixed doc ids and scores, for driving the combiners in tests.
 */
class ArrayScorer extends Scorer {
    private final int[] docs;
    private final float[] scores;
    private int index = -1;
    private int doc = -1;
    private int failAtDoc = -1;
    private int nextDocCalls;

    ArrayScorer(int[] docs, float[] scores) {
        super(null);
        if (docs.length != scores.length) {
            throw new IllegalArgumentException("docs and scores must have the same length");
        }
        this.docs = docs;
        this.scores = scores;
    }

    /**
     * Scorer giving every doc the same score.
     */
    static ArrayScorer of(float score, int... docs) {
        float[] scores = new float[docs.length];
        java.util.Arrays.fill(scores, score);
        return new ArrayScorer(docs, scores);
    }

    /**
     * Makes moving onto or past the given doc throw an {@link IOException}.
     */
    ArrayScorer failingAt(int doc) {
        this.failAtDoc = doc;
        return this;
    }

    int getNextDocCalls() {
        return nextDocCalls;
    }

    @Override
    public int docID() {
        return doc;
    }

    @Override
    public int nextDoc() throws IOException {
        nextDocCalls++;
        if (doc == NO_MORE_DOCS) {
            return doc;
        }
        index++;
        return position();
    }

    @Override
    public int advance(int target) throws IOException {
        if (doc == NO_MORE_DOCS) {
            return doc;
        }
        do {
            index++;
        } while (index < docs.length && docs[index] < target);
        return position();
    }

    private int position() throws IOException {
        if (index >= docs.length) {
            return doc = NO_MORE_DOCS;
        }
        if (failAtDoc >= 0 && docs[index] >= failAtDoc) {
            throw new IOException("simulated failure at doc " + docs[index]);
        }
        return doc = docs[index];
    }

    @Override
    public float score() {
        assert doc != -1 && doc != NO_MORE_DOCS;
        return scores[index];
    }

    @Override
    public float freq() {
        return 1;
    }
}
