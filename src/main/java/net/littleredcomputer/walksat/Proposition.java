package net.littleredcomputer.walksat;

import gnu.trove.list.array.TIntArrayList;

/**
 * A named boolean variable. Besides its name and dense index, a proposition holds
 * adjacency lists into the problem's constraint array: the constraints mentioning it
 * positively, those mentioning it negatively, and the two merged into the distinct
 * constraints it touches, each with a net weight. All of them are fixed at build time.
 */
public final class Proposition {
    private final int id;
    private final String name;
    private final int[] positive;
    private final int[] negative;
    // touched[i] gains weight[i] true literals when this proposition goes false -> true,
    // and loses as many going true -> false. weight = (#positive - #negative) occurrences.
    private final int[] touched;
    private final int[] weight;

    Proposition(int id, String name, TIntArrayList positive, TIntArrayList negative) {
        this.id = id;
        this.name = name;
        this.positive = positive.toArray();
        this.negative = negative.toArray();
        TIntArrayList t = new TIntArrayList();
        TIntArrayList w = new TIntArrayList();
        // Occurrence lists are in ascending constraint order, so a merge finds repeats.
        int i = 0, j = 0;
        while (i < this.positive.length || j < this.negative.length) {
            int c = Math.min(i < this.positive.length ? this.positive[i] : Integer.MAX_VALUE,
                    j < this.negative.length ? this.negative[j] : Integer.MAX_VALUE);
            int net = 0;
            while (i < this.positive.length && this.positive[i] == c) { ++net; ++i; }
            while (j < this.negative.length && this.negative[j] == c) { --net; ++j; }
            t.add(c);
            w.add(net);
        }
        this.touched = t.toArray();
        this.weight = w.toArray();
    }

    public int id() { return id; }
    public String name() { return name; }

    /** Indices of constraints containing this proposition as a positive literal, once per occurrence. */
    public int[] positiveConstraints() { return positive.clone(); }

    /** Indices of constraints containing this proposition negated, once per occurrence. */
    public int[] negativeConstraints() { return negative.clone(); }

    int nTouched() { return touched.length; }
    int touched(int i) { return touched[i]; }
    int weight(int i) { return weight[i]; }

    @Override
    public String toString() { return name; }
}
