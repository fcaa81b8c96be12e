package net.littleredcomputer.walksat;

/**
 * A total assignment of truth values to the propositions 0..n-1. The only mutation
 * is {@link #flip}.
 */
public final class TruthAssignment {
    private final boolean[] values;

    private TruthAssignment(boolean[] values) {
        this.values = values;
    }

    public static TruthAssignment random(int nPropositions, SGBRandom R) {
        boolean[] v = new boolean[nPropositions];
        for (int i = 0; i < nPropositions; ++i) v[i] = R.nextBoolean();
        return new TruthAssignment(v);
    }

    public static TruthAssignment of(boolean... values) {
        return new TruthAssignment(values.clone());
    }

    public int size() { return values.length; }

    public boolean get(int proposition) { return values[proposition]; }

    /** @return the new value of the proposition */
    public boolean flip(int proposition) {
        return values[proposition] = !values[proposition];
    }

    public int trueLiteralCount(Constraint c) {
        int n = 0;
        for (Literal l : c.literals()) if (l.isTrueUnder(this)) ++n;
        return n;
    }

    public boolean[] toArray() { return values.clone(); }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        for (boolean b : values) s.append(b ? '1' : '0');
        return s.toString();
    }
}
