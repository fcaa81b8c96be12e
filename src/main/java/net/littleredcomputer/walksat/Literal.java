package net.littleredcomputer.walksat;

import java.util.Objects;

/**
 * A proposition together with a polarity. Literals refer to their proposition by its
 * dense index, so they carry no reference to the problem that interned the name.
 */
public final class Literal {
    private final int proposition;
    private final boolean negated;

    public Literal(int proposition, boolean negated) {
        if (proposition < 0) throw new IllegalArgumentException("negative proposition index: " + proposition);
        this.proposition = proposition;
        this.negated = negated;
    }

    public static Literal of(int proposition) { return new Literal(proposition, false); }
    public static Literal not(int proposition) { return new Literal(proposition, true); }

    public int proposition() { return proposition; }
    public boolean negated() { return negated; }

    /** A literal is true when its proposition's value differs from its negation flag. */
    public boolean isTrueUnder(TruthAssignment a) {
        return a.get(proposition) != negated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal l = (Literal) o;
        return proposition == l.proposition && negated == l.negated;
    }

    @Override
    public int hashCode() { return Objects.hash(proposition, negated); }

    @Override
    public String toString() { return (negated ? "!" : "") + proposition; }
}
