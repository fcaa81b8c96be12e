package net.littleredcomputer.walksat;

import com.google.common.collect.ImmutableList;

/**
 * A generalized clause: the constraint is satisfied when the number of its literals
 * that are true lies in [minTrueLiterals, maxTrueLiterals]. An ordinary disjunction is
 * the range [1, size].
 */
public final class Constraint {
    private final int index;
    private final ImmutableList<Literal> literals;
    private final int minTrueLiterals;
    private final int maxTrueLiterals;

    Constraint(int index, Iterable<Literal> literals, int minTrueLiterals, int maxTrueLiterals) {
        this.index = index;
        this.literals = ImmutableList.copyOf(literals);
        if (this.literals.isEmpty()) throw new IllegalArgumentException("empty constraint");
        if (minTrueLiterals < 0) throw new IllegalArgumentException("negative minimum: " + minTrueLiterals);
        if (minTrueLiterals > maxTrueLiterals) {
            throw new IllegalArgumentException("minimum " + minTrueLiterals + " exceeds maximum " + maxTrueLiterals);
        }
        if (maxTrueLiterals > this.literals.size()) {
            throw new IllegalArgumentException("maximum " + maxTrueLiterals + " exceeds literal count " + this.literals.size());
        }
        this.minTrueLiterals = minTrueLiterals;
        this.maxTrueLiterals = maxTrueLiterals;
    }

    /** Position of this constraint in its problem; the key into the per-constraint count array. */
    public int index() { return index; }
    public ImmutableList<Literal> literals() { return literals; }
    public int size() { return literals.size(); }
    public int minTrueLiterals() { return minTrueLiterals; }
    public int maxTrueLiterals() { return maxTrueLiterals; }

    public boolean inRange(int trueLiterals) {
        return trueLiterals >= minTrueLiterals && trueLiterals <= maxTrueLiterals;
    }

    public boolean isPlainClause() {
        return minTrueLiterals == 1 && maxTrueLiterals == literals.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('#').append(index).append(' ');
        if (!isPlainClause()) sb.append('[').append(minTrueLiterals).append(',').append(maxTrueLiterals).append("] ");
        sb.append(literals);
        return sb.toString();
    }
}
