package net.littleredcomputer.walksat;

import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Optional;

/**
 * The mutable side of a search: a truth assignment, the number of true literals in
 * each constraint, and the set of constraints whose count is out of range. A flip
 * updates all three touching only the constraints that mention the flipped
 * proposition.
 * <p>
 * The unsatisfied set is an array of constraint indices together with the position of
 * each constraint in that array (or -1), giving constant-time insertion, removal,
 * membership and uniform selection. Its order is not meaningful.
 */
public class SearchState {
    private static final Logger log = LogManager.getFormatterLogger(SearchState.class);
    public static final int DEFAULT_NOISE_LEVEL = 10;

    private final Problem problem;
    private final TruthAssignment assignment;
    private final int[] trueLiteralCounts;
    private final TIntArrayList unsatisfied = new TIntArrayList();
    private final int[] unsatisfiedPosition;
    private int noiseLevel = DEFAULT_NOISE_LEVEL;
    private Literal lastFlip = null;  // the literal made true by the most recent flip
    private int lastFlipDelta = 0;

    public SearchState(Problem problem, TruthAssignment assignment) {
        if (assignment.size() != problem.nPropositions()) {
            throw new IllegalArgumentException("assignment covers " + assignment.size()
                    + " propositions, problem has " + problem.nPropositions());
        }
        this.problem = problem;
        this.assignment = assignment;
        final int m = problem.nConstraints();
        trueLiteralCounts = new int[m];
        unsatisfiedPosition = new int[m];
        Arrays.fill(unsatisfiedPosition, -1);
        for (Constraint c : problem.constraints()) {
            trueLiteralCounts[c.index()] = assignment.trueLiteralCount(c);
            if (unsatisfied(c)) addUnsatisfied(c.index());
        }
        log.debug("%d propositions, %d constraints, %d initially unsatisfied",
                problem.nPropositions(), m, unsatisfied.size());
    }

    public Problem problem() { return problem; }

    public boolean value(int proposition) { return assignment.get(proposition); }
    public boolean[] values() { return assignment.toArray(); }

    public int trueLiteralCount(Constraint c) { return trueLiteralCounts[c.index()]; }

    public boolean satisfied(Constraint c) { return c.inRange(trueLiteralCounts[c.index()]); }
    public boolean unsatisfied(Constraint c) { return !satisfied(c); }

    public boolean isSolved() { return unsatisfied.isEmpty(); }
    public int unsatisfiedCount() { return unsatisfied.size(); }

    /** @param i position in the unsatisfied set, 0 &lt;= i &lt; {@link #unsatisfiedCount()} */
    public Constraint unsatisfiedConstraint(int i) {
        return problem.constraint(unsatisfied.get(i));
    }

    public ImmutableList<Constraint> unsatisfiedConstraints() {
        ImmutableList.Builder<Constraint> b = ImmutableList.builder();
        for (int i = 0; i < unsatisfied.size(); ++i) b.add(problem.constraint(unsatisfied.get(i)));
        return b.build();
    }

    /** Membership in the cached set, as opposed to {@link #unsatisfied}, which consults the count. */
    boolean inUnsatisfiedSet(Constraint c) { return unsatisfiedPosition[c.index()] >= 0; }

    // Direct access to the cached bookkeeping, so tests can damage it and watch checkConsistency complain.
    void adjustCachedCount(Constraint c, int by) { trueLiteralCounts[c.index()] += by; }
    void setCachedPosition(Constraint c, int position) { unsatisfiedPosition[c.index()] = position; }

    public int noiseLevel() { return noiseLevel; }

    /** Sets the percentage of random-walk steps, clamped to [0, 100]. */
    public void setNoiseLevel(int noiseLevel) {
        this.noiseLevel = Math.max(0, Math.min(100, noiseLevel));
    }

    public Optional<Literal> lastFlip() { return Optional.ofNullable(lastFlip); }

    /** Decrease in the number of unsatisfied constraints caused by the most recent flip. */
    public int lastFlipDelta() { return lastFlipDelta; }

    /**
     * Toggle the value of a proposition, bringing the counts and the unsatisfied set
     * up to date.
     * @return the decrease in the number of unsatisfied constraints
     * @throws IndexOutOfBoundsException if there is no such proposition
     */
    public int flip(int proposition) {
        final Proposition p = problem.proposition(proposition);
        final boolean now = assignment.flip(proposition);
        final int sign = now ? 1 : -1;
        final int before = unsatisfied.size();
        for (int i = 0; i < p.nTouched(); ++i) {
            final int c = p.touched(i);
            trueLiteralCounts[c] += sign * p.weight(i);
            updateMembership(c);
        }
        lastFlip = new Literal(proposition, !now);
        lastFlipDelta = before - unsatisfied.size();
        log.trace("flip %s: %s -> %s, %d unsatisfied", p, !now, now, unsatisfied.size());
        return lastFlipDelta;
    }

    /**
     * The decrease in the number of unsatisfied constraints that flipping the proposition
     * would produce, computed from its adjacency lists without changing any state.
     */
    public int satisfactionDelta(int proposition) {
        final Proposition p = problem.proposition(proposition);
        final int sign = assignment.get(proposition) ? -1 : 1;
        int delta = 0;
        for (int i = 0; i < p.nTouched(); ++i) {
            final int w = p.weight(i);
            if (w == 0) continue;
            final int c = p.touched(i);
            final Constraint k = problem.constraint(c);
            final boolean was = k.inRange(trueLiteralCounts[c]);
            final boolean will = k.inRange(trueLiteralCounts[c] + sign * w);
            if (was != will) delta += will ? 1 : -1;
        }
        return delta;
    }

    private void updateMembership(int c) {
        final boolean member = unsatisfiedPosition[c] >= 0;
        final boolean out = !problem.constraint(c).inRange(trueLiteralCounts[c]);
        if (out && !member) addUnsatisfied(c);
        else if (!out && member) removeUnsatisfied(c);
    }

    private void addUnsatisfied(int c) {
        unsatisfiedPosition[c] = unsatisfied.size();
        unsatisfied.add(c);
    }

    private void removeUnsatisfied(int c) {
        final int pos = unsatisfiedPosition[c];
        final int last = unsatisfied.removeAt(unsatisfied.size() - 1);
        if (last != c) {
            unsatisfied.set(pos, last);
            unsatisfiedPosition[last] = pos;
        }
        unsatisfiedPosition[c] = -1;
    }

    private String lastFlipName() {
        return lastFlip == null ? "(none)" : problem.describe(lastFlip);
    }

    /**
     * Recompute every count and every membership from scratch and compare with the
     * cached values. Expensive; meant for tests and debugging.
     * @throws InternalConsistencyException describing the first discrepancy
     */
    public void checkConsistency() {
        for (Constraint c : problem.constraints()) {
            final int actual = assignment.trueLiteralCount(c);
            if (trueLiteralCounts[c.index()] != actual) {
                throw new InternalConsistencyException(String.format(
                        "true literal count of constraint %s is %d, should be %d. Last flip was %s",
                        c, trueLiteralCounts[c.index()], actual, lastFlipName()));
            }
        }
        int members = 0;
        for (Constraint c : problem.constraints()) {
            final boolean present = inUnsatisfiedSet(c);
            if (present) {
                ++members;
                final int pos = unsatisfiedPosition[c.index()];
                if (pos >= unsatisfied.size() || unsatisfied.get(pos) != c.index()) {
                    throw new InternalConsistencyException(String.format(
                            "constraint %s is misfiled in the unsatisfied set. Last flip was %s", c, lastFlipName()));
                }
            }
            if (satisfied(c) && present) {
                throw new InternalConsistencyException(String.format(
                        "constraint %s appears in the unsatisfied set but is satisfied. Last flip was %s",
                        c, lastFlipName()));
            }
            if (unsatisfied(c) && !present) {
                throw new InternalConsistencyException(String.format(
                        "constraint %s is unsatisfied but does not appear in the unsatisfied set. Last flip was %s",
                        c, lastFlipName()));
            }
        }
        if (members != unsatisfied.size()) {
            throw new InternalConsistencyException(String.format(
                    "unsatisfied set holds %d entries for %d constraints. Last flip was %s",
                    unsatisfied.size(), members, lastFlipName()));
        }
    }
}
