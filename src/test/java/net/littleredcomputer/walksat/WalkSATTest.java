package net.littleredcomputer.walksat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class WalkSATTest {
    private static final Logger log = LogManager.getFormatterLogger();

    /** A random source whose noise coin always comes up the same way. */
    private static SGBRandom coin(boolean randomWalk) {
        return new SGBRandom(0) {
            @Override public boolean percent(int percent) { return randomWalk; }
        };
    }

    private static WalkSAT walk(Problem p, SGBRandom R, boolean... values) {
        return new WalkSAT(new SearchState(p, TruthAssignment.of(values)), R);
    }

    @Test
    public void singleClauseFalse() {
        WalkSAT w = walk(Problem.parseFrom("A"), new SGBRandom(0), false);
        assertThat(w.state().isSolved(), is(false));
        assertThat(w.stepOne(), is(true));
        assertThat(w.stepCount(), is(1L));
        assertThat(w.state().value(0), is(true));
    }

    @Test
    public void singleClauseTrue() {
        WalkSAT w = walk(Problem.parseFrom("A"), new SGBRandom(0), true);
        assertThat(w.state().isSolved(), is(true));
        assertThat(w.stepOne(), is(true));
        assertThat(w.stepCount(), is(0L));
        assertThat(w.state().value(0), is(true));
        assertThat(w.state().lastFlip(), isEmpty());
    }

    @Test
    public void contradictionNeverSolves() {
        for (boolean initial : new boolean[]{false, true}) {
            WalkSAT w = walk(Problem.parseFrom("A\n!A"), new SGBRandom(5), initial);
            for (int i = 0; i < 5000; ++i) {
                assertThat(w.stepOne(), is(false));
                assertThat(w.state().unsatisfiedCount(), is(1));
            }
            // Every greedy flip trades one constraint for the other, so the noise only rises.
            assertThat(w.state().noiseLevel(), is(greaterThan(SearchState.DEFAULT_NOISE_LEVEL)));
            assertThat(w.solve(1000), isEmpty());
        }
    }

    @Test
    public void noiseStaysInBounds() {
        Problem p = Problem.randomInstance(3, 430, 100, 11);
        for (int start : new int[]{0, 50, 100}) {
            WalkSAT w = new WalkSAT(p, new SGBRandom(start));
            w.state().setNoiseLevel(start);
            for (int i = 0; i < 20000 && !w.stepOne(); ++i) {
                assertThat(w.state().noiseLevel(), is(both(greaterThanOrEqualTo(0)).and(lessThanOrEqualTo(100))));
            }
        }
    }

    @Test
    public void greedyPicksLargestDelta() {
        // all false: "a | b" and "b | c" are unsatisfied; flipping b fixes both, while
        // flipping a would break "!a | c" and flipping c only fixes one.
        Problem p = Problem.parseFrom("a | b\nb | c\n!a | c");
        WalkSAT w = walk(p, coin(false), false, false, false);
        assertThat(w.stepOne(), is(true));
        assertThat(w.state().values(), is(new boolean[]{false, true, false}));
        assertThat(w.state().lastFlipDelta(), is(2));
    }

    @Test
    public void tiesGoToTheFirstLiteral() {
        Problem p = Problem.parseFrom("b | a | c");
        WalkSAT w = walk(p, coin(false), false, false, false);
        assertThat(w.stepOne(), is(true));
        assertThat(w.state().values(), is(new boolean[]{true, false, false}));
    }

    @Test
    public void noiseFallsWhenImprovementBeatsPreviousFlip() {
        // Only "a" is unsatisfied; flipping a breaks the other two (delta -1). Either
        // of those is then best repaired by flipping a back (delta +1), which beats -1.
        Problem p = Problem.parseFrom("a\n!a | b\n!a | c");
        WalkSAT w = walk(p, coin(false), false, false, false);
        w.stepOne();
        assertThat(w.state().lastFlipDelta(), is(-1));
        assertThat("no previous flip to compare with", w.state().noiseLevel(), is(SearchState.DEFAULT_NOISE_LEVEL));
        w.stepOne();
        assertThat(w.state().value(0), is(false));
        assertThat(w.state().noiseLevel(), is(SearchState.DEFAULT_NOISE_LEVEL - 1));
    }

    @Test
    public void noiseRisesWhenImprovementDoesNotBeatPreviousFlip() {
        Problem p = Problem.parseFrom("a | b\nc | d");
        WalkSAT w = walk(p, coin(false), false, false, false, false);
        w.stepOne();
        assertThat(w.state().lastFlipDelta(), is(1));
        assertThat(w.stepOne(), is(true));
        assertThat(w.state().noiseLevel(), is(SearchState.DEFAULT_NOISE_LEVEL + 1));
    }

    @Test
    public void noiseIsClampedByAdaptation() {
        Problem p = Problem.parseFrom("a | b\nc | d");
        WalkSAT w = walk(p, coin(false), false, false, false, false);
        w.state().setNoiseLevel(100);
        w.stepOne();
        w.stepOne();
        assertThat(w.state().noiseLevel(), is(100));
    }

    @Test
    public void randomWalkLeavesNoiseAlone() {
        WalkSAT w = walk(Problem.parseFrom("A\n!A"), coin(true), false);
        for (int i = 0; i < 100; ++i) w.stepOne();
        assertThat(w.state().noiseLevel(), is(SearchState.DEFAULT_NOISE_LEVEL));
    }

    @Test
    public void adaptationCanBeDisabled() {
        WalkSAT w = walk(Problem.parseFrom("A\n!A"), coin(false), false).setAdaptiveNoise(false);
        for (int i = 0; i < 100; ++i) w.stepOne();
        assertThat(w.state().noiseLevel(), is(SearchState.DEFAULT_NOISE_LEVEL));
    }

    @Test
    public void pureGreedyNeverWorsens() {
        // With no negated literals, flipping a false literal of an unsatisfied clause can
        // only raise counts, and no plain clause can have too many true literals.
        SGBRandom R = new SGBRandom(23);
        Problem.Builder b = Problem.builder();
        for (int v = 0; v < 40; ++v) b.proposition("p" + v);
        for (int j = 0; j < 120; ++j) {
            List<Literal> clause = new ArrayList<>();
            for (int k = 0; k < 3; ++k) clause.add(Literal.of(R.unifRand(40)));
            b.addClause(clause);
        }
        Problem p = b.build();
        boolean[] allFalse = new boolean[p.nPropositions()];
        WalkSAT w = walk(p, new SGBRandom(1), allFalse).setAdaptiveNoise(false);
        w.state().setNoiseLevel(0);
        int steps = 0;
        while (!w.stepOne()) {
            assertThat(w.state().lastFlipDelta(), is(greaterThanOrEqualTo(0)));
            assertThat(w.state().noiseLevel(), is(0));
            assertThat(++steps, is(lessThanOrEqualTo(p.nConstraints())));
        }
        assertThat(w.state().lastFlipDelta(), is(greaterThanOrEqualTo(0)));
        assertThat(p.evaluate(w.state().values()), is(true));
    }

    private static void assertSolves(Problem p, int seed) {
        WalkSAT w = new WalkSAT(p, new SGBRandom(seed)).setCheckConsistency(true);
        Optional<boolean[]> solution = w.solve(200000);
        log.info("solved in %d steps, final noise %d", w.stepCount(), w.state().noiseLevel());
        assertThat(solution, isPresent());
        assertThat(p.evaluate(solution.get()), is(true));
    }

    @Test public void party() { assertSolves(ProblemTest.fromResource("party.sat"), 1); }
    @Test public void coloring() { assertSolves(ProblemTest.fromResource("coloring.sat"), 2); }
    @Test public void waerden3_3_8() { assertSolves(Problem.waerden(3, 3, 8), 3); }
    @Test public void langford3() { assertSolves(Problem.langford(3), 4); }

    @Test
    public void easyRandomInstances() {
        for (int seed = 0; seed < 5; ++seed) assertSolves(Problem.randomInstance(3, 80, 40, seed), seed);
    }

    @Test
    public void pigeonsDoNotFit() {
        Problem p = ProblemTest.fromResource("pigeons.sat");
        WalkSAT w = new WalkSAT(p, new SGBRandom(6));
        assertThat(w.solve(20000), isEmpty());
        assertThat(w.stepCount(), is(20000L));
        assertThat(w.state().unsatisfiedCount(), is(greaterThan(0)));
    }

    @Test
    public void solveWithNoBudget() {
        Problem p = Problem.parseFrom("a\nb");
        assertThat(walk(p, new SGBRandom(0), true, false).solve(0), isEmpty());
        assertThat(walk(p, new SGBRandom(0), true, true).solve(0), isPresent());
    }

    @Test
    public void unlimitedBudgetAfterEarlierSteps() {
        WalkSAT w = walk(Problem.parseFrom("a\nb"), new SGBRandom(0), false, false);
        assertThat(w.stepOne(), is(false));
        assertThat(w.solve(Long.MAX_VALUE), isPresent());
        assertThat(w.stepCount(), is(2L));
    }

    @Test
    public void sameSeedSameRun() {
        Problem p = Problem.randomInstance(3, 150, 40, 8);
        WalkSAT w1 = new WalkSAT(p, new SGBRandom(77));
        WalkSAT w2 = new WalkSAT(p, new SGBRandom(77));
        for (int i = 0; i < 3000; ++i) assertThat(w1.stepOne(), is(w2.stepOne()));
        assertThat(w1.state().values(), is(w2.state().values()));
        assertThat(w1.state().noiseLevel(), is(w2.state().noiseLevel()));
        assertThat(w1.stepCount(), is(w2.stepCount()));
    }
}
