package net.littleredcomputer.walksat;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * WalkSAT over generalized cardinality constraints. Each step picks an unsatisfied
 * constraint at random and flips one of its propositions: a random one with probability
 * noiseLevel percent, otherwise the one whose flip most reduces the number of
 * unsatisfied constraints (ties going to the earliest literal of the constraint).
 * <p>
 * After a greedy choice the noise level adapts: if the chosen flip promises a larger
 * improvement than the previous flip achieved, noise drops by one point, otherwise it
 * rises by one. This compares against the single preceding step, not against a target
 * improvement rate as in the usual adaptive-noise schemes.
 */
public class WalkSAT {
    private static final Logger log = LogManager.getFormatterLogger(WalkSAT.class);
    private static final int logCheckSteps = 10000;
    private final SearchState state;
    private final SGBRandom R;
    private boolean adaptiveNoise = true;
    private boolean checkConsistency = false;
    private long stepCount;
    private long lastStepCount;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    /** Search from a random initial assignment drawn from R. */
    public WalkSAT(Problem problem, SGBRandom R) {
        this(new SearchState(problem, TruthAssignment.random(problem.nPropositions(), R)), R);
    }

    public WalkSAT(SearchState state, SGBRandom R) {
        this.state = state;
        this.R = R;
    }

    public SearchState state() { return state; }
    public long stepCount() { return stepCount; }

    public WalkSAT setAdaptiveNoise(boolean adaptiveNoise) {
        this.adaptiveNoise = adaptiveNoise;
        return this;
    }

    /** Verify the tracker's bookkeeping after every step. Slow. */
    public WalkSAT setCheckConsistency(boolean checkConsistency) {
        this.checkConsistency = checkConsistency;
        return this;
    }

    public WalkSAT setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /**
     * Perform one flip, unless every constraint is already satisfied.
     * @return true if every constraint is now satisfied
     */
    public boolean stepOne() {
        if (state.isSolved()) return true;
        ++stepCount;
        final Constraint c = state.unsatisfiedConstraint(R.unifRand(state.unsatisfiedCount()));
        Literal chosen;
        if (R.percent(state.noiseLevel())) {
            chosen = R.randomElement(c.literals());
        } else {
            chosen = null;
            int best = Integer.MIN_VALUE;
            for (Literal l : c.literals()) {
                final int delta = state.satisfactionDelta(l.proposition());
                if (delta > best) {
                    best = delta;
                    chosen = l;
                }
            }
            if (adaptiveNoise && state.lastFlip().isPresent()) {
                state.setNoiseLevel(state.noiseLevel() + (best > state.lastFlipDelta() ? -1 : 1));
            }
        }
        state.flip(chosen.proposition());
        if (checkConsistency) state.checkConsistency();
        if (stepCount % logCheckSteps == 0) maybeReportProgress();
        return state.isSolved();
    }

    /**
     * Step until solved or until maxSteps more steps have been taken. An empty result
     * says nothing about satisfiability.
     * @return the satisfying assignment, indexed by proposition id, if one was found
     */
    public Optional<boolean[]> solve(long maxSteps) {
        if (maxSteps < 0) throw new IllegalArgumentException("negative step budget");
        start();
        final long first = stepCount;
        while (!state.isSolved()) {
            if (stepCount - first >= maxSteps) {
                log.info("gave up after %d steps %s with %d unsatisfied", stepCount, stopwatch, state.unsatisfiedCount());
                stopwatch.stop();
                return Optional.empty();
            }
            stepOne();
        }
        stopwatch.stop();
        log.info("solved after %d steps %s", stepCount, stopwatch);
        return Optional.of(state.values());
    }

    private void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    private void maybeReportProgress() {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d steps %s %.0f/sec %d unsatisfied noise %d",
                stepCount, stopwatch, perSec, state.unsatisfiedCount(), state.noiseLevel()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
