package net.littleredcomputer.walksat;

/**
 * The cached true-literal counts or the unsatisfied set disagree with the truth
 * assignment. This always indicates a bug in the flip bookkeeping.
 */
public class InternalConsistencyException extends IllegalStateException {
    public InternalConsistencyException(String message) {
        super(message);
    }
}
