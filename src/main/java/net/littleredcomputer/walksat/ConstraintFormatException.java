package net.littleredcomputer.walksat;

/**
 * Thrown when a constraint expression cannot be read as a list of literals.
 */
public class ConstraintFormatException extends IllegalArgumentException {
    public ConstraintFormatException(String message) {
        super(message);
    }

    public ConstraintFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
