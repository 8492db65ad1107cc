package dev.fumaz.tether.exception;

/**
 * Signals that a handle was resolved from a sequence other than the one its token is bound to.
 */
public class AffinityViolationException extends TetherException {

    public AffinityViolationException(String message) {
        super(message);
    }

    public AffinityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
