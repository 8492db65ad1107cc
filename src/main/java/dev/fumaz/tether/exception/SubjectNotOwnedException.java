package dev.fumaz.tether.exception;

/**
 * Indicates that strong ownership was requested from a subject that was never adopted or has already been released.
 */
public class SubjectNotOwnedException extends TetherException {

    public SubjectNotOwnedException(String message) {
        super(message);
    }

    public SubjectNotOwnedException(String message, Throwable cause) {
        super(message, cause);
    }
}
