package dev.fumaz.tether.exception;

/**
 * Base unchecked exception for recoverable Tether failures.
 */
public class TetherException extends RuntimeException {

    public TetherException(String message) {
        super(message);
    }

    public TetherException(String message, Throwable cause) {
        super(message, cause);
    }

    public TetherException(Throwable cause) {
        super(cause);
    }
}
