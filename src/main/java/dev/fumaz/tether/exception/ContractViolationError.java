package dev.fumaz.tether.exception;

/**
 * Thrown when a caller breaks a usage contract of the library, such as resolving a handle from the wrong sequence
 * under {@link dev.fumaz.tether.affinity.AffinityPolicy#ABORT} or casting a handle across unrelated types.
 * <p>
 * This is a programming error, not a runtime condition, and is not meant to be caught.
 */
public class ContractViolationError extends Error {

    public ContractViolationError(String message) {
        super(message);
    }
}
