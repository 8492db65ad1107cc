package dev.fumaz.tether.affinity;

/**
 * Decides how a checking {@link AffinityToken} responds when it is used from a sequence other than the bound one.
 */
public enum AffinityPolicy {

    /**
     * Treat the mismatch as a fatal contract violation and throw
     * {@link dev.fumaz.tether.exception.ContractViolationError}.
     */
    ABORT,

    /**
     * Throw a typed {@link dev.fumaz.tether.exception.AffinityViolationException}.
     */
    THROW,

    /**
     * Fail the check quietly, so the handle being resolved reports its target as gone.
     */
    RESOLVE_EMPTY
}
