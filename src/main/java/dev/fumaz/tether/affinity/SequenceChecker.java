package dev.fumaz.tether.affinity;

import dev.fumaz.tether.exception.AffinityViolationException;
import dev.fumaz.tether.exception.ContractViolationError;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A checking {@link AffinityToken}. The first {@link #check()} binds the token to the calling sequence; later checks
 * succeed only on that sequence until {@link #detach()} is called.
 */
public final class SequenceChecker implements AffinityToken {

    private static final Logger LOGGER = Logger.getLogger(SequenceChecker.class.getName());

    private final @NotNull AffinityPolicy policy;
    private final @NotNull SequenceIdentity identity;
    private final Object lock = new Object();
    private @Nullable Object boundSequence;

    public SequenceChecker(@NotNull AffinityPolicy policy, @NotNull SequenceIdentity identity) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    @Override
    public boolean check() {
        Object current = Objects.requireNonNull(identity.current(), "identity.current()");
        Object bound;

        synchronized (lock) {
            if (boundSequence == null) {
                boundSequence = current;
                return true;
            }

            bound = boundSequence;
        }

        if (bound.equals(current)) {
            return true;
        }

        return onViolation(bound, current);
    }

    @Override
    public void detach() {
        synchronized (lock) {
            boundSequence = null;
        }
    }

    @Override
    public boolean isBound() {
        synchronized (lock) {
            return boundSequence != null;
        }
    }

    public @NotNull AffinityPolicy getPolicy() {
        return policy;
    }

    private boolean onViolation(Object bound, Object current) {
        String message = "Weak handle resolved on sequence " + current + " but its token is bound to sequence "
                + bound;

        switch (policy) {
            case ABORT:
                LOGGER.severe(message);
                throw new ContractViolationError(message);
            case THROW:
                throw new AffinityViolationException(message);
            case RESOLVE_EMPTY:
                LOGGER.log(Level.FINE, message);
                return false;
            default:
                throw new IllegalStateException("Unknown affinity policy " + policy);
        }
    }

    @Override
    public String toString() {
        return "SequenceChecker{policy=" + policy + ", bound=" + isBound() + "}";
    }
}
