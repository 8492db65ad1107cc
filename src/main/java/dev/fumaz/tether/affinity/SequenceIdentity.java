package dev.fumaz.tether.affinity;

import org.jetbrains.annotations.NotNull;

/**
 * Supplies the identity of the logical execution sequence the caller is running on.
 * <p>
 * Identities are compared with {@link Object#equals(Object)} and are retained by a bound checker, so they should be
 * small value objects rather than the thread or executor itself.
 */
@FunctionalInterface
public interface SequenceIdentity {

    /**
     * Identifies sequences by the id of the current thread. Thread ids are never reused within a JVM.
     */
    static @NotNull SequenceIdentity currentThread() {
        return () -> Thread.currentThread().getId();
    }

    @NotNull Object current();

}
