package dev.fumaz.tether.affinity;

import org.jetbrains.annotations.NotNull;

/**
 * An {@link AffinityToken} records which sequence the handles of one generation belong to.
 * <p>
 * The token is strongly owned by a {@link dev.fumaz.tether.handle.WeakHandleFactory} and only weakly referenced by the
 * handles it issues, so replacing it orphans every handle of the previous generation.
 */
public interface AffinityToken {

    static @NotNull AffinityToken permissive() {
        return PermissiveAffinityToken.INSTANCE;
    }

    static @NotNull AffinityToken checking(@NotNull AffinityPolicy policy) {
        return new SequenceChecker(policy, SequenceIdentity.currentThread());
    }

    static @NotNull AffinityToken checking(@NotNull AffinityPolicy policy, @NotNull SequenceIdentity identity) {
        return new SequenceChecker(policy, identity);
    }

    /**
     * Checks that the caller runs on the bound sequence, binding the token to it if it is currently unbound.
     *
     * @return {@code true} if the caller may proceed
     */
    boolean check();

    /**
     * Forgets the bound sequence so the next {@link #check()} binds to whichever sequence calls it.
     */
    void detach();

    boolean isBound();

}
