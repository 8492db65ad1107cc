package dev.fumaz.tether.ownership;

import dev.fumaz.tether.exception.SubjectNotOwnedException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.ref.WeakReference;

/**
 * Base class for subjects that can produce strong and weak references to themselves from inside an instance.
 * <p>
 * Instances only gain that ability once {@link Ownership} has adopted them. Subclasses should keep their constructors
 * non-public and expose a static factory returning the {@link Owned} produced by {@link Ownership#create}.
 *
 * @param <T> the subject type exposed by {@link #sharedFromThis()}
 */
public abstract class SharedFromThis<T extends SharedFromThis<T>> {

    private volatile @Nullable Lifeline<?> lifeline;

    protected SharedFromThis() {
    }

    /**
     * Returns a new strong owner of this subject.
     *
     * @throws SubjectNotOwnedException if this subject was never adopted or has already been released
     */
    @SuppressWarnings("unchecked")
    public final @NotNull Owned<T> sharedFromThis() {
        return (Owned<T>) requireLifeline().share();
    }

    /**
     * Returns the weak reference shared by every observer of this subject. It is cleared when the subject is
     * released.
     *
     * @throws SubjectNotOwnedException if this subject was never adopted
     */
    @SuppressWarnings("unchecked")
    public final @NotNull WeakReference<T> weakFromThis() {
        return (WeakReference<T>) requireLifeline().weak();
    }

    /**
     * A number unique to this subject's adoption, never reused within the JVM. Handles cache it as the subject's
     * address.
     *
     * @throws SubjectNotOwnedException if this subject was never adopted
     */
    public final long ownershipSerial() {
        return requireLifeline().serial();
    }

    public final boolean isOwned() {
        Lifeline<?> local = lifeline;
        return local != null && local.isAlive();
    }

    /**
     * Invoked once, after the last strong owner has been closed and the weak reference has been cleared.
     */
    protected void onReleased() {
    }

    final void released() {
        onReleased();
    }

    final synchronized void attach(@NotNull Lifeline<?> lifeline) {
        if (this.lifeline != null) {
            throw new IllegalStateException(getClass().getName() + " has already been adopted");
        }

        this.lifeline = lifeline;
    }

    private @NotNull Lifeline<?> requireLifeline() {
        Lifeline<?> local = lifeline;

        if (local == null) {
            throw new SubjectNotOwnedException(getClass().getName()
                    + " is not owned; create it through Ownership.create");
        }

        return local;
    }
}
