package dev.fumaz.tether.handle;

import dev.fumaz.tether.ownership.SharedFromThis;
import org.jetbrains.annotations.NotNull;

/**
 * Base class for subjects that hand out {@link WeakHandle}s to themselves through one embedded
 * {@link WeakHandleFactory}.
 * <p>
 * When the last strong owner of the subject is closed, the factory is closed as well and every handle resolves to
 * {@code null}. Subclasses overriding {@link #onReleased()} must call {@code super.onReleased()}.
 *
 * <pre>{@code
 * public final class Session extends WeakSubject<Session> {
 *     private Session() {
 *         super(Session.class);
 *     }
 *
 *     public static Owned<Session> create() {
 *         return Ownership.create(Session::new);
 *     }
 * }
 * }</pre>
 *
 * @param <T> the subject type
 */
public abstract class WeakSubject<T extends WeakSubject<T>> extends SharedFromThis<T> {

    private final @NotNull WeakHandleFactory<T> weakHandles;

    protected WeakSubject(@NotNull Class<T> type) {
        this(type, HandleOptions.defaults());
    }

    protected WeakSubject(@NotNull Class<T> type, @NotNull HandleOptions options) {
        this.weakHandles = new WeakHandleFactory<>(type, type.cast(this), options);
    }

    public final @NotNull WeakHandle<T> weakHandle() {
        return weakHandles.issue();
    }

    /**
     * Issues a handle typed at the concrete class of this subject, for subjects whose handles are managed by a base
     * class.
     */
    public final <D extends T> @NotNull WeakHandle<D> weakHandleAs(@NotNull Class<D> type) {
        return weakHandles.issueAs(type);
    }

    public final boolean hasWeakHandles() {
        return weakHandles.hasOutstanding();
    }

    protected final void invalidateWeakHandles() {
        weakHandles.invalidate();
    }

    /**
     * Unbinds the affinity token so the next sequence resolving a handle takes over.
     */
    protected final void detachFromSequence() {
        weakHandles.detachFromSequence();
    }

    protected final @NotNull WeakHandleFactory<T> weakHandleFactory() {
        return weakHandles;
    }

    @Override
    protected void onReleased() {
        weakHandles.close();
    }
}
