package dev.fumaz.tether.ownership;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A strong owning handle to a subject. The subject stays alive while at least one of its {@link Owned} handles is open;
 * closing the last one destroys it.
 *
 * @param <T> the type of the subject
 */
public final class Owned<T extends SharedFromThis<?>> implements AutoCloseable {

    private final @NotNull Lifeline<T> lifeline;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    Owned(@NotNull Lifeline<T> lifeline) {
        this.lifeline = lifeline;
    }

    public @NotNull T get() {
        if (closed.get()) {
            throw new IllegalStateException("Owned handle has been closed");
        }

        return lifeline.subject();
    }

    /**
     * Creates another strong owner of the same subject.
     */
    public @NotNull Owned<T> share() {
        if (closed.get()) {
            throw new IllegalStateException("Owned handle has been closed");
        }

        return lifeline.share();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Whether the subject has been destroyed, through this or any other owner.
     */
    public boolean isReleased() {
        return !lifeline.isAlive();
    }

    /**
     * Gives up this owner's share. Only the first call has an effect.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            lifeline.release();
        }
    }

    @Override
    public String toString() {
        return "Owned{owners=" + lifeline.owners() + ", closed=" + closed.get() + "}";
    }
}
