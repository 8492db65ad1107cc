package dev.fumaz.tether.ownership;

import dev.fumaz.tether.exception.SubjectNotOwnedException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Control block shared by every {@link Owned} of one subject: the strong reference, the owner count and the single
 * weak reference handed out to observers.
 */
final class Lifeline<T extends SharedFromThis<?>> {

    private static final Logger LOGGER = Logger.getLogger(Lifeline.class.getName());
    private static final AtomicLong SERIALS = new AtomicLong();

    private final long serial = SERIALS.incrementAndGet();
    private final AtomicInteger owners = new AtomicInteger(1);
    private final @NotNull WeakReference<T> weak;
    private volatile @Nullable T subject;

    Lifeline(@NotNull T subject) {
        this.subject = subject;
        this.weak = new WeakReference<>(subject);
    }

    @NotNull Owned<T> share() {
        while (true) {
            int current = owners.get();

            if (current == 0) {
                throw new SubjectNotOwnedException("Subject has already been released");
            }

            if (owners.compareAndSet(current, current + 1)) {
                return new Owned<>(this);
            }
        }
    }

    void release() {
        int remaining = owners.decrementAndGet();

        if (remaining < 0) {
            throw new IllegalStateException("Lifeline released more often than it was shared");
        }

        if (remaining == 0) {
            destroy();
        }
    }

    @NotNull T subject() {
        T local = subject;

        if (local == null) {
            throw new SubjectNotOwnedException("Subject has already been released");
        }

        return local;
    }

    @NotNull WeakReference<T> weak() {
        return weak;
    }

    long serial() {
        return serial;
    }

    boolean isAlive() {
        return owners.get() > 0;
    }

    int owners() {
        return owners.get();
    }

    private void destroy() {
        T local = subject;
        subject = null;
        weak.clear();

        if (local == null) {
            return;
        }

        LOGGER.log(Level.FINE, "Released subject {0}", local.getClass().getName());

        try {
            local.released();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Release hook of " + local.getClass().getName() + " failed", e);
            throw e;
        }
    }
}
