package dev.fumaz.tether.handle;

import dev.fumaz.tether.affinity.AffinityToken;
import dev.fumaz.tether.exception.ContractViolationError;
import dev.fumaz.tether.flag.ValidityFlag;
import dev.fumaz.tether.ownership.SharedFromThis;
import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link WeakHandleFactory} issues {@link WeakHandle}s to one subject and can revoke all of them at once.
 * <p>
 * The factory owns one generation at a time: an {@link AffinityToken}, the weak reference to it shared by every handle
 * of the generation, and a {@link ValidityFlag}. {@link #invalidate()} replaces the generation and clears the old weak
 * reference before returning, so every earlier handle resolves to {@code null} from then on, on any thread.
 * <p>
 * {@link #issue()} is not serialised against a concurrent {@link #invalidate()}; whoever owns the subject's lifecycle
 * must not race the two.
 *
 * @param <T> the type of the subject
 */
public final class WeakHandleFactory<T extends SharedFromThis<? super T>> implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(WeakHandleFactory.class.getName());
    private static final VarHandle GENERATION_HANDLE;

    static {
        try {
            GENERATION_HANDLE = MethodHandles.lookup()
                    .findVarHandle(WeakHandleFactory.class, "generation", Generation.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final @NotNull Class<T> type;
    private final @NotNull T subject;
    private final @NotNull HandleOptions options;
    private Generation generation;

    public WeakHandleFactory(@NotNull Class<T> type, @NotNull T subject) {
        this(type, subject, HandleOptions.defaults());
    }

    public WeakHandleFactory(@NotNull Class<T> type, @NotNull T subject, @NotNull HandleOptions options) {
        this.type = Objects.requireNonNull(type, "type");
        this.subject = Objects.requireNonNull(subject, "subject");
        this.options = Objects.requireNonNull(options, "options");

        if (!type.isInstance(subject)) {
            throw new IllegalArgumentException(subject.getClass().getName() + " is not a " + type.getName());
        }

        GENERATION_HANDLE.setRelease(this, Generation.first(options.newToken()));
    }

    /**
     * Issues a handle bound to the current generation.
     *
     * @return a new handle, empty if the factory has been closed or the subject released
     * @throws dev.fumaz.tether.exception.SubjectNotOwnedException if the subject was never adopted
     */
    public @NotNull WeakHandle<T> issue() {
        return issue(type);
    }

    /**
     * Issues a handle typed at a subtype of the subject type, sharing this factory's generation.
     *
     * @throws ContractViolationError if the subject is not a {@code D}
     */
    public <D extends T> @NotNull WeakHandle<D> issueAs(@NotNull Class<D> target) {
        Objects.requireNonNull(target, "target");

        if (!target.isInstance(subject)) {
            throw new ContractViolationError("Cannot issue a handle to " + subject.getClass().getName() + " as "
                    + target.getName());
        }

        return issue(target);
    }

    /**
     * Revokes every handle issued so far and starts a new generation. Handles issued after this call returns are
     * unaffected. Does nothing once the factory is closed.
     */
    public void invalidate() {
        AffinityToken token = options.newToken();
        Generation previous;
        Generation next;

        do {
            previous = current();

            if (previous.isClosed()) {
                return;
            }

            next = previous.next(token);
        } while (!GENERATION_HANDLE.compareAndSet(this, previous, next));

        previous.revoke();

        LOGGER.log(Level.FINE, "Invalidated weak handles to {0}, now at generation {1}",
                new Object[]{type.getName(), next.getNumber()});
    }

    public boolean hasOutstanding() {
        return current().getFlag().hasOutstanding();
    }

    /**
     * Unbinds the current token, letting the next resolving call bind it to its own sequence. Used when ownership of
     * the subject legitimately moves to another sequence.
     */
    public void detachFromSequence() {
        current().getToken().detach();
    }

    /**
     * The number of completed invalidations.
     */
    public long getGeneration() {
        return current().getNumber();
    }

    public boolean isClosed() {
        return current().isClosed();
    }

    public @NotNull HandleOptions getOptions() {
        return options;
    }

    /**
     * Revokes every handle permanently. Handles issued afterwards are empty. Only the first call has an effect.
     */
    @Override
    public void close() {
        Generation previous;

        do {
            previous = current();

            if (previous.isClosed()) {
                return;
            }
        } while (!GENERATION_HANDLE.compareAndSet(this, previous, previous.closed()));

        previous.revoke();
        LOGGER.log(Level.FINE, "Closed weak handle factory for {0}", type.getName());
    }

    private <D> @NotNull WeakHandle<D> issue(@NotNull Class<D> target) {
        Generation current = current();

        if (current.isClosed()) {
            return WeakHandle.empty(target);
        }

        WeakReference<?> self = subject.weakFromThis();
        Object referent = self.get();

        if (referent == null) {
            return WeakHandle.empty(target);
        }

        return new WeakHandle<>(target, current.getTokenReference(), self, current.getFlag(),
                subject.ownershipSerial(), false);
    }

    private @NotNull Generation current() {
        return (Generation) GENERATION_HANDLE.getAcquire(this);
    }

    @Override
    public String toString() {
        return "WeakHandleFactory{type=" + type.getName() + ", generation=" + getGeneration() + ", options=" + options
                + "}";
    }

    private static final class Generation {

        private final @NotNull AffinityToken token;
        private final @NotNull WeakReference<AffinityToken> tokenReference;
        private final @NotNull ValidityFlag flag;
        private final long number;
        private final boolean closed;

        private Generation(@NotNull AffinityToken token, long number, boolean closed) {
            this.token = token;
            this.tokenReference = new WeakReference<>(token);
            this.flag = ValidityFlag.create();
            this.number = number;
            this.closed = closed;

            if (closed) {
                tokenReference.clear();
            }
        }

        static @NotNull Generation first(@NotNull AffinityToken token) {
            return new Generation(token, 0, false);
        }

        @NotNull Generation next(@NotNull AffinityToken token) {
            return new Generation(token, number + 1, false);
        }

        @NotNull Generation closed() {
            return new Generation(AffinityToken.permissive(), number, true);
        }

        void revoke() {
            tokenReference.clear();
        }

        boolean isClosed() {
            return closed;
        }

        @NotNull AffinityToken getToken() {
            return token;
        }

        @NotNull WeakReference<AffinityToken> getTokenReference() {
            return tokenReference;
        }

        @NotNull ValidityFlag getFlag() {
            return flag;
        }

        long getNumber() {
            return number;
        }
    }
}
