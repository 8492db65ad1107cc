package dev.fumaz.tether.flag;

import org.jetbrains.annotations.NotNull;

import java.lang.ref.Cleaner;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A shared counter answering whether any handles of one generation are still outstanding.
 * <p>
 * The issuing factory holds the flag itself; every handle holds a {@link Lease}. A lease is returned either explicitly
 * or when its holder is collected. The flag is purely observational and is never consulted during resolution.
 */
public final class ValidityFlag {

    private static final Cleaner CLEANER = Cleaner.create();

    private final AtomicInteger leases = new AtomicInteger();

    private ValidityFlag() {
    }

    public static @NotNull ValidityFlag create() {
        return new ValidityFlag();
    }

    /**
     * Takes a share of this flag on behalf of {@code holder}. The share is returned when the lease is
     * {@linkplain Lease#release() released} or when {@code holder} becomes unreachable, whichever happens first.
     *
     * @param holder the object whose reachability bounds the lease, never referenced strongly by the lease
     */
    public @NotNull Lease lease(@NotNull Object holder) {
        Objects.requireNonNull(holder, "holder");
        leases.incrementAndGet();

        return new Lease(this, CLEANER.register(holder, new Release(leases)));
    }

    /**
     * Whether any lease is still held. Every handle takes a lease when it is created, including temporaries that are
     * never stored (the result of a chained {@code issue().isEmpty()}, or of a conversion that is discarded), and
     * those keep this {@code true} until they are reset or collected.
     */
    public boolean hasOutstanding() {
        return leases.get() > 0;
    }

    public int outstanding() {
        return leases.get();
    }

    @Override
    public String toString() {
        return "ValidityFlag{outstanding=" + leases.get() + "}";
    }

    /**
     * One handle's share of a {@link ValidityFlag}.
     */
    public static final class Lease {

        private final @NotNull ValidityFlag flag;
        private final @NotNull Cleaner.Cleanable cleanable;

        private Lease(@NotNull ValidityFlag flag, @NotNull Cleaner.Cleanable cleanable) {
            this.flag = flag;
            this.cleanable = cleanable;
        }

        public @NotNull ValidityFlag getFlag() {
            return flag;
        }

        /**
         * Returns the share. Only the first call has an effect.
         */
        public void release() {
            cleanable.clean();
        }
    }

    // Must not capture the lease holder, or the holder could never become phantom reachable.
    private static final class Release implements Runnable {

        private final AtomicInteger leases;

        private Release(AtomicInteger leases) {
            this.leases = leases;
        }

        @Override
        public void run() {
            leases.decrementAndGet();
        }
    }
}
