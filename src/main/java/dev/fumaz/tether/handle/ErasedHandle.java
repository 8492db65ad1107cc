package dev.fumaz.tether.handle;

import dev.fumaz.tether.affinity.AffinityToken;
import dev.fumaz.tether.cast.TypeView;
import dev.fumaz.tether.cast.TypeViews;
import dev.fumaz.tether.flag.ValidityFlag;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.ref.WeakReference;
import java.util.Comparator;
import java.util.Objects;

/**
 * A {@link WeakHandle} whose static type has been erased, for storage in collections that hold handles of many
 * types. The handle remembers the type it was erased from and {@link #recover(Class)} checks against it.
 */
public final class ErasedHandle {

    public static final Comparator<ErasedHandle> ADDRESS_ORDER = Comparator.comparingLong(ErasedHandle::rawIdentity);

    private final @NotNull Class<?> origin;
    private final @NotNull TypeView view;
    private final boolean verified;
    private @Nullable WeakReference<AffinityToken> token;
    private @Nullable WeakReference<?> subject;
    private @Nullable ValidityFlag.Lease lease;
    private long identity;

    ErasedHandle(@NotNull Class<?> origin, @Nullable WeakReference<AffinityToken> token,
                 @Nullable WeakReference<?> subject, @Nullable ValidityFlag flag, long identity, boolean verified) {
        this.origin = origin;
        this.view = TypeView.of(origin);
        this.verified = verified;

        if (token == null || subject == null || flag == null) {
            return;
        }

        this.token = token;
        this.subject = subject;
        this.identity = identity;
        this.lease = flag.lease(this);
    }

    /**
     * Resolves the handle through the neutral view.
     *
     * @return the subject, or {@code null} under the same conditions as {@link WeakHandle#resolve()}
     */
    public @Nullable Object resolve() {
        WeakReference<AffinityToken> tokenReference = token;
        WeakReference<?> subjectReference = subject;

        if (tokenReference == null || subjectReference == null) {
            return null;
        }

        AffinityToken locked = tokenReference.get();

        if (locked == null || !locked.check()) {
            return null;
        }

        return TypeViews.convert(subjectReference.get(), view, TypeView.neutral());
    }

    public boolean isEmpty() {
        return resolve() == null;
    }

    /**
     * Drops every reference held by this handle and returns its share of the validity flag. Handles recovered from
     * it earlier keep their own share.
     */
    public void reset() {
        ValidityFlag.Lease local = lease;

        token = null;
        subject = null;
        lease = null;
        identity = 0;

        if (local != null) {
            local.release();
        }
    }

    /**
     * Recovers a typed handle. Recovering the original type, or one of its ancestors, relabels the handle; recovering
     * a descendant is checked against the subject at the moment of conversion; an unrelated type yields an empty
     * handle.
     */
    public <U> @NotNull WeakHandle<U> recover(@NotNull Class<U> target) {
        Objects.requireNonNull(target, "target");

        if (TypeViews.isUnrelated(origin, target)) {
            return WeakHandle.empty(target);
        }

        if (!target.isAssignableFrom(origin)) {
            Object referent = resolve();

            if (TypeViews.convert(referent, origin, target) == null) {
                return WeakHandle.empty(target);
            }
        }

        ValidityFlag.Lease local = lease;
        return new WeakHandle<>(target, token, subject, local == null ? null : local.getFlag(), identity, verified);
    }

    public @NotNull Class<?> getOrigin() {
        return origin;
    }

    public long rawIdentity() {
        return identity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o instanceof ErasedHandle) {
            return resolve() == ((ErasedHandle) o).resolve();
        }

        if (o instanceof WeakHandle) {
            return resolve() == ((WeakHandle<?>) o).resolveReferent();
        }

        return false;
    }

    /**
     * The raw identity captured at issuance. It does not change when the subject goes away, so an expired handle
     * equals an empty one without sharing its hash code; remove expired handles from hashed collections.
     */
    @Override
    public int hashCode() {
        return Long.hashCode(identity);
    }

    @Override
    public String toString() {
        return "ErasedHandle{origin=" + origin.getName() + ", identity=" + Long.toHexString(identity) + "}";
    }
}
