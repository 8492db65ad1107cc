package dev.fumaz.tether.handle;

import dev.fumaz.tether.affinity.AffinityToken;
import dev.fumaz.tether.cast.TypeViews;
import dev.fumaz.tether.exception.ContractViolationError;
import dev.fumaz.tether.flag.ValidityFlag;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.ref.WeakReference;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A {@link WeakHandle} is a non-owning reference to a subject that reports the subject as gone instead of dangling.
 * <p>
 * A handle resolves to its subject while the subject still has a strong owner, the generation it was issued under has
 * not been invalidated, and (with a checking token) the caller runs on the sequence the token is bound to. Every
 * {@link #resolve()} result must be checked for {@code null}.
 * <p>
 * Two handles are equal when their types are the same or related and they resolve to the same object; handles of
 * unrelated types are never equal. The hash code comes from the subject's ownership serial captured when the handle
 * was issued, so a handle that has expired stays in the same bucket but no longer equals a live handle to the same
 * subject. Remove expired handles from hashed collections.
 *
 * @param <T> the type of the subject
 */
public final class WeakHandle<T> {

    /**
     * Orders handles by the ownership serial of the subject they were issued for. Handles to distinct subjects never
     * compare equal; empty and reset handles sort first.
     */
    public static final Comparator<WeakHandle<?>> ADDRESS_ORDER = Comparator.comparingLong(WeakHandle::rawIdentity);

    private final @NotNull Class<T> type;
    private final boolean verified;
    private @Nullable WeakReference<AffinityToken> token;
    private @Nullable WeakReference<?> subject;
    private @Nullable ValidityFlag.Lease lease;
    private long identity;

    WeakHandle(@NotNull Class<T> type, @Nullable WeakReference<AffinityToken> token, @Nullable WeakReference<?> subject,
               @Nullable ValidityFlag flag, long identity, boolean verified) {
        this.type = Objects.requireNonNull(type, "type");
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
     * Returns an empty handle without a meaningful type.
     */
    @SuppressWarnings("unchecked")
    public static <T> @NotNull WeakHandle<T> empty() {
        return (WeakHandle<T>) empty(Object.class);
    }

    public static <T> @NotNull WeakHandle<T> empty(@NotNull Class<T> type) {
        return new WeakHandle<>(type, null, null, null, 0, false);
    }

    /**
     * Resolves the handle.
     *
     * @return the subject, or {@code null} if it is gone, the handle was invalidated or reset, or the affinity check
     * failed under {@link dev.fumaz.tether.affinity.AffinityPolicy#RESOLVE_EMPTY}
     * @throws ContractViolationError if the affinity check fails under
     *                                {@link dev.fumaz.tether.affinity.AffinityPolicy#ABORT}, or this handle came from a
     *                                sibling cast and the subject is not a {@code T}
     */
    public @Nullable T resolve() {
        Object referent = resolveReferent();

        if (referent == null) {
            return null;
        }

        if (verified && !type.isInstance(referent)) {
            throw new ContractViolationError("Handle cast to " + type.getName() + " refers to a "
                    + referent.getClass().getName());
        }

        @SuppressWarnings("unchecked")
        T typed = (T) referent;
        return typed;
    }

    public @NotNull Optional<T> resolveOptional() {
        return Optional.ofNullable(resolve());
    }

    /**
     * Resolves the handle for callers that have already checked it.
     *
     * @throws ContractViolationError if the handle is empty
     */
    public @NotNull T require() {
        T resolved = resolve();

        if (resolved == null) {
            throw new ContractViolationError("Dereferenced an empty weak handle to " + type.getName());
        }

        return resolved;
    }

    /**
     * Resolves the handle once and passes the subject to {@code action} if it is present.
     *
     * @return whether the action ran
     */
    public boolean ifPresent(@NotNull Consumer<? super T> action) {
        Objects.requireNonNull(action, "action");
        T resolved = resolve();

        if (resolved == null) {
            return false;
        }

        action.accept(resolved);
        return true;
    }

    public boolean isPresent() {
        return resolve() != null;
    }

    public boolean isEmpty() {
        return resolve() == null;
    }

    /**
     * Drops every reference held by this handle and returns its share of the validity flag. Not safe against
     * concurrent use of the same handle.
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
     * Checked downcast. The result is empty if the subject is gone or is not a {@code U} at the moment of conversion.
     */
    public <U extends T> @NotNull WeakHandle<U> narrow(@NotNull Class<U> target) {
        Objects.requireNonNull(target, "target");

        if (target == type) {
            return relabel(target, verified);
        }

        Object referent = resolveReferent();
        U converted = TypeViews.convert(referent, type, target);

        if (converted == null) {
            return empty(target);
        }

        return relabel(target, false);
    }

    /**
     * Erases the type of this handle so it can be stored alongside handles of other types.
     */
    public @NotNull ErasedHandle erase() {
        ValidityFlag.Lease local = lease;
        return new ErasedHandle(type, token, subject, local == null ? null : local.getFlag(), identity,
                verified);
    }

    public @NotNull Class<T> getType() {
        return type;
    }

    /**
     * The {@linkplain dev.fumaz.tether.ownership.SharedFromThis#ownershipSerial() ownership serial} of the subject
     * captured when the handle was issued, or 0 for an empty or reset handle. Distinct subjects never share it.
     */
    public long rawIdentity() {
        return identity;
    }

    @NotNull <U> WeakHandle<U> relabel(@NotNull Class<U> target, boolean verify) {
        ValidityFlag.Lease local = lease;
        return new WeakHandle<>(target, token, subject, local == null ? null : local.getFlag(), identity, verify);
    }

    boolean isVerified() {
        return verified;
    }

    @Nullable Object resolveReferent() {
        WeakReference<AffinityToken> tokenReference = token;
        WeakReference<?> subjectReference = subject;

        if (tokenReference == null || subjectReference == null) {
            return null;
        }

        AffinityToken locked = tokenReference.get();

        if (locked == null || !locked.check()) {
            return null;
        }

        return subjectReference.get();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o instanceof ErasedHandle) {
            return resolveReferent() == ((ErasedHandle) o).resolve();
        }

        if (!(o instanceof WeakHandle)) {
            return false;
        }

        WeakHandle<?> that = (WeakHandle<?>) o;

        if (TypeViews.isUnrelated(type, that.type)) {
            return false;
        }

        return resolveReferent() == that.resolveReferent();
    }

    /**
     * The raw identity captured at issuance, or 0 once reset. It does not change when the subject goes away, so an
     * expired handle equals an empty one without sharing its hash code; remove expired handles from hashed
     * collections before they expire.
     */
    @Override
    public int hashCode() {
        return Long.hashCode(identity);
    }

    @Override
    public String toString() {
        return "WeakHandle{type=" + type.getName() + ", identity=" + Long.toHexString(identity) + "}";
    }
}
