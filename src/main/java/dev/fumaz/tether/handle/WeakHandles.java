package dev.fumaz.tether.handle;

import dev.fumaz.tether.cast.TypeViews;
import dev.fumaz.tether.exception.ContractViolationError;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Conversions between {@link WeakHandle}s whose type relationship the compiler can prove.
 */
public final class WeakHandles {

    private WeakHandles() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * Upcasts a handle. The result shares the token, subject and validity flag of {@code handle}.
     */
    public static <B, D extends B> @NotNull WeakHandle<B> widen(@NotNull WeakHandle<D> handle,
                                                                @NotNull Class<B> type) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(type, "type");

        if (!type.isAssignableFrom(handle.getType())) {
            throw new ContractViolationError(handle.getType().getName() + " is not a subtype of " + type.getName());
        }

        return handle.relabel(type, handle.isVerified());
    }

    /**
     * Relabels a handle as a sibling type sharing the ancestor {@code base}. Resolving the result verifies that the
     * subject really is a {@code U} and throws {@link ContractViolationError} if it is not.
     *
     * @throws ContractViolationError if the handle type and {@code target} are already ancestor and descendant, in
     *                                which case {@link #widen} or {@link WeakHandle#narrow} applies
     */
    public static <B, T extends B, U extends B> @NotNull WeakHandle<U> castWithinHierarchy(
            @NotNull WeakHandle<T> handle, @NotNull Class<B> base, @NotNull Class<U> target) {
        return castWithinHierarchy(handle, base, target, true);
    }

    /**
     * Like {@link #castWithinHierarchy(WeakHandle, Class, Class)} but trusts the caller: the subject is not verified
     * on resolution, and a wrong cast surfaces as a {@link ClassCastException} where the result is used.
     */
    public static <B, T extends B, U extends B> @NotNull WeakHandle<U> castWithinHierarchyUnchecked(
            @NotNull WeakHandle<T> handle, @NotNull Class<B> base, @NotNull Class<U> target) {
        return castWithinHierarchy(handle, base, target, false);
    }

    private static <U> @NotNull WeakHandle<U> castWithinHierarchy(WeakHandle<?> handle, Class<?> base,
                                                                  Class<U> target, boolean verify) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(target, "target");

        Class<?> source = handle.getType();

        if (!base.isAssignableFrom(source) || !base.isAssignableFrom(target)) {
            throw new ContractViolationError(source.getName() + " and " + target.getName()
                    + " do not share the base " + base.getName());
        }

        if (TypeViews.isRelated(source, target)) {
            throw new ContractViolationError(source.getName() + " and " + target.getName()
                    + " are already related; widen or narrow the handle instead");
        }

        return handle.relabel(target, verify);
    }
}
