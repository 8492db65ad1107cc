package dev.fumaz.tether.cast;

import dev.fumaz.tether.exception.ContractViolationError;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Converts a referent between {@link TypeView}s.
 * <ul>
 *     <li>neutral to neutral, and a class to itself, pass the referent through;</li>
 *     <li>between related classes the conversion is checked and yields {@code null} if the referent is not an
 *     instance of the target;</li>
 *     <li>to or from the neutral view the referent passes through unchecked;</li>
 *     <li>between unrelated classes the conversion is a contract violation.</li>
 * </ul>
 */
public final class TypeViews {

    private TypeViews() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    public static @Nullable Object convert(@Nullable Object referent, @NotNull TypeView from, @NotNull TypeView to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");

        if (from.isNeutral() || to.isNeutral()) {
            return referent;
        }

        return convert(referent, from.getType(), to.getType());
    }

    public static <U> @Nullable U convert(@Nullable Object referent, @NotNull Class<?> from, @NotNull Class<U> to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");

        if (from == to) {
            return to.cast(referent);
        }

        if (!isRelated(from, to)) {
            throw new ContractViolationError("Cannot convert a view of " + from.getName() + " to the unrelated type "
                    + to.getName());
        }

        return to.isInstance(referent) ? to.cast(referent) : null;
    }

    /**
     * Whether one of the two types is an ancestor of the other. A type is related to itself.
     */
    public static boolean isRelated(@NotNull Class<?> first, @NotNull Class<?> second) {
        return first.isAssignableFrom(second) || second.isAssignableFrom(first);
    }

    /**
     * Whether the two types are distinct and neither is an ancestor of the other.
     */
    public static boolean isUnrelated(@NotNull Class<?> first, @NotNull Class<?> second) {
        return !isRelated(first, second);
    }
}
