package dev.fumaz.tether.cast;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The static type a referent is viewed through: either a concrete class or the type-neutral view used by erased
 * handles.
 */
public final class TypeView {

    private static final TypeView NEUTRAL = new TypeView(null);

    private final @Nullable Class<?> type;

    private TypeView(@Nullable Class<?> type) {
        this.type = type;
    }

    public static @NotNull TypeView neutral() {
        return NEUTRAL;
    }

    public static @NotNull TypeView of(@NotNull Class<?> type) {
        return new TypeView(Objects.requireNonNull(type, "type"));
    }

    public boolean isNeutral() {
        return type == null;
    }

    public @Nullable Class<?> getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof TypeView)) {
            return false;
        }

        TypeView that = (TypeView) o;
        return type == that.type;
    }

    @Override
    public int hashCode() {
        return type == null ? 0 : type.hashCode();
    }

    @Override
    public String toString() {
        return type == null ? "neutral" : type.getName();
    }
}
