package dev.fumaz.tether.ownership;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry point placing subjects under strong ownership.
 */
public final class Ownership {

    private Ownership() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * Constructs a subject and returns its first strong owner.
     */
    public static <S extends SharedFromThis<?>> @NotNull Owned<S> create(@NotNull Supplier<? extends S> constructor) {
        Objects.requireNonNull(constructor, "constructor");
        S subject = constructor.get();

        if (subject == null) {
            throw new IllegalStateException("Subject constructor produced null");
        }

        return adopt(subject);
    }

    /**
     * Places a freshly constructed subject under strong ownership.
     *
     * @throws IllegalStateException if the subject has already been adopted
     */
    public static <S extends SharedFromThis<?>> @NotNull Owned<S> adopt(@NotNull S subject) {
        Objects.requireNonNull(subject, "subject");
        Lifeline<S> lifeline = new Lifeline<>(subject);
        subject.attach(lifeline);

        return new Owned<>(lifeline);
    }
}
