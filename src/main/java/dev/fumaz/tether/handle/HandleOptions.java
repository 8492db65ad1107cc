package dev.fumaz.tether.handle;

import dev.fumaz.tether.affinity.AffinityPolicy;
import dev.fumaz.tether.affinity.AffinityToken;
import dev.fumaz.tether.affinity.SequenceIdentity;
import dev.fumaz.tether.exception.TetherException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * Configuration object controlling which {@link AffinityToken} a {@link WeakHandleFactory} installs for each
 * generation of handles.
 */
public final class HandleOptions {

    /**
     * System property selecting the default affinity behaviour: {@code abort}, {@code throw}, {@code empty} or
     * {@code off}. When absent, checking is enabled with {@link AffinityPolicy#ABORT} iff assertions are enabled.
     */
    public static final String AFFINITY_PROPERTY = "tether.affinity";

    private final @Nullable AffinityPolicy policy;
    private final @NotNull SequenceIdentity sequenceIdentity;

    private HandleOptions(@Nullable AffinityPolicy policy, @NotNull SequenceIdentity sequenceIdentity) {
        this.policy = policy;
        this.sequenceIdentity = sequenceIdentity;
    }

    public static @NotNull Builder builder() {
        return new Builder();
    }

    public static @NotNull HandleOptions defaults() {
        return fromProperty(System.getProperty(AFFINITY_PROPERTY), HandleOptions.class.desiredAssertionStatus());
    }

    public static @NotNull HandleOptions unchecked() {
        return builder().unchecked().build();
    }

    public static @NotNull HandleOptions checking(@NotNull AffinityPolicy policy) {
        return builder().affinity(policy).build();
    }

    static @NotNull HandleOptions fromProperty(@Nullable String value, boolean assertionsEnabled) {
        if (value == null || value.isBlank()) {
            return assertionsEnabled ? checking(AffinityPolicy.ABORT) : unchecked();
        }

        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "abort":
                return checking(AffinityPolicy.ABORT);
            case "throw":
                return checking(AffinityPolicy.THROW);
            case "empty":
                return checking(AffinityPolicy.RESOLVE_EMPTY);
            case "off":
                return unchecked();
            default:
                throw new TetherException("Unknown value '" + value + "' for " + AFFINITY_PROPERTY
                        + ", expected one of abort, throw, empty, off");
        }
    }

    /**
     * Creates the token for a new generation.
     */
    public @NotNull AffinityToken newToken() {
        if (policy == null) {
            return AffinityToken.permissive();
        }

        return AffinityToken.checking(policy, sequenceIdentity);
    }

    public boolean isChecking() {
        return policy != null;
    }

    public @Nullable AffinityPolicy getPolicy() {
        return policy;
    }

    public @NotNull SequenceIdentity getSequenceIdentity() {
        return sequenceIdentity;
    }

    @Override
    public String toString() {
        return "HandleOptions{policy=" + (policy == null ? "unchecked" : policy) + "}";
    }

    public static final class Builder {
        private @Nullable AffinityPolicy policy = AffinityPolicy.ABORT;
        private @NotNull SequenceIdentity sequenceIdentity = SequenceIdentity.currentThread();

        public Builder affinity(@NotNull AffinityPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder unchecked() {
            this.policy = null;
            return this;
        }

        public Builder sequence(@NotNull SequenceIdentity sequenceIdentity) {
            this.sequenceIdentity = Objects.requireNonNull(sequenceIdentity, "sequenceIdentity");
            return this;
        }

        public HandleOptions build() {
            return new HandleOptions(policy, sequenceIdentity);
        }
    }
}
