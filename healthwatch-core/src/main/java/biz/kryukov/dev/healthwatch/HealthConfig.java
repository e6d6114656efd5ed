package biz.kryukov.dev.healthwatch;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Health orchestrator configuration. Immutable, created via Builder.
 */
public final class HealthConfig {

    /** Default per-check timeout: 5 seconds. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    /** Default cache TTL: 10 seconds. */
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(10);

    public static final Duration MIN_TIMEOUT = Duration.ofMillis(10);
    public static final Duration MAX_TIMEOUT = Duration.ofMinutes(1);
    public static final Duration MAX_CACHE_TTL = Duration.ofHours(1);

    private final Duration timeout;
    private final Duration cacheTtl;
    private final Set<CheckKind> enabledChecks;

    private HealthConfig(Builder builder) {
        this.timeout = builder.timeout;
        this.cacheTtl = builder.cacheTtl;
        this.enabledChecks = Collections.unmodifiableSet(EnumSet.copyOf(builder.enabledChecks));
    }

    /** Returns the per-check timeout. */
    public Duration timeout() {
        return timeout;
    }

    /** Returns how long a snapshot is served from cache. */
    public Duration cacheTtl() {
        return cacheTtl;
    }

    /** Returns the enabled built-in checks. */
    public Set<CheckKind> enabledChecks() {
        return enabledChecks;
    }

    public boolean isEnabled(CheckKind kind) {
        return enabledChecks.contains(kind);
    }

    /** Creates a builder seeded with this configuration's values. */
    public Builder toBuilder() {
        return new Builder()
                .timeout(timeout)
                .cacheTtl(cacheTtl)
                .enabledChecks(enabledChecks);
    }

    /** Creates a new builder with default values. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a configuration with all default values. */
    public static HealthConfig defaults() {
        return builder().build();
    }

    /** Builder for {@link HealthConfig}. */
    public static final class Builder {
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration cacheTtl = DEFAULT_CACHE_TTL;
        private EnumSet<CheckKind> enabledChecks =
                EnumSet.of(CheckKind.DATABASE, CheckKind.STORAGE, CheckKind.AUTH);

        private Builder() {}

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        /** Replaces the set of enabled built-in checks. */
        public Builder enabledChecks(Collection<CheckKind> kinds) {
            this.enabledChecks = kinds.isEmpty()
                    ? EnumSet.noneOf(CheckKind.class)
                    : EnumSet.copyOf(kinds);
            return this;
        }

        public Builder enable(CheckKind kind) {
            this.enabledChecks.add(kind);
            return this;
        }

        public Builder disable(CheckKind kind) {
            this.enabledChecks.remove(kind);
            return this;
        }

        /** Builds and validates the configuration. */
        public HealthConfig build() {
            validate();
            return new HealthConfig(this);
        }

        private void validate() {
            if (timeout == null || timeout.compareTo(MIN_TIMEOUT) < 0
                    || timeout.compareTo(MAX_TIMEOUT) > 0) {
                throw new ValidationException(
                        "timeout must be between " + MIN_TIMEOUT + " and " + MAX_TIMEOUT
                                + ", got " + timeout);
            }
            if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.compareTo(MAX_CACHE_TTL) > 0) {
                throw new ValidationException(
                        "cacheTtl must be between 0 and " + MAX_CACHE_TTL + ", got " + cacheTtl);
            }
        }
    }
}
