package biz.kryukov.dev.healthwatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Dependency health check.
 *
 * <p>Implementations must be thread-safe. A check signals failure by throwing;
 * returning normally means the dependency answered. The runner interrupts the
 * calling thread when the timeout elapses, so blocking implementations should
 * honour interruption where the underlying client allows it.</p>
 */
public interface HealthCheck {

    /** Returns the check name used in results and metrics. */
    String name();

    /**
     * Performs the check.
     *
     * @param timeout time budget for this run
     * @throws Exception if the dependency is unhealthy or the check failed
     */
    void check(Duration timeout) throws Exception;

    /**
     * Latency above which a successful check is reported as degraded,
     * or {@code null} to never degrade on latency.
     */
    default Duration degradedThreshold() {
        return null;
    }

    /** Functional body for {@link #of}. */
    @FunctionalInterface
    interface Body {
        void run(Duration timeout) throws Exception;
    }

    /** Creates a check from a name and a body. */
    static HealthCheck of(String name, Body body) {
        return of(name, null, body);
    }

    /** Creates a check from a name, a degradation threshold and a body. */
    static HealthCheck of(String name, Duration degradedThreshold, Body body) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        return new HealthCheck() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void check(Duration timeout) throws Exception {
                body.run(timeout);
            }

            @Override
            public Duration degradedThreshold() {
                return degradedThreshold;
            }
        };
    }
}
