package biz.kryukov.dev.healthwatch;

import java.time.Instant;

/**
 * Liveness probe answer. Carries no dependency state.
 */
public record Liveness(String status, Instant timestamp) {

    public static final String OK = "ok";

    public static Liveness ok() {
        return new Liveness(OK, Instant.now());
    }
}
