package biz.kryukov.dev.healthwatch;

import java.util.Objects;

/**
 * Build and deployment metadata embedded verbatim in every health snapshot.
 *
 * @param version     application version
 * @param environment deployment environment (e.g. {@code production})
 * @param commit      VCS commit, may be {@code null}
 * @param branch      VCS branch, may be {@code null}
 * @param buildTime   build timestamp as supplied by the build, may be {@code null}
 */
public record BuildInfo(String version, String environment, String commit, String branch,
                        String buildTime) {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final String DEFAULT_ENVIRONMENT = "development";

    public BuildInfo {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(environment, "environment");
    }

    /** Build info with default version and environment and no VCS metadata. */
    public static BuildInfo defaults() {
        return new BuildInfo(DEFAULT_VERSION, DEFAULT_ENVIRONMENT, null, null, null);
    }

    /** Whether any of commit, branch or buildTime is set. */
    public boolean hasVcsMetadata() {
        return commit != null || branch != null || buildTime != null;
    }
}
