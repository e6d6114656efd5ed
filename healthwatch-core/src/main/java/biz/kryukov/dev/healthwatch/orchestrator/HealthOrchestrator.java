package biz.kryukov.dev.healthwatch.orchestrator;

import biz.kryukov.dev.healthwatch.BuildInfo;
import biz.kryukov.dev.healthwatch.CheckKind;
import biz.kryukov.dev.healthwatch.CheckResult;
import biz.kryukov.dev.healthwatch.ConfigurationException;
import biz.kryukov.dev.healthwatch.HealthCheck;
import biz.kryukov.dev.healthwatch.HealthConfig;
import biz.kryukov.dev.healthwatch.HealthSnapshot;
import biz.kryukov.dev.healthwatch.HealthStatus;
import biz.kryukov.dev.healthwatch.Liveness;
import biz.kryukov.dev.healthwatch.ValidationException;
import biz.kryukov.dev.healthwatch.checks.MemoryHealthCheck;
import biz.kryukov.dev.healthwatch.metrics.HealthMetrics;
import biz.kryukov.dev.healthwatch.runner.CheckRunner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the configured health checks concurrently, aggregates them into a
 * {@link HealthSnapshot} and serves the last snapshot from cache until its TTL expires.
 *
 * <p>The cache is written only under {@code refreshLock}; concurrent callers that
 * find it stale queue behind the running refresh and reuse its result instead of
 * starting an overlapping pass. Forced refreshes never overlap either.</p>
 */
public final class HealthOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(HealthOrchestrator.class);

    /** Default maximum number of checks running at once, abandoned ones included. */
    public static final int DEFAULT_MAX_IN_FLIGHT = 64;

    private final Map<CheckKind, HealthCheck> builtIns;
    private final Map<String, HealthCheck> customChecks = new LinkedHashMap<>();
    private final MemoryHealthCheck memoryCheck;
    private final CheckRunner runner;
    private final BuildInfo buildInfo;
    private final HealthMetrics metrics;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile HealthConfig config;
    private volatile CachedSnapshot cache;

    private HealthOrchestrator(Builder builder, HealthConfig config) {
        this.builtIns = Collections.unmodifiableMap(new EnumMap<>(builder.builtIns));
        this.customChecks.putAll(builder.customChecks);
        this.memoryCheck = builder.memoryCheck;
        this.runner = new CheckRunner(builder.maxInFlight);
        this.buildInfo = builder.buildInfo;
        this.metrics = builder.metrics;
        this.config = config;
    }

    /**
     * Returns the cached snapshot while it is valid, otherwise runs every enabled
     * check and caches the new snapshot.
     *
     * @param force bypass the cache; the result still replaces the cached entry
     */
    public HealthSnapshot checkHealth(boolean force) {
        if (!force) {
            HealthSnapshot cached = validCached();
            if (cached != null) {
                LOG.debug("healthwatch: serving cached snapshot from {}", cached.timestamp());
                return cached;
            }
        }

        refreshLock.lock();
        try {
            if (!force) {
                HealthSnapshot cached = validCached();
                if (cached != null) {
                    return cached;
                }
            }
            HealthSnapshot snapshot = runFullPass();
            cache = new CachedSnapshot(snapshot, System.nanoTime());
            return snapshot;
        } finally {
            refreshLock.unlock();
        }
    }

    /** Same as {@code checkHealth(false)}. */
    public HealthSnapshot checkHealth() {
        return checkHealth(false);
    }

    /** Proves the process is responsive. Performs no dependency checks. */
    public Liveness checkLiveness() {
        return Liveness.ok();
    }

    /**
     * Runs only the enabled load-bearing checks (database, auth) and aggregates
     * over them. Never cached.
     */
    public HealthSnapshot checkReadiness() {
        HealthConfig cfg = config;
        List<HealthCheck> checks = new ArrayList<>();
        for (Map.Entry<CheckKind, HealthCheck> entry : builtIns.entrySet()) {
            if (entry.getKey().readiness() && cfg.isEnabled(entry.getKey())) {
                checks.add(entry.getValue());
            }
        }
        List<CheckResult> results = runner.runAll(checks, cfg.timeout());
        return new HealthSnapshot(results, buildInfo, uptime(), false);
    }

    /**
     * Registers a custom check, replacing any custom check with the same name.
     */
    public void addCheck(HealthCheck check) {
        String name = requireName(check);
        synchronized (customChecks) {
            if (customChecks.put(name, check) != null) {
                LOG.debug("healthwatch: replaced custom check {}", name);
            }
        }
    }

    /** Registers a custom check from a name and body. */
    public void addCheck(String name, HealthCheck.Body body) {
        addCheck(HealthCheck.of(name, body));
    }

    /** Removes a custom check. Unknown names are ignored. */
    public void removeCheck(String name) {
        synchronized (customChecks) {
            customChecks.remove(name);
        }
    }

    /** Returns the names of registered custom checks in registration order. */
    public List<String> customCheckNames() {
        synchronized (customChecks) {
            return List.copyOf(customChecks.keySet());
        }
    }

    /**
     * Applies a partial update to the live configuration. Fields the updater does
     * not touch keep their current values.
     *
     * @throws ConfigurationException if the update enables a built-in check with no implementation
     */
    public void configure(Consumer<HealthConfig.Builder> updater) {
        refreshLock.lock();
        try {
            HealthConfig.Builder b = config.toBuilder();
            updater.accept(b);
            HealthConfig updated = b.build();
            requireImplementations(updated, builtIns);
            config = updated;
        } finally {
            refreshLock.unlock();
        }
    }

    /** Returns the live configuration. */
    public HealthConfig config() {
        return config;
    }

    /** Forces the next {@code checkHealth(false)} to run the checks. */
    public void clearCache() {
        cache = null;
    }

    /** Returns the build metadata stamped into snapshots. */
    public BuildInfo buildInfo() {
        return buildInfo;
    }

    /** Returns the process uptime. */
    public Duration uptime() {
        long startMs = ManagementFactory.getRuntimeMXBean().getStartTime();
        return Duration.ofMillis(Math.max(0L, System.currentTimeMillis() - startMs));
    }

    /** Returns the uptime as {@code 1d 2h 3m}, {@code 2h 3m 4s}, {@code 3m 4s} or {@code 4s}. */
    public String formatUptime() {
        return formatUptime(uptime());
    }

    static String formatUptime(Duration uptime) {
        long seconds = uptime.toSeconds();
        long minutes = seconds / 60;
        long hours = minutes / 60;
        long days = hours / 24;
        if (days > 0) {
            return days + "d " + (hours % 24) + "h " + (minutes % 60) + "m";
        }
        if (hours > 0) {
            return hours + "h " + (minutes % 60) + "m " + (seconds % 60) + "s";
        }
        if (minutes > 0) {
            return minutes + "m " + (seconds % 60) + "s";
        }
        return seconds + "s";
    }

    @Override
    public void close() {
        runner.close();
    }

    private HealthSnapshot validCached() {
        CachedSnapshot c = cache;
        if (c != null && c.isValid(System.nanoTime(), config.cacheTtl())) {
            return c.snapshot();
        }
        return null;
    }

    private HealthSnapshot runFullPass() {
        HealthConfig cfg = config;
        List<HealthCheck> checks = new ArrayList<>();
        for (Map.Entry<CheckKind, HealthCheck> entry : builtIns.entrySet()) {
            if (cfg.isEnabled(entry.getKey())) {
                checks.add(entry.getValue());
            }
        }
        synchronized (customChecks) {
            checks.addAll(customChecks.values());
        }

        List<CheckResult> results = new ArrayList<>(runner.runAll(checks, cfg.timeout()));
        results.add(memoryCheck.evaluate());

        HealthSnapshot snapshot = new HealthSnapshot(results, buildInfo, uptime(), true);

        long healthy = results.stream().filter(r -> r.status() == HealthStatus.HEALTHY).count();
        LOG.info("healthwatch: health check completed, status={}, checks={}, healthy={}",
                snapshot.status().label(), results.size(), healthy);
        for (CheckResult r : results) {
            if (r.status() != HealthStatus.HEALTHY) {
                LOG.warn("healthwatch: {} is {}: {}", r.name(), r.status().label(), r.message());
            }
        }
        if (metrics != null) {
            results.forEach(metrics::recordCheck);
            metrics.recordSnapshot(snapshot.status());
        }
        return snapshot;
    }

    private static String requireName(HealthCheck check) {
        Objects.requireNonNull(check, "check");
        String name = check.name();
        if (name == null || name.isBlank()) {
            throw new ValidationException("check name must not be blank");
        }
        return name;
    }

    private static void requireImplementations(HealthConfig cfg, Map<CheckKind, HealthCheck> builtIns) {
        for (CheckKind kind : cfg.enabledChecks()) {
            if (!builtIns.containsKey(kind)) {
                throw new ConfigurationException(
                        "check " + kind.label() + " is enabled but no implementation is registered");
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private record CachedSnapshot(HealthSnapshot snapshot, long cachedAtNs) {
        boolean isValid(long nowNs, Duration ttl) {
            return nowNs - cachedAtNs < ttl.toNanos();
        }
    }

    /**
     * Builder for {@link HealthOrchestrator}.
     *
     * <p>Without an explicit {@link #config}, the default set of built-ins
     * (database, storage, auth) is enabled as far as implementations are registered.</p>
     */
    public static final class Builder {
        private final Map<CheckKind, HealthCheck> builtIns = new EnumMap<>(CheckKind.class);
        private final Map<String, HealthCheck> customChecks = new LinkedHashMap<>();
        private HealthConfig config;
        private BuildInfo buildInfo = BuildInfo.defaults();
        private HealthMetrics metrics;
        private MemoryHealthCheck memoryCheck = new MemoryHealthCheck();
        private int maxInFlight = DEFAULT_MAX_IN_FLIGHT;

        private Builder() {}

        /** Registers the implementation of a built-in check. */
        public Builder builtIn(CheckKind kind, HealthCheck check) {
            builtIns.put(kind, check);
            return this;
        }

        /** Registers a built-in check from a body, using the kind's name and latency threshold. */
        public Builder builtIn(CheckKind kind, HealthCheck.Body body) {
            return builtIn(kind, HealthCheck.of(kind.label(), kind.degradedThreshold(), body));
        }

        public Builder customCheck(HealthCheck check) {
            customChecks.put(requireName(check), check);
            return this;
        }

        public Builder config(HealthConfig config) {
            this.config = config;
            return this;
        }

        public Builder buildInfo(BuildInfo buildInfo) {
            this.buildInfo = Objects.requireNonNull(buildInfo, "buildInfo");
            return this;
        }

        public Builder metrics(HealthMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder memoryCheck(MemoryHealthCheck memoryCheck) {
            this.memoryCheck = Objects.requireNonNull(memoryCheck, "memoryCheck");
            return this;
        }

        /** Limits concurrently running checks, including abandoned ones. */
        public Builder maxInFlight(int maxInFlight) {
            if (maxInFlight < 1) {
                throw new ValidationException("maxInFlight must be positive, got " + maxInFlight);
            }
            this.maxInFlight = maxInFlight;
            return this;
        }

        public HealthOrchestrator build() {
            HealthConfig cfg = config;
            if (cfg == null) {
                HealthConfig defaults = HealthConfig.defaults();
                List<CheckKind> enabled = new ArrayList<>(defaults.enabledChecks());
                enabled.retainAll(builtIns.keySet());
                cfg = defaults.toBuilder().enabledChecks(enabled).build();
            }
            requireImplementations(cfg, builtIns);
            return new HealthOrchestrator(this, cfg);
        }
    }
}
