package biz.kryukov.dev.healthwatch.scheduler;

import biz.kryukov.dev.healthwatch.metrics.HealthMetrics;
import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeResult;
import biz.kryukov.dev.healthwatch.uptime.UptimeReport;
import biz.kryukov.dev.healthwatch.uptime.probe.ProbeExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs enabled uptime probes on their own fixed-rate timers.
 *
 * <p>Each enabled probe gets one timer whose first firing happens one interval after
 * {@link #start()}. Failures feed a per-probe consecutive-failure counter that drives
 * {@link ProbeFailureHandler}; a success resets it. The scheduler can be started again
 * after {@link #stop()}.</p>
 */
public final class UptimeScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(UptimeScheduler.class);
    private static final int MIN_CORE_POOL_SIZE = 1;
    private static final long STOP_TIMEOUT_SECONDS = 5;

    private final ProbeExecutor probeExecutor;
    private final ProbeFailureHandler failureHandler;
    private final HealthMetrics metrics;
    private final Logger logger;
    private final Map<String, ProbeState> states = new ConcurrentHashMap<>();
    private final ExecutorService checkNowPool;
    private final Object recordLock = new Object();

    private volatile MonitoringConfig config;
    private ScheduledThreadPoolExecutor executor;
    private volatile boolean running;

    public UptimeScheduler(MonitoringConfig config, ProbeExecutor probeExecutor,
                           ProbeFailureHandler failureHandler, HealthMetrics metrics) {
        this(config, probeExecutor, failureHandler, metrics, LOG);
    }

    public UptimeScheduler(MonitoringConfig config, ProbeExecutor probeExecutor,
                           ProbeFailureHandler failureHandler, HealthMetrics metrics, Logger logger) {
        this.config = Objects.requireNonNull(config, "config");
        this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
        this.metrics = metrics;
        this.logger = logger;
        this.checkNowPool = Executors.newCachedThreadPool(daemonFactory("healthwatch-uptime-now"));
    }

    /** Current monitoring configuration. */
    public MonitoringConfig config() {
        return config;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Starts one timer per enabled probe. Does nothing when monitoring is disabled.
     *
     * @throws IllegalStateException if already running
     */
    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("Uptime scheduler already started");
        }
        MonitoringConfig current = config;
        if (!current.enabled()) {
            logger.info("healthwatch: uptime monitoring disabled, no probes scheduled");
            return;
        }
        running = true;
        List<ProbeConfig> probes = current.enabledProbes();
        executor = new ScheduledThreadPoolExecutor(Math.max(MIN_CORE_POOL_SIZE, probes.size()),
                daemonFactory("healthwatch-uptime"));
        executor.setRemoveOnCancelPolicy(true);

        for (ProbeConfig probe : probes) {
            schedule(probe);
        }
        logger.info("healthwatch: uptime scheduler started, {} probes", probes.size());
    }

    /** Cancels every timer and waits for in-flight firings. Idempotent. */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        // firings that outlive the termination wait must not count or alert
        synchronized (recordLock) {
            running = false;
        }

        for (ProbeState state : states.values()) {
            state.cancel();
        }
        states.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        logger.info("healthwatch: uptime scheduler stopped");
    }

    /** Number of live probe timers. */
    public int activeTimers() {
        int count = 0;
        for (ProbeState state : states.values()) {
            if (state.hasLiveTimer()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Adds a probe, replacing any probe with the same name. When running, the replaced
     * probe's timer is cancelled and an enabled probe gets a new timer.
     */
    public synchronized void addProbe(ProbeConfig probe) {
        config = config.withProbe(probe);
        if (!running) {
            return;
        }
        ProbeState previous = states.remove(probe.name());
        if (previous != null) {
            previous.cancel();
        }
        if (probe.enabled()) {
            executor.setCorePoolSize(Math.max(MIN_CORE_POOL_SIZE, states.size() + 1));
            schedule(probe);
        }
        logger.info("healthwatch: probe {} added", probe.name());
    }

    /** Removes a probe and cancels its timer. Unknown names are ignored. */
    public synchronized void removeProbe(String name) {
        config = config.withoutProbe(name);
        ProbeState state = states.remove(name);
        if (state != null) {
            state.cancel();
            logger.info("healthwatch: probe {} removed", name);
        }
    }

    /**
     * Runs every enabled probe once, in parallel, without touching failure counters
     * or alerting.
     */
    public UptimeReport checkNow() {
        List<CompletableFuture<ProbeResult>> futures = new ArrayList<>();
        for (ProbeConfig probe : config.enabledProbes()) {
            futures.add(CompletableFuture.supplyAsync(() -> probeExecutor.execute(probe), checkNowPool));
        }
        List<ProbeResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ProbeResult> future : futures) {
            results.add(future.join());
        }
        return UptimeReport.of(results);
    }

    /** Last scheduled result per probe, for probes that have fired at least once. */
    public Map<String, ProbeResult> lastResults() {
        Map<String, ProbeResult> result = new LinkedHashMap<>();
        for (ProbeConfig probe : config.probes()) {
            ProbeState state = states.get(probe.name());
            if (state != null && state.lastResult() != null) {
                result.put(probe.name(), state.lastResult());
            }
        }
        return result;
    }

    /** Consecutive failures of a scheduled probe, 0 if unknown. */
    public int consecutiveFailures(String name) {
        ProbeState state = states.get(name);
        return state == null ? 0 : state.consecutiveFailures();
    }

    @Override
    public void close() {
        stop();
        checkNowPool.shutdownNow();
    }

    private void schedule(ProbeConfig probe) {
        ProbeState state = new ProbeState(probe);
        states.put(probe.name(), state);
        long intervalMs = probe.interval().toMillis();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(
                () -> fire(state), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        state.setFuture(future);
    }

    private void fire(ProbeState state) {
        try {
            if (!running || states.get(state.probe().name()) != state) {
                return;
            }
            logger.debug("healthwatch: probe {} firing", state.probe().name());
            ProbeResult result = probeExecutor.execute(state.probe());
            synchronized (recordLock) {
                if (!running || states.get(state.probe().name()) != state) {
                    logger.debug("healthwatch: discarding result of {}, probe no longer scheduled",
                            state.probe().name());
                    return;
                }
                record(state, result);
            }
        } catch (RuntimeException e) {
            // an exception escaping here would suppress all later firings of this timer
            logger.error("healthwatch: probe {} firing failed", state.probe().name(), e);
        }
    }

    /** Executes one firing for a probe registered with this scheduler. */
    ProbeResult runProbe(ProbeConfig probe) {
        ProbeState state = states.computeIfAbsent(probe.name(), k -> new ProbeState(probe));
        ProbeResult result = probeExecutor.execute(probe);
        record(state, result);
        return result;
    }

    private void record(ProbeState state, ProbeResult result) {
        ProbeConfig probe = state.probe();
        int failures;
        if (result.up()) {
            if (state.recordSuccess(result)) {
                logger.info("healthwatch: probe {} recovered", probe.name());
            }
            failures = 0;
        } else {
            failures = state.recordFailure(result, probe.alertPolicy().failureThreshold());
            failureHandler.handle(probe, result, failures, config.inMaintenance());
        }
        if (metrics != null) {
            metrics.recordProbe(probe, result.up(), result.latency(), failures);
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
