package biz.kryukov.dev.healthwatch.runner;

import biz.kryukov.dev.healthwatch.CheckResult;
import biz.kryukov.dev.healthwatch.ErrorCategory;
import biz.kryukov.dev.healthwatch.ErrorClassifier;
import biz.kryukov.dev.healthwatch.HealthCheck;
import biz.kryukov.dev.healthwatch.HealthStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs health checks under a per-check deadline and turns every outcome into a
 * {@link CheckResult}. Never throws.
 *
 * <p>A check that misses its deadline is interrupted and its result discarded.
 * The underlying I/O may keep running; such abandoned checks still hold one of
 * {@code maxInFlight} permits until they actually return, so a dependency that
 * hangs cannot pile up unbounded threads. When no permit is free the check is
 * reported unhealthy without being started.</p>
 */
public final class CheckRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CheckRunner.class);
    private static final String DETAIL_CATEGORY = "category";

    private final ExecutorService executor;
    private final Semaphore permits;
    private final int maxInFlight;

    public CheckRunner(int maxInFlight) {
        this.maxInFlight = maxInFlight;
        this.permits = new Semaphore(maxInFlight);
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "healthwatch-check-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs a single check.
     *
     * @param check   the check to run
     * @param timeout time budget
     * @return the normalized result
     */
    public CheckResult run(HealthCheck check, Duration timeout) {
        return await(submit(check, timeout), timeout);
    }

    /** Runs an ad-hoc check body under the given name. */
    public CheckResult run(String name, Duration timeout, HealthCheck.Body body) {
        return run(HealthCheck.of(name, body), timeout);
    }

    /**
     * Starts all checks at once and collects their results in input order.
     * Total wall time is bounded by the slowest single check.
     */
    public List<CheckResult> runAll(List<HealthCheck> checks, Duration timeout) {
        List<Pending> pending = new ArrayList<>(checks.size());
        for (HealthCheck check : checks) {
            pending.add(submit(check, timeout));
        }
        List<CheckResult> results = new ArrayList<>(pending.size());
        for (Pending p : pending) {
            results.add(await(p, timeout));
        }
        return results;
    }

    /** Returns the number of checks currently holding a permit, abandoned ones included. */
    public int inFlight() {
        return maxInFlight - permits.availablePermits();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private Pending submit(HealthCheck check, Duration timeout) {
        long startNs = System.nanoTime();
        if (!permits.tryAcquire()) {
            return new Pending(check, startNs, null);
        }
        Callable<Long> task = () -> {
            long taskStart = System.nanoTime();
            try {
                check.check(timeout);
                return System.nanoTime() - taskStart;
            } finally {
                permits.release();
            }
        };
        try {
            return new Pending(check, startNs, executor.submit(task));
        } catch (RejectedExecutionException e) {
            permits.release();
            return new Pending(check, startNs, null);
        }
    }

    private CheckResult await(Pending p, Duration timeout) {
        String name = p.check().name();
        if (p.future() == null) {
            LOG.warn("healthwatch: {} not started, {} checks already in flight", name, maxInFlight);
            return failure(name, Duration.ZERO,
                    name + " rejected: too many checks in flight", ErrorCategory.REJECTED,
                    HealthStatus.UNHEALTHY);
        }

        long remaining = p.startNs() + timeout.toNanos() - System.nanoTime();
        try {
            long elapsedNs = p.future().get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            return success(p.check(), Duration.ofNanos(elapsedNs));
        } catch (TimeoutException e) {
            p.future().cancel(true);
            return failure(name, timeout,
                    name + " timed out after " + timeout.toMillis() + "ms",
                    ErrorCategory.TIMEOUT, HealthStatus.UNHEALTHY);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Error) {
                LOG.error("healthwatch: unexpected error in check {}", name, cause);
            }
            Duration latency = Duration.ofNanos(System.nanoTime() - p.startNs());
            return failure(name, latency.compareTo(timeout) > 0 ? timeout : latency,
                    ErrorClassifier.messageOf(cause), ErrorClassifier.classify(cause),
                    ErrorClassifier.statusOf(cause));
        } catch (InterruptedException e) {
            p.future().cancel(true);
            Thread.currentThread().interrupt();
            return failure(name, Duration.ofNanos(System.nanoTime() - p.startNs()),
                    name + " interrupted", ErrorCategory.ERROR, HealthStatus.UNHEALTHY);
        } catch (RuntimeException e) {
            p.future().cancel(true);
            LOG.error("healthwatch: failed to collect result of {}", name, e);
            return failure(name, Duration.ofNanos(System.nanoTime() - p.startNs()),
                    ErrorClassifier.messageOf(e), ErrorCategory.ERROR, HealthStatus.UNHEALTHY);
        }
    }

    private static CheckResult success(HealthCheck check, Duration latency) {
        Duration threshold = check.degradedThreshold();
        if (threshold != null && latency.compareTo(threshold) > 0) {
            return new CheckResult(check.name(), HealthStatus.DEGRADED, latency,
                    check.name() + " response time is slow (" + latency.toMillis() + "ms)",
                    Map.of("thresholdMs", threshold.toMillis()), Instant.now());
        }
        return CheckResult.healthy(check.name(), latency, check.name() + " is responding");
    }

    private static CheckResult failure(String name, Duration latency, String message,
                                       String category, HealthStatus status) {
        return new CheckResult(name, status, latency, message,
                Map.of(DETAIL_CATEGORY, category), Instant.now());
    }

    private record Pending(HealthCheck check, long startNs, Future<Long> future) {}
}
