package biz.kryukov.dev.healthwatch.runner;

import biz.kryukov.dev.healthwatch.CheckResult;
import biz.kryukov.dev.healthwatch.DegradedException;
import biz.kryukov.dev.healthwatch.ErrorCategory;
import biz.kryukov.dev.healthwatch.HealthCheck;
import biz.kryukov.dev.healthwatch.HealthStatus;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CheckRunnerTest {

    private static final Duration TIMEOUT = Duration.ofMillis(300);

    private CheckRunner runner;

    @BeforeEach
    void setUp() {
        runner = new CheckRunner(8);
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Test
    void successIsHealthy() {
        CheckResult result = runner.run("ping", TIMEOUT, timeout -> { });

        assertEquals("ping", result.name());
        assertEquals(HealthStatus.HEALTHY, result.status());
        assertEquals("ping is responding", result.message());
        assertFalse(result.latency().isNegative());
    }

    @Test
    void thrownExceptionBecomesUnhealthyWithMessage() {
        CheckResult result = runner.run("queue-depth", TIMEOUT, timeout -> {
            throw new RuntimeException("boom");
        });

        assertEquals("queue-depth", result.name());
        assertEquals(HealthStatus.UNHEALTHY, result.status());
        assertTrue(result.message().contains("boom"));
        assertEquals(ErrorCategory.ERROR, result.details().get("category"));
    }

    @Test
    void errorIsConvertedToo() {
        CheckResult result = runner.run("oom", TIMEOUT, timeout -> {
            throw new AssertionError("fatal");
        });

        assertEquals(HealthStatus.UNHEALTHY, result.status());
        assertEquals("fatal", result.message());
    }

    @Test
    void connectionFailureIsClassified() {
        CheckResult result = runner.run("db", TIMEOUT, timeout -> {
            throw new ConnectException("Connection refused");
        });

        assertEquals(ErrorCategory.CONNECTION_ERROR, result.details().get("category"));
    }

    @Test
    void degradedExceptionKeepsDegradedStatus() {
        CheckResult result = runner.run("cache", TIMEOUT, timeout -> {
            throw new DegradedException("replica lag");
        });

        assertEquals(HealthStatus.DEGRADED, result.status());
        assertEquals("replica lag", result.message());
    }

    @Test
    void hangingCheckTimesOutWithConfiguredLatency() {
        long start = System.nanoTime();
        CheckResult result = runner.run("storage", TIMEOUT, timeout -> new CountDownLatch(1).await());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(HealthStatus.UNHEALTHY, result.status());
        assertEquals(TIMEOUT, result.latency());
        assertEquals("storage timed out after 300ms", result.message());
        assertEquals(ErrorCategory.TIMEOUT, result.details().get("category"));
        assertTrue(elapsedMs < TIMEOUT.toMillis() + 1000, "returned after " + elapsedMs + "ms");
    }

    @Test
    void slowSuccessAboveThresholdIsDegraded() {
        HealthCheck slow = HealthCheck.of("auth", Duration.ofMillis(50), timeout -> Thread.sleep(120));

        CheckResult result = runner.run(slow, Duration.ofSeconds(2));

        assertEquals(HealthStatus.DEGRADED, result.status());
        assertTrue(result.message().startsWith("auth response time is slow"));
        assertEquals(50L, result.details().get("thresholdMs"));
        assertTrue(result.latency().toMillis() >= 120);
    }

    @Test
    void runAllKeepsInputOrderAndRunsConcurrently() {
        List<HealthCheck> checks = List.of(
                HealthCheck.of("slow", timeout -> Thread.sleep(400)),
                HealthCheck.of("fast", timeout -> { }),
                HealthCheck.of("medium", timeout -> Thread.sleep(300)));

        long start = System.nanoTime();
        List<CheckResult> results = runner.runAll(checks, Duration.ofSeconds(2));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(List.of("slow", "fast", "medium"), results.stream().map(CheckResult::name).toList());
        assertTrue(results.stream().allMatch(r -> r.status() == HealthStatus.HEALTHY));
        // bounded by the slowest check, not the sum
        assertTrue(elapsedMs < 650, "took " + elapsedMs + "ms");
    }

    @Test
    void abandonedChecksHoldPermitsUntilTheyReturn() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        try (CheckRunner small = new CheckRunner(1)) {
            // ignores interruption so the abandoned task keeps its permit
            HealthCheck stubborn = HealthCheck.of("stubborn", timeout -> {
                while (release.getCount() > 0) {
                    try {
                        release.await();
                    } catch (InterruptedException ignored) {
                        // keep waiting
                    }
                }
            });

            CheckResult first = small.run(stubborn, Duration.ofMillis(50));
            assertEquals(ErrorCategory.TIMEOUT, first.details().get("category"));
            assertEquals(1, small.inFlight());

            CheckResult second = small.run("next", Duration.ofMillis(50), timeout -> { });
            assertEquals(HealthStatus.UNHEALTHY, second.status());
            assertEquals(ErrorCategory.REJECTED, second.details().get("category"));

            release.countDown();
            long deadline = System.currentTimeMillis() + 2000;
            while (small.inFlight() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, small.inFlight());
            assertEquals(HealthStatus.HEALTHY, small.run("next", TIMEOUT, timeout -> { }).status());
        }
    }
}
