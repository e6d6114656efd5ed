package biz.kryukov.dev.healthwatch.scheduler;

import biz.kryukov.dev.healthwatch.ErrorCategory;
import biz.kryukov.dev.healthwatch.HealthStatus;
import biz.kryukov.dev.healthwatch.metrics.HealthMetrics;
import biz.kryukov.dev.healthwatch.uptime.AlertChannel;
import biz.kryukov.dev.healthwatch.uptime.AlertPolicy;
import biz.kryukov.dev.healthwatch.uptime.MaintenanceWindow;
import biz.kryukov.dev.healthwatch.uptime.MonitoringConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeConfig;
import biz.kryukov.dev.healthwatch.uptime.ProbeResult;
import biz.kryukov.dev.healthwatch.uptime.UptimeReport;
import biz.kryukov.dev.healthwatch.uptime.probe.ProbeExecutor;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UptimeSchedulerTest {

    private final AtomicInteger executions = new AtomicInteger();
    private final Set<String> downProbes = ConcurrentHashMap.newKeySet();
    private ProbeExecutor probeExecutor;
    private AlertNotifier notifier;
    private SimpleMeterRegistry registry;
    private UptimeScheduler scheduler;

    @BeforeEach
    void setUp() {
        probeExecutor = mock(ProbeExecutor.class);
        when(probeExecutor.execute(any())).thenAnswer(inv -> {
            ProbeConfig probe = inv.getArgument(0);
            executions.incrementAndGet();
            boolean up = !downProbes.contains(probe.name());
            return new ProbeResult(probe.name(), probe.kind(), up, up ? 200 : 503, Duration.ofMillis(12),
                    up ? "HTTP 200" : "unexpected HTTP status 503", up ? null : ErrorCategory.UNHEALTHY,
                    null, Instant.now());
        });
        notifier = mock(AlertNotifier.class);
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    private UptimeScheduler scheduler(MonitoringConfig config) {
        scheduler = new UptimeScheduler(config, probeExecutor, new ProbeFailureHandler(notifier),
                new HealthMetrics(registry));
        return scheduler;
    }

    private static ProbeConfig probe(String name) {
        return ProbeConfig.builder(name, "https://" + name + ".example.com/health")
                .interval(Duration.ofSeconds(1))
                .alertPolicy(new AlertPolicy(List.of(AlertChannel.SLACK), 2, false))
                .build();
    }

    @Test
    void oneTimerPerEnabledProbe() {
        MonitoringConfig config = MonitoringConfig.builder()
                .probe(probe("api"))
                .probe(probe("web"))
                .probe(probe("legacy").toBuilder().enabled(false).build())
                .build();
        scheduler(config).start();

        assertTrue(scheduler.isRunning());
        assertEquals(2, scheduler.activeTimers());

        scheduler.stop();

        assertFalse(scheduler.isRunning());
        assertEquals(0, scheduler.activeTimers());
    }

    @Test
    void noExecutionsAfterStop() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        doAnswer(inv -> {
            ProbeConfig probe = inv.getArgument(0);
            executions.incrementAndGet();
            fired.countDown();
            return new ProbeResult(probe.name(), probe.kind(), true, 200, Duration.ofMillis(3),
                    "HTTP 200", null, null, Instant.now());
        }).when(probeExecutor).execute(any());
        scheduler(MonitoringConfig.builder().probe(probe("api")).build()).start();

        assertTrue(fired.await(3, TimeUnit.SECONDS));
        scheduler.stop();
        int afterStop = executions.get();

        Thread.sleep(1300);
        assertEquals(afterStop, executions.get());
    }

    @Test
    void firingThatOutlivesStopDoesNotAlert() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch returned = new CountDownLatch(1);
        doAnswer(inv -> {
            ProbeConfig probe = inv.getArgument(0);
            fired.countDown();
            boolean released = false;
            while (!released) {
                try {
                    released = release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    // blocking I/O that ignores interrupts
                }
            }
            returned.countDown();
            return new ProbeResult(probe.name(), probe.kind(), false, 0, Duration.ofMillis(7000),
                    "connection reset", ErrorCategory.CONNECTION_ERROR, null, Instant.now());
        }).when(probeExecutor).execute(any());
        ProbeConfig api = probe("api").toBuilder()
                .alertPolicy(new AlertPolicy(List.of(AlertChannel.EMAIL), 1, true))
                .build();
        scheduler(MonitoringConfig.builder().probe(api).build()).start();

        assertTrue(fired.await(3, TimeUnit.SECONDS));
        scheduler.stop();
        release.countDown();

        assertTrue(returned.await(3, TimeUnit.SECONDS));
        Thread.sleep(200);
        verify(notifier, never()).send(any());
        assertNull(registry.find("app_uptime_probe_up").gauge());
    }

    @Test
    void firstFiringWaitsOneInterval() throws Exception {
        scheduler(MonitoringConfig.builder().probe(probe("api")).build()).start();

        Thread.sleep(300);
        assertEquals(0, executions.get());
    }

    @Test
    void disabledMonitoringSchedulesNothing() {
        scheduler(MonitoringConfig.builder().enabled(false).probe(probe("api")).build()).start();

        assertFalse(scheduler.isRunning());
        assertEquals(0, scheduler.activeTimers());
    }

    @Test
    void doubleStartFailsAndRestartWorks() {
        scheduler(MonitoringConfig.builder().probe(probe("api")).build()).start();

        assertThrows(IllegalStateException.class, scheduler::start);

        scheduler.stop();
        scheduler.stop();
        scheduler.start();
        assertEquals(1, scheduler.activeTimers());
    }

    @Test
    void addAndRemoveWhileRunning() {
        scheduler(MonitoringConfig.builder().probe(probe("api")).build()).start();

        scheduler.addProbe(probe("web"));
        assertEquals(2, scheduler.activeTimers());

        scheduler.addProbe(probe("web").toBuilder().intervalSeconds(30).build());
        assertEquals(2, scheduler.activeTimers());
        assertEquals(Duration.ofSeconds(30), scheduler.config().probes().get(1).interval());

        scheduler.removeProbe("api");
        scheduler.removeProbe("unknown");
        assertEquals(1, scheduler.activeTimers());
        assertEquals(List.of("web"), scheduler.config().probes().stream().map(ProbeConfig::name).toList());
    }

    @Test
    void addDisabledProbeCreatesNoTimer() {
        scheduler(MonitoringConfig.builder().build()).start();

        scheduler.addProbe(probe("api").toBuilder().enabled(false).build());

        assertEquals(0, scheduler.activeTimers());
        assertEquals(1, scheduler.config().probes().size());
    }

    @Test
    void alertFiresOnceWhenThresholdIsReached() throws Exception {
        ProbeConfig api = probe("api");
        scheduler(MonitoringConfig.builder().probe(api).build());
        downProbes.add("api");

        scheduler.runProbe(api);
        assertEquals(1, scheduler.consecutiveFailures("api"));
        verify(notifier, never()).send(any());

        scheduler.runProbe(api);
        scheduler.runProbe(api);
        assertEquals(3, scheduler.consecutiveFailures("api"));
        verify(notifier, times(1)).send(any());
    }

    @Test
    void successResetsCounter() throws Exception {
        ProbeConfig api = probe("api");
        scheduler(MonitoringConfig.builder().probe(api).build());

        downProbes.add("api");
        scheduler.runProbe(api);
        downProbes.clear();
        scheduler.runProbe(api);
        downProbes.add("api");
        scheduler.runProbe(api);

        assertEquals(1, scheduler.consecutiveFailures("api"));
        verify(notifier, never()).send(any());
        assertTrue(scheduler.lastResults().containsKey("api"));
    }

    @Test
    void maintenanceSuppressesAlerts() throws Exception {
        ProbeConfig api = probe("api");
        scheduler(MonitoringConfig.builder()
                .probe(api)
                .maintenance(new MaintenanceWindow(true, "Sun 02:00-04:00"))
                .build());
        downProbes.add("api");

        for (int i = 0; i < 4; i++) {
            scheduler.runProbe(api);
        }

        assertEquals(4, scheduler.consecutiveFailures("api"));
        verify(notifier, never()).send(any());
    }

    @Test
    void checkNowRunsEnabledProbesWithoutTouchingCounters() {
        scheduler(MonitoringConfig.builder()
                .probe(probe("api"))
                .probe(probe("web"))
                .probe(probe("legacy").toBuilder().enabled(false).build())
                .build());
        downProbes.add("web");

        UptimeReport report = scheduler.checkNow();

        assertEquals(HealthStatus.UNHEALTHY, report.status());
        assertEquals(List.of("api", "web"), report.probes().stream().map(ProbeResult::name).toList());
        assertEquals(0, scheduler.consecutiveFailures("web"));
        assertEquals(2, executions.get());
    }

    @Test
    void checkNowAllUpIsHealthy() {
        scheduler(MonitoringConfig.builder().probe(probe("api")).build());

        assertEquals(HealthStatus.HEALTHY, scheduler.checkNow().status());
    }

    @Test
    void firingsAreExportedAsMetrics() {
        ProbeConfig api = probe("api");
        scheduler(MonitoringConfig.builder().probe(api).build());
        downProbes.add("api");

        scheduler.runProbe(api);

        assertEquals(0.0, registry.get("app_uptime_probe_up").tags("probe", "api", "kind", "http")
                .gauge().value());
        assertEquals(1.0, registry.get("app_uptime_probe_consecutive_failures").tags("probe", "api")
                .gauge().value());
        Map<String, ProbeResult> last = scheduler.lastResults();
        assertFalse(last.get("api").up());
    }
}
