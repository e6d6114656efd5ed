package biz.kryukov.dev.healthwatch.spring;

import biz.kryukov.dev.healthwatch.HealthWatch;
import org.springframework.context.SmartLifecycle;

/**
 * SmartLifecycle: starts uptime probes on application startup and stops them on shutdown.
 */
public class HealthWatchLifecycle implements SmartLifecycle {

    private final HealthWatch healthWatch;
    private volatile boolean running;

    public HealthWatchLifecycle(HealthWatch healthWatch) {
        this.healthWatch = healthWatch;
    }

    @Override
    public void start() {
        healthWatch.start();
        running = true;
    }

    @Override
    public void stop() {
        healthWatch.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE; // start after all beans are initialized
    }
}
