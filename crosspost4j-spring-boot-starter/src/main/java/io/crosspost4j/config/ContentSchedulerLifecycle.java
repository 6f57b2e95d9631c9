package io.crosspost4j.config;

import io.crosspost4j.ContentScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 */
public class ContentSchedulerLifecycle implements SmartLifecycle {
    private final ContentScheduler scheduler;
    private volatile boolean running = false;

    public ContentSchedulerLifecycle(ContentScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // last to start, first to stop: publish jobs may call into any other bean
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
