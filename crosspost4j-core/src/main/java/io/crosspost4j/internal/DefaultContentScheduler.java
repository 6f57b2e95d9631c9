package io.crosspost4j.internal;

import io.crosspost4j.ContentScheduler;
import io.crosspost4j.ContentStore;
import io.crosspost4j.MetricsCollector;
import io.crosspost4j.Publisher;
import io.crosspost4j.config.EngineProperties;
import io.crosspost4j.core.ContentRecord;
import io.crosspost4j.core.ContentStatus;
import io.crosspost4j.core.ContentUpdate;
import io.crosspost4j.core.JobRegistry;
import io.crosspost4j.core.MetricSnapshot;
import io.crosspost4j.core.TrackingPolicy;
import io.crosspost4j.utils.AgeBucketTrackingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process scheduling engine: publish jobs, tracking jobs and the recovery sweeper around one
 * {@link JobRegistry}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * ContentScheduler scheduler = new DefaultContentScheduler(props, store, publisher, collector, Clock.systemUTC());
 * scheduler.start();
 *
 * scheduler.schedule("post-42", Instant.parse("2026-01-20T09:30:00Z"));
 * scheduler.reschedule("post-42", Instant.parse("2026-01-21T09:30:00Z"));
 *
 * scheduler.stop();
 * }</pre>
 */
public class DefaultContentScheduler implements ContentScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultContentScheduler.class);

    private final EngineProperties props;
    private final ContentStore store;
    private final JobRegistry registry = new JobRegistry();
    private final JobRunner runner;
    private final PublishScheduler publishScheduler;
    private final TrackingScheduler trackingScheduler;
    private final RecoverySweeper sweeper;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public DefaultContentScheduler(EngineProperties props,
                                   ContentStore store,
                                   Publisher publisher,
                                   MetricsCollector collector,
                                   Clock clock) {
        this(props, store, publisher, collector, clock, defaultPolicy(props));
    }

    public DefaultContentScheduler(EngineProperties props,
                                   ContentStore store,
                                   Publisher publisher,
                                   MetricsCollector collector,
                                   Clock clock,
                                   TrackingPolicy trackingPolicy) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(publisher, "publisher must not be null");
        Objects.requireNonNull(collector, "collector must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(trackingPolicy, "trackingPolicy must not be null");

        this.runner = new JobRunner(props.getMaxConcurrency());
        this.trackingScheduler = new TrackingScheduler(store, collector, registry, runner, trackingPolicy, clock);
        this.publishScheduler = new PublishScheduler(store, publisher, registry, runner, trackingScheduler, clock);
        this.sweeper = new RecoverySweeper(
                store,
                registry,
                publishScheduler,
                trackingScheduler,
                clock,
                props.getSweepInterval(),
                props.getSweepBackoff(),
                props.getMissedLookback(),
                props.isResumeTrackingOnStartup() ? props.getTrackingColdAge() : null
        );
    }

    /**
     * Start the worker pool and the recovery sweeper. Idempotent.
     */
    @Override
    public void start() {
        requirePositive(props.getShutdownTimeout(), "crosspost.shutdownTimeout");

        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Content scheduler starting with maxConcurrency={}, sweepInterval={}, sweepBackoff={}, missedLookback={}, trackingBaseInterval={}",
                props.getMaxConcurrency(),
                props.getSweepInterval(),
                props.getSweepBackoff(),
                props.getMissedLookback(),
                props.getTrackingBaseInterval());

        runner.start();
        sweeper.start();
        log.info("Content scheduler started successfully.");
    }

    /**
     * Stop sweeping, cancel every job and wait for in-flight work. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Content scheduler stopping...");
        sweeper.stop();
        int cancelled = registry.cancelAll();
        runner.shutdown(props.getShutdownTimeout());
        log.info("Content scheduler stopped successfully. cancelledJobs={}", cancelled);
    }

    @Override
    public void schedule(String entityId, Instant dueTime) {
        requireRunning();
        publishScheduler.schedule(entityId, dueTime);
    }

    @Override
    public boolean cancel(String entityId) {
        return publishScheduler.cancel(entityId);
    }

    @Override
    public void reschedule(String entityId, Instant newDueTime) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(newDueTime, "newDueTime must not be null");
        requireRunning();

        boolean moved = store.updateIfStatus(entityId, ContentStatus.reschedulable(), ContentUpdate.builder()
                .status(ContentStatus.SCHEDULED)
                .dueTime(newDueTime)
                .build());
        if (!moved) {
            ContentRecord record = store.findById(entityId)
                    .orElseThrow(() -> new IllegalArgumentException("No content found for id: " + entityId));
            throw new IllegalStateException(
                    "Content " + entityId + " cannot be rescheduled in status " + record.status());
        }
        publishScheduler.schedule(entityId, newDueTime);
        log.info("Content rescheduled id={} to={}", entityId, newDueTime);
    }

    @Override
    public void startTracking(String entityId, Collection<String> platforms) {
        requireRunning();
        trackingScheduler.start(entityId, platforms);
    }

    @Override
    public boolean stopTracking(String entityId) {
        return trackingScheduler.stop(entityId);
    }

    @Override
    public boolean isScheduled(String entityId) {
        return publishScheduler.isScheduled(entityId);
    }

    @Override
    public boolean isTracking(String entityId) {
        return trackingScheduler.isTracking(entityId);
    }

    @Override
    public List<MetricSnapshot> refreshMetrics(String entityId) {
        requireRunning();
        ContentRecord record = store.findById(entityId)
                .orElseThrow(() -> new IllegalArgumentException("No content found for id: " + entityId));
        Set<String> platforms = record.successfulPlatforms();
        if (platforms.isEmpty()) {
            log.debug("Nothing to refresh, no published platforms id={}", entityId);
            return List.of();
        }
        return trackingScheduler.collectOnce(entityId, platforms);
    }

    @Override
    public Map<String, List<MetricSnapshot>> statistics(String entityId) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        return store.findMetrics(entityId);
    }

    JobRegistry registry() {
        return registry;
    }

    private void requireRunning() {
        if (!started.get()) {
            throw new IllegalStateException("Content scheduler is not running");
        }
    }

    private static TrackingPolicy defaultPolicy(EngineProperties props) {
        Objects.requireNonNull(props, "props must not be null");
        return new AgeBucketTrackingPolicy(
                props.getTrackingBaseInterval(),
                props.getTrackingMaxCycles(),
                props.getTrackingColdAge()
        );
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
