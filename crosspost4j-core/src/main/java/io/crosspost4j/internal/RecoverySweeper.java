package io.crosspost4j.internal;

import io.crosspost4j.ContentStore;
import io.crosspost4j.core.ContentRecord;
import io.crosspost4j.core.ContentStatus;
import io.crosspost4j.core.JobKey;
import io.crosspost4j.core.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Re-arms publish jobs from the stored state.
 *
 * <p>The sweeper thread first reconciles every scheduled record (the registry is empty after a
 * restart), then sweeps periodically for scheduled records that have no publish job, e.g.
 * because a job was dropped. Store failures are logged and retried after a backoff; the thread
 * runs until {@link #stop()}.
 */
public class RecoverySweeper {
    private static final Logger log = LoggerFactory.getLogger(RecoverySweeper.class);

    private final ContentStore store;
    private final JobRegistry registry;
    private final PublishScheduler publishScheduler;
    private final TrackingScheduler trackingScheduler;
    private final Clock clock;

    private final Duration sweepInterval;
    private final Duration backoff;
    private final Duration missedLookback;
    private final Duration resumeTrackingWithin; // null disables resume

    private volatile boolean running;
    private volatile Thread sweeperThread;

    public RecoverySweeper(ContentStore store,
                           JobRegistry registry,
                           PublishScheduler publishScheduler,
                           TrackingScheduler trackingScheduler,
                           Clock clock,
                           Duration sweepInterval,
                           Duration backoff,
                           Duration missedLookback,
                           Duration resumeTrackingWithin) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.publishScheduler = Objects.requireNonNull(publishScheduler, "publishScheduler must not be null");
        this.trackingScheduler = Objects.requireNonNull(trackingScheduler, "trackingScheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sweepInterval = requirePositive(sweepInterval, "sweepInterval");
        this.backoff = requirePositive(backoff, "backoff");
        this.missedLookback = Objects.requireNonNull(missedLookback, "missedLookback must not be null");
        if (missedLookback.isNegative()) {
            throw new IllegalArgumentException("missedLookback must not be negative");
        }
        this.resumeTrackingWithin = resumeTrackingWithin;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Thread t = new Thread(this::sweepLoop);
        t.setName("crosspost.sweeper");
        t.setDaemon(true);
        sweeperThread = t;
        t.start();
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread t = sweeperThread;
        sweeperThread = null;
        if (t != null) {
            t.interrupt();
            try {
                t.join(backoff.toMillis() + 1_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("Recovery sweeper did not stop in time, it exits after its current store call thread={}",
                        t.getName());
            }
        }
    }

    /**
     * Schedules every stored record in status scheduled, whatever its due time, and resumes
     * tracking of recently published records.
     *
     * @return number of publish jobs armed
     */
    public int reconcile() {
        List<ContentRecord> scheduled = store.findByStatus(ContentStatus.SCHEDULED);
        int armed = 0;
        for (ContentRecord record : scheduled) {
            if (record.dueTime() == null) {
                log.warn("Scheduled content without due time skipped id={}", record.id());
                continue;
            }
            if (registry.contains(JobKey.publish(record.id()))) {
                continue;
            }
            publishScheduler.schedule(record.id(), record.dueTime());
            armed++;
        }

        int resumed = resumeTracking();
        log.info("Startup reconciliation done scheduled={} armed={} trackingResumed={}",
                scheduled.size(), armed, resumed);
        return armed;
    }

    /**
     * One steady-state pass over {@code [now - missedLookback, now + sweepInterval]}.
     *
     * @return number of publish jobs re-armed
     */
    public int sweepOnce() {
        Instant now = clock.instant();
        List<ContentRecord> due = store.findByStatusAndDueTimeBetween(
                ContentStatus.SCHEDULED,
                now.minus(missedLookback),
                now.plus(sweepInterval)
        );

        int armed = 0;
        for (ContentRecord record : due) {
            if (record.dueTime() == null || registry.contains(JobKey.publish(record.id()))) {
                continue;
            }
            log.info("Sweep recovered publish job id={} dueTime={}", record.id(), record.dueTime());
            publishScheduler.schedule(record.id(), record.dueTime());
            armed++;
        }
        log.debug("Sweep done candidates={} armed={}", due.size(), armed);
        return armed;
    }

    private int resumeTracking() {
        if (resumeTrackingWithin == null) {
            return 0;
        }
        Instant now = clock.instant();
        int resumed = 0;
        for (ContentRecord record : store.findByStatus(ContentStatus.PUBLISHED)) {
            if (record.publishedTime() == null
                    || Duration.between(record.publishedTime(), now).compareTo(resumeTrackingWithin) > 0
                    || trackingScheduler.isTracking(record.id())) {
                continue;
            }
            Set<String> platforms = record.successfulPlatforms();
            if (platforms.isEmpty()) {
                continue;
            }
            trackingScheduler.start(record.id(), platforms);
            resumed++;
        }
        return resumed;
    }

    private void sweepLoop() {
        boolean reconciled = false;
        while (isCurrent()) {
            try {
                if (!reconciled) {
                    reconcile();
                    reconciled = true;
                } else {
                    sweepOnce();
                }
            } catch (Exception e) {
                log.error("Recovery {} failed msg={}", reconciled ? "sweep" : "reconciliation", e.getMessage(), e);
                if (!sleep(backoff)) {
                    break;
                }
                continue;
            }

            if (!sleep(sweepInterval)) {
                break;
            }
        }
        log.debug("Recovery sweeper exited");
    }

    // a thread left behind by a timed-out stop() must not keep sweeping after a restart
    private boolean isCurrent() {
        return running && sweeperThread == Thread.currentThread();
    }

    private boolean sleep(Duration d) {
        try {
            Thread.sleep(d.toMillis());
            return isCurrent();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
        return d;
    }
}
