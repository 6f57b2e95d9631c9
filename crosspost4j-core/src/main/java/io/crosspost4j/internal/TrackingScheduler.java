package io.crosspost4j.internal;

import io.crosspost4j.ContentStore;
import io.crosspost4j.MetricsCollector;
import io.crosspost4j.core.ContentRecord;
import io.crosspost4j.core.JobHandle;
import io.crosspost4j.core.JobKey;
import io.crosspost4j.core.JobRegistry;
import io.crosspost4j.core.MetricSnapshot;
import io.crosspost4j.core.TrackingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Recurring metrics polling of published content.
 *
 * <p>One tracking job per record. Each cycle collects a snapshot per platform, then the
 * {@link TrackingPolicy} picks the next delay from the content age, or ends the job once the
 * content is cold. Tracking is best-effort: failures are logged and the loop goes on.
 */
public class TrackingScheduler {
    private static final Logger log = LoggerFactory.getLogger(TrackingScheduler.class);

    private final ContentStore store;
    private final MetricsCollector collector;
    private final JobRegistry registry;
    private final JobRunner runner;
    private final TrackingPolicy policy;
    private final Clock clock;

    public TrackingScheduler(ContentStore store,
                             MetricsCollector collector,
                             JobRegistry registry,
                             JobRunner runner,
                             TrackingPolicy policy,
                             Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.collector = Objects.requireNonNull(collector, "collector must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Starts (or restarts) tracking of {@code entityId}. The first cycle runs right away on a
     * worker thread.
     */
    public void start(String entityId, Collection<String> platforms) {
        Objects.requireNonNull(platforms, "platforms must not be null");
        JobKey key = JobKey.tracking(entityId);

        Set<String> targets = new LinkedHashSet<>(platforms);
        targets.removeIf(p -> p == null || p.isBlank());
        if (targets.isEmpty()) {
            log.info("Tracking not started, no platforms id={}", entityId);
            return;
        }

        TrackingJob job = new TrackingJob(new JobHandle(key), Collections.unmodifiableSet(targets));
        registry.register(job.handle);
        try {
            arm(job, Duration.ZERO);
        } catch (IllegalStateException e) {
            registry.remove(job.handle);
            throw e;
        }
        log.info("Tracking started id={} platforms={}", entityId, targets);
    }

    public boolean stop(String entityId) {
        boolean removed = registry.cancel(JobKey.tracking(entityId));
        if (removed) {
            log.info("Tracking stopped id={}", entityId);
        }
        return removed;
    }

    public boolean isTracking(String entityId) {
        return registry.contains(JobKey.tracking(entityId));
    }

    /**
     * One synchronous collection pass outside any tracking job.
     *
     * @return snapshots collected and stored; platforms that failed are left out
     */
    public List<MetricSnapshot> collectOnce(String entityId, Collection<String> platforms) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(platforms, "platforms must not be null");
        List<MetricSnapshot> collected = new ArrayList<>(platforms.size());
        for (String platform : platforms) {
            MetricSnapshot snapshot = collect(entityId, platform);
            if (snapshot != null) {
                collected.add(snapshot);
            }
        }
        return collected;
    }

    private void arm(TrackingJob job, Duration delay) {
        Instant runAt = clock.instant().plus(delay);
        job.handle.attach(
                runner.schedule("tracking " + job.entityId(), delay, () -> runCycle(job)),
                runAt
        );
    }

    private void runCycle(TrackingJob job) {
        String id = job.entityId();
        if (job.handle.isCancelled()) {
            log.debug("Tracking cycle skipped, job cancelled id={}", id);
            return;
        }

        try {
            Optional<ContentRecord> found = store.findById(id);
            if (found.isEmpty()) {
                log.info("Tracking ended, content not found id={}", id);
                registry.remove(job.handle);
                return;
            }
            if (found.get().publishedTime() != null) {
                job.publishedTime = found.get().publishedTime();
            }

            for (String platform : job.platforms) {
                if (job.handle.isCancelled()) {
                    log.debug("Tracking cycle interrupted by cancellation id={}", id);
                    return;
                }
                collect(id, platform);
            }
            job.cycles++;
        } catch (Exception e) {
            log.warn("Tracking cycle skipped id={} msg={}", id, e.getMessage(), e);
        }

        Duration age = job.age(clock.instant());
        if (policy.isCold(job.cycles, age)) {
            log.info("Tracking finished, content is cold id={} cycles={} age={}", id, job.cycles, age);
            registry.remove(job.handle);
            return;
        }

        if (job.handle.isCancelled()) {
            return;
        }
        Duration delay = policy.nextDelay(age);
        try {
            arm(job, delay);
            log.debug("Tracking next cycle id={} cycles={} age={} delay={}", id, job.cycles, age, delay);
        } catch (IllegalStateException e) {
            log.debug("Tracking not re-armed, runner stopped id={}", id);
            registry.remove(job.handle);
        }
    }

    private MetricSnapshot collect(String entityId, String platform) {
        try {
            MetricSnapshot snapshot = collector.fetch(entityId, platform);
            if (snapshot == null) {
                log.warn("Metrics collector returned nothing id={} platform={}", entityId, platform);
                return null;
            }
            store.appendMetric(entityId, platform, snapshot);
            return snapshot;
        } catch (Exception e) {
            log.warn("Metrics collection failed id={} platform={} msg={}", entityId, platform, e.getMessage(), e);
            return null;
        }
    }

    private static final class TrackingJob {
        private final JobHandle handle;
        private final Set<String> platforms;

        // touched only by the cycle currently running; cycles of one job never overlap
        private int cycles;
        private Instant publishedTime;

        private TrackingJob(JobHandle handle, Set<String> platforms) {
            this.handle = handle;
            this.platforms = platforms;
        }

        private String entityId() {
            return handle.key().entityId();
        }

        private Duration age(Instant now) {
            if (publishedTime == null) {
                return Duration.ZERO;
            }
            Duration age = Duration.between(publishedTime, now);
            return age.isNegative() ? Duration.ZERO : age;
        }
    }
}
