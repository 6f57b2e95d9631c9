package io.crosspost4j.internal;

import io.crosspost4j.ContentStore;
import io.crosspost4j.Publisher;
import io.crosspost4j.core.ContentRecord;
import io.crosspost4j.core.ContentStatus;
import io.crosspost4j.core.ContentUpdate;
import io.crosspost4j.core.JobHandle;
import io.crosspost4j.core.JobKey;
import io.crosspost4j.core.JobRegistry;
import io.crosspost4j.core.PlatformOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One-shot delayed publishing.
 *
 * <p>A publish job waits until the due time, re-reads the record and only proceeds while it is
 * still {@link ContentStatus#SCHEDULED}. The {@code PUBLISHING} transition is a conditional write;
 * from there on the job owns the record until it reaches a terminal status, and cancelling or
 * re-scheduling no longer affects it. A job that fails before that write leaves the record as is.
 */
public class PublishScheduler {
    private static final Logger log = LoggerFactory.getLogger(PublishScheduler.class);

    private static final Set<ContentStatus> CLAIMABLE = Set.of(ContentStatus.SCHEDULED);

    private final ContentStore store;
    private final Publisher publisher;
    private final JobRegistry registry;
    private final JobRunner runner;
    private final TrackingScheduler tracking;
    private final Clock clock;

    public PublishScheduler(ContentStore store,
                            Publisher publisher,
                            JobRegistry registry,
                            JobRunner runner,
                            TrackingScheduler tracking,
                            Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.tracking = Objects.requireNonNull(tracking, "tracking must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Arms the publish job of {@code entityId}, replacing any pending one. Returns without
     * waiting, also when {@code dueTime} already passed.
     */
    public void schedule(String entityId, Instant dueTime) {
        Objects.requireNonNull(dueTime, "dueTime must not be null");
        JobHandle handle = new JobHandle(JobKey.publish(entityId));

        Duration delay = Duration.between(clock.instant(), dueTime);
        registry.register(handle);
        try {
            handle.attach(runner.schedule("publish " + entityId, delay, () -> fire(handle)), dueTime);
        } catch (IllegalStateException e) {
            registry.remove(handle);
            throw e;
        }

        if (delay.isNegative() || delay.isZero()) {
            log.info("Publish due now id={} dueTime={}", entityId, dueTime);
        } else {
            log.info("Publish scheduled id={} dueTime={} delay={}", entityId, dueTime, delay);
        }
    }

    public boolean cancel(String entityId) {
        boolean removed = registry.cancel(JobKey.publish(entityId));
        if (removed) {
            log.info("Publish cancelled id={}", entityId);
        } else {
            log.debug("No pending publish to cancel id={}", entityId);
        }
        return removed;
    }

    public boolean isScheduled(String entityId) {
        return registry.contains(JobKey.publish(entityId));
    }

    void fire(JobHandle handle) {
        String id = handle.key().entityId();
        ContentRecord record = null;
        boolean claimed = false;
        Set<String> tracked = null;
        try {
            if (handle.isCancelled()) {
                log.debug("Publish skipped, job cancelled id={}", id);
                return;
            }

            Optional<ContentRecord> found = store.findById(id);
            if (found.isEmpty()) {
                log.warn("Publish skipped, content not found id={}", id);
                return;
            }
            record = found.get();
            if (record.status() != ContentStatus.SCHEDULED) {
                log.info("Publish skipped id={} status={}", id, record.status());
                return;
            }
            if (handle.isCancelled()) {
                log.debug("Publish skipped, job cancelled id={}", id);
                return;
            }

            if (!store.updateIfStatus(id, CLAIMABLE, ContentUpdate.status(ContentStatus.PUBLISHING))) {
                log.info("Publish skipped, content no longer scheduled id={}", id);
                return;
            }
            claimed = true;
            log.info("Publishing id={} platforms={}", id, record.platforms());

            Map<String, PlatformOutcome> results = collectOutcomes(record,
                    publisher.publish(record.text(), record.media(), record.platforms()));
            tracked = successful(results);

            ContentUpdate.Builder update = ContentUpdate.builder().results(results);
            if (tracked.isEmpty()) {
                update.status(ContentStatus.FAILED);
            } else {
                update.status(ContentStatus.PUBLISHED).publishedTime(clock.instant());
            }
            store.update(id, update.build());

            if (tracked.isEmpty()) {
                log.warn("Publish failed on every platform id={} results={}", id, results);
            } else {
                log.info("Published id={} succeeded={} of={}", id, tracked, results.keySet());
            }
        } catch (Exception e) {
            tracked = null;
            if (claimed) {
                log.error("Publish job failed id={} msg={}", id, e.getMessage(), e);
                markFailed(id, record, e);
            } else {
                // status untouched: a scheduled record is picked up again by the recovery sweep
                log.error("Publish job aborted before publishing id={} msg={}", id, e.getMessage(), e);
            }
        } finally {
            registry.remove(handle);
        }

        if (tracked != null && !tracked.isEmpty()) {
            try {
                tracking.start(id, tracked);
            } catch (Exception e) {
                log.error("Tracking hand-off failed id={} msg={}", id, e.getMessage(), e);
            }
        }
    }

    // Every requested platform gets an entry; one the publisher left out counts as failed.
    private static Map<String, PlatformOutcome> collectOutcomes(ContentRecord record,
                                                                Map<String, PlatformOutcome> reported) {
        Map<String, PlatformOutcome> results = new LinkedHashMap<>();
        for (String platform : record.platforms()) {
            PlatformOutcome outcome = reported == null ? null : reported.get(platform);
            results.put(platform, outcome != null ? outcome : PlatformOutcome.failure("no outcome reported"));
        }
        return results;
    }

    private static Set<String> successful(Map<String, PlatformOutcome> results) {
        Set<String> out = new LinkedHashSet<>();
        results.forEach((platform, outcome) -> {
            if (outcome.success()) {
                out.add(platform);
            }
        });
        return out;
    }

    private void markFailed(String id, ContentRecord record, Exception cause) {
        ContentUpdate.Builder update = ContentUpdate.builder().status(ContentStatus.FAILED);
        if (record != null && !record.platforms().isEmpty()) {
            String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            Map<String, PlatformOutcome> results = new LinkedHashMap<>();
            for (String platform : record.platforms()) {
                results.put(platform, PlatformOutcome.failure(error));
            }
            update.results(results);
        }
        try {
            store.update(id, update.build());
        } catch (Exception storeEx) {
            log.error("Publish markFailed failed id={} msg={}", id, storeEx.getMessage(), storeEx);
        }
    }
}
