package io.crosspost4j;

import io.crosspost4j.core.MetricSnapshot;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Main engine API.
 *
 * <p>Covers two kinds of background work per content record:
 * <ul>
 *   <li>one-shot publishing at a due time, recovered after a restart</li>
 *   <li>recurring metrics tracking of published content, slowing down as content ages</li>
 * </ul>
 */
public interface ContentScheduler {
    void start();

    void stop();

    /**
     * Arm (or re-arm) the publish job of a record. Replaces any pending publish job for the
     * same record. Never runs the publish inside the caller's thread.
     */
    void schedule(String entityId, Instant dueTime);

    /**
     * Drop the pending publish job. Does not touch the stored record.
     */
    boolean cancel(String entityId);

    /**
     * Persist a new due time (status back to scheduled) and re-arm the publish job.
     */
    void reschedule(String entityId, Instant newDueTime);

    void startTracking(String entityId, Collection<String> platforms);

    boolean stopTracking(String entityId);

    boolean isScheduled(String entityId);

    boolean isTracking(String entityId);

    /**
     * Collect metrics for every successfully published platform right now, outside the
     * tracking cadence.
     */
    List<MetricSnapshot> refreshMetrics(String entityId);

    /**
     * Stored snapshots grouped by platform, oldest first.
     */
    Map<String, List<MetricSnapshot>> statistics(String entityId);
}
