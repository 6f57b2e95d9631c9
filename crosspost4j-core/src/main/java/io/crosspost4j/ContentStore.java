package io.crosspost4j;

import io.crosspost4j.core.ContentRecord;
import io.crosspost4j.core.ContentStatus;
import io.crosspost4j.core.ContentUpdate;
import io.crosspost4j.core.MetricSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable storage of content records and their metric snapshots.
 *
 * <p>Implementations must be safe for concurrent use; the engine does no locking around them.
 */
public interface ContentStore {

    /**
     * Records with the given status whose due time lies in {@code [from, to]}.
     */
    List<ContentRecord> findByStatusAndDueTimeBetween(ContentStatus status, Instant from, Instant to);

    List<ContentRecord> findByStatus(ContentStatus status);

    Optional<ContentRecord> findById(String id);

    /**
     * Apply all fields of {@code update} in one write.
     */
    void update(String id, ContentUpdate update);

    /**
     * Apply {@code update} only while the record's status is one of {@code expected}, as a
     * single atomic write.
     *
     * @return true if the record matched and was written
     */
    boolean updateIfStatus(String id, Set<ContentStatus> expected, ContentUpdate update);

    void appendMetric(String id, String platform, MetricSnapshot snapshot);

    Map<String, List<MetricSnapshot>> findMetrics(String id);
}
