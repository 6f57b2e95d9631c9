package io.crosspost4j.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Engagement metrics of one platform post at a point in time (e.g. views, likes, reposts).
 */
public record MetricSnapshot(
        String platform,
        Map<String, Long> values,
        Instant collectedAt
) {
    public MetricSnapshot {
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(collectedAt, "collectedAt must not be null");
        values = values == null ? Map.of() : Map.copyOf(values);
    }
}
