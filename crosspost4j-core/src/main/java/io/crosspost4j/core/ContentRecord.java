package io.crosspost4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of a persisted content record as seen by the scheduling engine.
 */
public record ContentRecord(

        // identity
        String id,

        // payload
        String text,
        List<String> media,
        Set<String> platforms,

        // lifecycle
        ContentStatus status,
        Instant dueTime,
        Instant publishedTime,
        Map<String, PlatformOutcome> results
) {
    public ContentRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        media = media == null ? List.of() : List.copyOf(media);
        platforms = platforms == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(platforms));
        results = results == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /**
     * Platforms whose recorded outcome is a success, in result order.
     */
    public Set<String> successfulPlatforms() {
        Set<String> out = new LinkedHashSet<>();
        for (var e : results.entrySet()) {
            if (e.getValue() != null && e.getValue().success()) {
                out.add(e.getKey());
            }
        }
        return out;
    }
}
