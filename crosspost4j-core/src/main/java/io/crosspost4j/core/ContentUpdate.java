package io.crosspost4j.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ContentUpdate describes a partial update of a content record.
 *
 * <p>Only non-null fields are written. This is an API-layer object; each store translates it
 * into its own update statement.
 */
public final class ContentUpdate {

    private final ContentStatus status;
    private final Instant dueTime;
    private final Instant publishedTime;
    private final Map<String, PlatformOutcome> results;

    private ContentUpdate(ContentStatus status,
                          Instant dueTime,
                          Instant publishedTime,
                          Map<String, PlatformOutcome> results) {
        this.status = status;
        this.dueTime = dueTime;
        this.publishedTime = publishedTime;
        this.results = results == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public ContentStatus status() {
        return status;
    }

    public Instant dueTime() {
        return dueTime;
    }

    public Instant publishedTime() {
        return publishedTime;
    }

    /**
     * Per-platform results; replaces the stored map as a whole when present.
     */
    public Map<String, PlatformOutcome> results() {
        return results;
    }

    public boolean isEmpty() {
        return status == null
                && dueTime == null
                && publishedTime == null
                && results == null;
    }

    public static ContentUpdate status(ContentStatus status) {
        return builder().status(status).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ContentUpdate{status=" + status
                + ", dueTime=" + dueTime
                + ", publishedTime=" + publishedTime
                + ", results=" + results + '}';
    }

    public static final class Builder {
        private ContentStatus status;
        private Instant dueTime;
        private Instant publishedTime;
        private Map<String, PlatformOutcome> results;

        public Builder status(ContentStatus status) {
            this.status = status;
            return this;
        }

        public Builder dueTime(Instant dueTime) {
            this.dueTime = dueTime;
            return this;
        }

        public Builder publishedTime(Instant publishedTime) {
            this.publishedTime = publishedTime;
            return this;
        }

        public Builder results(Map<String, PlatformOutcome> results) {
            this.results = results;
            return this;
        }

        public ContentUpdate build() {
            ContentUpdate update = new ContentUpdate(status, dueTime, publishedTime, results);
            if (update.isEmpty()) {
                throw new IllegalStateException(
                        "ContentUpdate must contain at least one field: status, dueTime, publishedTime, or results"
                );
            }
            return update;
        }
    }
}
