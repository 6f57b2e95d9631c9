package io.crosspost4j.core;

import java.util.Objects;

/**
 * Identity of an in-memory job: one content record, one kind of work.
 */
public record JobKey(String entityId, JobKind kind) {

    public JobKey {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
    }

    public static JobKey publish(String entityId) {
        return new JobKey(entityId, JobKind.PUBLISH);
    }

    public static JobKey tracking(String entityId) {
        return new JobKey(entityId, JobKind.TRACKING);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + entityId;
    }
}
