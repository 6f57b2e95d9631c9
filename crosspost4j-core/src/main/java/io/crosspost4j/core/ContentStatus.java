package io.crosspost4j.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a content record.
 *
 * <p>The engine only moves records forward: {@code SCHEDULED -> PUBLISHING -> PUBLISHED | FAILED}.
 */
public enum ContentStatus {
    DRAFT {
        @Override
        public boolean isReschedulable() {
            return true;
        }
    },
    SCHEDULED {
        @Override
        public boolean isReschedulable() {
            return true;
        }
    },
    PUBLISHING {
        @Override
        public boolean isReschedulable() {
            return false;
        }
    },
    PUBLISHED {
        @Override
        public boolean isReschedulable() {
            return false;
        }
    },
    FAILED {
        @Override
        public boolean isReschedulable() {
            return true;
        }
    };

    /**
     * Whether a record in this status may be given a new due time and put back to
     * {@link #SCHEDULED}. A publish in progress or done is never re-armed.
     */
    public abstract boolean isReschedulable();

    public static Set<ContentStatus> reschedulable() {
        EnumSet<ContentStatus> out = EnumSet.noneOf(ContentStatus.class);
        for (ContentStatus s : values()) {
            if (s.isReschedulable()) {
                out.add(s);
            }
        }
        return out;
    }
}
