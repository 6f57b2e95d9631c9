package io.crosspost4j.core;

public enum JobKind {
    PUBLISH {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    TRACKING {
        @Override
        public boolean isRecurring() {
            return true;
        }
    };

    public abstract boolean isRecurring();
}
