package io.crosspost4j.core;

import java.time.Duration;

/**
 * Decides how often published content is polled and when it is cold.
 */
public interface TrackingPolicy {

    /**
     * Delay until the next poll for content of the given age.
     */
    Duration nextDelay(Duration age);

    /**
     * True once tracking should stop, evaluated after each cycle.
     */
    boolean isCold(int completedCycles, Duration age);
}
