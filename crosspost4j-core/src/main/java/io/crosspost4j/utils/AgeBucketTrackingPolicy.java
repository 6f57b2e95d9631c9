package io.crosspost4j.utils;

import io.crosspost4j.core.TrackingPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Polls fresh content often and old content rarely.
 *
 * <p>Buckets (strictly greater-than, checked from the largest bound down):
 * <ul>
 *   <li>age &gt; 7 days: every 12 hours</li>
 *   <li>age &gt; 3 days: every 6 hours</li>
 *   <li>age &gt; 1 day: every 3 hours</li>
 *   <li>otherwise: base interval (1 hour by default)</li>
 * </ul>
 * <p>Content is cold once more than {@code maxCycles} cycles ran <b>and</b> it is older than
 * {@code coldAge}, both on the same evaluation.
 */
public class AgeBucketTrackingPolicy implements TrackingPolicy {

    static final Duration ONE_DAY = Duration.ofDays(1);
    static final Duration THREE_DAYS = Duration.ofDays(3);
    static final Duration SEVEN_DAYS = Duration.ofDays(7);

    private final Duration baseInterval;
    private final int maxCycles;
    private final Duration coldAge;

    public AgeBucketTrackingPolicy() {
        this(Duration.ofHours(1), 30, SEVEN_DAYS);
    }

    public AgeBucketTrackingPolicy(Duration baseInterval, int maxCycles, Duration coldAge) {
        this.baseInterval = Objects.requireNonNull(baseInterval, "baseInterval must not be null");
        this.coldAge = Objects.requireNonNull(coldAge, "coldAge must not be null");
        if (baseInterval.isZero() || baseInterval.isNegative()) {
            throw new IllegalArgumentException("baseInterval must be a positive duration");
        }
        if (maxCycles < 0) {
            throw new IllegalArgumentException("maxCycles must not be negative");
        }
        this.maxCycles = maxCycles;
    }

    @Override
    public Duration nextDelay(Duration age) {
        Duration a = normalize(age);
        if (a.compareTo(SEVEN_DAYS) > 0) {
            return Duration.ofHours(12);
        }
        if (a.compareTo(THREE_DAYS) > 0) {
            return Duration.ofHours(6);
        }
        if (a.compareTo(ONE_DAY) > 0) {
            return Duration.ofHours(3);
        }
        return baseInterval;
    }

    @Override
    public boolean isCold(int completedCycles, Duration age) {
        return completedCycles > maxCycles && normalize(age).compareTo(coldAge) > 0;
    }

    private static Duration normalize(Duration age) {
        if (age == null || age.isNegative()) {
            return Duration.ZERO;
        }
        return age;
    }
}
