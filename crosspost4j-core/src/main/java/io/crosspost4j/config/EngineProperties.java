package io.crosspost4j.config;

import java.time.Duration;

/**
 * Runtime configuration for the scheduling engine.
 *
 * <p>Plain bean so the core stays free of Spring; the starter binds it to {@code crosspost.*}.
 */
public class EngineProperties {
    private int maxConcurrency = 20; // worker threads shared by all jobs
    private Duration sweepInterval = Duration.ofSeconds(60);
    private Duration sweepBackoff = Duration.ofSeconds(10);
    private Duration missedLookback = Duration.ofHours(24);
    private Duration trackingBaseInterval = Duration.ofHours(1);
    private int trackingMaxCycles = 30;
    private Duration trackingColdAge = Duration.ofDays(7);
    private boolean resumeTrackingOnStartup = true;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean ensureIndexesOnStartup = false;

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public Duration getSweepBackoff() {
        return sweepBackoff;
    }

    public void setSweepBackoff(Duration sweepBackoff) {
        this.sweepBackoff = sweepBackoff;
    }

    /**
     * How far into the past the steady-state sweep looks for scheduled records whose job was lost.
     */
    public Duration getMissedLookback() {
        return missedLookback;
    }

    public void setMissedLookback(Duration missedLookback) {
        this.missedLookback = missedLookback;
    }

    public Duration getTrackingBaseInterval() {
        return trackingBaseInterval;
    }

    public void setTrackingBaseInterval(Duration trackingBaseInterval) {
        this.trackingBaseInterval = trackingBaseInterval;
    }

    public int getTrackingMaxCycles() {
        return trackingMaxCycles;
    }

    public void setTrackingMaxCycles(int trackingMaxCycles) {
        this.trackingMaxCycles = trackingMaxCycles;
    }

    public Duration getTrackingColdAge() {
        return trackingColdAge;
    }

    public void setTrackingColdAge(Duration trackingColdAge) {
        this.trackingColdAge = trackingColdAge;
    }

    public boolean isResumeTrackingOnStartup() {
        return resumeTrackingOnStartup;
    }

    public void setResumeTrackingOnStartup(boolean resumeTrackingOnStartup) {
        this.resumeTrackingOnStartup = resumeTrackingOnStartup;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
