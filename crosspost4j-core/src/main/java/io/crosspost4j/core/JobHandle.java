package io.crosspost4j.core;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and ownership token of one in-memory job.
 *
 * <p>Cancelling is cooperative: the pending wait (if any) is cancelled without interrupting,
 * and the job observes {@link #isCancelled()} at its next check. Work already inside a
 * Store/Publisher call runs to completion of that call.
 */
public final class JobHandle {

    private final JobKey key;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile Future<?> pending;
    private volatile Instant nextRunAt;

    public JobHandle(JobKey key) {
        this.key = Objects.requireNonNull(key, "key must not be null");
    }

    public JobKey key() {
        return key;
    }

    /**
     * Fire time of a publish job, or next poll time of a tracking job. Null until attached.
     */
    public Instant nextRunAt() {
        return nextRunAt;
    }

    /**
     * Binds the wait currently standing for this job. If the handle was cancelled before the
     * wait got attached, the wait is cancelled right away.
     */
    public void attach(Future<?> wait, Instant runAt) {
        Objects.requireNonNull(wait, "wait must not be null");
        this.nextRunAt = runAt;
        this.pending = wait;
        if (cancelled.get()) {
            wait.cancel(false);
        }
    }

    /**
     * Signals cancellation. Returns true only for the call that flipped the flag.
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        Future<?> wait = pending;
        if (wait != null) {
            wait.cancel(false);
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "JobHandle{key=" + key + ", nextRunAt=" + nextRunAt + ", cancelled=" + cancelled.get() + '}';
    }
}
