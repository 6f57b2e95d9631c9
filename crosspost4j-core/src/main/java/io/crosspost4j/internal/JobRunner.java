package io.crosspost4j.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Timer + worker pool shared by every publish and tracking job.
 *
 * <p>Pending waits live on a single timer thread; when a wait expires the job body is handed to
 * the worker pool. A job stuck in a slow Store/Publisher call therefore holds one worker and
 * never delays other jobs' wake-ups.
 *
 * <p>Every body is wrapped so that an exception is logged here and goes no further.
 */
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final int maxConcurrency;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile ScheduledExecutorService timer;
    private volatile ExecutorService workerPool;

    public JobRunner(int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be a positive number");
        }
        this.maxConcurrency = maxConcurrency;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger workerSeq = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r);
            t.setName("crosspost.worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("crosspost.timer");
            t.setDaemon(true);
            return t;
        });
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Runs {@code task} on a worker once {@code delay} has elapsed. A zero or negative delay
     * still goes through the timer, so the caller never executes the task itself.
     *
     * @return the pending wait; cancelling it drops the task if it has not been handed over yet
     * @throws IllegalStateException if the runner is not started
     */
    public Future<?> schedule(String name, Duration delay, Runnable task) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(delay, "delay must not be null");
        Objects.requireNonNull(task, "task must not be null");

        ScheduledExecutorService t = timer;
        if (!started.get() || t == null) {
            throw new IllegalStateException("JobRunner is not running");
        }

        long delayMs = Math.max(0L, delay.toMillis());
        Runnable body = isolated(name, task);
        try {
            return t.schedule(() -> handOver(name, body), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("JobRunner is shutting down", e);
        }
    }

    /**
     * Cancels pending waits, waits for running bodies up to {@code awaitTermination}, then
     * interrupts whatever is left.
     */
    public void shutdown(Duration awaitTermination) {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        ScheduledExecutorService t = timer;
        timer = null;
        if (t != null) {
            List<Runnable> dropped = t.shutdownNow();
            log.debug("JobRunner dropped pending waits count={}", dropped.size());
        }

        ExecutorService pool = workerPool;
        workerPool = null;
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(awaitTermination.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("JobRunner workers did not finish within {}; interrupting", awaitTermination);
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            }
        }
    }

    private void handOver(String name, Runnable body) {
        ExecutorService pool = workerPool;
        if (pool == null) {
            log.debug("JobRunner stopped before job could run name={}", name);
            return;
        }
        try {
            pool.execute(body);
        } catch (RejectedExecutionException e) {
            log.debug("JobRunner rejected job during shutdown name={}", name);
        }
    }

    private static Runnable isolated(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("job failed name={} msg={}", name, e.getMessage(), e);
            }
        };
    }
}
