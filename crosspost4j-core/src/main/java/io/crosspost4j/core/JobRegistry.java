package io.crosspost4j.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory registry of live jobs, at most one per {@link JobKey}.
 *
 * <p>Every operation runs under one monitor. Cancelling a handle never blocks, so doing it
 * while holding the monitor is fine.
 */
public class JobRegistry {

    private final Object lock = new Object();
    private final Map<JobKey, JobHandle> handles = new HashMap<>();

    /**
     * Stores the handle under its key, cancelling whatever handle held the key before.
     */
    public void register(JobHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        synchronized (lock) {
            JobHandle previous = handles.get(handle.key());
            if (previous != null && previous != handle) {
                previous.cancel();
            }
            handles.put(handle.key(), handle);
        }
    }

    /**
     * Cancels and removes the handle for {@code key}. Unknown keys are a no-op.
     *
     * @return true if a handle was removed
     */
    public boolean cancel(JobKey key) {
        Objects.requireNonNull(key, "key must not be null");
        JobHandle removed;
        synchronized (lock) {
            removed = handles.remove(key);
            if (removed != null) {
                removed.cancel();
            }
        }
        return removed != null;
    }

    public boolean contains(JobKey key) {
        Objects.requireNonNull(key, "key must not be null");
        synchronized (lock) {
            return handles.containsKey(key);
        }
    }

    /**
     * Removes the entry only while it is still {@code handle}; a replacement registered in the
     * meantime stays untouched.
     */
    public boolean remove(JobHandle handle) {
        Objects.requireNonNull(handle, "handle must not be null");
        synchronized (lock) {
            return handles.remove(handle.key(), handle);
        }
    }

    public JobHandle get(JobKey key) {
        synchronized (lock) {
            return handles.get(key);
        }
    }

    /**
     * Cancels and removes every handle.
     *
     * @return number of handles cancelled
     */
    public int cancelAll() {
        List<JobHandle> drained;
        synchronized (lock) {
            drained = new ArrayList<>(handles.values());
            handles.clear();
        }
        for (JobHandle h : drained) {
            h.cancel();
        }
        return drained.size();
    }

    public int size() {
        synchronized (lock) {
            return handles.size();
        }
    }
}
