package com.nayem.tether.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Cluster-wide, time-bounded mutual exclusion keyed by name.
 */
public interface DistributedLock {

    /**
     * Attempts to acquire a lock without waiting.
     *
     * @param lockName The unique key for the lock
     * @param ttl      How long the lock is held at most
     * @return a handle if the lock was acquired, empty if another holder has it
     */
    Optional<LockHandle> tryAcquire(String lockName, Duration ttl);

    /**
     * Releases a lock obtained from {@link #tryAcquire}.
     *
     * @param handle The handle returned on acquisition
     */
    void release(LockHandle handle);
}
