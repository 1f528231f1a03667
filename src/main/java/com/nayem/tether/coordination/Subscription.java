package com.nayem.tether.coordination;

import java.time.Duration;

/**
 * An open subscription to one channel. Messages are drained by polling.
 */
public interface Subscription extends AutoCloseable {

    String channel();

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return the next payload, or null if none arrived in time
     * @throws InterruptedException if the polling thread is interrupted
     */
    String poll(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
