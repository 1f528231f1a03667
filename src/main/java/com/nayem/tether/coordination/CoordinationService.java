package com.nayem.tether.coordination;

import java.time.Duration;

/**
 * Networked store that actors, proxies and locks coordinate through.
 * <p>
 * Supplies publish/subscribe channels keyed by name and a handful of atomic key
 * operations with expiry. Implementations must make every key operation atomic with
 * respect to concurrent callers across the cluster.
 * </p>
 */
public interface CoordinationService {

    /**
     * Publishes a payload on a channel.
     *
     * @param channel The channel name
     * @param payload The encoded message
     * @return the number of subscribers that received the message
     */
    long publish(String channel, String payload);

    /**
     * Opens a subscription to a channel. Messages published after this call returns
     * are buffered in the subscription until polled.
     *
     * @param channel The channel name
     * @return an open subscription
     */
    Subscription subscribe(String channel);

    /**
     * Sets the key only if it does not exist yet.
     *
     * @return true if the value was written
     */
    boolean setIfAbsent(String key, String value);

    /**
     * @return the current value, or null if the key is absent
     */
    String get(String key);

    /**
     * Atomically writes a new value and returns the previous one.
     *
     * @return the previous value, or null if the key was absent
     */
    String getAndSet(String key, String value);

    void delete(String key);

    /**
     * Sets a time-to-live on an existing key.
     */
    void expire(String key, Duration ttl);

    /**
     * Deletes the key only if its current value equals the given one.
     *
     * @return true if the key was deleted
     */
    boolean deleteIfEquals(String key, String value);
}
