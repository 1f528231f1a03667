package com.nayem.tether.coordination;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link CoordinationService}.
 * <p>
 * Suitable for development, testing, and single-instance deployments.
 * Note: Keys and subscriptions are lost on application restart, and only actors
 * and proxies inside this JVM can see each other.
 * </p>
 */
public class InMemoryCoordinationService implements CoordinationService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCoordinationService.class);

    private final Map<String, List<QueueSubscription>> channels = new ConcurrentHashMap<>();
    private final Map<String, Entry> keys = new HashMap<>();
    private final Clock clock;

    public InMemoryCoordinationService() {
        this(Clock.systemUTC());
    }

    public InMemoryCoordinationService(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long publish(String channel, String payload) {
        List<QueueSubscription> subscribers = channels.get(channel);
        if (subscribers == null) {
            return 0;
        }
        long delivered = 0;
        for (QueueSubscription subscription : subscribers) {
            if (subscription.offer(payload)) {
                delivered++;
            }
        }
        return delivered;
    }

    @Override
    public Subscription subscribe(String channel) {
        QueueSubscription subscription = new QueueSubscription(channel, this::unsubscribe);
        channels.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(subscription);
        log.debug("Subscribed to channel {}", channel);
        return subscription;
    }

    private void unsubscribe(QueueSubscription subscription) {
        channels.computeIfPresent(subscription.channel(), (channel, subscribers) -> {
            subscribers.remove(subscription);
            return subscribers.isEmpty() ? null : subscribers;
        });
        log.debug("Unsubscribed from channel {}", subscription.channel());
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value) {
        if (live(key) != null) {
            return false;
        }
        keys.put(key, new Entry(value, null));
        return true;
    }

    @Override
    public synchronized String get(String key) {
        Entry entry = live(key);
        return entry == null ? null : entry.value();
    }

    @Override
    public synchronized String getAndSet(String key, String value) {
        Entry previous = live(key);
        // GETSET discards any TTL on the key
        keys.put(key, new Entry(value, null));
        return previous == null ? null : previous.value();
    }

    @Override
    public synchronized void delete(String key) {
        keys.remove(key);
    }

    @Override
    public synchronized void expire(String key, Duration ttl) {
        Entry entry = live(key);
        if (entry != null) {
            keys.put(key, new Entry(entry.value(), clock.instant().plus(ttl)));
        }
    }

    @Override
    public synchronized boolean deleteIfEquals(String key, String value) {
        Entry entry = live(key);
        if (entry != null && entry.value().equals(value)) {
            keys.remove(key);
            return true;
        }
        return false;
    }

    /**
     * @return the number of open subscriptions on a channel
     */
    public int subscriberCount(String channel) {
        List<QueueSubscription> subscribers = channels.get(channel);
        return subscribers == null ? 0 : subscribers.size();
    }

    private Entry live(String key) {
        Entry entry = keys.get(key);
        if (entry != null && entry.expiresAt() != null && !clock.instant().isBefore(entry.expiresAt())) {
            keys.remove(key);
            return null;
        }
        return entry;
    }

    private record Entry(String value, Instant expiresAt) {
    }
}
