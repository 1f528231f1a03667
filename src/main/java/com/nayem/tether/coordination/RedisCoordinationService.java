package com.nayem.tether.coordination;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Redis-backed implementation of {@link CoordinationService}.
 * <p>
 * Key operations map one-to-one onto SETNX, GET, GETSET, DEL and EXPIRE. Channel
 * subscriptions are registered on a shared {@link RedisMessageListenerContainer}, which
 * hands every received message to the subscription's queue.
 * </p>
 */
public class RedisCoordinationService implements CoordinationService, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisCoordinationService.class);

    private static final RedisScript<Long> DELETE_IF_EQUALS = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;

    public RedisCoordinationService(StringRedisTemplate redisTemplate,
            RedisMessageListenerContainer listenerContainer) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
    }

    @Override
    public long publish(String channel, String payload) {
        Long receivers = redisTemplate.convertAndSend(channel, payload);
        return receivers == null ? 0 : receivers;
    }

    @Override
    public Subscription subscribe(String channel) {
        ChannelTopic topic = new ChannelTopic(channel);
        ListenerHolder holder = new ListenerHolder();
        QueueSubscription subscription = new QueueSubscription(channel,
                closed -> listenerContainer.removeMessageListener(holder.listener, topic));
        holder.listener = (message, pattern) -> {
            if (!subscription.offer(new String(message.getBody(), StandardCharsets.UTF_8))) {
                log.debug("Dropped message for closed subscription on {}", channel);
            }
        };
        listenerContainer.addMessageListener(holder.listener, topic);
        log.debug("Subscribed to Redis channel {}", channel);
        return subscription;
    }

    @Override
    public boolean setIfAbsent(String key, String value) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value));
    }

    @Override
    public String get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public String getAndSet(String key, String value) {
        return redisTemplate.opsForValue().getAndSet(key, value);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    @Override
    public void expire(String key, Duration ttl) {
        redisTemplate.expire(key, ttl);
    }

    @Override
    public boolean deleteIfEquals(String key, String value) {
        Long deleted = redisTemplate.execute(DELETE_IF_EQUALS, List.of(key), value);
        return deleted != null && deleted > 0;
    }

    @Override
    public void close() {
        log.info("Stopping Redis listener container");
        listenerContainer.stop();
    }

    private static final class ListenerHolder {
        private MessageListener listener;
    }
}
