package com.nayem.tether.core;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.nayem.tether.coordination.CoordinationService;
import com.nayem.tether.coordination.InMemoryCoordinationService;
import com.nayem.tether.lock.DistributedLock;
import com.nayem.tether.lock.ExpiringLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Everything actors and proxies of one process share: the coordination service, the
 * envelope codec, the distributed lock and the proxy settings.
 * <p>
 * Proxies attached by actor id are cached per id and closed when they are evicted or
 * when the runtime closes.
 * </p>
 */
public class ActorRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ActorRuntime.class);

    private final CoordinationService coordination;
    private final EnvelopeCodec codec;
    private final DistributedLock distributedLock;
    private final TetherMetrics metrics;
    private final ProxySettings proxySettings;
    private final String lockContext;
    private final Duration lockTtl;
    private final String threadNamePrefix;
    private final Cache<String, ActorProxy> attachedProxies;

    private ActorRuntime(Builder builder) {
        this.coordination = builder.coordination;
        this.codec = builder.codec;
        this.metrics = builder.metrics;
        this.distributedLock = builder.distributedLock != null
                ? builder.distributedLock
                : new ExpiringLock(builder.coordination, Clock.systemUTC(), false, builder.metrics);
        this.proxySettings = builder.proxySettings;
        this.lockContext = builder.lockContext;
        this.lockTtl = builder.lockTtl;
        this.threadNamePrefix = builder.threadNamePrefix;

        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder()
                .expireAfterAccess(builder.proxyEvictionTime)
                .executor(Runnable::run);
        if (builder.maxCachedProxies > 0) {
            cacheBuilder.maximumSize(builder.maxCachedProxies);
        }
        this.attachedProxies = cacheBuilder
                .removalListener((String actorId, ActorProxy proxy, RemovalCause cause) -> {
                    if (proxy != null) {
                        log.debug("Closing proxy for actor {} ({})", actorId, cause);
                        proxy.close();
                    }
                })
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a runtime on a fresh {@link InMemoryCoordinationService} with default settings
     */
    public static ActorRuntime inMemory() {
        return builder().coordination(new InMemoryCoordinationService()).build();
    }

    /**
     * Builds a new proxy cloned from a local actor.
     */
    public ActorProxy proxyOf(Actor actor) {
        return newProxyBuilder().actor(actor).build();
    }

    /**
     * Returns the cached proxy for an actor id, attaching a new one on first use.
     *
     * @throws NoSuchActorException if no actor with this id is listening
     */
    public ActorProxy attach(String actorId) {
        ActorProxy cached = attachedProxies.getIfPresent(actorId);
        if (cached != null && !cached.isClosed()) {
            return cached;
        }

        // discovery waits on the actor, so it runs outside the cache
        ActorProxy created = newProxyBuilder().actorId(actorId).build();
        ActorProxy winner = attachedProxies.asMap().compute(actorId,
                (id, current) -> current != null && !current.isClosed() ? current : created);
        if (winner != created) {
            created.close();
        }
        return winner;
    }

    private ActorProxy.Builder newProxyBuilder() {
        return ActorProxy.builder()
                .coordination(coordination)
                .codec(codec)
                .metrics(metrics)
                .settings(proxySettings);
    }

    public long getAttachedProxyCount() {
        attachedProxies.cleanUp();
        return attachedProxies.estimatedSize();
    }

    public CoordinationService getCoordination() {
        return coordination;
    }

    public EnvelopeCodec getCodec() {
        return codec;
    }

    public DistributedLock getDistributedLock() {
        return distributedLock;
    }

    public TetherMetrics getMetrics() {
        return metrics;
    }

    public ProxySettings getProxySettings() {
        return proxySettings;
    }

    /** Lock context used by {@code singular} methods that name none. */
    public String getLockContext() {
        return lockContext;
    }

    /** Lock TTL used by {@code singular} methods that name none. */
    public Duration getLockTtl() {
        return lockTtl;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    @Override
    public void close() {
        log.info("ActorRuntime shutting down, closing {} attached proxies", attachedProxies.estimatedSize());
        attachedProxies.invalidateAll();
        attachedProxies.cleanUp();
    }

    /**
     * Builder for creating an {@link ActorRuntime}.
     */
    public static class Builder {
        private CoordinationService coordination;
        private EnvelopeCodec codec = new EnvelopeCodec();
        private DistributedLock distributedLock;
        private TetherMetrics metrics = TetherMetrics.noOp();
        private ProxySettings proxySettings = ProxySettings.defaults();
        private String lockContext = "global.lock";
        private Duration lockTtl = Duration.ofSeconds(2);
        private String threadNamePrefix = "tether-actor-";
        private Duration proxyEvictionTime = Duration.ofMinutes(10);
        private long maxCachedProxies = 0;

        /**
         * Sets the coordination service. Required.
         */
        public Builder coordination(CoordinationService coordination) {
            this.coordination = coordination;
            return this;
        }

        public Builder codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Sets the lock guarding {@code singular} methods.
         * Default is an {@link ExpiringLock} on the coordination service.
         */
        public Builder distributedLock(DistributedLock distributedLock) {
            this.distributedLock = distributedLock;
            return this;
        }

        public Builder metrics(TetherMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder proxySettings(ProxySettings proxySettings) {
            this.proxySettings = proxySettings;
            return this;
        }

        /**
         * Sets the default lock context of {@code singular} methods. Default is "global.lock".
         */
        public Builder lockContext(String lockContext) {
            this.lockContext = lockContext;
            return this;
        }

        /**
         * Sets the default lock TTL of {@code singular} methods. Default is 2 seconds.
         */
        public Builder lockTtl(Duration lockTtl) {
            this.lockTtl = lockTtl;
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        /**
         * Sets how long an unused attached proxy stays cached before it is closed.
         */
        public Builder proxyEvictionTime(Duration proxyEvictionTime) {
            this.proxyEvictionTime = proxyEvictionTime;
            return this;
        }

        /**
         * Sets the maximum number of cached attached proxies. 0 means unbounded.
         */
        public Builder maxCachedProxies(long maxCachedProxies) {
            this.maxCachedProxies = maxCachedProxies;
            return this;
        }

        public ActorRuntime build() {
            if (coordination == null) {
                throw new IllegalStateException("A coordination service is required");
            }
            return new ActorRuntime(this);
        }
    }
}
