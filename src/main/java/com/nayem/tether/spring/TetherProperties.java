package com.nayem.tether.spring;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for tether actor proxies and singular calls.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code tether} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "tether")
@Validated
public class TetherProperties {

    /**
     * Configuration of the coordination service backend.
     */
    @Valid
    private Coordination coordination = new Coordination();

    /**
     * Configuration of the envelope wire codec.
     */
    @Valid
    private Codec codec = new Codec();

    /**
     * Configuration of actor proxies.
     */
    @Valid
    private Proxy proxy = new Proxy();

    /**
     * Configuration of the distributed lock behind singular calls.
     */
    @Valid
    private Lock lock = new Lock();

    /**
     * Configuration of actors hosted in this process.
     */
    @Valid
    private Actor actor = new Actor();

    public Coordination getCoordination() {
        return coordination;
    }

    public void setCoordination(Coordination coordination) {
        this.coordination = coordination;
    }

    public Codec getCodec() {
        return codec;
    }

    public void setCodec(Codec codec) {
        this.codec = codec;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public Lock getLock() {
        return lock;
    }

    public void setLock(Lock lock) {
        this.lock = lock;
    }

    public Actor getActor() {
        return actor;
    }

    public void setActor(Actor actor) {
        this.actor = actor;
    }

    /**
     * Coordination service backend.
     */
    public static class Coordination {
        /**
         * Backend: 'memory' (single process) or 'redis' (cluster).
         * Redis requires {@code spring-boot-starter-data-redis} to be configured.
         */
        private String store = "memory"; // memory, redis

        /** @return the backend name */
        public String getStore() {
            return store;
        }

        /** @param store the backend name */
        public void setStore(String store) {
            this.store = store;
        }
    }

    /**
     * Envelope wire codec.
     */
    public static class Codec {
        /**
         * Package prefixes of application types that may travel as call arguments and results,
         * e.g. {@code com.example.orders.}. JDK value types are always allowed.
         */
        @NotNull
        private List<String> trustedPackages = new ArrayList<>();

        public List<String> getTrustedPackages() {
            return trustedPackages;
        }

        public void setTrustedPackages(List<String> trustedPackages) {
            this.trustedPackages = trustedPackages;
        }
    }

    /**
     * Actor proxy timing and caching.
     */
    public static class Proxy {
        /**
         * How long one poll of a reply subscription blocks.
         */
        @NotNull
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration pollTimeout = Duration.ofMillis(100);

        /**
         * Fixed pause of the reply listener after every poll.
         */
        @NotNull
        @DurationUnit(ChronoUnit.MILLIS)
        private Duration pollInterval = Duration.ofMillis(10);

        /**
         * Default timeout of a proxied call. Unset means calls wait for their reply forever.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration callTimeout;

        /**
         * How long an unused proxy attached by actor id stays cached.
         */
        @NotNull
        @DurationUnit(ChronoUnit.MINUTES)
        private Duration evictionTime = Duration.ofMinutes(10);

        /**
         * Maximum number of cached attached proxies. Set to 0 for unbounded.
         */
        @Min(0)
        private long maxCached = 0;

        public Duration getPollTimeout() {
            return pollTimeout;
        }

        public void setPollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public Duration getEvictionTime() {
            return evictionTime;
        }

        public void setEvictionTime(Duration evictionTime) {
            this.evictionTime = evictionTime;
        }

        public long getMaxCached() {
            return maxCached;
        }

        public void setMaxCached(long maxCached) {
            this.maxCached = maxCached;
        }
    }

    /**
     * Distributed lock used by singular calls.
     */
    public static class Lock {
        /**
         * Lock namespace for singular calls that name none.
         */
        @NotBlank
        private String context = "global.lock";

        /**
         * Lock window for singular calls that name none.
         */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration ttl = Duration.ofSeconds(2);

        /**
         * Whether release only deletes a lock still holding this holder's expiry value.
         * Off by default: release deletes the key unconditionally.
         */
        private boolean verifyOwner = false;

        /** @return the default lock context */
        public String getContext() {
            return context;
        }

        /** @param context the default lock context */
        public void setContext(String context) {
            this.context = context;
        }

        /** @return the default lock TTL */
        public Duration getTtl() {
            return ttl;
        }

        /** @param ttl the default lock TTL */
        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        /** @return whether release verifies ownership */
        public boolean isVerifyOwner() {
            return verifyOwner;
        }

        /** @param verifyOwner whether release verifies ownership */
        public void setVerifyOwner(boolean verifyOwner) {
            this.verifyOwner = verifyOwner;
        }
    }

    /**
     * Actors hosted in this process.
     */
    public static class Actor {
        /**
         * Prefix for actor executor thread names.
         */
        private String threadNamePrefix = "tether-actor-";

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
