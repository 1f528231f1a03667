package com.nayem.tether.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.tether.coordination.CoordinationService;
import com.nayem.tether.coordination.InMemoryCoordinationService;
import com.nayem.tether.coordination.RedisCoordinationService;
import com.nayem.tether.core.ActorRuntime;
import com.nayem.tether.core.EnvelopeCodec;
import com.nayem.tether.core.ProxySettings;
import com.nayem.tether.core.TetherMetrics;
import com.nayem.tether.lock.DistributedLock;
import com.nayem.tether.lock.ExpiringLock;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.time.Clock;

@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableAspectJAutoProxy
@EnableConfigurationProperties(TetherProperties.class)
public class TetherAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TetherAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CoordinationService coordinationService(
            TetherProperties properties,
            ObjectProvider<StringRedisTemplate> redisTemplateProvider,
            ObjectProvider<RedisConnectionFactory> connectionFactoryProvider) {

        String store = properties.getCoordination().getStore();
        return switch (store.toLowerCase()) {
            case "memory" -> new InMemoryCoordinationService();
            case "redis" -> {
                StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
                RedisConnectionFactory connectionFactory = connectionFactoryProvider.getIfAvailable();
                if (redis == null || connectionFactory == null) {
                    throw new IllegalStateException(
                            "StringRedisTemplate and RedisConnectionFactory are required for the Redis coordination store");
                }
                RedisMessageListenerContainer container = new RedisMessageListenerContainer();
                container.setConnectionFactory(connectionFactory);
                container.afterPropertiesSet();
                container.start();
                yield new RedisCoordinationService(redis, container);
            }
            default -> {
                log.warn("Unknown coordination store '{}', falling back to memory", store);
                yield new InMemoryCoordinationService();
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec(ObjectProvider<ObjectMapper> objectMapperProvider,
            TetherProperties properties) {
        ObjectMapper mapper = objectMapperProvider.getIfAvailable();
        if (mapper == null) {
            mapper = new ObjectMapper();
        }
        return new EnvelopeCodec(mapper, properties.getCodec().getTrustedPackages());
    }

    @Bean
    @ConditionalOnMissingBean
    public TetherMetrics tetherMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        return new TetherMetrics(registryProvider.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public DistributedLock distributedLock(CoordinationService coordinationService,
            TetherProperties properties,
            TetherMetrics metrics) {
        return new ExpiringLock(coordinationService, Clock.systemUTC(),
                properties.getLock().isVerifyOwner(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActorRuntime actorRuntime(CoordinationService coordinationService,
            EnvelopeCodec codec,
            DistributedLock distributedLock,
            TetherMetrics metrics,
            TetherProperties properties) {

        TetherProperties.Proxy proxy = properties.getProxy();
        return ActorRuntime.builder()
                .coordination(coordinationService)
                .codec(codec)
                .distributedLock(distributedLock)
                .metrics(metrics)
                .proxySettings(new ProxySettings(proxy.getPollTimeout(), proxy.getPollInterval(),
                        proxy.getCallTimeout()))
                .proxyEvictionTime(proxy.getEvictionTime())
                .maxCachedProxies(proxy.getMaxCached())
                .lockContext(properties.getLock().getContext())
                .lockTtl(properties.getLock().getTtl())
                .threadNamePrefix(properties.getActor().getThreadNamePrefix())
                .build();
    }

    @Bean
    public SingularAspect singularAspect(DistributedLock distributedLock, TetherProperties properties) {
        return new SingularAspect(distributedLock, properties);
    }
}
