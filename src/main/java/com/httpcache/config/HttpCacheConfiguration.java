package com.httpcache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.httpcache.model.HttpCacheOptions;
import com.httpcache.repository.CacheManager;
import com.httpcache.repository.EntryCodec;
import com.httpcache.repository.InMemoryCacheManager;
import com.httpcache.repository.IndexedCacheManager;
import com.httpcache.repository.RedisCacheManager;
import com.httpcache.service.CacheModeParser;
import com.httpcache.service.HttpCacheFilter;
import com.httpcache.service.key.CacheKeyFunction;
import com.httpcache.service.policy.FreshnessPolicyEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;

/**
 * Wires the cache backend chosen by {@code httpcache.storage.type} and the
 * filter that uses it.
 */
@Slf4j
@Configuration
public class HttpCacheConfiguration {

    private final HttpCacheProperties properties;

    public HttpCacheConfiguration(HttpCacheProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock cacheClock() {
        return Clock.systemUTC();
    }

    @Bean
    public EntryCodec entryCodec(ObjectMapper objectMapper) {
        return new EntryCodec(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheManager cacheManager(EntryCodec entryCodec,
                                     Clock cacheClock,
                                     ObjectProvider<RedisTemplate<String, byte[]>> redisTemplate) {
        HttpCacheProperties.StorageConfig storage = properties.getStorage();
        log.info("Configuring {} cache storage", storage.getType());

        return switch (storage.getType()) {
            case MEMORY -> new InMemoryCacheManager(
                    storage.getMemory().getMaxSize(),
                    storage.getMemory().getExpireAfterWrite());
            case INDEXED -> new IndexedCacheManager(
                    storage.getIndexed().toOptions(), entryCodec, cacheClock);
            case REDIS -> new RedisCacheManager(
                    redisTemplate.getObject(), entryCodec, storage.getRedis().getNamespace());
        };
    }

    @Bean
    public FreshnessPolicyEngine freshnessPolicyEngine(Clock cacheClock) {
        return new FreshnessPolicyEngine(cacheClock, properties.isShared());
    }

    /**
     * Options for the filter. A {@link CacheKeyFunction} bean, if one is
     * defined, replaces the default key derivation.
     */
    @Bean
    public HttpCacheOptions httpCacheOptions(ObjectProvider<CacheKeyFunction> cacheKeyFunction) {
        return HttpCacheOptions.builder()
                .cacheKey(cacheKeyFunction.getIfAvailable())
                .shared(properties.isShared())
                .maxBodySize(properties.getStorage().getMaxBodySize().toBytes())
                .build();
    }

    @Bean
    public HttpCacheFilter httpCacheFilter(CacheManager cacheManager,
                                           HttpCacheOptions httpCacheOptions,
                                           FreshnessPolicyEngine freshnessPolicyEngine) {
        return new HttpCacheFilter(
                cacheManager,
                properties.getMode(),
                httpCacheOptions,
                freshnessPolicyEngine,
                properties.isControlHeaderEnabled() ? new CacheModeParser() : null,
                properties.getStorage().getTimeout());
    }
}
