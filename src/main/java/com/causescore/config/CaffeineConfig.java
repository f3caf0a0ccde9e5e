package com.causescore.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches used through @Cacheable. Identity caches with split positive/negative
 * TTLs are built directly in IngestionAdapterConfig.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String FARCASTER_CASTS_CACHE = "farcasterCastsCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(FARCASTER_CASTS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(1, TimeUnit.HOURS)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}
