package com.github.dimitryivaniuta.quota.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.quota.cache.TtlCaffeineCacheManager;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Local Caffeine caches; TTL per cache via the ":ttl=NN" name suffix.
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager() {
        return new TtlCaffeineCacheManager(() ->
                Caffeine.newBuilder()
                        .maximumSize(100_000)
                        .expireAfterAccess(Duration.ofMinutes(10))
                        .recordStats()
        );
    }
}
