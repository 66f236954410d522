package com.github.dimitryivaniuta.quota.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.AbstractCacheManager;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caffeine CacheManager that reads the expire-after-write TTL from the cache name:
 *
 *   "subscriptionInfo:ttl=60"  -> 60 seconds
 *   "subscriptionInfo"         -> base builder settings only
 *
 * Caffeine builders are mutable, so every cache gets a fresh builder from the supplier.
 */
public final class TtlCaffeineCacheManager extends AbstractCacheManager {

    private static final Pattern TTL_SUFFIX = Pattern.compile(":ttl=(\\d{1,9})$");
    private static final long MAX_TTL_SECONDS = 24 * 60 * 60;

    private final Supplier<Caffeine<Object, Object>> builderFactory;

    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> builderFactory) {
        this.builderFactory = Objects.requireNonNull(builderFactory, "builderFactory must not be null");
    }

    @Override
    protected Collection<? extends Cache> loadCaches() {
        return List.of();
    }

    // AbstractCacheManager registers the returned cache, so each name is built once.
    @Override
    protected Cache getMissingCache(String name) {
        Caffeine<Object, Object> builder = builderFactory.get();
        Long ttl = ttlSeconds(name);
        if (ttl != null) {
            builder = builder.expireAfterWrite(Duration.ofSeconds(ttl));
        }
        return new CaffeineCache(name, builder.build());
    }

    static Long ttlSeconds(String name) {
        if (name == null) {
            return null;
        }
        Matcher m = TTL_SUFFIX.matcher(name.trim());
        if (!m.find()) {
            return null;
        }
        long ttl = Long.parseLong(m.group(1));
        return Math.max(1, Math.min(ttl, MAX_TTL_SECONDS));
    }
}
