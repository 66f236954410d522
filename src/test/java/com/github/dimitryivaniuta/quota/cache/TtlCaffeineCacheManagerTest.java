package com.github.dimitryivaniuta.quota.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TtlCaffeineCacheManagerTest {

    @Test
    void differentTtlNames_shouldBeIndependentCaches() {
        CacheManager cm = new TtlCaffeineCacheManager(() ->
                Caffeine.newBuilder()
                        .maximumSize(10_000)
                        .expireAfterAccess(Duration.ofMinutes(5))
        );

        Cache c60 = cm.getCache("subscriptionInfo:ttl=60");
        Cache c30 = cm.getCache("subscriptionInfo:ttl=30");

        assertThat(c60).isNotNull();
        assertThat(c30).isNotNull();
        assertThat(c60.getName()).isEqualTo("subscriptionInfo:ttl=60");

        c60.put("u1", "pro");
        assertThat(c60.get("u1", String.class)).isEqualTo("pro");
        assertThat(c30.get("u1")).isNull();
    }

    @Test
    void sameName_shouldReturnSameInstance() {
        CacheManager cm = new TtlCaffeineCacheManager(() -> Caffeine.newBuilder().maximumSize(10_000));

        assertThat(cm.getCache("subscriptionInfo:ttl=10")).isSameAs(cm.getCache("subscriptionInfo:ttl=10"));
    }

    @Test
    void ttlSuffix_shouldBeParsedAndClamped() {
        assertThat(TtlCaffeineCacheManager.ttlSeconds("subscriptionInfo:ttl=60")).isEqualTo(60L);
        assertThat(TtlCaffeineCacheManager.ttlSeconds("subscriptionInfo:ttl=0")).isEqualTo(1L);
        assertThat(TtlCaffeineCacheManager.ttlSeconds("subscriptionInfo:ttl=999999")).isEqualTo(86_400L);
        assertThat(TtlCaffeineCacheManager.ttlSeconds("subscriptionInfo")).isNull();
        assertThat(TtlCaffeineCacheManager.ttlSeconds(null)).isNull();
    }
}
