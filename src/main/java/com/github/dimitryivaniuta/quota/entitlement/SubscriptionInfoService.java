package com.github.dimitryivaniuta.quota.entitlement;

import com.github.dimitryivaniuta.quota.metrics.QuotaMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionInfoService {

    static final String CACHE_NAME = "subscriptionInfo:ttl=60"; // hits and not-found both cached

    private final EntitlementSource source;
    private final CacheManager cacheManager;
    private final QuotaMetrics metrics;

    /**
     * Subscription info for {@code userId}; unknown users get {@link SubscriptionInfo#none()}.
     *
     * @throws IllegalArgumentException     if {@code userId} is null or blank
     * @throws UpstreamUnavailableException if the source fails (not cached)
     */
    public SubscriptionInfo get(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache != null) {
            SubscriptionInfo cached = cache.get(userId, SubscriptionInfo.class);
            if (cached != null) {
                return cached;
            }
        }

        SubscriptionInfo loaded;
        try {
            loaded = source.findSubscriptionInfo(userId).orElseGet(SubscriptionInfo::none);
        } catch (RuntimeException ex) {
            metrics.entitlementLookupFailed();
            log.warn("Entitlement lookup failed for user {}: {}", userId, ex.getMessage());
            throw new UpstreamUnavailableException("Entitlement source unavailable", ex);
        }

        if (cache != null) {
            cache.put(userId, loaded);
        }
        return loaded;
    }
}
