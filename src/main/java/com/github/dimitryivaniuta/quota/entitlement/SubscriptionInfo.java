package com.github.dimitryivaniuta.quota.entitlement;

import com.github.dimitryivaniuta.quota.limits.RateLimitsConfig;

import java.time.Instant;
import java.util.Set;

/**
 * @param entitlementTags       tiers granted to the user; never empty
 * @param subscriptionStartedAt anchor for subscription months, null if unknown
 */
public record SubscriptionInfo(Set<String> entitlementTags, Instant subscriptionStartedAt) {

    private static final SubscriptionInfo NONE = new SubscriptionInfo(Set.of(RateLimitsConfig.NONE), null);

    public SubscriptionInfo {
        entitlementTags = (entitlementTags == null || entitlementTags.isEmpty())
                ? Set.of(RateLimitsConfig.NONE)
                : Set.copyOf(entitlementTags);
    }

    public static SubscriptionInfo none() {
        return NONE;
    }
}
