package com.github.dimitryivaniuta.quota.limits;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entitlement tag -> limits. Tiers are plain data; declaration order is kept
 * (lowest tier first by convention) and used to pick the tier shown to users.
 */
public final class RateLimitsConfig {

    public static final String NONE = "none";

    private final Map<String, LimitTriple> tiers;

    public RateLimitsConfig(Map<String, LimitTriple> tiers) {
        if (tiers == null || !tiers.containsKey(NONE)) {
            throw new QuotaConfigurationException("Rate limits must configure the '" + NONE + "' tier");
        }
        if (tiers.values().stream().anyMatch(v -> v == null)) {
            throw new QuotaConfigurationException("Rate limits must not contain null tiers");
        }
        this.tiers = Collections.unmodifiableMap(new LinkedHashMap<>(tiers));
    }

    public Optional<LimitTriple> find(String tag) {
        return tag == null ? Optional.empty() : Optional.ofNullable(tiers.get(tag));
    }

    public LimitTriple fallback() {
        return tiers.get(NONE);
    }

    /** Declaration order. */
    public Map<String, LimitTriple> tiers() {
        return tiers;
    }

    @Override
    public String toString() {
        return "RateLimitsConfig" + tiers;
    }
}
