package com.github.dimitryivaniuta.quota.limits;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Turns a user's entitlement tags into one effective {@link LimitTriple}.
 *
 * <p>Merge is per period and most-permissive-wins, which is commutative and idempotent,
 * so the result never depends on tag order or duplicates. Unknown tags are ignored;
 * if nothing matches, the {@code none} tier applies.
 */
@Component
public class QuotaResolver {

    public LimitTriple resolve(Collection<String> tags, RateLimitsConfig config) {
        if (tags == null || tags.isEmpty()) {
            return config.fallback();
        }
        LimitTriple merged = null;
        for (String tag : new HashSet<>(tags)) {
            LimitTriple limits = config.find(tag).orElse(null);
            if (limits == null) {
                continue;
            }
            merged = (merged == null) ? limits : merged.mostPermissive(limits);
        }
        return merged != null ? merged : config.fallback();
    }

    /**
     * Tier reported to the user: the last-declared configured tier among {@code tags}
     * (other than {@code none}), or {@code none}.
     */
    public String primaryEntitlement(Collection<String> tags, RateLimitsConfig config) {
        if (tags == null || tags.isEmpty()) {
            return RateLimitsConfig.NONE;
        }
        Set<String> held = new HashSet<>(tags);
        String primary = RateLimitsConfig.NONE;
        for (String tier : config.tiers().keySet()) {
            if (!RateLimitsConfig.NONE.equals(tier) && held.contains(tier)) {
                primary = tier;
            }
        }
        return primary;
    }
}
