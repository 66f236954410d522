package com.github.dimitryivaniuta.quota;

import com.github.dimitryivaniuta.quota.limits.LimitTriple;

import java.util.List;

/**
 * Current standing of one user, plus the catalogue of configured tiers.
 *
 * @param tiers every configured tier, in declaration order
 * @param usage per finite period {@code limit - remaining}; 0 for unbounded periods
 */
public record QuotaStatus(
        List<Tier> tiers,
        String entitlement,
        String displayName,
        LimitTriple limits,
        Usage usage,
        LimitTriple remaining
) {
    public QuotaStatus {
        tiers = List.copyOf(tiers);
    }

    public record Tier(String entitlement, String displayName, LimitTriple limits) {}

    public record Usage(int hourly, int daily, int monthly) {}
}
