package com.github.dimitryivaniuta.quota;

import com.github.dimitryivaniuta.quota.config.QuotaProperties;
import com.github.dimitryivaniuta.quota.counter.CheckOutcome;
import com.github.dimitryivaniuta.quota.counter.CounterStore;
import com.github.dimitryivaniuta.quota.entitlement.SubscriptionInfo;
import com.github.dimitryivaniuta.quota.entitlement.SubscriptionInfoService;
import com.github.dimitryivaniuta.quota.limits.Limit;
import com.github.dimitryivaniuta.quota.limits.LimitTriple;
import com.github.dimitryivaniuta.quota.limits.QuotaResolver;
import com.github.dimitryivaniuta.quota.limits.RateLimitsConfig;
import com.github.dimitryivaniuta.quota.metrics.QuotaMetrics;
import com.github.dimitryivaniuta.quota.window.PeriodType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Entry point for callers: entitlement source -> resolver -> counter store.
 *
 * <p>Upstream and storage failures propagate unchanged; whether to fail open or closed is
 * the caller's decision.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaService {

    private final SubscriptionInfoService subscriptionInfoService;
    private final QuotaResolver resolver;
    private final RateLimitsConfig rateLimitsConfig;
    private final CounterStore counterStore;
    private final QuotaProperties props;
    private final QuotaMetrics metrics;
    private final Clock clock;

    public CheckOutcome checkAndIncrement(String userId) {
        SubscriptionInfo info = subscriptionInfoService.get(userId);
        LimitTriple limits = resolver.resolve(info.entitlementTags(), rateLimitsConfig);
        String entitlement = resolver.primaryEntitlement(info.entitlementTags(), rateLimitsConfig);

        long start = System.nanoTime();
        try {
            CheckOutcome outcome = counterStore.checkAndIncrement(userId, limits, info.subscriptionStartedAt(), clock.instant());
            if (outcome.allowed()) {
                metrics.checkAllowed(entitlement);
            } else {
                metrics.checkDenied(entitlement, outcome.exhausted());
            }
            return outcome;
        } finally {
            metrics.recordCheckDuration(System.nanoTime() - start);
        }
    }

    /**
     * @throws QuotaExceededException when any finite period is exhausted
     */
    public CheckOutcome enforce(String userId) {
        CheckOutcome outcome = checkAndIncrement(userId);
        if (!outcome.allowed()) {
            throw new QuotaExceededException("Rate limit exceeded", retryAfterSeconds(outcome.retryAt()), outcome.exhausted());
        }
        return outcome;
    }

    public QuotaStatus status(String userId) {
        SubscriptionInfo info = subscriptionInfoService.get(userId);
        LimitTriple limits = resolver.resolve(info.entitlementTags(), rateLimitsConfig);
        String entitlement = resolver.primaryEntitlement(info.entitlementTags(), rateLimitsConfig);

        CheckOutcome current = counterStore.checkOnly(userId, limits, info.subscriptionStartedAt(), clock.instant());
        LimitTriple remaining = current.remaining();

        QuotaStatus.Usage usage = new QuotaStatus.Usage(
                used(limits.hourly(), remaining.hourly()),
                used(limits.daily(), remaining.daily()),
                used(limits.monthly(), remaining.monthly())
        );
        return new QuotaStatus(tiers(), entitlement, displayName(entitlement), limits, usage, remaining);
    }

    private List<QuotaStatus.Tier> tiers() {
        return rateLimitsConfig.tiers().entrySet().stream()
                .map(e -> new QuotaStatus.Tier(e.getKey(), displayName(e.getKey()), e.getValue()))
                .toList();
    }

    /**
     * @param periodTypeName "hour", "day" or "month" (enum names accepted too)
     * @param limit          max entries; null for the configured default
     */
    public QuotaHistory history(String userId, String periodTypeName, Integer limit) {
        PeriodType type = PeriodType.fromName(periodTypeName);
        int cap = (limit == null)
                ? props.getHistoryDefaultLimit()
                : Math.max(1, Math.min(limit, props.getHistoryMaxLimit()));

        SubscriptionInfo info = subscriptionInfoService.get(userId);
        Limit periodLimit = resolver.resolve(info.entitlementTags(), rateLimitsConfig).get(type);

        List<QuotaHistory.Entry> entries = counterStore
                .getHistory(userId, type, info.subscriptionStartedAt(), cap)
                .stream()
                .map(e -> new QuotaHistory.Entry(e.periodStart(), e.periodEnd(), e.requestCount(), periodLimit.valueOrNull()))
                .toList();
        return new QuotaHistory(type, entries, entries.size());
    }

    String displayName(String entitlement) {
        QuotaProperties.Tier tier = props.getTiers().get(entitlement);
        if (tier != null && tier.getDisplayName() != null && !tier.getDisplayName().isBlank()) {
            return tier.getDisplayName();
        }
        if (entitlement.isEmpty()) {
            return entitlement;
        }
        return entitlement.substring(0, 1).toUpperCase(Locale.ROOT) + entitlement.substring(1);
    }

    private long retryAfterSeconds(Instant retryAt) {
        if (retryAt == null) {
            return 1L;
        }
        long s = Duration.between(clock.instant(), retryAt).toSeconds();
        return Math.max(1L, s);
    }

    private static int used(Limit limit, Limit remaining) {
        if (limit.isUnbounded()) {
            return 0;
        }
        return limit.valueOrNull() - remaining.valueOrNull();
    }
}
