package com.github.dimitryivaniuta.quota.metrics;

import com.github.dimitryivaniuta.quota.window.PeriodType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Low-cardinality quota meters. User ids are never used as tags.
 */
@Component
public class QuotaMetrics {

    private final MeterRegistry registry;

    public QuotaMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void checkAllowed(String entitlement) {
        Counter.builder("quota_check_allowed_total")
                .tag("entitlement", entitlement)
                .register(registry)
                .increment();
    }

    public void checkDenied(String entitlement, Collection<PeriodType> exhausted) {
        for (PeriodType p : exhausted) {
            Counter.builder("quota_check_denied_total")
                    .tag("entitlement", entitlement)
                    .tag("period", p.apiName())
                    .register(registry)
                    .increment();
        }
    }

    public void entitlementLookupFailed() {
        Counter.builder("quota_entitlement_lookup_failures_total")
                .register(registry)
                .increment();
    }

    public void recordCheckDuration(long nanos) {
        Timer.builder("quota_check_duration_seconds")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
