package com.github.dimitryivaniuta.quota.counter;

import com.github.dimitryivaniuta.quota.limits.LimitTriple;
import com.github.dimitryivaniuta.quota.window.PeriodType;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Result of a quota check.
 *
 * @param allowed   false iff some finite period was already at its limit
 * @param remaining per-period remaining count, unbounded where no cap applies
 * @param exhausted periods that caused the denial (empty when allowed)
 * @param retryAt   when every exhausted window has rolled over; null when allowed
 */
public record CheckOutcome(boolean allowed, LimitTriple remaining, Set<PeriodType> exhausted, Instant retryAt) {

    public CheckOutcome {
        exhausted = exhausted.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(exhausted));
    }
}
