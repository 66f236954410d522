package com.github.dimitryivaniuta.quota;

import com.github.dimitryivaniuta.quota.window.PeriodType;

import java.time.Instant;
import java.util.List;

public record QuotaHistory(PeriodType periodType, List<Entry> entries, int totalEntries) {

    /**
     * @param limit the user's current cap for the period, null when unbounded
     */
    public record Entry(Instant periodStart, Instant periodEnd, int requestCount, Integer limit) {}
}
