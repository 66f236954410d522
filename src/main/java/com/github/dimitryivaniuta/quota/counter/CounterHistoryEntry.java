package com.github.dimitryivaniuta.quota.counter;

import java.time.Instant;

public record CounterHistoryEntry(Instant periodStart, Instant periodEnd, int requestCount) {}
