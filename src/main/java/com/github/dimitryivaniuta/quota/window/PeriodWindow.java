package com.github.dimitryivaniuta.quota.window;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)}.
 */
public record PeriodWindow(Instant start, Instant end) {

    public PeriodWindow {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("window end must be after start: " + start + " / " + end);
        }
    }

    public boolean contains(Instant t) {
        return !t.isBefore(start) && t.isBefore(end);
    }
}
