package com.github.dimitryivaniuta.quota.window;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Window boundaries for each {@link PeriodType}. All arithmetic is done in UTC.
 *
 * <p>Monthly windows are phase-aligned with the subscription anchor rather than the calendar:
 * <ul>
 *   <li>boundary day-of-month = anchor day-of-month, at 00:00 UTC</li>
 *   <li>months shorter than the anchor day clamp to their last day (anchor 31 -> Feb 28/29)</li>
 *   <li>no anchor -> calendar month</li>
 * </ul>
 */
public final class TimeWindowCalculator {
    private TimeWindowCalculator() {}

    public static PeriodWindow windowFor(PeriodType type, Instant subscriptionAnchor, Instant now) {
        Objects.requireNonNull(type, "type must not be null");
        return switch (type) {
            case HOURLY -> hourWindow(now);
            case DAILY -> dayWindow(now);
            case MONTHLY -> subscriptionMonthWindow(subscriptionAnchor, now);
        };
    }

    public static PeriodWindow hourWindow(Instant now) {
        Instant start = now.truncatedTo(ChronoUnit.HOURS);
        return new PeriodWindow(start, start.plus(1, ChronoUnit.HOURS));
    }

    public static PeriodWindow dayWindow(Instant now) {
        Instant start = now.truncatedTo(ChronoUnit.DAYS);
        return new PeriodWindow(start, start.plus(1, ChronoUnit.DAYS));
    }

    public static PeriodWindow subscriptionMonthWindow(Instant subscriptionAnchor, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        int anchorDay = (subscriptionAnchor == null)
                ? 1
                : subscriptionAnchor.atOffset(ZoneOffset.UTC).getDayOfMonth();

        YearMonth month = YearMonth.from(now.atOffset(ZoneOffset.UTC));
        Instant start = boundary(month, anchorDay);
        if (start.isAfter(now)) {
            month = month.minusMonths(1);
            start = boundary(month, anchorDay);
        }
        Instant end = boundary(month.plusMonths(1), anchorDay);
        return new PeriodWindow(start, end);
    }

    private static Instant boundary(YearMonth month, int anchorDay) {
        int day = Math.min(anchorDay, month.lengthOfMonth());
        LocalDate date = month.atDay(day);
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
