package com.github.dimitryivaniuta.quota.limits;

import com.github.dimitryivaniuta.quota.window.PeriodType;

import java.util.Objects;

/**
 * One {@link Limit} per period. Used both for effective limits and for remaining counts.
 */
public record LimitTriple(Limit hourly, Limit daily, Limit monthly) {

    public static final LimitTriple UNBOUNDED =
            new LimitTriple(Limit.unbounded(), Limit.unbounded(), Limit.unbounded());

    public LimitTriple {
        Objects.requireNonNull(hourly, "hourly must not be null");
        Objects.requireNonNull(daily, "daily must not be null");
        Objects.requireNonNull(monthly, "monthly must not be null");
    }

    /** Null components are unbounded. */
    public static LimitTriple of(Integer hourly, Integer daily, Integer monthly) {
        return new LimitTriple(Limit.ofNullable(hourly), Limit.ofNullable(daily), Limit.ofNullable(monthly));
    }

    public Limit get(PeriodType type) {
        return switch (type) {
            case HOURLY -> hourly;
            case DAILY -> daily;
            case MONTHLY -> monthly;
        };
    }

    public LimitTriple with(PeriodType type, Limit value) {
        return switch (type) {
            case HOURLY -> new LimitTriple(value, daily, monthly);
            case DAILY -> new LimitTriple(hourly, value, monthly);
            case MONTHLY -> new LimitTriple(hourly, daily, value);
        };
    }

    public LimitTriple mostPermissive(LimitTriple other) {
        return new LimitTriple(
                hourly.mostPermissive(other.hourly),
                daily.mostPermissive(other.daily),
                monthly.mostPermissive(other.monthly)
        );
    }
}
