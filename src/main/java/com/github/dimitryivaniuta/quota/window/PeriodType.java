package com.github.dimitryivaniuta.quota.window;

import java.util.Locale;

/**
 * Counting periods, in the order they are checked and locked.
 */
public enum PeriodType {
    HOURLY("hour"),
    DAILY("day"),
    MONTHLY("month");

    private final String apiName;

    PeriodType(String apiName) {
        this.apiName = apiName;
    }

    /** Short name used by reporting callers ("hour", "day", "month"). */
    public String apiName() {
        return apiName;
    }

    /**
     * Accepts the short names as well as the enum names, case-insensitive.
     *
     * @throws InvalidPeriodTypeException for anything else (including null)
     */
    public static PeriodType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidPeriodTypeException(name);
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (PeriodType t : values()) {
            if (t.apiName.equals(n) || t.name().toLowerCase(Locale.ROOT).equals(n)) {
                return t;
            }
        }
        throw new InvalidPeriodTypeException(name);
    }
}
