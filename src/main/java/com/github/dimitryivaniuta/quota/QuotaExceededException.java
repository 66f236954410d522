package com.github.dimitryivaniuta.quota;

import com.github.dimitryivaniuta.quota.window.PeriodType;
import lombok.Getter;

import java.util.Set;

@Getter
public class QuotaExceededException extends RuntimeException {

    private final long retryAfterSeconds;
    private final Set<PeriodType> exhausted;

    public QuotaExceededException(String message, long retryAfterSeconds, Set<PeriodType> exhausted) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
        this.exhausted = Set.copyOf(exhausted);
    }
}
