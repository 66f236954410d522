package com.github.dimitryivaniuta.quota.window;

import lombok.Getter;

/**
 * Caller asked for a period type that does not exist. Input error, not a storage or upstream failure.
 */
@Getter
public class InvalidPeriodTypeException extends RuntimeException {

    private final String requested;

    public InvalidPeriodTypeException(String requested) {
        super("Invalid period type: " + requested);
        this.requested = requested;
    }
}
