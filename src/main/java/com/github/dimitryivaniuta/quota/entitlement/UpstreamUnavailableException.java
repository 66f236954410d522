package com.github.dimitryivaniuta.quota.entitlement;

/**
 * The entitlement provider failed. Callers decide whether to fail open or closed.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
