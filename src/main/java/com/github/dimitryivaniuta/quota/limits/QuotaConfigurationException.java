package com.github.dimitryivaniuta.quota.limits;

/**
 * Tier configuration is unusable. Raised while the context starts, never per request.
 */
public class QuotaConfigurationException extends RuntimeException {

    public QuotaConfigurationException(String message) {
        super(message);
    }
}
