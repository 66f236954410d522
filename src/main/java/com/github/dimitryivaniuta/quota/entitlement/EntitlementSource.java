package com.github.dimitryivaniuta.quota.entitlement;

import java.util.Optional;

/**
 * Supplies a user's entitlement tags and subscription start, typically from a billing provider.
 *
 * <p>Contract:
 * <ul>
 *   <li>{@code Optional.empty()} means the provider does not know the user (mapped to the "none" tier).</li>
 *   <li>Any exception means the provider is unavailable; it is never mapped to "none".</li>
 * </ul>
 */
@FunctionalInterface
public interface EntitlementSource {

    Optional<SubscriptionInfo> findSubscriptionInfo(String userId);
}
