package com.github.dimitryivaniuta.quota.config;

import com.github.dimitryivaniuta.quota.entitlement.EntitlementSource;
import com.github.dimitryivaniuta.quota.limits.LimitTriple;
import com.github.dimitryivaniuta.quota.limits.RateLimitsConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Configuration
@EnableConfigurationProperties(QuotaProperties.class)
public class QuotaConfig {

    /**
     * Fails the context start when the "none" tier is missing.
     */
    @Bean
    public RateLimitsConfig rateLimitsConfig(QuotaProperties props) {
        Map<String, LimitTriple> tiers = new LinkedHashMap<>();
        props.getTiers().forEach((tag, t) ->
                tiers.put(tag, LimitTriple.of(t.getHourly(), t.getDaily(), t.getMonthly())));
        RateLimitsConfig config = new RateLimitsConfig(tiers);
        log.info("Loaded quota tiers: {}", config);
        return config;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Used only when the application does not provide its own source: every user is unknown
     * and therefore on the "none" tier.
     */
    @Bean
    @ConditionalOnMissingBean(EntitlementSource.class)
    public EntitlementSource noSubscriptionEntitlementSource() {
        log.warn("No EntitlementSource configured; all users resolve to the '{}' tier", RateLimitsConfig.NONE);
        return userId -> Optional.empty();
    }
}
