package com.github.dimitryivaniuta.quota.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <pre>
 * quota:
 *   tiers:
 *     none:    { display-name: Free, hourly: 5, daily: 20, monthly: 100 }
 *     starter: { hourly: 10, daily: 50, monthly: 500 }
 *     pro:     { display-name: Pro }   # omitted limits are unbounded
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "quota")
public class QuotaProperties {

    @NotEmpty
    private Map<String, @Valid Tier> tiers = new LinkedHashMap<>();

    @Min(1)
    private int historyDefaultLimit = 100;

    @Min(1)
    private int historyMaxLimit = 1000;

    @Getter
    @Setter
    public static class Tier {
        private String displayName;

        @PositiveOrZero
        private Integer hourly;

        @PositiveOrZero
        private Integer daily;

        @PositiveOrZero
        private Integer monthly;
    }
}
