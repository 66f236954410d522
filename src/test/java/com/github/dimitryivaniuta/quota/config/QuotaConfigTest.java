package com.github.dimitryivaniuta.quota.config;

import com.github.dimitryivaniuta.quota.entitlement.EntitlementSource;
import com.github.dimitryivaniuta.quota.limits.Limit;
import com.github.dimitryivaniuta.quota.limits.QuotaConfigurationException;
import com.github.dimitryivaniuta.quota.limits.RateLimitsConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class QuotaConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(QuotaConfig.class);

    @Test
    void tiers_shouldBindWithOmittedLimitsAsUnbounded() {
        runner.withPropertyValues(
                        "quota.tiers.none.hourly=5",
                        "quota.tiers.none.daily=20",
                        "quota.tiers.none.monthly=100",
                        "quota.tiers.pro.display-name=Pro",
                        "quota.tiers.pro.hourly=1000")
                .run(ctx -> {
                    RateLimitsConfig cfg = ctx.getBean(RateLimitsConfig.class);
                    assertThat(cfg.fallback().daily()).isEqualTo(Limit.of(20));
                    assertThat(cfg.find("pro").orElseThrow().hourly()).isEqualTo(Limit.of(1000));
                    assertThat(cfg.find("pro").orElseThrow().monthly().isUnbounded()).isTrue();
                });
    }

    @Test
    void missingNoneTier_shouldFailStartup() {
        runner.withPropertyValues("quota.tiers.starter.hourly=10")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure()
                        .hasRootCauseInstanceOf(QuotaConfigurationException.class));
    }

    @Test
    void negativeLimit_shouldFailValidation() {
        runner.withPropertyValues("quota.tiers.none.hourly=-1")
                .run(ctx -> assertThat(ctx).hasFailed()
                        .getFailure()
                        .hasRootCauseInstanceOf(BindValidationException.class));
    }

    @Test
    void defaultEntitlementSource_shouldReportEveryoneAsUnknown() {
        runner.withPropertyValues("quota.tiers.none.hourly=5")
                .run(ctx -> assertThat(ctx.getBean(EntitlementSource.class).findSubscriptionInfo("anyone"))
                        .isEqualTo(Optional.empty()));
    }

    @Test
    void applicationEntitlementSource_shouldReplaceDefault() {
        EntitlementSource custom = userId -> Optional.empty();
        runner.withPropertyValues("quota.tiers.none.hourly=5")
                .withBean(EntitlementSource.class, () -> custom)
                .run(ctx -> assertThat(ctx.getBean(EntitlementSource.class)).isSameAs(custom));
    }
}
