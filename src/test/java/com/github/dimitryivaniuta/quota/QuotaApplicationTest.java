package com.github.dimitryivaniuta.quota;

import com.github.dimitryivaniuta.quota.counter.CheckOutcome;
import com.github.dimitryivaniuta.quota.infra.BaseIntegrationTest;
import com.github.dimitryivaniuta.quota.limits.Limit;
import com.github.dimitryivaniuta.quota.limits.LimitTriple;
import com.github.dimitryivaniuta.quota.limits.RateLimitsConfig;
import com.github.dimitryivaniuta.quota.window.PeriodType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Full context with the default entitlement source: every user is on the "none" tier.
 */
@SpringBootTest
class QuotaApplicationTest extends BaseIntegrationTest {

    @Autowired QuotaService quotaService;
    @Autowired RateLimitsConfig rateLimitsConfig;

    @Test
    void tiers_shouldBeBoundInDeclarationOrder() {
        assertThat(rateLimitsConfig.tiers().keySet()).containsExactly("none", "starter", "pro");
        assertThat(rateLimitsConfig.fallback()).isEqualTo(LimitTriple.of(5, 20, 100));
        assertThat(rateLimitsConfig.find("pro")).contains(LimitTriple.UNBOUNDED);
    }

    @Test
    void enforce_shouldDenySixthRequestOfTheHour() {
        for (int i = 0; i < 5; i++) {
            CheckOutcome out = quotaService.enforce("henry");
            assertThat(out.remaining().hourly()).isEqualTo(Limit.of(4 - i));
        }

        assertThatThrownBy(() -> quotaService.enforce("henry"))
                .isInstanceOfSatisfying(QuotaExceededException.class, ex -> {
                    assertThat(ex.getExhausted()).containsExactly(PeriodType.HOURLY);
                    assertThat(ex.getRetryAfterSeconds()).isBetween(1L, 3600L);
                });

        QuotaStatus status = quotaService.status("henry");
        assertThat(status.entitlement()).isEqualTo("none");
        assertThat(status.displayName()).isEqualTo("Free");
        assertThat(status.tiers()).extracting(QuotaStatus.Tier::entitlement).containsExactly("none", "starter", "pro");
        assertThat(status.usage()).isEqualTo(new QuotaStatus.Usage(5, 5, 5));
        assertThat(storedCount("henry", "HOURLY")).isEqualTo(5);
    }

    @Test
    void history_shouldListCurrentWindowWithLimit() {
        quotaService.checkAndIncrement("ivy");
        quotaService.checkAndIncrement("ivy");

        QuotaHistory history = quotaService.history("ivy", "day", null);

        assertThat(history.totalEntries()).isEqualTo(1);
        assertThat(history.entries().get(0).requestCount()).isEqualTo(2);
        assertThat(history.entries().get(0).limit()).isEqualTo(20);
    }
}
