package com.marketpush.unit.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketpush.scheduler.IntervalSpec;
import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

class IntervalSpecTest {

    @Test
    @DisplayName("a fixed interval becomes a fixed-rate trigger delayed by one period")
    void fixedInterval() {
        IntervalSpec spec = IntervalSpec.every(Duration.ofMinutes(20));

        assertThat(spec.isCron()).isFalse();
        assertThat(spec.getPeriod()).isEqualTo(Duration.ofMinutes(20));
        assertThat(spec.toTrigger()).isInstanceOfSatisfying(PeriodicTrigger.class, trigger -> {
            assertThat(trigger.isFixedRate()).isTrue();
            assertThat(trigger.getPeriodDuration()).isEqualTo(Duration.ofMinutes(20));
            assertThat(trigger.getInitialDelayDuration()).isEqualTo(Duration.ofMinutes(20));
        });
    }

    @Test
    @DisplayName("a cron expression becomes a cron trigger in its zone")
    void cronExpression() {
        IntervalSpec spec = IntervalSpec.cron("0 */20 * * * *", ZoneId.of("Asia/Shanghai"));

        assertThat(spec.isCron()).isTrue();
        assertThat(spec.getPeriod()).isNull();
        assertThat(spec.toTrigger()).isInstanceOf(CronTrigger.class);
        assertThat(spec.describe()).isEqualTo("cron '0 */20 * * * *' (Asia/Shanghai)");
    }

    @Test
    @DisplayName("non-positive intervals are rejected")
    void rejectsNonPositive() {
        assertThatThrownBy(() -> IntervalSpec.every(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IntervalSpec.every(Duration.ofSeconds(-5))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IntervalSpec.every(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("malformed cron expressions are rejected")
    void rejectsMalformedCron() {
        assertThatThrownBy(() -> IntervalSpec.cron("every twenty minutes", ZoneId.of("UTC")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IntervalSpec.cron(" ", ZoneId.of("UTC")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
