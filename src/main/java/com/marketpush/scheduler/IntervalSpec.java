package com.marketpush.scheduler;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

/**
 * When recurring executions fire: either a fixed period or a cron expression in
 * a zone. The first periodic tick comes one period after start; the accelerated
 * startup run covers the gap.
 */
public final class IntervalSpec {

    private final Duration period;
    private final String cron;
    private final ZoneId zone;

    private IntervalSpec(Duration period, String cron, ZoneId zone) {
        this.period = period;
        this.cron = cron;
        this.zone = zone;
    }

    public static IntervalSpec every(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + period);
        }
        return new IntervalSpec(period, null, null);
    }

    public static IntervalSpec cron(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be blank");
        }
        // throws IllegalArgumentException on a malformed expression
        new CronTrigger(expression, zone);
        return new IntervalSpec(null, expression, zone);
    }

    public Trigger toTrigger() {
        if (cron != null) {
            return new CronTrigger(cron, zone);
        }
        PeriodicTrigger trigger = new PeriodicTrigger(period);
        trigger.setFixedRate(true);
        trigger.setInitialDelay(period);
        return trigger;
    }

    public boolean isCron() {
        return cron != null;
    }

    /** Period of a fixed-interval spec, null for cron. */
    public Duration getPeriod() {
        return period;
    }

    public String describe() {
        return cron != null ? "cron '" + cron + "' (" + zone + ")" : "every " + period;
    }

    @Override
    public String toString() {
        return describe();
    }
}
