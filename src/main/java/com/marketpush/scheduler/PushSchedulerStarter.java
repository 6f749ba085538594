package com.marketpush.scheduler;

import com.marketpush.config.PushProperties;
import jakarta.annotation.PreDestroy;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Starts the push scheduler once the application is ready and stops it on shutdown.
 * {@code push.scheduler.cron}, when set, wins over {@code push.scheduler.interval}.
 */
@Component
public class PushSchedulerStarter implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(PushSchedulerStarter.class);

    private final PushScheduler pushScheduler;
    private final PushProperties pushProperties;

    public PushSchedulerStarter(PushScheduler pushScheduler, PushProperties pushProperties) {
        this.pushScheduler = pushScheduler;
        this.pushProperties = pushProperties;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        PushProperties.Scheduler config = pushProperties.getScheduler();
        if (!config.isEnabled()) {
            log.info("Push scheduler disabled (push.scheduler.enabled=false)");
            return;
        }
        IntervalSpec spec = resolveSpec(config);
        warnIfRetentionTooShort(spec);
        pushScheduler.start(spec);
    }

    @PreDestroy
    public void shutdown() {
        pushScheduler.stop();
    }

    IntervalSpec resolveSpec(PushProperties.Scheduler config) {
        if (config.getCron() != null && !config.getCron().isBlank()) {
            return IntervalSpec.cron(config.getCron(), ZoneId.of(config.getZone()));
        }
        return IntervalSpec.every(config.getInterval());
    }

    private void warnIfRetentionTooShort(IntervalSpec spec) {
        if (spec.isCron()) {
            return;
        }
        if (pushProperties.getDedup().getRetention().compareTo(spec.getPeriod()) < 0) {
            log.warn(
                    "Dedup retention {} is shorter than the push interval {}; items still offered upstream may be sent twice",
                    pushProperties.getDedup().getRetention(),
                    spec.getPeriod());
        }
    }
}
