package com.marketpush.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the push engine.
 *
 * <p>Reads from application.yml:
 * <pre>
 * push.scheduler.enabled=true
 * push.scheduler.interval=20m
 * push.scheduler.cron=            # optional, overrides interval
 * push.scheduler.zone=Asia/Shanghai
 * push.scheduler.initial-delay=1s
 * push.dispatch.pacing=150ms
 * push.dispatch.worker-threads=4
 * push.dedup.retention=1h
 * push.dedup.store=memory         # or redis
 * push.filter.min-transfer-notional=1000000
 * push.upstream.base-url=${PUSH_UPSTREAM_BASE_URL:}
 * push.telegram.bot-token=${TELEGRAM_BOT_TOKEN:}
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "push")
public class PushProperties {

    private Scheduler scheduler = new Scheduler();
    private Dispatch dispatch = new Dispatch();
    private Dedup dedup = new Dedup();
    private Filter filter = new Filter();
    private Upstream upstream = new Upstream();
    private Telegram telegram = new Telegram();
    private Groups groups = new Groups();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(20);

        /** Six-field Spring cron expression; when set it takes precedence over {@link #interval}. */
        private String cron;

        private String zone = "Asia/Shanghai";
        private Duration initialDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class Dispatch {

        /** Minimum gap between two physical gateway sends, across all workers. */
        private Duration pacing = Duration.ofMillis(150);

        private int workerThreads = 4;
    }

    @Data
    public static class Dedup {

        /** Must be at least the upstream content refresh horizon. */
        private Duration retention = Duration.ofHours(1);

        private String store = "memory";
    }

    @Data
    public static class Filter {
        private BigDecimal minTransferNotional = new BigDecimal("1000000");
    }

    @Data
    public static class Upstream {
        private String baseUrl = "http://localhost:8080";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
        private Duration tokenTtl = Duration.ofHours(24);
    }

    @Data
    public static class Telegram {
        private boolean enabled = false;
        private String botToken;
        private String apiUrl = "https://api.telegram.org";
    }

    @Data
    public static class Groups {
        private Duration welcomeDelay = Duration.ofSeconds(2);
        private String welcomeMessage = "<b>Market alerts enabled for this group.</b>\n\n"
                + "Pushes follow the group owner's personal settings. "
                + "The owner can change them with /push in a private chat.";
    }
}
