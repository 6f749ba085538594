package com.marketpush.dispatch;

import com.marketpush.domain.model.RenderedMessage;
import com.marketpush.exception.GatewaySendFailedException;
import com.marketpush.gateway.MessageGateway;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * One-shot messages sent after a delay, such as the welcome note posted when the
 * bot joins a group. At most one pending message per channel; scheduling again
 * replaces the earlier one.
 */
@Component
public class DelayedMessageScheduler {

    private static final Logger log = LoggerFactory.getLogger(DelayedMessageScheduler.class);

    private final TaskScheduler taskScheduler;
    private final MessageGateway messageGateway;
    private final SendRateGate sendRateGate;

    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public DelayedMessageScheduler(
            @Qualifier("pushTaskScheduler") TaskScheduler taskScheduler,
            MessageGateway messageGateway,
            SendRateGate sendRateGate) {
        this.taskScheduler = taskScheduler;
        this.messageGateway = messageGateway;
        this.sendRateGate = sendRateGate;
    }

    public void schedule(String channelId, RenderedMessage message, Duration delay) {
        cancel(channelId);
        ScheduledFuture<?> future = taskScheduler.schedule(() -> sendNow(channelId, message), Instant.now().plus(delay));
        pending.put(channelId, future);
        log.debug("Scheduled delayed message to {} in {} ms", channelId, delay.toMillis());
    }

    /** @return true when a pending message was cancelled */
    public boolean cancel(String channelId) {
        ScheduledFuture<?> future = pending.remove(channelId);
        if (future == null) {
            return false;
        }
        boolean cancelled = future.cancel(false);
        if (cancelled) {
            log.debug("Cancelled delayed message to {}", channelId);
        }
        return cancelled;
    }

    public Set<String> pendingChannels() {
        return Set.copyOf(pending.keySet());
    }

    void sendNow(String channelId, RenderedMessage message) {
        pending.remove(channelId);
        try {
            sendRateGate.acquire();
            messageGateway.send(channelId, message);
            log.info("Delayed message sent to {}", channelId);
        } catch (GatewaySendFailedException e) {
            log.warn("Delayed message to {} failed: {}", channelId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted before sending delayed message to {}", channelId);
        }
    }
}
