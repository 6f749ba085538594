package com.marketpush.dispatch;

import com.marketpush.dedup.PushDeduplicator;
import com.marketpush.domain.enums.ContentCategory;
import com.marketpush.domain.model.ContentItem;
import com.marketpush.domain.model.DeliveryResult;
import com.marketpush.domain.model.Recipient;
import com.marketpush.domain.model.RenderedMessage;
import com.marketpush.exception.GatewaySendFailedException;
import com.marketpush.exception.MalformedContentException;
import com.marketpush.format.MessageFormatter;
import com.marketpush.gateway.MessageGateway;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Delivers one recipient's candidates to one channel.
 *
 * <p>Categories go out in {@link ContentCategory} declaration order, items in
 * upstream order. Each item is deduplicated against the recipient's scope, rendered,
 * paced through the {@link SendRateGate} and sent. Only items the gateway accepted
 * are marked delivered; a failed send affects that item alone and leaves it eligible
 * for the next cycle.
 */
@Service
public class FanOutDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FanOutDispatcher.class);

    private final PushDeduplicator pushDeduplicator;
    private final MessageFormatter messageFormatter;
    private final MessageGateway messageGateway;
    private final SendRateGate sendRateGate;

    public FanOutDispatcher(
            PushDeduplicator pushDeduplicator,
            MessageFormatter messageFormatter,
            MessageGateway messageGateway,
            SendRateGate sendRateGate) {
        this.pushDeduplicator = pushDeduplicator;
        this.messageFormatter = messageFormatter;
        this.messageGateway = messageGateway;
        this.sendRateGate = sendRateGate;
    }

    public DeliveryResult deliver(Recipient recipient, Map<ContentCategory, List<ContentItem>> candidates) {
        String channelId = recipient.getChannelId();
        String scopeId = recipient.getScopeId();
        int sent = 0;
        int failed = 0;
        int dropped = 0;

        for (ContentCategory category : ContentCategory.values()) {
            List<ContentItem> items = candidates != null ? candidates.get(category) : null;
            if (items == null || items.isEmpty()) {
                continue;
            }

            List<ContentItem> fresh = pushDeduplicator.filterDuplicates(scopeId, items, category);
            if (fresh.isEmpty()) {
                continue;
            }

            List<ContentItem> delivered = new ArrayList<>(fresh.size());
            try {
                for (ContentItem item : fresh) {
                    RenderedMessage message;
                    try {
                        message = messageFormatter.format(item);
                    } catch (MalformedContentException e) {
                        dropped++;
                        log.warn("Dropping {} item {} for {}: {}", category.getKey(), item.getFingerprint(), scopeId, e.getMessage());
                        continue;
                    }

                    try {
                        sendRateGate.acquire();
                        messageGateway.send(channelId, message);
                        delivered.add(item);
                        sent++;
                    } catch (GatewaySendFailedException e) {
                        failed++;
                        log.warn("Send of {} item {} to {} failed: {}", category.getKey(), item.getFingerprint(), scopeId, e.getMessage());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        failed++;
                        log.warn("Interrupted while pacing send to {}, stopping delivery", scopeId);
                        return new DeliveryResult(channelId, sent, failed, dropped);
                    } catch (RuntimeException e) {
                        failed++;
                        log.error("Unexpected error sending {} item {} to {}", category.getKey(), item.getFingerprint(), scopeId, e);
                    }
                }
            } finally {
                // Confirmed sends are recorded even when the loop exits early.
                pushDeduplicator.markDelivered(scopeId, delivered, category);
            }
        }

        if (sent > 0 || failed > 0 || dropped > 0) {
            log.info("Delivered to {}: sent={}, failed={}, dropped={}", scopeId, sent, failed, dropped);
        }
        return new DeliveryResult(channelId, sent, failed, dropped);
    }
}
