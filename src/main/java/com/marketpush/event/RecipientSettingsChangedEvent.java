package com.marketpush.event;

import com.marketpush.domain.model.PushSettings;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a user changes push settings outside the engine (chat command,
 * operator API). The recipient registry listens and upserts or removes the user.
 */
public class RecipientSettingsChangedEvent extends ApplicationEvent {

    private final String recipientId;
    private final PushSettings settings;
    private final LocalDateTime occurredAt;

    public RecipientSettingsChangedEvent(Object source, String recipientId, PushSettings settings) {
        super(source);
        this.recipientId = recipientId;
        this.settings = settings;
        this.occurredAt = LocalDateTime.now();
    }

    public String getRecipientId() {
        return recipientId;
    }

    public PushSettings getSettings() {
        return settings;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
