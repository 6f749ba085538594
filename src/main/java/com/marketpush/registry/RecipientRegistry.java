package com.marketpush.registry;

import com.marketpush.domain.model.PushSettings;
import com.marketpush.event.RecipientSettingsChangedEvent;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * In-memory set of user recipients currently opted into push, with their
 * latest known settings and bound groups.
 *
 * <p>Mutated from two directions: settings-change events from the command layer,
 * and the per-execution refresh in {@link com.marketpush.scheduler.PushExecutionService}.
 * All mutation goes through {@link #add} and {@link #remove}; {@link #list()} hands out
 * a copy so an execution iterating the snapshot is unaffected by concurrent changes.
 *
 * <p>Also remembers group chats the bot has been removed from, so fan-out can
 * skip them until the bot is added back.
 */
@Component
public class RecipientRegistry {

    private static final Logger log = LoggerFactory.getLogger(RecipientRegistry.class);

    private final Map<String, PushSettings> recipients = new ConcurrentHashMap<>();
    private final Set<String> departedGroups = ConcurrentHashMap.newKeySet();

    /**
     * Upserts a recipient. Idempotent: adding the same settings twice leaves one entry.
     */
    public void add(String recipientId, PushSettings settings) {
        if (recipientId == null || recipientId.isBlank()) {
            throw new IllegalArgumentException("recipientId must not be blank");
        }
        PushSettings previous = recipients.put(recipientId, settings != null ? settings.copy() : PushSettings.allDisabled());
        if (previous == null) {
            log.info("Recipient {} added to push tracking", recipientId);
        } else {
            log.debug("Recipient {} settings updated", recipientId);
        }
    }

    /**
     * Replaces the settings of a recipient that is still tracked. Returns false when the
     * recipient was removed in the meantime, so a refresh never resurrects it.
     */
    public boolean refresh(String recipientId, PushSettings settings) {
        return recipients.computeIfPresent(recipientId, (id, current) -> settings.copy()) != null;
    }

    /** Drops a recipient. No-op when absent. */
    public void remove(String recipientId) {
        if (recipientId != null && recipients.remove(recipientId) != null) {
            log.info("Recipient {} removed from push tracking", recipientId);
        }
    }

    /** Snapshot of tracked recipient ids. */
    public List<String> list() {
        return List.copyOf(recipients.keySet());
    }

    public Optional<PushSettings> get(String recipientId) {
        PushSettings settings = recipients.get(recipientId);
        return Optional.ofNullable(settings).map(PushSettings::copy);
    }

    public boolean contains(String recipientId) {
        return recipients.containsKey(recipientId);
    }

    public int size() {
        return recipients.size();
    }

    /** Marks a group chat the bot can no longer post to. */
    public void markGroupDeparted(String groupId) {
        if (departedGroups.add(groupId)) {
            log.info("Group {} marked as departed, pushes to it are suspended", groupId);
        }
    }

    public void markGroupPresent(String groupId) {
        if (departedGroups.remove(groupId)) {
            log.info("Group {} present again, pushes resume", groupId);
        }
    }

    public boolean isGroupDeparted(String groupId) {
        return departedGroups.contains(groupId);
    }

    /**
     * Applies an external settings change: all categories off removes the
     * recipient, anything else upserts it.
     */
    @EventListener
    public void onSettingsChanged(RecipientSettingsChangedEvent event) {
        PushSettings settings = event.getSettings();
        if (settings == null || !settings.isAnyEnabled()) {
            remove(event.getRecipientId());
        } else {
            add(event.getRecipientId(), settings);
        }
    }
}
