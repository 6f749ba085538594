package com.marketpush.group;

import com.marketpush.config.PushProperties;
import com.marketpush.dispatch.DelayedMessageScheduler;
import com.marketpush.domain.model.RenderedMessage;
import com.marketpush.registry.RecipientRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tracks whether the bot is still a member of bound group chats.
 *
 * <p>When the bot joins a group a welcome message is scheduled after a short delay;
 * when it leaves, pushes to the group stop and a welcome still pending is cancelled.
 */
@Service
public class GroupMembershipService {

    private static final Logger log = LoggerFactory.getLogger(GroupMembershipService.class);

    private final RecipientRegistry recipientRegistry;
    private final DelayedMessageScheduler delayedMessageScheduler;
    private final PushProperties pushProperties;

    public GroupMembershipService(
            RecipientRegistry recipientRegistry,
            DelayedMessageScheduler delayedMessageScheduler,
            PushProperties pushProperties) {
        this.recipientRegistry = recipientRegistry;
        this.delayedMessageScheduler = delayedMessageScheduler;
        this.pushProperties = pushProperties;
    }

    public void onBotAdded(String groupId) {
        recipientRegistry.markGroupPresent(groupId);
        PushProperties.Groups groups = pushProperties.getGroups();
        RenderedMessage welcome = RenderedMessage.builder().text(groups.getWelcomeMessage()).build();
        delayedMessageScheduler.schedule(groupId, welcome, groups.getWelcomeDelay());
        log.info("Bot added to group {}, welcome message in {} ms", groupId, groups.getWelcomeDelay().toMillis());
    }

    public void onBotRemoved(String groupId) {
        recipientRegistry.markGroupDeparted(groupId);
        if (delayedMessageScheduler.cancel(groupId)) {
            log.info("Cancelled pending welcome message for group {}", groupId);
        }
        log.info("Bot removed from group {}", groupId);
    }

    public boolean isWelcomePending(String groupId) {
        return delayedMessageScheduler.pendingChannels().contains(groupId);
    }
}
