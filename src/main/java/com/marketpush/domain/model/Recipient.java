package com.marketpush.domain.model;

import com.marketpush.domain.enums.RecipientKind;
import lombok.Builder;
import lombok.Value;

/**
 * A push destination: a user chat or a group chat bound to a user.
 *
 * <p>{@link #getChannelId()} is what the messaging gateway addresses;
 * {@link #getScopeId()} is what the deduplicator keys on.
 */
@Value
@Builder
public class Recipient {

    String id;
    RecipientKind kind;
    PushSettings settings;

    public static Recipient user(String userId, PushSettings settings) {
        return new Recipient(userId, RecipientKind.USER, settings);
    }

    public static Recipient group(String groupId, PushSettings ownerSettings) {
        return new Recipient(groupId, RecipientKind.GROUP, ownerSettings);
    }

    public String getChannelId() {
        return id;
    }

    public String getScopeId() {
        return kind.scopeIdFor(id);
    }
}
