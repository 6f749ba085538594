package com.marketpush.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** Whether the bot is currently a member of a group chat. */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class GroupMembershipRequest {

    @NotNull(message = "present is required")
    private Boolean present;
}
