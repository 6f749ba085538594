package com.marketpush.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings pushed by the command layer or an operator. All three categories
 * disabled removes the recipient.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipientSettingsRequest {

    private boolean news;
    private boolean largeTransfer;
    private boolean fundFlow;

    @Valid
    @Builder.Default
    private List<Group> boundGroups = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Group {

        @NotBlank(message = "groupId is required")
        private String groupId;

        private String groupName;
    }
}
