package com.marketpush.source.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Upstream response of {@code GET /api/user/push-settings}.
 *
 * <p>{@code code} arrives as either a number or a string. Absent, 0 and 200 mean success;
 * the payload's presence is checked separately.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushSettingsEnvelope {

    private Object code;
    private String message;
    private Payload data;

    public boolean isSuccess() {
        if (code == null) {
            return true;
        }
        String value = String.valueOf(code).trim();
        return "0".equals(value) || "200".equals(value);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {

        @JsonProperty("user_settings")
        private UserSettingsDto userSettings;

        @JsonProperty("push_data")
        private PushDataDto pushData;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserSettingsDto {

        @JsonProperty("flash_enabled")
        private boolean flashEnabled;

        @JsonProperty("whale_enabled")
        private boolean whaleEnabled;

        @JsonProperty("fund_enabled")
        private boolean fundEnabled;

        @JsonProperty("managed_groups")
        private List<ManagedGroupDto> managedGroups;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ManagedGroupDto {

        @JsonProperty("group_id")
        private String groupId;

        @JsonProperty("group_name")
        private String groupName;

        @JsonProperty("bound_at")
        private String boundAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PushDataDto {

        @JsonProperty("flash_news")
        private List<FlashNewsDto> flashNews;

        @JsonProperty("whale_actions")
        private List<WhaleActionDto> whaleActions;

        @JsonProperty("fund_flows")
        private List<FundFlowDto> fundFlows;
    }
}
