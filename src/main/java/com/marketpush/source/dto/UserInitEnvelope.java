package com.marketpush.source.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Upstream response of {@code POST /api/tgbot/user/init}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserInitEnvelope {

    private Object code;
    private String message;
    private UserInitData data;

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
    public static class UserInitData {
        private String userId;
        private String accessToken;
    }
}
