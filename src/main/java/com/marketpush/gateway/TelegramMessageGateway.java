package com.marketpush.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpush.config.PushProperties;
import com.marketpush.domain.model.RenderedMessage;
import com.marketpush.exception.GatewaySendFailedException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends messages through the Telegram Bot API {@code sendMessage} method.
 *
 * <p>Pacing is not done here; callers go through the dispatcher's rate gate.
 * When Telegram is disabled every send fails, so nothing is recorded as delivered.
 */
@Component
public class TelegramMessageGateway implements MessageGateway {

    private static final Logger log = LoggerFactory.getLogger(TelegramMessageGateway.class);

    private static final String SEND_MESSAGE_PATH = "%s/bot%s/sendMessage";

    private final PushProperties pushProperties;
    private final RestTemplate restTemplate;

    public TelegramMessageGateway(
            PushProperties pushProperties, @Qualifier("telegramRestTemplate") RestTemplate restTemplate) {
        this.pushProperties = pushProperties;
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(String channelId, RenderedMessage message) {
        PushProperties.Telegram telegram = pushProperties.getTelegram();
        if (!telegram.isEnabled()) {
            log.debug("Telegram disabled, not sending to {}", channelId);
            throw new GatewaySendFailedException(channelId, "Telegram gateway disabled");
        }

        String url = String.format(SEND_MESSAGE_PATH, telegram.getApiUrl(), telegram.getBotToken());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", channelId);
        payload.put("text", message.getText());
        if (message.isHtml()) {
            payload.put("parse_mode", "HTML");
        }
        payload.put("disable_web_page_preview", true);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(payload, headers);

        ResponseEntity<SendMessageResponse> response;
        try {
            response = restTemplate.postForEntity(url, request, SendMessageResponse.class);
        } catch (RestClientException e) {
            throw new GatewaySendFailedException("Telegram send to " + channelId + " failed: " + e.getMessage(), e);
        }

        SendMessageResponse body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || body == null || !body.isOk()) {
            String description = body != null ? body.getDescription() : "empty response";
            throw new GatewaySendFailedException(channelId, "Telegram rejected message to " + channelId + ": " + description);
        }
        log.debug("Telegram message sent to {}", channelId);
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SendMessageResponse {
        private boolean ok;
        private String description;

        @JsonProperty("error_code")
        private Integer errorCode;
    }
}
