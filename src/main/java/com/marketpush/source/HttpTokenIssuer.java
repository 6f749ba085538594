package com.marketpush.source;

import com.marketpush.exception.AuthExpiredException;
import com.marketpush.exception.MalformedContentException;
import com.marketpush.exception.UpstreamUnavailableException;
import com.marketpush.source.dto.UserInitEnvelope;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Obtains access tokens from the upstream user-init endpoint. The endpoint is
 * idempotent: calling it for an existing user returns a new token for that user.
 */
@Component
public class HttpTokenIssuer implements TokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(HttpTokenIssuer.class);

    static final String USER_INIT_PATH = "/api/tgbot/user/init";

    private final RestClient upstreamRestClient;

    public HttpTokenIssuer(@Qualifier("upstreamRestClient") RestClient upstreamRestClient) {
        this.upstreamRestClient = upstreamRestClient;
    }

    @Override
    public String issue(String recipientId) {
        UserInitEnvelope envelope;
        try {
            envelope = upstreamRestClient
                    .post()
                    .uri(USER_INIT_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("telegram_id", recipientId))
                    .retrieve()
                    .body(UserInitEnvelope.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                throw new AuthExpiredException("Token issue rejected for " + recipientId + " (" + status + ")", e);
            }
            throw new UpstreamUnavailableException("Token issue failed for " + recipientId + " (" + status + ")", e);
        } catch (ResourceAccessException e) {
            throw new UpstreamUnavailableException("Token endpoint unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new MalformedContentException("Unreadable token response for " + recipientId, e);
        }

        if (envelope == null
                || !envelope.isSuccess()
                || envelope.getData() == null
                || envelope.getData().getAccessToken() == null
                || envelope.getData().getAccessToken().isBlank()) {
            throw new MalformedContentException("Token response for " + recipientId + " carried no access token");
        }
        log.info("Issued upstream access token for {}", recipientId);
        return envelope.getData().getAccessToken();
    }
}
