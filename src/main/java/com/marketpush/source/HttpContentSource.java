package com.marketpush.source;

import com.marketpush.domain.model.ContentBatch;
import com.marketpush.domain.model.PushSettings;
import com.marketpush.domain.model.RecipientContent;
import com.marketpush.exception.AuthExpiredException;
import com.marketpush.exception.BaseException;
import com.marketpush.exception.MalformedContentException;
import com.marketpush.exception.UpstreamUnavailableException;
import com.marketpush.source.dto.PushSettingsEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Fetches settings and content from the upstream push endpoint in one call.
 *
 * <p>Error mapping:
 * <ul>
 *   <li>401/403 → {@link AuthExpiredException}</li>
 *   <li>other HTTP errors, timeouts, connection failures → {@link UpstreamUnavailableException}</li>
 *   <li>non-zero envelope code, missing data, unreadable body → {@link MalformedContentException}</li>
 * </ul>
 */
@Component
public class HttpContentSource implements ContentSource {

    private static final Logger log = LoggerFactory.getLogger(HttpContentSource.class);

    static final String PUSH_SETTINGS_PATH = "/api/user/push-settings";

    private final RestClient upstreamRestClient;
    private final ContentNormalizer contentNormalizer;

    public HttpContentSource(
            @Qualifier("upstreamRestClient") RestClient upstreamRestClient, ContentNormalizer contentNormalizer) {
        this.upstreamRestClient = upstreamRestClient;
        this.contentNormalizer = contentNormalizer;
    }

    @Override
    public RecipientContent fetch(String recipientId, String credential) {
        PushSettingsEnvelope envelope = call(recipientId, credential);

        if (!envelope.isSuccess()) {
            throw new MalformedContentException(
                    "Upstream returned code " + envelope.getCode() + " for " + recipientId + ": " + envelope.getMessage());
        }
        if (envelope.getData() == null || envelope.getData().getUserSettings() == null) {
            throw new MalformedContentException("Upstream response for " + recipientId + " has no settings");
        }

        PushSettings settings = contentNormalizer.toSettings(envelope.getData().getUserSettings());
        ContentBatch batch = contentNormalizer.toBatch(envelope.getData().getPushData());
        log.debug(
                "Fetched content for {}: news={}, transfers={}, fundFlows={}, groups={}",
                recipientId,
                batch.getNews().size(),
                batch.getLargeTransfers().size(),
                batch.getFundFlows().size(),
                settings.getBoundGroups().size());
        return new RecipientContent(settings, batch);
    }

    @Override
    public boolean healthCheck(String recipientId, String credential) {
        try {
            fetch(recipientId, credential);
            return true;
        } catch (BaseException e) {
            log.warn("Upstream health check failed for {}: {}", recipientId, e.getMessage());
            return false;
        }
    }

    private PushSettingsEnvelope call(String recipientId, String credential) {
        PushSettingsEnvelope envelope;
        try {
            envelope = upstreamRestClient
                    .get()
                    .uri(PUSH_SETTINGS_PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + credential)
                    .retrieve()
                    .body(PushSettingsEnvelope.class);
        } catch (RestClientResponseException e) {
            HttpStatusCode status = e.getStatusCode();
            if (status.value() == 401 || status.value() == 403) {
                throw new AuthExpiredException("Credential rejected for " + recipientId + " (" + status.value() + ")", e);
            }
            throw new UpstreamUnavailableException(
                    "Upstream returned " + status.value() + " for " + recipientId, e);
        } catch (ResourceAccessException e) {
            throw new UpstreamUnavailableException("Upstream unreachable for " + recipientId + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new MalformedContentException("Unreadable upstream response for " + recipientId, e);
        }
        if (envelope == null) {
            throw new MalformedContentException("Empty upstream response for " + recipientId);
        }
        return envelope;
    }
}
