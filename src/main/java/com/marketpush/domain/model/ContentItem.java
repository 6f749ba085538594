package com.marketpush.domain.model;

import com.marketpush.domain.enums.ContentCategory;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import lombok.Builder;
import lombok.Value;

/**
 * One alertable fact fetched from upstream.
 *
 * <p>The fingerprint is the dedup key. It is derived from the category, the
 * payload's stable key and the event timestamp truncated to the minute, so two
 * fetches of the same event always agree.
 */
@Value
@Builder
public class ContentItem {

    private static final int TIMESTAMP_PREFIX_LENGTH = 16;

    ContentCategory category;
    ContentPayload payload;
    String timestamp;
    String fingerprint;

    public static ContentItem of(ContentCategory category, ContentPayload payload, String timestamp) {
        return ContentItem.builder()
                .category(category)
                .payload(payload)
                .timestamp(timestamp)
                .fingerprint(fingerprintOf(category, payload, timestamp))
                .build();
    }

    public static String fingerprintOf(ContentCategory category, ContentPayload payload, String timestamp) {
        String raw = category.name()
                + "|" + (payload != null ? payload.stableKey() : "")
                + "|" + PayloadKeys.prefix(timestamp, TIMESTAMP_PREFIX_LENGTH);
        return sha256(raw);
    }

    /** First 16 hex characters of SHA-256. */
    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
