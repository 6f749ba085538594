package com.marketpush.domain.model;

/**
 * Category-specific fields of a {@link ContentItem}.
 */
public interface ContentPayload {

    /** Related token symbol, or null when none could be determined. */
    String getSymbol();

    /**
     * Concatenation of the fields that identify the underlying event. Must not
     * include anything that changes between two fetches of the same event.
     */
    String stableKey();
}
