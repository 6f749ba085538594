package com.marketpush.domain.enums;

/**
 * The two shapes a fund-flow item can arrive in from upstream. Resolved once
 * at the content source boundary; everything downstream switches on this tag.
 */
public enum FundFlowFormat {

    /** Point-to-point flow: {@code from}, {@code to}, {@code amount}. */
    TRANSFER,

    /** Per-token summary: headline message, price, 1h and 4h net flow. */
    MARKET_SUMMARY
}
