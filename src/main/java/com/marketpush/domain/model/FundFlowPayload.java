package com.marketpush.domain.model;

import com.marketpush.domain.enums.FundFlowFormat;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Normalized fund flow. Which fields are populated depends on {@link #format}:
 * <ul>
 *   <li>{@link FundFlowFormat#TRANSFER}: from, to, amount</li>
 *   <li>{@link FundFlowFormat#MARKET_SUMMARY}: headline, price, flow1h, flow4h</li>
 * </ul>
 */
@Value
@Builder
public class FundFlowPayload implements ContentPayload {

    FundFlowFormat format;

    String from;
    String to;
    String amount;

    String headline;
    String price;
    String flow1h;
    String flow4h;

    @With
    String symbol;

    @Override
    public String stableKey() {
        if (format == FundFlowFormat.MARKET_SUMMARY) {
            return PayloadKeys.join(format.name(), PayloadKeys.prefix(headline, 50), symbol);
        }
        return PayloadKeys.join(format.name(), from, to, PayloadKeys.prefix(amount, 20), symbol);
    }
}
