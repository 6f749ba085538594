package com.marketpush.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A large-holder transfer or position change. {@code amount} is kept in the
 * upstream's textual form; the category filter parses it when thresholding.
 */
@Value
@Builder
public class TransferPayload implements ContentPayload {

    String address;
    String action;
    String amount;

    @With
    String symbol;

    String transactionHash;
    String exchange;
    String leverage;
    String positionType;
    String tradeType;
    String pnlAmount;
    String pnlCurrency;
    String pnlType;
    String marginType;

    @Override
    public String stableKey() {
        return PayloadKeys.join(
                PayloadKeys.prefix(address, 20),
                PayloadKeys.prefix(action, 20),
                PayloadKeys.prefix(amount, 20),
                symbol);
    }
}
