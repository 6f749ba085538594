package com.marketpush.source.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class WhaleActionDto {

    private String id;
    private String address;
    private String action;
    private String amount;
    private String symbol;
    private String timestamp;
    private String exchange;
    private String leverage;

    @JsonProperty("transaction_hash")
    private String transactionHash;

    @JsonProperty("position_type")
    private String positionType;

    @JsonProperty("trade_type")
    private String tradeType;

    @JsonProperty("pnl_amount")
    private String pnlAmount;

    @JsonProperty("pnl_currency")
    private String pnlCurrency;

    @JsonProperty("pnl_type")
    private String pnlType;

    @JsonProperty("margin_type")
    private String marginType;
}
