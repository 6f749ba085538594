package com.marketpush.source.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Union of both upstream fund-flow shapes. Exactly one group of fields is
 * expected to be populated; {@link com.marketpush.source.ContentNormalizer}
 * decides which.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class FundFlowDto {

    private String id;
    private String timestamp;
    private String symbol;

    // transfer format
    private String from;
    private String to;
    private String amount;

    // market summary format
    private String message;
    private String price;
    private String flow1h;
    private String flow4h;
}
