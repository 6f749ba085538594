package com.marketpush.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder
public class NewsPayload implements ContentPayload {

    String title;
    String body;
    String source;
    String url;

    @With
    String symbol;

    @Override
    public String stableKey() {
        return PayloadKeys.join(PayloadKeys.prefix(title, 50));
    }
}
