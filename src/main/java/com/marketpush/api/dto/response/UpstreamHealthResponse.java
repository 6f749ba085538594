package com.marketpush.api.dto.response;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UpstreamHealthResponse {

    String recipientId;
    boolean upstreamHealthy;
}
