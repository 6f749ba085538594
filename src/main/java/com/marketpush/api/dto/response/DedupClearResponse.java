package com.marketpush.api.dto.response;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DedupClearResponse {

    String scopeId;
    String category;
    int cleared;
}
