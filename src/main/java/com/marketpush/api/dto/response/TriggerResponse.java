package com.marketpush.api.dto.response;

import com.marketpush.domain.model.ExecutionRun;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a manual trigger. {@code skipped} is true when another execution was
 * in progress; {@code run} is then null.
 */
@Value
@Builder
public class TriggerResponse {

    boolean skipped;
    ExecutionRun run;
}
