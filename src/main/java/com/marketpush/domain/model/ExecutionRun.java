package com.marketpush.domain.model;

import com.marketpush.domain.enums.ExecutionTrigger;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Record of one scheduler cycle.
 *
 * <p>{@code successCount} and {@code failureCount} are per user recipient: a
 * recipient succeeds when its own delivery and every bound-group delivery had no
 * failed sends. A recipient with nothing new to send still counts as a success.
 * Recipients removed by the settings self-heal count toward {@code removedCount}
 * only.
 */
@Data
@Builder
public class ExecutionRun {

    private String executionId;
    private ExecutionTrigger trigger;
    private Instant startedAt;
    private Instant finishedAt;

    private int recipientsProcessed;
    private int successCount;
    private int failureCount;
    private int removedCount;

    private int messagesSent;
    private int messagesFailed;
    private int itemsDropped;

    private long durationMs;
    private boolean aborted;
}
