package com.marketpush.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Point-in-time view of the push scheduler for operators. */
@Value
@Builder
public class SchedulerStatus {

    boolean running;
    boolean executing;
    String schedule;
    Instant lastRunAt;
    ExecutionRun lastRun;
    long totalRuns;
    long successCount;
    long failureCount;
    long skippedTicks;
    int trackedRecipients;
}
