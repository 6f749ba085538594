package com.marketpush.observability;

import com.marketpush.domain.model.ExecutionRun;
import com.marketpush.event.PushExecutionCompletedEvent;
import com.marketpush.registry.RecipientRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the push engine, fed by {@link PushExecutionCompletedEvent}:
 * <ul>
 *   <li><b>push.executions</b> (counter, tags trigger/outcome)</li>
 *   <li><b>push.messages.sent</b> / <b>push.messages.failed</b> (counters)</li>
 *   <li><b>push.recipients.failed</b> (counter)</li>
 *   <li><b>push.ticks.skipped</b> (counter)</li>
 *   <li><b>push.execution.duration</b> (timer)</li>
 *   <li><b>push.registry.size</b> (gauge)</li>
 * </ul>
 */
@Service
public class PushMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter messagesSentCounter;
    private final Counter messagesFailedCounter;
    private final Counter recipientsFailedCounter;
    private final Counter ticksSkippedCounter;
    private final Timer executionTimer;

    public PushMetricsService(MeterRegistry meterRegistry, RecipientRegistry recipientRegistry) {
        this.meterRegistry = meterRegistry;

        this.messagesSentCounter = Counter.builder("push.messages.sent")
                .description("Messages accepted by the gateway")
                .register(meterRegistry);

        this.messagesFailedCounter = Counter.builder("push.messages.failed")
                .description("Messages the gateway did not accept")
                .register(meterRegistry);

        this.recipientsFailedCounter = Counter.builder("push.recipients.failed")
                .description("Recipients counted as failed in an execution")
                .register(meterRegistry);

        this.ticksSkippedCounter = Counter.builder("push.ticks.skipped")
                .description("Ticks dropped because an execution was in progress")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("push.execution.duration")
                .description("Wall time of one push execution")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofMinutes(10))
                .register(meterRegistry);

        meterRegistry.gauge("push.registry.size", recipientRegistry, RecipientRegistry::size);
    }

    @EventListener
    public void onExecutionCompleted(PushExecutionCompletedEvent event) {
        if (event.isSkipped()) {
            ticksSkippedCounter.increment();
            return;
        }
        ExecutionRun run = event.getRun();
        String outcome = run.isAborted() ? "aborted" : run.getFailureCount() > 0 ? "partial" : "success";
        Counter.builder("push.executions")
                .description("Finished push executions")
                .tag("trigger", run.getTrigger().name().toLowerCase())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();

        messagesSentCounter.increment(run.getMessagesSent());
        messagesFailedCounter.increment(run.getMessagesFailed());
        recipientsFailedCounter.increment(run.getFailureCount());
        executionTimer.record(run.getDurationMs(), TimeUnit.MILLISECONDS);
    }
}
