package com.marketpush.scheduler;

import com.marketpush.config.PushProperties;
import com.marketpush.domain.enums.ExecutionTrigger;
import com.marketpush.domain.model.ExecutionRun;
import com.marketpush.domain.model.SchedulerStatus;
import com.marketpush.event.PushExecutionCompletedEvent;
import com.marketpush.exception.SchedulerAlreadyRunningException;
import com.marketpush.registry.RecipientRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Drives push executions on a timer.
 *
 * <p>States: stopped, running idle, running executing. Timed ticks, the accelerated
 * startup run and manual triggers all pass through one guard; whichever arrives while
 * an execution is in progress is dropped and counted, never queued.
 *
 * <p>{@link #stop()} only cancels future ticks. An execution already in progress
 * finishes normally.
 */
@Component
public class PushScheduler {

    private static final Logger log = LoggerFactory.getLogger(PushScheduler.class);

    private final TaskScheduler taskScheduler;
    private final PushExecutionService pushExecutionService;
    private final RecipientRegistry recipientRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final PushProperties pushProperties;

    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final AtomicLong totalRuns = new AtomicLong();
    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();

    private ScheduledFuture<?> recurringTask;
    private ScheduledFuture<?> startupTask;
    private IntervalSpec intervalSpec;

    private volatile ExecutionRun lastRun;
    private volatile Instant lastRunAt;

    public PushScheduler(
            @Qualifier("pushTaskScheduler") TaskScheduler taskScheduler,
            PushExecutionService pushExecutionService,
            RecipientRegistry recipientRegistry,
            ApplicationEventPublisher eventPublisher,
            PushProperties pushProperties) {
        this.taskScheduler = taskScheduler;
        this.pushExecutionService = pushExecutionService;
        this.recipientRegistry = recipientRegistry;
        this.eventPublisher = eventPublisher;
        this.pushProperties = pushProperties;
    }

    /**
     * Starts recurring executions and schedules one accelerated run shortly after.
     *
     * @throws SchedulerAlreadyRunningException when already started
     */
    public synchronized void start(IntervalSpec spec) {
        if (recurringTask != null) {
            throw new SchedulerAlreadyRunningException("Push scheduler already running " + intervalSpec.describe());
        }
        Duration initialDelay = pushProperties.getScheduler().getInitialDelay();
        recurringTask = taskScheduler.schedule(() -> runGuarded(ExecutionTrigger.SCHEDULED), spec.toTrigger());
        startupTask = taskScheduler.schedule(
                () -> runGuarded(ExecutionTrigger.STARTUP), Instant.now().plus(initialDelay));
        intervalSpec = spec;
        log.info("Push scheduler started {}, first run in {} ms", spec.describe(), initialDelay.toMillis());
    }

    /** Cancels future ticks. No-op when already stopped. */
    public synchronized void stop() {
        if (recurringTask == null) {
            return;
        }
        recurringTask.cancel(false);
        if (startupTask != null) {
            startupTask.cancel(false);
        }
        recurringTask = null;
        startupTask = null;
        log.info("Push scheduler stopped{}", executing.get() ? ", in-flight execution will finish" : "");
    }

    public synchronized boolean isRunning() {
        return recurringTask != null;
    }

    public boolean isExecuting() {
        return executing.get();
    }

    /**
     * Runs one execution on the calling thread. Works whether or not the timer is
     * running.
     *
     * @return the finished run, or empty when another execution was in progress
     */
    public Optional<ExecutionRun> triggerManual() {
        log.info("Manual push execution requested");
        return runGuarded(ExecutionTrigger.MANUAL);
    }

    Optional<ExecutionRun> runGuarded(ExecutionTrigger trigger) {
        if (!executing.compareAndSet(false, true)) {
            long skipped = skippedTicks.incrementAndGet();
            log.warn("{} push execution skipped, previous execution still in progress ({} skipped so far)", trigger, skipped);
            eventPublisher.publishEvent(new PushExecutionCompletedEvent(this, null, true));
            return Optional.empty();
        }

        ExecutionRun run;
        try {
            run = pushExecutionService.execute(trigger);
        } catch (RuntimeException e) {
            log.error("{} push execution aborted before processing recipients", trigger, e);
            Instant now = Instant.now();
            run = ExecutionRun.builder()
                    .executionId(PushExecutionService.newExecutionId(now))
                    .trigger(trigger)
                    .startedAt(now)
                    .finishedAt(now)
                    .aborted(true)
                    .build();
        } finally {
            executing.set(false);
        }

        totalRuns.incrementAndGet();
        successCount.addAndGet(run.getSuccessCount());
        failureCount.addAndGet(run.getFailureCount());
        lastRun = run;
        lastRunAt = run.getFinishedAt();

        eventPublisher.publishEvent(new PushExecutionCompletedEvent(this, run, false));
        return Optional.of(run);
    }

    public SchedulerStatus getStatus() {
        IntervalSpec spec;
        boolean running;
        synchronized (this) {
            spec = intervalSpec;
            running = recurringTask != null;
        }
        return SchedulerStatus.builder()
                .running(running)
                .executing(executing.get())
                .schedule(spec != null ? spec.describe() : null)
                .lastRunAt(lastRunAt)
                .lastRun(lastRun)
                .totalRuns(totalRuns.get())
                .successCount(successCount.get())
                .failureCount(failureCount.get())
                .skippedTicks(skippedTicks.get())
                .trackedRecipients(recipientRegistry.size())
                .build();
    }
}
