package com.marketpush.unit.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.marketpush.config.PushProperties;
import com.marketpush.domain.enums.ExecutionTrigger;
import com.marketpush.domain.model.ExecutionRun;
import com.marketpush.domain.model.SchedulerStatus;
import com.marketpush.event.PushExecutionCompletedEvent;
import com.marketpush.exception.SchedulerAlreadyRunningException;
import com.marketpush.registry.RecipientRegistry;
import com.marketpush.scheduler.IntervalSpec;
import com.marketpush.scheduler.PushExecutionService;
import com.marketpush.scheduler.PushScheduler;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

@ExtendWith(MockitoExtension.class)
class PushSchedulerTest {

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private PushExecutionService pushExecutionService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private PushScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new PushScheduler(
                taskScheduler, pushExecutionService, new RecipientRegistry(), eventPublisher, new PushProperties());
    }

    private static ExecutionRun run(ExecutionTrigger trigger, int success, int failure) {
        Instant now = Instant.now();
        return ExecutionRun.builder()
                .executionId("push_1_abc")
                .trigger(trigger)
                .startedAt(now)
                .finishedAt(now)
                .recipientsProcessed(success + failure)
                .successCount(success)
                .failureCount(failure)
                .build();
    }

    private ScheduledFuture<?> stubScheduling() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        return future;
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("start schedules the recurring task and an accelerated first run")
        void startSchedulesBoth() {
            stubScheduling();

            scheduler.start(IntervalSpec.every(Duration.ofMinutes(20)));

            verify(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
            verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
            assertThat(scheduler.isRunning()).isTrue();
            assertThat(scheduler.getStatus().getSchedule()).isEqualTo("every PT20M");
        }

        @Test
        @DisplayName("starting twice is rejected")
        void startTwice() {
            stubScheduling();
            scheduler.start(IntervalSpec.every(Duration.ofMinutes(20)));

            assertThatThrownBy(() -> scheduler.start(IntervalSpec.every(Duration.ofMinutes(5))))
                    .isInstanceOf(SchedulerAlreadyRunningException.class);
        }

        @Test
        @DisplayName("stop cancels future ticks without interrupting and can be repeated")
        void stopCancels() {
            ScheduledFuture<?> future = stubScheduling();
            scheduler.start(IntervalSpec.every(Duration.ofMinutes(20)));

            scheduler.stop();
            scheduler.stop();

            verify(future, times(2)).cancel(false);
            assertThat(scheduler.isRunning()).isFalse();
        }

        @Test
        @DisplayName("the recurring task runs a scheduled execution")
        void recurringTaskRuns() {
            stubScheduling();
            when(pushExecutionService.execute(ExecutionTrigger.SCHEDULED))
                    .thenReturn(run(ExecutionTrigger.SCHEDULED, 1, 0));
            scheduler.start(IntervalSpec.every(Duration.ofMinutes(20)));

            ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler).schedule(task.capture(), any(Trigger.class));
            task.getValue().run();

            verify(pushExecutionService).execute(ExecutionTrigger.SCHEDULED);
            assertThat(scheduler.getStatus().getTotalRuns()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Execution guard")
    class ExecutionGuard {

        @Test
        @DisplayName("a manual trigger runs even while the timer is stopped")
        void manualWhileStopped() {
            when(pushExecutionService.execute(ExecutionTrigger.MANUAL)).thenReturn(run(ExecutionTrigger.MANUAL, 2, 1));

            Optional<ExecutionRun> result = scheduler.triggerManual();

            assertThat(result).isPresent();
            SchedulerStatus status = scheduler.getStatus();
            assertThat(status.isRunning()).isFalse();
            assertThat(status.getTotalRuns()).isEqualTo(1);
            assertThat(status.getSuccessCount()).isEqualTo(2);
            assertThat(status.getFailureCount()).isEqualTo(1);
            assertThat(status.getLastRun()).isSameAs(result.get());

            ArgumentCaptor<PushExecutionCompletedEvent> event = ArgumentCaptor.forClass(PushExecutionCompletedEvent.class);
            verify(eventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().isSkipped()).isFalse();
        }

        @Test
        @DisplayName("a trigger arriving during an execution is skipped, not queued")
        void overlappingTriggerSkipped() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(pushExecutionService.execute(ExecutionTrigger.MANUAL)).thenAnswer(invocation -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return run(ExecutionTrigger.MANUAL, 1, 0);
            });

            CompletableFuture<Optional<ExecutionRun>> first = CompletableFuture.supplyAsync(scheduler::triggerManual);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(scheduler.isExecuting()).isTrue();

            Optional<ExecutionRun> second = scheduler.triggerManual();
            release.countDown();

            assertThat(second).isEmpty();
            assertThat(first.get(5, TimeUnit.SECONDS)).isPresent();
            SchedulerStatus status = scheduler.getStatus();
            assertThat(status.getSkippedTicks()).isEqualTo(1);
            assertThat(status.getTotalRuns()).isEqualTo(1);
            assertThat(status.isExecuting()).isFalse();
        }

        @Test
        @DisplayName("an execution that throws becomes an aborted run and releases the guard")
        void abortedRun() {
            when(pushExecutionService.execute(ExecutionTrigger.MANUAL))
                    .thenThrow(new IllegalStateException("registry unavailable"))
                    .thenReturn(run(ExecutionTrigger.MANUAL, 1, 0));

            Optional<ExecutionRun> aborted = scheduler.triggerManual();
            Optional<ExecutionRun> next = scheduler.triggerManual();

            assertThat(aborted).hasValueSatisfying(r -> {
                assertThat(r.isAborted()).isTrue();
                assertThat(r.getTrigger()).isEqualTo(ExecutionTrigger.MANUAL);
                assertThat(r.getExecutionId()).startsWith("push_");
            });
            assertThat(next).hasValueSatisfying(r -> assertThat(r.isAborted()).isFalse());
        }
    }
}
