package com.marketpush.unit.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.marketpush.config.PushProperties;
import com.marketpush.scheduler.IntervalSpec;
import com.marketpush.scheduler.PushScheduler;
import com.marketpush.scheduler.PushSchedulerStarter;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.context.event.ApplicationReadyEvent;

@ExtendWith(MockitoExtension.class)
class PushSchedulerStarterTest {

    @Mock
    private PushScheduler pushScheduler;

    private PushProperties pushProperties;
    private PushSchedulerStarter starter;

    @BeforeEach
    void setUp() {
        pushProperties = new PushProperties();
        starter = new PushSchedulerStarter(pushScheduler, pushProperties);
    }

    private IntervalSpec startedWith() {
        ArgumentCaptor<IntervalSpec> spec = ArgumentCaptor.forClass(IntervalSpec.class);
        verify(pushScheduler).start(spec.capture());
        return spec.getValue();
    }

    @Test
    @DisplayName("starts on the configured interval once the application is ready")
    void startsWithInterval() {
        pushProperties.getScheduler().setInterval(Duration.ofMinutes(5));

        starter.onApplicationEvent(mock(ApplicationReadyEvent.class));

        assertThat(startedWith().getPeriod()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("a cron expression takes precedence over the interval")
    void cronWins() {
        pushProperties.getScheduler().setCron("0 */20 * * * *");
        pushProperties.getScheduler().setZone("UTC");

        starter.onApplicationEvent(mock(ApplicationReadyEvent.class));

        assertThat(startedWith().isCron()).isTrue();
    }

    @Test
    @DisplayName("does nothing when the scheduler is disabled")
    void disabled() {
        pushProperties.getScheduler().setEnabled(false);

        starter.onApplicationEvent(mock(ApplicationReadyEvent.class));

        verify(pushScheduler, never()).start(any());
    }

    @Test
    @DisplayName("stops the scheduler on shutdown")
    void stopsOnShutdown() {
        starter.shutdown();

        verify(pushScheduler).stop();
    }
}
