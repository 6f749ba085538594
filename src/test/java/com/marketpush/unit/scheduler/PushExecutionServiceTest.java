package com.marketpush.unit.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.marketpush.config.PushProperties;
import com.marketpush.dispatch.FanOutDispatcher;
import com.marketpush.domain.enums.ContentCategory;
import com.marketpush.domain.enums.ExecutionTrigger;
import com.marketpush.domain.enums.RecipientKind;
import com.marketpush.domain.model.BoundGroup;
import com.marketpush.domain.model.ContentBatch;
import com.marketpush.domain.model.ContentItem;
import com.marketpush.domain.model.DeliveryResult;
import com.marketpush.domain.model.ExecutionRun;
import com.marketpush.domain.model.NewsPayload;
import com.marketpush.domain.model.PushSettings;
import com.marketpush.domain.model.Recipient;
import com.marketpush.domain.model.RecipientContent;
import com.marketpush.exception.AuthExpiredException;
import com.marketpush.exception.UpstreamUnavailableException;
import com.marketpush.filter.AmountParser;
import com.marketpush.filter.CategoryFilter;
import com.marketpush.registry.RecipientRegistry;
import com.marketpush.scheduler.PushExecutionService;
import com.marketpush.source.AuthenticatedCallExecutor;
import com.marketpush.source.ContentSource;
import com.marketpush.source.CredentialProvider;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PushExecutionServiceTest {

    private static final String TS = "2025-03-01T08:00:00Z";

    @Mock
    private ContentSource contentSource;

    @Mock
    private CredentialProvider credentialProvider;

    @Mock
    private FanOutDispatcher fanOutDispatcher;

    private RecipientRegistry registry;
    private PushExecutionService service;

    @BeforeEach
    void setUp() {
        registry = new RecipientRegistry();
        service = new PushExecutionService(
                registry,
                contentSource,
                new AuthenticatedCallExecutor(credentialProvider),
                new CategoryFilter(new AmountParser(), new PushProperties()),
                fanOutDispatcher,
                Runnable::run);
    }

    private static PushSettings newsOnly(BoundGroup... groups) {
        return PushSettings.builder().news(true).boundGroups(List.of(groups)).build();
    }

    private static RecipientContent contentWithNews(PushSettings settings) {
        ContentItem item = ContentItem.of(ContentCategory.NEWS, NewsPayload.builder().title("BTC ETF").build(), TS);
        return new RecipientContent(settings, ContentBatch.builder().news(List.of(item)).build());
    }

    private void tokenFor(String recipientId) {
        when(credentialProvider.getToken(recipientId)).thenReturn("token-" + recipientId);
    }

    @Nested
    @DisplayName("Settings self-heal")
    class SelfHeal {

        @Test
        @DisplayName("a recipient with everything disabled upstream is removed and not delivered to")
        void removesDisabledRecipient() {
            registry.add("1001", newsOnly());
            tokenFor("1001");
            when(contentSource.fetch("1001", "token-1001"))
                    .thenReturn(new RecipientContent(PushSettings.allDisabled(), ContentBatch.empty()));

            ExecutionRun run = service.execute(ExecutionTrigger.MANUAL);

            assertThat(registry.contains("1001")).isFalse();
            assertThat(run.getRemovedCount()).isEqualTo(1);
            assertThat(run.getSuccessCount()).isZero();
            assertThat(run.getFailureCount()).isZero();
            verify(fanOutDispatcher, never()).deliver(any(), any());
        }

        @Test
        @DisplayName("the registry picks up the refreshed settings")
        void refreshesSettings() {
            registry.add("1001", newsOnly());
            PushSettings upstream = PushSettings.builder().news(true).fundFlow(true).build();
            tokenFor("1001");
            when(contentSource.fetch("1001", "token-1001"))
                    .thenReturn(new RecipientContent(upstream, ContentBatch.empty()));
            when(fanOutDispatcher.deliver(any(), any())).thenReturn(DeliveryResult.empty("1001"));

            service.execute(ExecutionTrigger.SCHEDULED);

            assertThat(registry.get("1001")).hasValueSatisfying(settings -> assertThat(settings.isFundFlow()).isTrue());
        }
    }

    @Nested
    @DisplayName("Fan-out")
    class FanOut {

        @Test
        @DisplayName("delivers to the user and to every bound group that is still present")
        void userAndGroups() {
            PushSettings settings = newsOnly(
                    new BoundGroup("-100A", "A", null), new BoundGroup("-100B", "B", null));
            registry.add("1001", settings);
            registry.markGroupDeparted("-100B");
            tokenFor("1001");
            when(contentSource.fetch("1001", "token-1001")).thenReturn(contentWithNews(settings));
            when(fanOutDispatcher.deliver(any(), any())).thenReturn(new DeliveryResult("x", 1, 0, 0));

            ExecutionRun run = service.execute(ExecutionTrigger.SCHEDULED);

            ArgumentCaptor<Recipient> recipients = ArgumentCaptor.forClass(Recipient.class);
            verify(fanOutDispatcher, times(2)).deliver(recipients.capture(), any());
            assertThat(recipients.getAllValues())
                    .extracting(Recipient::getKind, Recipient::getChannelId)
                    .containsExactly(
                            tuple(RecipientKind.USER, "1001"),
                            tuple(RecipientKind.GROUP, "-100A"));
            assertThat(run.getSuccessCount()).isEqualTo(1);
            assertThat(run.getMessagesSent()).isEqualTo(2);
        }

        @Test
        @DisplayName("a group bound by two users is delivered to once per execution")
        void sharedGroupDeliveredOnce() {
            BoundGroup shared = new BoundGroup("-100S", "Shared", null);
            PushSettings settings = newsOnly(shared);
            registry.add("1001", settings);
            registry.add("1002", settings);
            tokenFor("1001");
            tokenFor("1002");
            when(contentSource.fetch("1001", "token-1001")).thenReturn(contentWithNews(settings));
            when(contentSource.fetch("1002", "token-1002")).thenReturn(contentWithNews(settings));
            when(fanOutDispatcher.deliver(any(), any())).thenReturn(new DeliveryResult("x", 1, 0, 0));

            ExecutionRun run = service.execute(ExecutionTrigger.SCHEDULED);

            ArgumentCaptor<Recipient> recipients = ArgumentCaptor.forClass(Recipient.class);
            verify(fanOutDispatcher, times(3)).deliver(recipients.capture(), any());
            assertThat(recipients.getAllValues())
                    .extracting(Recipient::getKind, Recipient::getChannelId)
                    .containsExactlyInAnyOrder(
                            tuple(RecipientKind.USER, "1001"),
                            tuple(RecipientKind.USER, "1002"),
                            tuple(RecipientKind.GROUP, "-100S"));
            assertThat(run.getSuccessCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("only categories the recipient enabled reach the dispatcher")
        void filtersByCategory() {
            PushSettings settings = PushSettings.builder().largeTransfer(true).build();
            registry.add("1001", settings);
            tokenFor("1001");
            when(contentSource.fetch("1001", "token-1001")).thenReturn(contentWithNews(settings));
            when(fanOutDispatcher.deliver(any(), any())).thenReturn(DeliveryResult.empty("1001"));

            service.execute(ExecutionTrigger.SCHEDULED);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<ContentCategory, List<ContentItem>>> candidates = ArgumentCaptor.forClass(Map.class);
            verify(fanOutDispatcher).deliver(any(), candidates.capture());
            assertThat(candidates.getValue().get(ContentCategory.NEWS)).isEmpty();
        }

        @Test
        @DisplayName("a failed send marks the recipient failed")
        void failedSendCounts() {
            PushSettings settings = newsOnly();
            registry.add("1001", settings);
            tokenFor("1001");
            when(contentSource.fetch("1001", "token-1001")).thenReturn(contentWithNews(settings));
            when(fanOutDispatcher.deliver(any(), any())).thenReturn(new DeliveryResult("1001", 0, 1, 0));

            ExecutionRun run = service.execute(ExecutionTrigger.SCHEDULED);

            assertThat(run.getFailureCount()).isEqualTo(1);
            assertThat(run.getMessagesFailed()).isEqualTo(1);
        }

        @Test
        @DisplayName("nothing new to send still counts as success")
        void emptyIsSuccess() {
            PushSettings settings = newsOnly();
            registry.add("1001", settings);
            tokenFor("1001");
            when(contentSource.fetch("1001", "token-1001"))
                    .thenReturn(new RecipientContent(settings, ContentBatch.empty()));
            when(fanOutDispatcher.deliver(any(), any())).thenReturn(DeliveryResult.empty("1001"));

            ExecutionRun run = service.execute(ExecutionTrigger.SCHEDULED);

            assertThat(run.getSuccessCount()).isEqualTo(1);
            assertThat(run.getMessagesSent()).isZero();
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("an upstream failure for one recipient does not affect the others")
        void oneFailsOthersProceed() {
            PushSettings settings = newsOnly();
            registry.add("1001", settings);
            registry.add("1002", settings);
            tokenFor("1001");
            tokenFor("1002");
            when(contentSource.fetch("1001", "token-1001")).thenThrow(new UpstreamUnavailableException("timeout"));
            when(contentSource.fetch("1002", "token-1002")).thenReturn(contentWithNews(settings));
            when(fanOutDispatcher.deliver(any(), any())).thenReturn(new DeliveryResult("1002", 1, 0, 0));

            ExecutionRun run = service.execute(ExecutionTrigger.SCHEDULED);

            assertThat(run.getRecipientsProcessed()).isEqualTo(2);
            assertThat(run.getFailureCount()).isEqualTo(1);
            assertThat(run.getSuccessCount()).isEqualTo(1);
            assertThat(registry.contains("1001")).isTrue();
        }

        @Test
        @DisplayName("an unexpected dispatcher error is contained to the recipient")
        void dispatcherCrash() {
            PushSettings settings = newsOnly();
            registry.add("1001", settings);
            tokenFor("1001");
            when(contentSource.fetch("1001", "token-1001")).thenReturn(contentWithNews(settings));
            when(fanOutDispatcher.deliver(any(), any())).thenThrow(new IllegalStateException("boom"));

            ExecutionRun run = service.execute(ExecutionTrigger.SCHEDULED);

            assertThat(run.getFailureCount()).isEqualTo(1);
            assertThat(run.isAborted()).isFalse();
        }

        @Test
        @DisplayName("an expired credential is refreshed and the fetch retried once")
        void authRetry() {
            PushSettings settings = newsOnly();
            registry.add("1001", settings);
            when(credentialProvider.getToken("1001")).thenReturn("stale");
            when(credentialProvider.refreshToken("1001")).thenReturn("fresh");
            when(contentSource.fetch("1001", "stale")).thenThrow(new AuthExpiredException("401"));
            when(contentSource.fetch("1001", "fresh")).thenReturn(contentWithNews(settings));
            when(fanOutDispatcher.deliver(any(), any())).thenReturn(new DeliveryResult("1001", 1, 0, 0));

            ExecutionRun run = service.execute(ExecutionTrigger.SCHEDULED);

            assertThat(run.getSuccessCount()).isEqualTo(1);
            verify(credentialProvider).refreshToken("1001");
        }
    }

    @Test
    @DisplayName("an empty registry finishes immediately with zero counts")
    void emptyRegistry() {
        ExecutionRun run = service.execute(ExecutionTrigger.STARTUP);

        assertThat(run.getRecipientsProcessed()).isZero();
        assertThat(run.getTrigger()).isEqualTo(ExecutionTrigger.STARTUP);
        assertThat(run.getExecutionId()).matches("push_\\d+_[0-9a-z]{1,9}");
        assertThat(run.getFinishedAt()).isAfterOrEqualTo(run.getStartedAt());
    }

    @Test
    @DisplayName("upstream health goes through the authenticated path")
    void upstreamHealth() {
        tokenFor("1001");
        when(contentSource.healthCheck("1001", "token-1001")).thenReturn(true);

        assertThat(service.checkUpstreamHealth("1001")).isTrue();
    }
}
