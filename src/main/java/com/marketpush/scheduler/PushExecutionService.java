package com.marketpush.scheduler;

import com.marketpush.dispatch.FanOutDispatcher;
import com.marketpush.domain.enums.ContentCategory;
import com.marketpush.domain.enums.ExecutionTrigger;
import com.marketpush.domain.model.BoundGroup;
import com.marketpush.domain.model.ContentItem;
import com.marketpush.domain.model.DeliveryResult;
import com.marketpush.domain.model.ExecutionRun;
import com.marketpush.domain.model.PushSettings;
import com.marketpush.domain.model.Recipient;
import com.marketpush.domain.model.RecipientContent;
import com.marketpush.exception.BaseException;
import com.marketpush.filter.CategoryFilter;
import com.marketpush.registry.RecipientRegistry;
import com.marketpush.source.AuthenticatedCallExecutor;
import com.marketpush.source.ContentSource;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * One push execution over every tracked recipient.
 *
 * <p>Per recipient: fetch settings and content (refresh-and-retry once on an expired
 * credential), drop the recipient when upstream shows everything disabled, otherwise
 * store the refreshed settings, filter the batch and deliver it to the user and to each
 * bound group. Recipients run on the worker pool and are joined before the run returns.
 * A group bound by several users is delivered to once per execution, by whichever of
 * them claims it first, so concurrent workers never share a group dedup scope.
 *
 * <p>Errors for one recipient are contained and counted; only a failure to take the
 * registry snapshot escapes, and the scheduler turns that into an aborted run.
 */
@Service
public class PushExecutionService {

    private static final Logger log = LoggerFactory.getLogger(PushExecutionService.class);

    private final RecipientRegistry recipientRegistry;
    private final ContentSource contentSource;
    private final AuthenticatedCallExecutor authenticatedCallExecutor;
    private final CategoryFilter categoryFilter;
    private final FanOutDispatcher fanOutDispatcher;
    private final Executor workerExecutor;

    public PushExecutionService(
            RecipientRegistry recipientRegistry,
            ContentSource contentSource,
            AuthenticatedCallExecutor authenticatedCallExecutor,
            CategoryFilter categoryFilter,
            FanOutDispatcher fanOutDispatcher,
            @Qualifier("pushWorkerExecutor") Executor workerExecutor) {
        this.recipientRegistry = recipientRegistry;
        this.contentSource = contentSource;
        this.authenticatedCallExecutor = authenticatedCallExecutor;
        this.categoryFilter = categoryFilter;
        this.fanOutDispatcher = fanOutDispatcher;
        this.workerExecutor = workerExecutor;
    }

    public ExecutionRun execute(ExecutionTrigger trigger) {
        Instant startedAt = Instant.now();
        String executionId = newExecutionId(startedAt);

        List<String> recipientIds = recipientRegistry.list();
        log.info("[{}] {} push execution started for {} recipients", executionId, trigger, recipientIds.size());

        Set<String> claimedGroups = ConcurrentHashMap.newKeySet();
        List<CompletableFuture<RecipientOutcome>> futures = new ArrayList<>(recipientIds.size());
        for (String recipientId : recipientIds) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> processRecipient(executionId, recipientId, claimedGroups), workerExecutor));
        }

        ExecutionRun run = ExecutionRun.builder()
                .executionId(executionId)
                .trigger(trigger)
                .startedAt(startedAt)
                .recipientsProcessed(recipientIds.size())
                .build();

        for (CompletableFuture<RecipientOutcome> future : futures) {
            RecipientOutcome outcome = future.join();
            switch (outcome.status()) {
                case SUCCESS -> run.setSuccessCount(run.getSuccessCount() + 1);
                case FAILURE -> run.setFailureCount(run.getFailureCount() + 1);
                case REMOVED -> run.setRemovedCount(run.getRemovedCount() + 1);
            }
            run.setMessagesSent(run.getMessagesSent() + outcome.sent());
            run.setMessagesFailed(run.getMessagesFailed() + outcome.failed());
            run.setItemsDropped(run.getItemsDropped() + outcome.dropped());
        }

        Instant finishedAt = Instant.now();
        run.setFinishedAt(finishedAt);
        run.setDurationMs(Duration.between(startedAt, finishedAt).toMillis());

        log.info(
                "[{}] Push execution finished in {} ms: success={}, failure={}, removed={}, sent={}, failed={}, dropped={}",
                executionId,
                run.getDurationMs(),
                run.getSuccessCount(),
                run.getFailureCount(),
                run.getRemovedCount(),
                run.getMessagesSent(),
                run.getMessagesFailed(),
                run.getItemsDropped());
        return run;
    }

    /** Checks upstream reachability for one recipient through the authenticated path. */
    public boolean checkUpstreamHealth(String recipientId) {
        try {
            return authenticatedCallExecutor.execute(
                    recipientId, credential -> contentSource.healthCheck(recipientId, credential));
        } catch (BaseException e) {
            log.warn("Upstream health check for {} failed: {}", recipientId, e.getMessage());
            return false;
        }
    }

    RecipientOutcome processRecipient(String executionId, String recipientId, Set<String> claimedGroups) {
        RecipientContent content;
        try {
            content = authenticatedCallExecutor.execute(
                    recipientId, credential -> contentSource.fetch(recipientId, credential));
        } catch (BaseException e) {
            log.warn("[{}] Recipient {} skipped this cycle: {} {}", executionId, recipientId, e.getErrorCode(), e.getMessage());
            return RecipientOutcome.failure();
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error fetching content for {}", executionId, recipientId, e);
            return RecipientOutcome.failure();
        }

        PushSettings settings = content.getSettings();
        if (!settings.isAnyEnabled()) {
            recipientRegistry.remove(recipientId);
            log.info("[{}] Recipient {} has every category disabled upstream, removed", executionId, recipientId);
            return RecipientOutcome.removed();
        }
        if (!recipientRegistry.refresh(recipientId, settings)) {
            log.info("[{}] Recipient {} was removed during the execution, not delivering", executionId, recipientId);
            return RecipientOutcome.removed();
        }

        Map<ContentCategory, List<ContentItem>> candidates = categoryFilter.filter(content.getBatch(), settings);

        List<DeliveryResult> results = new ArrayList<>();
        results.add(deliverSafely(executionId, Recipient.user(recipientId, settings), candidates));

        for (BoundGroup group : settings.getBoundGroups()) {
            if (recipientRegistry.isGroupDeparted(group.getGroupId())) {
                log.debug("[{}] Skipping departed group {} of {}", executionId, group.getGroupId(), recipientId);
                continue;
            }
            if (!claimedGroups.add(group.getGroupId())) {
                log.debug("[{}] Group {} already served by another user this execution", executionId, group.getGroupId());
                continue;
            }
            results.add(deliverSafely(executionId, Recipient.group(group.getGroupId(), settings), candidates));
        }

        int sent = 0;
        int failed = 0;
        int dropped = 0;
        for (DeliveryResult result : results) {
            sent += result.getSent();
            failed += result.getFailed();
            dropped += result.getDropped();
        }
        return failed == 0
                ? RecipientOutcome.success(sent, dropped)
                : RecipientOutcome.failure(sent, failed, dropped);
    }

    private DeliveryResult deliverSafely(
            String executionId, Recipient recipient, Map<ContentCategory, List<ContentItem>> candidates) {
        try {
            return fanOutDispatcher.deliver(recipient, candidates);
        } catch (RuntimeException e) {
            log.error("[{}] Delivery to {} aborted", executionId, recipient.getScopeId(), e);
            return new DeliveryResult(recipient.getChannelId(), 0, 1, 0);
        }
    }

    static String newExecutionId(Instant at) {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "push_" + at.toEpochMilli() + "_" + suffix.substring(0, Math.min(9, suffix.length()));
    }

    enum OutcomeStatus {
        SUCCESS,
        FAILURE,
        REMOVED
    }

    record RecipientOutcome(OutcomeStatus status, int sent, int failed, int dropped) {

        static RecipientOutcome success(int sent, int dropped) {
            return new RecipientOutcome(OutcomeStatus.SUCCESS, sent, 0, dropped);
        }

        static RecipientOutcome failure() {
            return new RecipientOutcome(OutcomeStatus.FAILURE, 0, 0, 0);
        }

        static RecipientOutcome failure(int sent, int failed, int dropped) {
            return new RecipientOutcome(OutcomeStatus.FAILURE, sent, failed, dropped);
        }

        static RecipientOutcome removed() {
            return new RecipientOutcome(OutcomeStatus.REMOVED, 0, 0, 0);
        }
    }
}
