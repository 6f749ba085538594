package com.marketpush.api.controller;

import com.marketpush.api.dto.request.GroupMembershipRequest;
import com.marketpush.api.dto.request.RecipientSettingsRequest;
import com.marketpush.api.dto.response.DedupClearResponse;
import com.marketpush.api.dto.response.RecipientResponse;
import com.marketpush.api.dto.response.TriggerResponse;
import com.marketpush.api.dto.response.UpstreamHealthResponse;
import com.marketpush.dedup.PushDeduplicator;
import com.marketpush.domain.enums.ContentCategory;
import com.marketpush.domain.model.BoundGroup;
import com.marketpush.domain.model.ExecutionRun;
import com.marketpush.domain.model.PushSettings;
import com.marketpush.domain.model.SchedulerStatus;
import com.marketpush.event.RecipientSettingsChangedEvent;
import com.marketpush.exception.ResourceNotFoundException;
import com.marketpush.group.GroupMembershipService;
import com.marketpush.registry.RecipientRegistry;
import com.marketpush.scheduler.PushExecutionService;
import com.marketpush.scheduler.PushScheduler;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator API for the push engine.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/push/status} -- scheduler state and cumulative counters</li>
 *   <li>{@code POST /api/push/trigger} -- run one execution now</li>
 *   <li>{@code GET /api/push/recipients} -- tracked recipients with their settings</li>
 *   <li>{@code PUT /api/push/recipients/{recipientId}} -- upsert settings (all off removes)</li>
 *   <li>{@code DELETE /api/push/recipients/{recipientId}} -- stop tracking a recipient</li>
 *   <li>{@code DELETE /api/push/dedup/{scopeId}} -- forget deliveries for a scope</li>
 *   <li>{@code POST /api/push/groups/{groupId}/membership} -- bot joined or left a group</li>
 *   <li>{@code GET /api/push/health/{recipientId}} -- upstream reachability for a recipient</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/push")
public class PushController {

    private final PushScheduler pushScheduler;
    private final PushExecutionService pushExecutionService;
    private final RecipientRegistry recipientRegistry;
    private final PushDeduplicator pushDeduplicator;
    private final GroupMembershipService groupMembershipService;
    private final ApplicationEventPublisher eventPublisher;

    public PushController(
            PushScheduler pushScheduler,
            PushExecutionService pushExecutionService,
            RecipientRegistry recipientRegistry,
            PushDeduplicator pushDeduplicator,
            GroupMembershipService groupMembershipService,
            ApplicationEventPublisher eventPublisher) {
        this.pushScheduler = pushScheduler;
        this.pushExecutionService = pushExecutionService;
        this.recipientRegistry = recipientRegistry;
        this.pushDeduplicator = pushDeduplicator;
        this.groupMembershipService = groupMembershipService;
        this.eventPublisher = eventPublisher;
    }

    @GetMapping("/status")
    public SchedulerStatus getStatus() {
        return pushScheduler.getStatus();
    }

    @PostMapping("/trigger")
    public TriggerResponse trigger() {
        Optional<ExecutionRun> run = pushScheduler.triggerManual();
        return TriggerResponse.builder().skipped(run.isEmpty()).run(run.orElse(null)).build();
    }

    @GetMapping("/recipients")
    public List<RecipientResponse> listRecipients() {
        List<RecipientResponse> responses = new ArrayList<>();
        for (String recipientId : recipientRegistry.list()) {
            // may have been removed since list() was taken
            recipientRegistry.get(recipientId).ifPresent(settings -> responses.add(RecipientResponse.of(recipientId, settings)));
        }
        return responses;
    }

    @PutMapping("/recipients/{recipientId}")
    public RecipientResponse updateRecipient(
            @PathVariable String recipientId, @Valid @RequestBody RecipientSettingsRequest request) {
        PushSettings settings = toSettings(request);
        eventPublisher.publishEvent(new RecipientSettingsChangedEvent(this, recipientId, settings));
        return RecipientResponse.of(recipientId, settings);
    }

    @DeleteMapping("/recipients/{recipientId}")
    public Map<String, String> removeRecipient(@PathVariable String recipientId) {
        if (!recipientRegistry.contains(recipientId)) {
            throw new ResourceNotFoundException("Recipient", recipientId);
        }
        recipientRegistry.remove(recipientId);
        return Map.of("message", "Recipient " + recipientId + " removed");
    }

    @DeleteMapping("/dedup/{scopeId}")
    public DedupClearResponse clearDedup(
            @PathVariable String scopeId, @RequestParam(required = false) String category) {
        ContentCategory contentCategory = category != null ? ContentCategory.fromKey(category) : null;
        int cleared = pushDeduplicator.clearScope(scopeId, contentCategory);
        return DedupClearResponse.builder()
                .scopeId(scopeId)
                .category(contentCategory != null ? contentCategory.getKey() : "all")
                .cleared(cleared)
                .build();
    }

    @PostMapping("/groups/{groupId}/membership")
    public Map<String, Object> updateGroupMembership(
            @PathVariable String groupId, @Valid @RequestBody GroupMembershipRequest request) {
        if (request.getPresent()) {
            groupMembershipService.onBotAdded(groupId);
        } else {
            groupMembershipService.onBotRemoved(groupId);
        }
        return Map.of("groupId", groupId, "present", request.getPresent());
    }

    @GetMapping("/health/{recipientId}")
    public UpstreamHealthResponse checkUpstreamHealth(@PathVariable String recipientId) {
        return UpstreamHealthResponse.builder()
                .recipientId(recipientId)
                .upstreamHealthy(pushExecutionService.checkUpstreamHealth(recipientId))
                .build();
    }

    private PushSettings toSettings(RecipientSettingsRequest request) {
        List<BoundGroup> groups = new ArrayList<>();
        if (request.getBoundGroups() != null) {
            String boundAt = Instant.now().toString();
            for (RecipientSettingsRequest.Group group : request.getBoundGroups()) {
                groups.add(new BoundGroup(group.getGroupId(), group.getGroupName(), boundAt));
            }
        }
        return PushSettings.builder()
                .news(request.isNews())
                .largeTransfer(request.isLargeTransfer())
                .fundFlow(request.isFundFlow())
                .boundGroups(groups)
                .build();
    }
}
