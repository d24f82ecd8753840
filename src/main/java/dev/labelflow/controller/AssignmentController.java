package dev.labelflow.controller;

import dev.labelflow.domain.valueobject.Actor;
import dev.labelflow.domain.valueobject.DistributionResult;
import dev.labelflow.domain.valueobject.UserAllocation;
import dev.labelflow.dto.request.ManualDistributionRequest;
import dev.labelflow.dto.request.SmartDistributionRequest;
import dev.labelflow.dto.response.AssignmentMetricsResponse;
import dev.labelflow.dto.response.AssignmentResponse;
import dev.labelflow.dto.response.DistributionResponse;
import dev.labelflow.dto.response.PageResponse;
import dev.labelflow.service.AssignmentQueryService;
import dev.labelflow.service.DistributionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/projects/{projectId}/assignments")
public class AssignmentController {
    private final DistributionService distributionService;
    private final AssignmentQueryService queryService;

    public AssignmentController(DistributionService distributionService, AssignmentQueryService queryService) {
        this.distributionService = distributionService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<DistributionResponse> distributeManual(@PathVariable UUID projectId,
                                                                 @Valid @RequestBody ManualDistributionRequest request,
                                                                 @AuthenticationPrincipal Actor actor) {
        DistributionResult result = distributionService.distributeManual(projectId,
                request.allocations().stream().map(a -> new UserAllocation(a.userId(), a.count())).toList(),
                actor.id(), request.resetDistribution());
        return ResponseEntity.ok(AssignmentQueryService.toResponse(result));
    }

    @PostMapping("/smart")
    public ResponseEntity<DistributionResponse> distributeSmart(@PathVariable UUID projectId,
                                                                @RequestBody(required = false) SmartDistributionRequest request,
                                                                @AuthenticationPrincipal Actor actor) {
        boolean reset = request != null && request.resetDistribution();
        return ResponseEntity.ok(AssignmentQueryService.toResponse(
                distributionService.distributeSmart(projectId, actor.id(), reset)));
    }

    @GetMapping
    public ResponseEntity<PageResponse<AssignmentResponse>> listAssignments(@PathVariable UUID projectId,
                                                                            @RequestParam(required = false) UUID userId,
                                                                            @RequestParam(defaultValue = "0") int page,
                                                                            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(userId == null
                ? queryService.listProjectAssignments(projectId, page, size)
                : queryService.listUserAssignments(projectId, userId, page, size));
    }

    @GetMapping("/mine")
    public ResponseEntity<PageResponse<AssignmentResponse>> listOwnAssignments(@PathVariable UUID projectId,
                                                                               @AuthenticationPrincipal Actor actor,
                                                                               @RequestParam(defaultValue = "0") int page,
                                                                               @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(queryService.listUserAssignments(projectId, actor.id(), page, size));
    }

    @GetMapping("/metrics")
    public ResponseEntity<AssignmentMetricsResponse> getMetrics(@PathVariable UUID projectId) {
        return ResponseEntity.ok(queryService.getAssignmentMetrics(projectId));
    }
}
