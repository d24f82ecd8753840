package dev.labelflow.controller;

import dev.labelflow.domain.entity.FlaggedImage;
import dev.labelflow.domain.entity.ImageFeedback;
import dev.labelflow.domain.entity.SubmissionReview;
import dev.labelflow.domain.enums.SubmissionStatus;
import dev.labelflow.domain.valueobject.Actor;
import dev.labelflow.domain.valueobject.ReviewDecision;
import dev.labelflow.domain.valueobject.SubmitEligibility;
import dev.labelflow.dto.request.ReviewRequest;
import dev.labelflow.dto.request.SubmitRequest;
import dev.labelflow.dto.response.EligibilityResponse;
import dev.labelflow.dto.response.ImageFeedbackResponse;
import dev.labelflow.dto.response.PageResponse;
import dev.labelflow.dto.response.SubmissionResponse;
import dev.labelflow.dto.response.SubmissionStatsResponse;
import dev.labelflow.dto.response.UserSubmissionStatusResponse;
import dev.labelflow.exception.ForbiddenException;
import dev.labelflow.service.SubmissionQueryService;
import dev.labelflow.service.SubmissionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Submission and review endpoints. Admins see every submission in the
 * project; other users only their own.
 */
@RestController
@RequestMapping("/projects/{projectId}/submissions")
public class SubmissionController {
    private final SubmissionService submissionService;
    private final SubmissionQueryService queryService;

    public SubmissionController(SubmissionService submissionService, SubmissionQueryService queryService) {
        this.submissionService = submissionService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<SubmissionResponse> submit(@PathVariable UUID projectId,
                                                     @Valid @RequestBody SubmitRequest request,
                                                     @AuthenticationPrincipal Actor actor) {
        SubmissionReview submission = submissionService.submitForReview(
                projectId, actor.id(), request.assignmentId(), request.message());
        return ResponseEntity.status(HttpStatus.CREATED).body(queryService.getSubmission(projectId, submission.getId()));
    }

    @PostMapping("/{submissionId}/review")
    public ResponseEntity<SubmissionResponse> review(@PathVariable UUID projectId, @PathVariable UUID submissionId,
                                                     @Valid @RequestBody ReviewRequest request,
                                                     @AuthenticationPrincipal Actor actor) {
        submissionService.reviewSubmission(projectId, submissionId, actor.id(), toDecision(request));
        return ResponseEntity.ok(queryService.getSubmission(projectId, submissionId));
    }

    @GetMapping
    public ResponseEntity<PageResponse<SubmissionResponse>> list(@PathVariable UUID projectId,
                                                                 @RequestParam(required = false) UUID userId,
                                                                 @RequestParam(required = false) SubmissionStatus status,
                                                                 @RequestParam(defaultValue = "0") int page,
                                                                 @RequestParam(defaultValue = "20") int size,
                                                                 @AuthenticationPrincipal Actor actor) {
        UUID owner = actor.isAdmin() ? userId : actor.id();
        return ResponseEntity.ok(queryService.listSubmissions(projectId, owner, status, page, size));
    }

    @GetMapping("/stats")
    public ResponseEntity<SubmissionStatsResponse> stats(@PathVariable UUID projectId) {
        return ResponseEntity.ok(queryService.getStats(projectId));
    }

    @GetMapping("/eligibility")
    public ResponseEntity<EligibilityResponse> eligibility(@PathVariable UUID projectId,
                                                           @RequestParam(required = false) UUID userId,
                                                           @AuthenticationPrincipal Actor actor) {
        SubmitEligibility e = submissionService.canUserSubmit(projectId, subject(actor, userId));
        return ResponseEntity.ok(new EligibilityResponse(e.canSubmit(), e.reason(), e.hasAssignedImages(),
                e.pendingSubmission()));
    }

    @GetMapping("/status")
    public ResponseEntity<UserSubmissionStatusResponse> status(@PathVariable UUID projectId,
                                                               @RequestParam(required = false) UUID userId,
                                                               @AuthenticationPrincipal Actor actor) {
        return ResponseEntity.ok(queryService.getUserStatus(projectId, subject(actor, userId)));
    }

    @GetMapping("/{submissionId}")
    public ResponseEntity<SubmissionResponse> get(@PathVariable UUID projectId, @PathVariable UUID submissionId,
                                                  @AuthenticationPrincipal Actor actor) {
        requireOwnerOrAdmin(projectId, submissionId, actor);
        return ResponseEntity.ok(queryService.getSubmission(projectId, submissionId));
    }

    @GetMapping("/{submissionId}/images/{imageId}/feedback")
    public ResponseEntity<ImageFeedbackResponse> imageFeedback(@PathVariable UUID projectId,
                                                               @PathVariable UUID submissionId,
                                                               @PathVariable UUID imageId,
                                                               @AuthenticationPrincipal Actor actor) {
        requireOwnerOrAdmin(projectId, submissionId, actor);
        return ResponseEntity.ok(queryService.getImageFeedback(projectId, submissionId, imageId));
    }

    private static UUID subject(Actor actor, UUID requested) {
        if (requested == null || requested.equals(actor.id())) return actor.id();
        if (!actor.isAdmin()) {
            throw new ForbiddenException("Only administrators may query other users");
        }
        return requested;
    }

    private void requireOwnerOrAdmin(UUID projectId, UUID submissionId, Actor actor) {
        if (!actor.isAdmin() && !queryService.ownerOf(projectId, submissionId).equals(actor.id())) {
            throw new ForbiddenException("Submission %s belongs to another user".formatted(submissionId));
        }
    }

    private static ReviewDecision toDecision(ReviewRequest request) {
        List<FlaggedImage> flagged = request.flaggedImages() == null ? List.of() : request.flaggedImages().stream()
                .map(f -> new FlaggedImage(f.imageId(), f.reason()))
                .toList();
        List<ImageFeedback> feedback = request.imageFeedback() == null ? List.of() : request.imageFeedback().stream()
                .map(f -> new ImageFeedback(f.imageId(), f.feedback()))
                .toList();
        return new ReviewDecision(request.status(), request.feedback(), flagged, feedback);
    }
}
