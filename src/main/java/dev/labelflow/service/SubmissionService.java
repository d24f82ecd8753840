package dev.labelflow.service;

import dev.labelflow.config.WorkflowProperties;
import dev.labelflow.domain.entity.FlaggedImage;
import dev.labelflow.domain.entity.ImageAssignment;
import dev.labelflow.domain.entity.ImageFeedback;
import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.entity.SubmissionReview;
import dev.labelflow.domain.enums.ActivityAction;
import dev.labelflow.domain.enums.AnnotationStatus;
import dev.labelflow.domain.enums.ImageReviewStatus;
import dev.labelflow.domain.enums.ProjectStatus;
import dev.labelflow.domain.enums.SubmissionStatus;
import dev.labelflow.domain.event.ActivityEvent;
import dev.labelflow.domain.valueobject.ProjectStats;
import dev.labelflow.domain.valueobject.ReviewDecision;
import dev.labelflow.domain.valueobject.SubmitEligibility;
import dev.labelflow.exception.ConflictException;
import dev.labelflow.exception.ForbiddenException;
import dev.labelflow.exception.NotFoundException;
import dev.labelflow.exception.ValidationException;
import dev.labelflow.repository.ImageAssignmentRepository;
import dev.labelflow.repository.ProjectImageRepository;
import dev.labelflow.repository.ProjectRepository;
import dev.labelflow.repository.SubmissionReviewRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command side of the review cycle: submit, decide, complete.
 *
 * <p>Each operation holds the project lock for its whole transaction, which
 * makes "one pending submission per user" and the submission status change
 * check-and-set operations.
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    private final ProjectLock projectLock;
    private final AssignmentLedger ledger;
    private final ProjectAggregator aggregator;
    private final ImageAssignmentRepository assignmentRepository;
    private final SubmissionReviewRepository submissionRepository;
    private final ProjectImageRepository imageRepository;
    private final ProjectRepository projectRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final WorkflowProperties properties;

    public SubmissionService(ProjectLock projectLock, AssignmentLedger ledger, ProjectAggregator aggregator,
                             ImageAssignmentRepository assignmentRepository,
                             SubmissionReviewRepository submissionRepository,
                             ProjectImageRepository imageRepository, ProjectRepository projectRepository,
                             ApplicationEventPublisher eventPublisher, MeterRegistry meterRegistry,
                             WorkflowProperties properties) {
        this.projectLock = projectLock;
        this.ledger = ledger;
        this.aggregator = aggregator;
        this.assignmentRepository = assignmentRepository;
        this.submissionRepository = submissionRepository;
        this.imageRepository = imageRepository;
        this.projectRepository = projectRepository;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    /**
     * Opens a review round for the user's assignment. The user must hold at
     * least one fully annotated image that is not yet approved. Images already
     * approved in an earlier round are left out of the snapshot.
     */
    @Transactional
    public SubmissionReview submitForReview(UUID projectId, UUID userId, UUID assignmentId, String message) {
        Project project = projectLock.acquire(projectId);
        if (project.getStatus().isClosed()) {
            throw new ConflictException("Project %s is %s and no longer accepts submissions"
                    .formatted(projectId, project.getStatus()));
        }
        ImageAssignment assignment = assignmentRepository.findById(assignmentId)
                .filter(a -> a.getProjectId().equals(projectId))
                .orElseThrow(() -> NotFoundException.of("Assignment", assignmentId));
        if (!assignment.getUserId().equals(userId)) {
            throw new ForbiddenException("Assignment %s does not belong to user %s".formatted(assignmentId, userId));
        }
        if (assignment.getStatus().isAwaitingReview()) {
            throw new ConflictException("Assignment %s is already submitted for review".formatted(assignmentId));
        }
        submissionRepository.findFirstByProjectIdAndUserIdAndStatusIn(projectId, userId, SubmissionStatus.PENDING)
                .ifPresent(pending -> {
                    throw new ConflictException("User %s already has pending submission %s"
                            .formatted(userId, pending.getId()));
                });
        SubmitEligibility eligibility = readyToSubmit(projectId, userId);
        if (!eligibility.canSubmit()) {
            throw new ValidationException(eligibility.reason());
        }

        List<ProjectImage> submittable = imageRepository.findAllById(assignment.getImageIds()).stream()
                .filter(image -> !image.isApproved())
                .toList();
        if (submittable.isEmpty()) {
            throw new ValidationException("Assignment %s has no images left to submit".formatted(assignmentId));
        }
        // keep the assignment's image order in the snapshot
        Set<UUID> submittableIds = submittable.stream().map(ProjectImage::getId).collect(Collectors.toSet());
        List<UUID> snapshot = assignment.getImageIds().stream().filter(submittableIds::contains).toList();

        SubmissionReview submission = submissionRepository.save(
                SubmissionReview.submit(projectId, userId, assignmentId, snapshot, message));
        assignment.markSubmitted();
        submittable.forEach(image -> image.markUnderReview(submission.getId()));
        aggregator.recompute(project);

        eventPublisher.publishEvent(ActivityEvent.of(ActivityAction.SUBMISSION_CREATED, projectId, userId,
                Map.of("submissionId", submission.getId(), "assignmentId", assignmentId,
                        "imageCount", snapshot.size())));
        log.info("submission.created submissionId={} projectId={} userId={} images={}",
                submission.getId(), projectId, userId, snapshot.size());
        return submission;
    }

    /**
     * Applies a reviewer decision to a pending submission, its images and its
     * assignment. Reaching all-approved is only announced; completing the
     * project stays an explicit admin step.
     */
    @Transactional
    public SubmissionReview reviewSubmission(UUID projectId, UUID submissionId, UUID reviewerId,
                                             ReviewDecision decision) {
        validateDecisionShape(decision);
        Project project = projectLock.acquire(projectId);
        SubmissionReview submission = submissionRepository.findById(submissionId)
                .filter(s -> s.getProjectId().equals(projectId))
                .orElseThrow(() -> NotFoundException.of("Submission", submissionId));
        if (!submission.isPending()) {
            throw new ConflictException("Submission %s is already %s".formatted(submissionId, submission.getStatus()));
        }
        validateDecisionTargets(submission, decision);

        Instant now = Instant.now();
        submission.recordDecision(reviewerId, now, decision.status(), decision.feedback(),
                decision.flaggedImages(), decision.imageFeedback());
        applyToImages(submission, decision, reviewerId, now);
        assignmentRepository.findById(submission.getAssignmentId())
                .ifPresentOrElse(
                        assignment -> ledger.applyReview(assignment, decision.status()),
                        () -> log.warn("Assignment {} of submission {} no longer exists",
                                submission.getAssignmentId(), submissionId));

        ProjectStats stats = aggregator.recompute(project);
        meterRegistry.counter("labelflow.review.decisions", "status", decision.status().name()).increment();
        eventPublisher.publishEvent(ActivityEvent.of(ActivityAction.SUBMISSION_REVIEWED, projectId, reviewerId,
                Map.of("submissionId", submissionId, "status", decision.status(),
                        "flagged", decision.flaggedImages().size())));
        log.info("review.submitted submissionId={} projectId={} reviewerId={} status={} flagged={}",
                submissionId, projectId, reviewerId, decision.status(), decision.flaggedImages().size());

        if (stats.allApproved() && project.getStatus() != ProjectStatus.COMPLETED) {
            log.info("All {} images of project {} are approved; ready for completion", stats.totalImages(), projectId);
            eventPublisher.publishEvent(ActivityEvent.of(ActivityAction.PROJECT_READY_FOR_COMPLETION, projectId,
                    reviewerId, Map.of("approvedImages", stats.approvedImages())));
        }
        return submission;
    }

    /**
     * Closes the project once every image is approved. Submissions still
     * pending are force-rejected with the configured note.
     */
    @Transactional
    public Project completeProject(UUID projectId, UUID actorId) {
        Project project = projectLock.acquire(projectId);
        if (project.getStatus().isClosed()) {
            throw new ConflictException("Project %s is already %s".formatted(projectId, project.getStatus()));
        }
        ProjectStats stats = aggregator.recompute(project);
        if (!stats.allApproved()) {
            throw new ConflictException(
                    "Cannot mark project as complete. Only %d out of %d images are approved."
                            .formatted(stats.approvedImages(), stats.totalImages()));
        }

        Instant now = Instant.now();
        List<SubmissionReview> pending =
                submissionRepository.findByProjectIdAndStatusIn(projectId, SubmissionStatus.PENDING);
        for (SubmissionReview submission : pending) {
            submission.autoReject(actorId, now, properties.completionRejectionNote());
            assignmentRepository.findById(submission.getAssignmentId())
                    .ifPresent(assignment -> ledger.applyReview(assignment, SubmissionStatus.REJECTED));
        }
        project.markCompleted(actorId);

        eventPublisher.publishEvent(ActivityEvent.of(ActivityAction.PROJECT_COMPLETED, projectId, actorId,
                Map.of("approvedImages", stats.approvedImages(), "autoRejected", pending.size())));
        log.info("Project {} completed by {} ({} pending submissions auto-rejected)",
                projectId, actorId, pending.size());
        return project;
    }

    /**
     * Whether the user could open a submission right now. Never mutates.
     */
    @Transactional(readOnly = true)
    public SubmitEligibility canUserSubmit(UUID projectId, UUID userId) {
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> NotFoundException.of("Project", projectId));
        if (project.getStatus().isClosed()) {
            return SubmitEligibility.denied(project.getStatus() == ProjectStatus.COMPLETED
                    ? "Project is marked as complete" : "Project is archived", false, null);
        }
        Optional<SubmissionReview> pending = submissionRepository
                .findFirstByProjectIdAndUserIdAndStatusIn(projectId, userId, SubmissionStatus.PENDING);
        if (pending.isPresent()) {
            return SubmitEligibility.denied("You have a pending submission awaiting review", true,
                    pending.get().getId());
        }
        return readyToSubmit(projectId, userId);
    }

    private SubmitEligibility readyToSubmit(UUID projectId, UUID userId) {
        long ready = imageRepository.countByProjectIdAndAssignedToAndAnnotationStatusAndReviewStatusNot(
                projectId, userId, AnnotationStatus.COMPLETED, ImageReviewStatus.APPROVED);
        if (ready > 0) {
            return SubmitEligibility.allowed();
        }
        if (imageRepository.countByProjectIdAndAssignedTo(projectId, userId) == 0) {
            return SubmitEligibility.denied("No images assigned to you", false, null);
        }
        return SubmitEligibility.denied(
                "All your assigned images are already approved or not fully annotated", true, null);
    }

    private static void validateDecisionShape(ReviewDecision decision) {
        if (decision == null || decision.status() == null) {
            throw new ValidationException("Review status is required");
        }
        if (!decision.status().isDecision()) {
            throw new ValidationException("%s is not a valid review decision".formatted(decision.status()));
        }
    }

    private static void validateDecisionTargets(SubmissionReview submission, ReviewDecision decision) {
        List<UUID> targets = Stream.concat(
                        decision.flaggedImages().stream().map(FlaggedImage::getImageId),
                        decision.imageFeedback().stream().map(ImageFeedback::getImageId))
                .toList();
        for (UUID imageId : targets) {
            if (imageId == null || !submission.includes(imageId)) {
                throw new ValidationException("Image %s is not part of submission %s"
                        .formatted(imageId, submission.getId()));
            }
        }
    }

    private void applyToImages(SubmissionReview submission, ReviewDecision decision, UUID reviewerId, Instant at) {
        if (decision.status() == SubmissionStatus.UNDER_REVIEW) return;
        Set<UUID> flagged = decision.flaggedImages().stream()
                .map(FlaggedImage::getImageId)
                .collect(Collectors.toSet());
        for (ProjectImage image : imageRepository.findAllById(submission.getImageIds())) {
            // moved to someone else or reclaimed since the snapshot was taken
            if (!submission.getUserId().equals(image.getAssignedTo())) {
                log.debug("Skipping image {} of submission {}; no longer held by {}",
                        image.getId(), submission.getId(), submission.getUserId());
                continue;
            }
            if (decision.status() == SubmissionStatus.APPROVED) {
                image.approve(reviewerId, at);
            } else if (flagged.contains(image.getId())) {
                image.flag(reviewerId, at);
            } else {
                image.returnToAnnotator(reviewerId, at);
            }
        }
    }
}
