package dev.labelflow.domain.entity;

import dev.labelflow.domain.enums.SubmissionStatus;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One round of review for an annotator's batch.
 *
 * <p>The top-level status, feedback and flags always reflect the latest
 * decision; every decision is also appended to {@code reviewHistory}, which
 * only grows. APPROVED and REJECTED are terminal: the next round is a new
 * submission. Records are never deleted.
 */
@Entity
@Table(name = "submission_reviews", indexes = {
        @Index(name = "idx_submission_project_user", columnList = "project_id, user_id"),
        @Index(name = "idx_submission_status", columnList = "status"),
        @Index(name = "idx_submission_submitted", columnList = "submitted_at")
})
public class SubmissionReview {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "assignment_id", nullable = false)
    private UUID assignmentId;

    @ElementCollection
    @CollectionTable(name = "submission_images", joinColumns = @JoinColumn(name = "submission_id"))
    @OrderColumn(name = "position")
    @Column(name = "image_id", nullable = false)
    private List<UUID> imageIds = new ArrayList<>();

    @Column(length = 4000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SubmissionStatus status;

    @Column(length = 4000)
    private String feedback;

    @ElementCollection
    @CollectionTable(name = "submission_flagged_images", joinColumns = @JoinColumn(name = "submission_id"))
    @OrderColumn(name = "position")
    private List<FlaggedImage> flaggedImages = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "submission_image_feedback", joinColumns = @JoinColumn(name = "submission_id"))
    @OrderColumn(name = "position")
    private List<ImageFeedback> imageFeedback = new ArrayList<>();

    @OneToMany(mappedBy = "submission", cascade = CascadeType.ALL)
    @OrderBy("reviewedAt ASC")
    private List<ReviewHistoryEntry> reviewHistory = new ArrayList<>();

    @Version
    private Long version;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private Instant submittedAt;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    protected SubmissionReview() {
    }

    public static SubmissionReview submit(UUID projectId, UUID userId, UUID assignmentId,
                                          Collection<UUID> imageIds, String message) {
        if (imageIds == null || imageIds.isEmpty())
            throw new IllegalArgumentException("a submission needs at least one image");
        SubmissionReview s = new SubmissionReview();
        s.id = UUID.randomUUID();
        s.projectId = projectId;
        s.userId = userId;
        s.assignmentId = assignmentId;
        s.imageIds.addAll(new LinkedHashSet<>(imageIds));
        s.message = message == null ? "" : message;
        s.feedback = "";
        s.status = SubmissionStatus.SUBMITTED;
        s.submittedAt = Instant.now();
        return s;
    }

    /**
     * Applies a reviewer decision and appends it to the history.
     */
    public ReviewHistoryEntry recordDecision(UUID reviewerId, Instant at, SubmissionStatus decision, String feedback,
                                             List<FlaggedImage> flagged, List<ImageFeedback> perImage) {
        transitionFrom(SubmissionStatus.SUBMITTED, SubmissionStatus.UNDER_REVIEW);
        if (!decision.isDecision())
            throw new IllegalArgumentException("%s is not a review decision".formatted(decision));
        String text = feedback == null ? "" : feedback;

        this.status = decision;
        this.feedback = text;
        this.reviewedBy = reviewerId;
        this.reviewedAt = at;
        this.flaggedImages.clear();
        this.flaggedImages.addAll(flagged);
        this.imageFeedback.clear();
        this.imageFeedback.addAll(perImage);

        ReviewHistoryEntry entry = ReviewHistoryEntry.of(reviewerId, at, decision, text, flagged, perImage);
        entry.setSubmission(this);
        reviewHistory.add(entry);
        return entry;
    }

    /** Closes a still-pending submission when its project is completed. */
    public void autoReject(UUID actorId, Instant at, String note) {
        recordDecision(actorId, at, SubmissionStatus.REJECTED, note, List.of(), List.of());
    }

    public boolean isPending() {
        return status.isPending();
    }

    public boolean includes(UUID imageId) {
        return imageIds.contains(imageId);
    }

    public Optional<String> feedbackFor(UUID imageId) {
        return imageFeedback.stream()
                .filter(f -> f.getImageId().equals(imageId))
                .map(ImageFeedback::getFeedback)
                .findFirst();
    }

    private void transitionFrom(SubmissionStatus... allowedPredecessors) {
        for (SubmissionStatus allowed : allowedPredecessors) {
            if (this.status == allowed) return;
        }
        throw new IllegalStateException(
                "Submission %s is %s and not available for review".formatted(id, status));
    }

    public UUID getId() {
        return id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getAssignmentId() {
        return assignmentId;
    }

    public List<UUID> getImageIds() {
        return List.copyOf(imageIds);
    }

    public String getMessage() {
        return message;
    }

    public SubmissionStatus getStatus() {
        return status;
    }

    public String getFeedback() {
        return feedback;
    }

    public List<FlaggedImage> getFlaggedImages() {
        return List.copyOf(flaggedImages);
    }

    public List<ImageFeedback> getImageFeedback() {
        return List.copyOf(imageFeedback);
    }

    public List<ReviewHistoryEntry> getReviewHistory() {
        return List.copyOf(reviewHistory);
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public UUID getReviewedBy() {
        return reviewedBy;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }
}
