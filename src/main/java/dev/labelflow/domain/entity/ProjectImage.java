package dev.labelflow.domain.entity;

import dev.labelflow.domain.enums.AnnotationStatus;
import dev.labelflow.domain.enums.ImageReviewStatus;
import dev.labelflow.domain.enums.ImageStatus;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One image of a project and its assignment, annotation and review state.
 *
 * <p>{@code assignedTo} and {@code reviewStatus} are the fields concurrent
 * workflow operations contend on; {@code @Version} turns a lost race into an
 * optimistic locking failure instead of a silent double assignment.
 * {@code annotatedBy} survives reassignment and member removal.
 */
@Entity
@Table(name = "project_images", indexes = {
        @Index(name = "idx_image_project_assignee", columnList = "project_id, assigned_to"),
        @Index(name = "idx_image_project_uploaded", columnList = "project_id, uploaded_at"),
        @Index(name = "idx_image_submission", columnList = "current_submission_id")
})
public class ProjectImage {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(nullable = false)
    private String filename;

    @Column(name = "storage_key", nullable = false, length = 1024)
    private String storageKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ImageStatus status;

    @Column(name = "assigned_to")
    private UUID assignedTo;

    @Enumerated(EnumType.STRING)
    @Column(name = "annotation_status", nullable = false, length = 20)
    private AnnotationStatus annotationStatus;

    @Column(name = "annotated_by")
    private UUID annotatedBy;

    @Column(name = "annotated_at")
    private Instant annotatedAt;

    @Column(name = "time_spent_seconds", nullable = false)
    private long timeSpentSeconds;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_status", nullable = false, length = 20)
    private ImageReviewStatus reviewStatus;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "current_submission_id")
    private UUID currentSubmissionId;

    @Version
    private Long version;

    @Column(name = "uploaded_by")
    private UUID uploadedBy;

    @Column(name = "uploaded_at", nullable = false, updatable = false)
    private Instant uploadedAt;

    protected ProjectImage() {
    }

    public static ProjectImage register(UUID projectId, String filename, String storageKey, UUID uploadedBy) {
        ProjectImage i = new ProjectImage();
        i.id = UUID.randomUUID();
        i.projectId = projectId;
        i.filename = filename;
        i.storageKey = storageKey;
        i.status = ImageStatus.UPLOADED;
        i.annotationStatus = AnnotationStatus.UNANNOTATED;
        i.reviewStatus = ImageReviewStatus.NOT_REVIEWED;
        i.uploadedBy = uploadedBy;
        i.uploadedAt = Instant.now();
        return i;
    }

    public void assignTo(UUID userId) {
        this.assignedTo = Objects.requireNonNull(userId, "userId");
        this.status = ImageStatus.ASSIGNED;
    }

    /** Clears ownership; annotation attribution is kept. */
    public void unassign() {
        this.assignedTo = null;
        this.status = ImageStatus.UPLOADED;
    }

    public void recordDraft(long secondsSpent) {
        this.annotationStatus = AnnotationStatus.IN_PROGRESS;
        this.timeSpentSeconds += Math.max(0, secondsSpent);
    }

    /**
     * Marks the annotation finished by {@code userId}. A flagged image becomes
     * eligible for a fresh submission.
     */
    public void recordCompletedAnnotation(UUID userId, long secondsSpent) {
        this.status = ImageStatus.ANNOTATED;
        this.annotationStatus = AnnotationStatus.COMPLETED;
        this.annotatedBy = userId;
        this.annotatedAt = Instant.now();
        this.timeSpentSeconds += Math.max(0, secondsSpent);
        if (reviewStatus == ImageReviewStatus.FLAGGED) {
            this.reviewStatus = ImageReviewStatus.NOT_REVIEWED;
            this.currentSubmissionId = null;
        }
    }

    public void markUnderReview(UUID submissionId) {
        this.status = ImageStatus.UNDER_REVIEW;
        this.currentSubmissionId = submissionId;
    }

    public void approve(UUID reviewerId, Instant at) {
        this.status = ImageStatus.APPROVED;
        this.reviewStatus = ImageReviewStatus.APPROVED;
        stampReview(reviewerId, at);
    }

    public void flag(UUID reviewerId, Instant at) {
        this.status = ImageStatus.REVIEWED;
        this.reviewStatus = ImageReviewStatus.FLAGGED;
        stampReview(reviewerId, at);
    }

    /** Rejected with the rest of its submission but not flagged; review status is left as it was. */
    public void returnToAnnotator(UUID reviewerId, Instant at) {
        this.status = ImageStatus.ANNOTATED;
        stampReview(reviewerId, at);
    }

    private void stampReview(UUID reviewerId, Instant at) {
        this.reviewedBy = reviewerId;
        this.reviewedAt = at;
    }

    public boolean isApproved() {
        return reviewStatus == ImageReviewStatus.APPROVED;
    }

    public UUID getId() {
        return id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public String getFilename() {
        return filename;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public ImageStatus getStatus() {
        return status;
    }

    public UUID getAssignedTo() {
        return assignedTo;
    }

    public AnnotationStatus getAnnotationStatus() {
        return annotationStatus;
    }

    public UUID getAnnotatedBy() {
        return annotatedBy;
    }

    public Instant getAnnotatedAt() {
        return annotatedAt;
    }

    public long getTimeSpentSeconds() {
        return timeSpentSeconds;
    }

    public ImageReviewStatus getReviewStatus() {
        return reviewStatus;
    }

    public UUID getReviewedBy() {
        return reviewedBy;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public UUID getCurrentSubmissionId() {
        return currentSubmissionId;
    }

    public UUID getUploadedBy() {
        return uploadedBy;
    }

    public Instant getUploadedAt() {
        return uploadedAt;
    }
}
