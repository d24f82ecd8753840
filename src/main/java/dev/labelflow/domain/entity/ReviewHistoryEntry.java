package dev.labelflow.domain.entity;

import dev.labelflow.domain.enums.SubmissionStatus;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable record of one review decision. Entries are only ever appended to
 * their submission.
 */
@Entity
@Table(name = "review_history_entries", indexes = {
        @Index(name = "idx_history_submission", columnList = "submission_id")
})
public class ReviewHistoryEntry {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "submission_id", nullable = false, updatable = false)
    private SubmissionReview submission;

    @Column(name = "reviewed_by", nullable = false, updatable = false)
    private UUID reviewedBy;

    @Column(name = "reviewed_at", nullable = false, updatable = false)
    private Instant reviewedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private SubmissionStatus status;

    @Column(length = 4000, updatable = false)
    private String feedback;

    @ElementCollection
    @CollectionTable(name = "review_history_flags", joinColumns = @JoinColumn(name = "entry_id"))
    @OrderColumn(name = "position")
    private List<FlaggedImage> flaggedImages = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "review_history_image_feedback", joinColumns = @JoinColumn(name = "entry_id"))
    @OrderColumn(name = "position")
    private List<ImageFeedback> imageFeedback = new ArrayList<>();

    protected ReviewHistoryEntry() {
    }

    static ReviewHistoryEntry of(UUID reviewedBy, Instant reviewedAt, SubmissionStatus status, String feedback,
                                 List<FlaggedImage> flagged, List<ImageFeedback> imageFeedback) {
        ReviewHistoryEntry e = new ReviewHistoryEntry();
        e.id = UUID.randomUUID();
        e.reviewedBy = reviewedBy;
        e.reviewedAt = reviewedAt;
        e.status = status;
        e.feedback = feedback;
        e.flaggedImages.addAll(flagged);
        e.imageFeedback.addAll(imageFeedback);
        return e;
    }

    void setSubmission(SubmissionReview submission) {
        this.submission = submission;
    }

    public UUID getId() {
        return id;
    }

    public UUID getReviewedBy() {
        return reviewedBy;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
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
}
