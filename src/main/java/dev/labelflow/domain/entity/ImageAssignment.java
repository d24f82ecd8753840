package dev.labelflow.domain.entity;

import dev.labelflow.domain.enums.AssignmentStatus;
import dev.labelflow.domain.enums.SubmissionStatus;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A batch of images handed to one annotator.
 *
 * <p>At most one record per (project, user) is pending (ASSIGNED or IN_PROGRESS);
 * later allocations are appended to it through {@link #addImages}. Image ids keep
 * allocation order and never repeat.
 */
@Entity
@Table(name = "image_assignments", indexes = {
        @Index(name = "idx_assignment_project_user", columnList = "project_id, user_id"),
        @Index(name = "idx_assignment_status", columnList = "status")
})
public class ImageAssignment {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @ElementCollection
    @CollectionTable(name = "assignment_images", joinColumns = @JoinColumn(name = "assignment_id"))
    @OrderColumn(name = "position")
    @Column(name = "image_id", nullable = false)
    private List<UUID> imageIds = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AssignmentStatus status;

    @Column(name = "total_images", nullable = false)
    private int totalImages;

    @Column(name = "completed_images", nullable = false)
    private int completedImages;

    @Version
    private Long version;

    @Column(name = "assigned_by")
    private UUID assignedBy;

    @Column(name = "assigned_at", nullable = false, updatable = false)
    private Instant assignedAt;

    @Column(name = "last_activity")
    private Instant lastActivity;

    protected ImageAssignment() {
    }

    public static ImageAssignment create(UUID projectId, UUID userId, Collection<UUID> imageIds, UUID assignedBy) {
        if (imageIds == null || imageIds.isEmpty())
            throw new IllegalArgumentException("an assignment needs at least one image");
        ImageAssignment a = new ImageAssignment();
        a.id = UUID.randomUUID();
        a.projectId = projectId;
        a.userId = userId;
        a.imageIds.addAll(new LinkedHashSet<>(imageIds));
        a.totalImages = a.imageIds.size();
        a.status = AssignmentStatus.ASSIGNED;
        a.assignedBy = assignedBy;
        a.assignedAt = Instant.now();
        return a;
    }

    public void addImages(Collection<UUID> ids) {
        if (!status.isPending())
            throw new IllegalStateException("Cannot add images to %s assignment %s".formatted(status, id));
        Set<UUID> present = new LinkedHashSet<>(imageIds);
        for (UUID imageId : ids) {
            if (present.add(imageId)) imageIds.add(imageId);
        }
        this.totalImages = imageIds.size();
        touch();
    }

    /**
     * Drops the given images from this batch.
     *
     * @return true when nothing is left and the record should be deleted
     */
    public boolean removeImages(Collection<UUID> ids) {
        imageIds.removeAll(Set.copyOf(ids));
        this.totalImages = imageIds.size();
        return imageIds.isEmpty();
    }

    public void markInProgress() {
        if (status == AssignmentStatus.ASSIGNED) {
            this.status = AssignmentStatus.IN_PROGRESS;
        }
        touch();
    }

    public void markSubmitted() {
        if (status.isAwaitingReview())
            throw new IllegalStateException("Assignment %s is already submitted for review".formatted(id));
        this.status = AssignmentStatus.SUBMITTED;
        touch();
    }

    /** Mirrors a reviewer decision onto the batch. */
    public void applyDecision(SubmissionStatus decision, int approvedCount) {
        this.status = switch (decision) {
            case APPROVED -> AssignmentStatus.COMPLETED;
            case REJECTED -> AssignmentStatus.NEEDS_REVISION;
            case UNDER_REVIEW, SUBMITTED -> AssignmentStatus.UNDER_REVIEW;
        };
        this.completedImages = approvedCount;
        touch();
    }

    /** Every image in the batch is approved, whatever the latest decision said. */
    public void markFullyApproved() {
        this.status = AssignmentStatus.COMPLETED;
        this.completedImages = totalImages;
        touch();
    }

    private void touch() {
        this.lastActivity = Instant.now();
    }

    public boolean contains(UUID imageId) {
        return imageIds.contains(imageId);
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

    public List<UUID> getImageIds() {
        return List.copyOf(imageIds);
    }

    public AssignmentStatus getStatus() {
        return status;
    }

    public int getTotalImages() {
        return totalImages;
    }

    public int getCompletedImages() {
        return completedImages;
    }

    public UUID getAssignedBy() {
        return assignedBy;
    }

    public Instant getAssignedAt() {
        return assignedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }
}
