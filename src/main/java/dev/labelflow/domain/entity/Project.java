package dev.labelflow.domain.entity;

import dev.labelflow.domain.enums.ProgressStatus;
import dev.labelflow.domain.enums.ProjectStatus;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate root for an annotation project.
 *
 * <p>Carries two statuses: {@code status} is authoritative and only moves to
 * COMPLETED or ARCHIVED through explicit admin actions; {@code progressStatus}
 * is recomputed from image state and never gates behavior. Counters are owned
 * by the project aggregator.
 *
 * <p>The project row doubles as the per-project serialization point: mutating
 * workflow operations lock it before reading the image pool or submission state.
 */
@Entity
@Table(name = "projects", indexes = {
        @Index(name = "idx_project_status", columnList = "status"),
        @Index(name = "idx_project_created", columnList = "created_at")
})
public class Project {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(length = 2000)
    private String description;

    @ElementCollection
    @CollectionTable(name = "project_classes", joinColumns = @JoinColumn(name = "project_id"))
    @OrderColumn(name = "position")
    private List<ProjectClass> classes = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProjectStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "progress_status", nullable = false, length = 20)
    private ProgressStatus progressStatus;

    @Column(name = "total_images", nullable = false)
    private int totalImages;

    @Column(name = "annotated_images", nullable = false)
    private int annotatedImages;

    @Column(name = "reviewed_images", nullable = false)
    private int reviewedImages;

    @Column(name = "approved_images", nullable = false)
    private int approvedImages;

    @Column(name = "completion_percentage", nullable = false)
    private int completionPercentage;

    @Version
    private Long version;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_by")
    private UUID completedBy;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected Project() {
    }

    public static Project create(String name, String description, List<ProjectClass> classes, UUID createdBy) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name required");
        Project p = new Project();
        p.id = UUID.randomUUID();
        p.name = name;
        p.description = description;
        if (classes != null) p.classes.addAll(classes);
        p.status = ProjectStatus.CREATED;
        p.progressStatus = ProgressStatus.CREATED;
        p.createdBy = createdBy;
        p.createdAt = Instant.now();
        p.updatedAt = p.createdAt;
        return p;
    }

    /**
     * Applies freshly computed counters. The authoritative status is only
     * promoted from CREATED to IN_PROGRESS here; closed projects keep 100%.
     */
    public void applyStats(int total, int annotated, int reviewed, int approved,
                           int percentage, ProgressStatus progress) {
        this.totalImages = total;
        this.annotatedImages = annotated;
        this.reviewedImages = reviewed;
        this.approvedImages = approved;
        this.progressStatus = progress;
        if (status == ProjectStatus.COMPLETED) {
            this.completionPercentage = 100;
        } else {
            this.completionPercentage = percentage;
            if (status == ProjectStatus.CREATED && progress != ProgressStatus.CREATED) {
                this.status = ProjectStatus.IN_PROGRESS;
            }
        }
        touch();
    }

    public void markCompleted(UUID actorId) {
        if (status.isClosed())
            throw new IllegalStateException("Project %s is already %s".formatted(id, status));
        this.status = ProjectStatus.COMPLETED;
        this.completionPercentage = 100;
        this.completedBy = actorId;
        this.completedAt = Instant.now();
        touch();
    }

    public void markArchived() {
        if (status == ProjectStatus.ARCHIVED)
            throw new IllegalStateException("Project %s is already archived".formatted(id));
        this.status = ProjectStatus.ARCHIVED;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<ProjectClass> getClasses() {
        return List.copyOf(classes);
    }

    public ProjectStatus getStatus() {
        return status;
    }

    public ProgressStatus getProgressStatus() {
        return progressStatus;
    }

    public int getTotalImages() {
        return totalImages;
    }

    public int getAnnotatedImages() {
        return annotatedImages;
    }

    public int getReviewedImages() {
        return reviewedImages;
    }

    public int getApprovedImages() {
        return approvedImages;
    }

    public int getCompletionPercentage() {
        return completionPercentage;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public UUID getCompletedBy() {
        return completedBy;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
