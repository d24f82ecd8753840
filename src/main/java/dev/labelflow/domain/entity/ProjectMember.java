package dev.labelflow.domain.entity;

import dev.labelflow.domain.enums.MemberRole;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "project_members",
        uniqueConstraints = @UniqueConstraint(name = "uk_member_project_user", columnNames = {"project_id", "user_id"}),
        indexes = @Index(name = "idx_member_project_role", columnList = "project_id, role"))
public class ProjectMember {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MemberRole role;

    @Version
    private Long version;

    @Column(name = "added_by")
    private UUID addedBy;

    @Column(name = "added_at", nullable = false, updatable = false)
    private Instant addedAt;

    protected ProjectMember() {
    }

    public static ProjectMember create(UUID projectId, UUID userId, MemberRole role, UUID addedBy) {
        ProjectMember m = new ProjectMember();
        m.id = UUID.randomUUID();
        m.projectId = projectId;
        m.userId = userId;
        m.role = role;
        m.addedBy = addedBy;
        m.addedAt = Instant.now();
        return m;
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

    public MemberRole getRole() {
        return role;
    }

    public UUID getAddedBy() {
        return addedBy;
    }

    public Instant getAddedAt() {
        return addedAt;
    }
}
