package dev.labelflow.dto.response;

import dev.labelflow.domain.enums.ProgressStatus;
import dev.labelflow.domain.enums.ProjectStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ProjectResponse(
        UUID id, String name, String description, List<ClassSummary> classes,
        ProjectStatus status, ProgressStatus progressStatus,
        int totalImages, int annotatedImages, int reviewedImages, int approvedImages, int completionPercentage,
        UUID createdBy, Instant createdAt, Instant updatedAt, UUID completedBy, Instant completedAt
) {
    public record ClassSummary(String id, String name, String color, boolean custom) {}
}
