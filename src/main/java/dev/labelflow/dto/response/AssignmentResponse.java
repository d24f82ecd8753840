package dev.labelflow.dto.response;

import dev.labelflow.domain.enums.AssignmentStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AssignmentResponse(
        UUID id, UUID projectId, UUID userId, List<UUID> imageIds, AssignmentStatus status,
        int totalImages, int completedImages, UUID assignedBy, Instant assignedAt, Instant lastActivity
) {
}
