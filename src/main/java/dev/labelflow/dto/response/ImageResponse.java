package dev.labelflow.dto.response;

import dev.labelflow.domain.enums.AnnotationStatus;
import dev.labelflow.domain.enums.ImageReviewStatus;
import dev.labelflow.domain.enums.ImageStatus;
import java.time.Instant;
import java.util.UUID;

public record ImageResponse(
        UUID id, UUID projectId, String filename, String storageKey, ImageStatus status, UUID assignedTo,
        AnnotationStatus annotationStatus, UUID annotatedBy, Instant annotatedAt, long timeSpentSeconds,
        ImageReviewStatus reviewStatus, UUID reviewedBy, Instant reviewedAt, UUID currentSubmissionId,
        Instant uploadedAt
) {
}
