package dev.labelflow.dto.response;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Project-wide and per-annotator progress. {@code redistributableImages} is
 * what a reset distribution would draw from.
 */
public record AssignmentMetricsResponse(
        int totalImages, long unassignedImages, long assignedImages, long annotatedImages,
        long redistributableImages, List<UserProgress> userProgress
) {
    public record UserProgress(UUID userId, long totalAssigned, long annotated, long unannotated, int progress,
                               long timeSpentSeconds, long averageTimePerImage, Instant lastActivity) {}
}
