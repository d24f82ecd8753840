package dev.labelflow.dto.response;

import dev.labelflow.domain.enums.SubmissionStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record SubmissionResponse(
        UUID id, UUID projectId, UUID userId, UUID assignmentId, List<UUID> imageIds, String message,
        SubmissionStatus status, String feedback, List<Flag> flaggedImages, List<Feedback> imageFeedback,
        List<HistoryEntry> reviewHistory, Instant submittedAt, UUID reviewedBy, Instant reviewedAt
) {
    public record Flag(UUID imageId, String reason) {}

    public record Feedback(UUID imageId, String feedback) {}

    public record HistoryEntry(UUID reviewedBy, Instant reviewedAt, SubmissionStatus status, String feedback,
                               List<Flag> flaggedImages, List<Feedback> imageFeedback) {}
}
