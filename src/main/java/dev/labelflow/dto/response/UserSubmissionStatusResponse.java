package dev.labelflow.dto.response;

import java.util.UUID;

public record UserSubmissionStatusResponse(
        long totalAssigned, long completed, long flagged, long approved, long pendingReview, int progress,
        boolean canSubmit, UUID pendingSubmissionId
) {
}
