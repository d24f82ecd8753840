package dev.labelflow.dto.response;

import java.util.UUID;

public record EligibilityResponse(boolean canSubmit, String reason, boolean hasAssignedImages,
                                  UUID pendingSubmissionId) {
}
