package dev.labelflow.dto.response;

import java.util.UUID;

public record ImageFeedbackResponse(UUID submissionId, UUID imageId, boolean flagged, String flagReason,
                                    String feedback) {
}
