package dev.labelflow.dto.request;

import dev.labelflow.domain.enums.SubmissionStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

/**
 * Reviewer verdict. {@code status} must be UNDER_REVIEW, APPROVED or REJECTED.
 */
public record ReviewRequest(
        @NotNull SubmissionStatus status,
        @Size(max = 4000) String feedback,
        List<@Valid Flag> flaggedImages,
        List<@Valid Feedback> imageFeedback
) {
    public record Flag(@NotNull UUID imageId, @Size(max = 2000) String reason) {}

    public record Feedback(@NotNull UUID imageId, @NotBlank @Size(max = 4000) String feedback) {}
}
