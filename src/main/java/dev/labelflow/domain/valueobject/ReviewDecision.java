package dev.labelflow.domain.valueobject;

import dev.labelflow.domain.entity.FlaggedImage;
import dev.labelflow.domain.entity.ImageFeedback;
import dev.labelflow.domain.enums.SubmissionStatus;
import java.util.List;

/**
 * A reviewer's verdict on a submission. Flags and per-image feedback are
 * independent: an image may carry feedback without being flagged.
 */
public record ReviewDecision(
        SubmissionStatus status,
        String feedback,
        List<FlaggedImage> flaggedImages,
        List<ImageFeedback> imageFeedback
) {
    public ReviewDecision {
        feedback = feedback == null ? "" : feedback;
        flaggedImages = flaggedImages == null ? List.of() : List.copyOf(flaggedImages);
        imageFeedback = imageFeedback == null ? List.of() : List.copyOf(imageFeedback);
    }

    public static ReviewDecision approve(String feedback) {
        return new ReviewDecision(SubmissionStatus.APPROVED, feedback, List.of(), List.of());
    }

    public static ReviewDecision reject(String feedback, List<FlaggedImage> flagged) {
        return new ReviewDecision(SubmissionStatus.REJECTED, feedback, flagged, List.of());
    }
}
