package dev.labelflow.domain.valueobject;

import dev.labelflow.domain.enums.ProgressStatus;

public record ProjectStats(
        int totalImages,
        int annotatedImages,
        int reviewedImages,
        int approvedImages,
        int completionPercentage,
        ProgressStatus progressStatus
) {
    public boolean allApproved() {
        return totalImages > 0 && approvedImages == totalImages;
    }
}
