package dev.labelflow.domain.enums;

/**
 * Review verdict carried by a single image, independent of the submission it was part of.
 */
public enum ImageReviewStatus {
    NOT_REVIEWED, UNDER_REVIEW, FLAGGED, APPROVED
}
