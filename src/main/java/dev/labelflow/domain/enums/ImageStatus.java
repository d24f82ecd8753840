package dev.labelflow.domain.enums;

/**
 * Lifecycle: UPLOADED → ASSIGNED → ANNOTATED → UNDER_REVIEW → REVIEWED | APPROVED
 */
public enum ImageStatus {
    UPLOADED, ASSIGNED, ANNOTATED, UNDER_REVIEW, REVIEWED, APPROVED
}
