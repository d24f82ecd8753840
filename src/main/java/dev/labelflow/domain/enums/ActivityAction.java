package dev.labelflow.domain.enums;

public enum ActivityAction {
    PROJECT_CREATED,
    PROJECT_COMPLETED,
    PROJECT_ARCHIVED,
    PROJECT_READY_FOR_COMPLETION,
    IMAGES_REGISTERED,
    MEMBER_ADDED,
    MEMBER_REMOVED,
    IMAGES_ASSIGNED,
    IMAGES_REASSIGNED,
    ANNOTATION_RECORDED,
    SUBMISSION_CREATED,
    SUBMISSION_REVIEWED
}
