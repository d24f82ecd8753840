package dev.labelflow.domain.enums;

public enum AnnotationStatus {
    UNANNOTATED, IN_PROGRESS, COMPLETED
}
