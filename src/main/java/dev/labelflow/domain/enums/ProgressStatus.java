package dev.labelflow.domain.enums;

/**
 * Derived from image state on every recomputation. Advisory only;
 * callers deciding whether a project is finished should read {@link ProjectStatus}.
 */
public enum ProgressStatus {
    CREATED, IN_PROGRESS, COMPLETED
}
