package dev.labelflow.domain.enums;

/**
 * Authoritative project lifecycle: CREATED → IN_PROGRESS → COMPLETED | ARCHIVED.
 * COMPLETED and ARCHIVED are only reachable through explicit admin actions.
 */
public enum ProjectStatus {
    CREATED, IN_PROGRESS, COMPLETED, ARCHIVED;

    public boolean isClosed() {
        return this == COMPLETED || this == ARCHIVED;
    }
}
