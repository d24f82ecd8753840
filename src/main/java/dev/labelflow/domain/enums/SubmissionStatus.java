package dev.labelflow.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle: SUBMITTED → UNDER_REVIEW → APPROVED | REJECTED
 */
public enum SubmissionStatus {
    SUBMITTED, UNDER_REVIEW, REJECTED, APPROVED;

    public static final Set<SubmissionStatus> PENDING = EnumSet.of(SUBMITTED, UNDER_REVIEW);

    public boolean isPending() {
        return PENDING.contains(this);
    }

    /** Statuses a reviewer may set. */
    public boolean isDecision() {
        return this != SUBMITTED;
    }
}
