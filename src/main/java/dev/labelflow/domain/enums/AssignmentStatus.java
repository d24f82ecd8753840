package dev.labelflow.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle: ASSIGNED → IN_PROGRESS → SUBMITTED → UNDER_REVIEW → NEEDS_REVISION | COMPLETED
 */
public enum AssignmentStatus {
    ASSIGNED, IN_PROGRESS, SUBMITTED, UNDER_REVIEW, NEEDS_REVISION, COMPLETED;

    /** Statuses that new allocations merge into. */
    public static final Set<AssignmentStatus> PENDING = EnumSet.of(ASSIGNED, IN_PROGRESS);

    public boolean isPending() {
        return PENDING.contains(this);
    }

    public boolean isAwaitingReview() {
        return this == SUBMITTED || this == UNDER_REVIEW;
    }
}
