package dev.labelflow.domain.valueobject;

import java.util.UUID;

/**
 * Answer to "may this user submit now?".
 *
 * @param reason            why not, or null when {@code canSubmit}
 * @param pendingSubmission the user's open submission, if any
 */
public record SubmitEligibility(
        boolean canSubmit,
        String reason,
        boolean hasAssignedImages,
        UUID pendingSubmission
) {
    public static SubmitEligibility allowed() {
        return new SubmitEligibility(true, null, true, null);
    }

    public static SubmitEligibility denied(String reason, boolean hasAssignedImages, UUID pendingSubmission) {
        return new SubmitEligibility(false, reason, hasAssignedImages, pendingSubmission);
    }
}
