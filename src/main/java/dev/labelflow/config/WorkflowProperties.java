package dev.labelflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Workflow tuning bound from {@code labelflow.workflow.*}.
 */
@ConfigurationProperties(prefix = "labelflow.workflow")
public record WorkflowProperties(
        String completionRejectionNote,
        int maxPageSize,
        int defaultPageSize
) {
    public WorkflowProperties {
        if (completionRejectionNote == null || completionRejectionNote.isBlank())
            completionRejectionNote = "This submission was automatically rejected because the project was marked as complete.";
        if (maxPageSize <= 0) maxPageSize = 100;
        if (defaultPageSize <= 0) defaultPageSize = 20;
        if (defaultPageSize > maxPageSize) defaultPageSize = maxPageSize;
    }

    /** Clamps a requested page size into [1, maxPageSize]. */
    public int clampPageSize(int requested) {
        if (requested <= 0) return defaultPageSize;
        return Math.min(requested, maxPageSize);
    }
}
