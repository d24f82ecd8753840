package dev.labelflow.domain.event;

import dev.labelflow.domain.enums.ActivityAction;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Published inside the workflow transaction; the activity log consumes it after commit.
 */
public record ActivityEvent(
        ActivityAction action,
        UUID projectId,
        UUID actorId,
        Map<String, Object> details,
        Instant occurredAt
) {
    public ActivityEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ActivityEvent of(ActivityAction action, UUID projectId, UUID actorId, Map<String, Object> details) {
        return new ActivityEvent(action, projectId, actorId, details, Instant.now());
    }
}
