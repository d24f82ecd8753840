package dev.labelflow.infrastructure.activity;

import dev.labelflow.domain.event.ActivityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes workflow activity to the audit log once the transaction has committed.
 *
 * <p>Fire-and-forget: nothing is recorded for rolled-back operations, and a
 * failure here is logged without reaching the caller, whose operation has
 * already committed.
 */
@Component
public class ActivityLogListener {

    private static final Logger log = LoggerFactory.getLogger(ActivityLogListener.class);
    private static final Logger audit = LoggerFactory.getLogger("labelflow.activity");

    @Async("activityExecutor")
    @TransactionalEventListener(fallbackExecution = true)
    public void onActivity(ActivityEvent event) {
        try {
            audit.info("activity action={} projectId={} actorId={} details={} at={}",
                    event.action(), event.projectId(), event.actorId(), event.details(), event.occurredAt());
        } catch (RuntimeException e) {
            log.warn("Failed to record activity {} for project {}: {}",
                    event.action(), event.projectId(), e.getMessage());
        }
    }
}
