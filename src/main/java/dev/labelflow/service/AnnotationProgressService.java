package dev.labelflow.service;

import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.enums.ActivityAction;
import dev.labelflow.domain.enums.ImageStatus;
import dev.labelflow.domain.event.ActivityEvent;
import dev.labelflow.exception.ConflictException;
import dev.labelflow.exception.ForbiddenException;
import dev.labelflow.exception.NotFoundException;
import dev.labelflow.repository.ProjectImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

/**
 * Applies the annotation editor's state effects to images. The annotation
 * content itself is owned by the editor and never passes through here.
 */
@Service
public class AnnotationProgressService {

    private static final Logger log = LoggerFactory.getLogger(AnnotationProgressService.class);

    private final ProjectLock projectLock;
    private final ProjectImageRepository imageRepository;
    private final AssignmentLedger ledger;
    private final ProjectAggregator aggregator;
    private final ApplicationEventPublisher eventPublisher;

    public AnnotationProgressService(ProjectLock projectLock, ProjectImageRepository imageRepository,
                                     AssignmentLedger ledger, ProjectAggregator aggregator,
                                     ApplicationEventPublisher eventPublisher) {
        this.projectLock = projectLock;
        this.imageRepository = imageRepository;
        this.ledger = ledger;
        this.aggregator = aggregator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Records a save from the editor: a draft, or a finished annotation that
     * becomes submittable. Re-annotating a flagged image clears the flag.
     */
    @Transactional
    public ProjectImage recordAnnotation(UUID projectId, UUID imageId, UUID userId,
                                         boolean completed, long timeSpentSeconds) {
        Project project = projectLock.acquire(projectId);
        if (project.getStatus().isClosed()) {
            throw new ConflictException("Project %s is %s; annotations are read-only"
                    .formatted(projectId, project.getStatus()));
        }
        ProjectImage image = imageRepository.findById(imageId)
                .filter(i -> i.getProjectId().equals(projectId))
                .orElseThrow(() -> NotFoundException.of("Image", imageId));
        if (!userId.equals(image.getAssignedTo())) {
            throw new ForbiddenException("Image %s is not assigned to user %s".formatted(imageId, userId));
        }
        if (image.isApproved()) {
            throw new ConflictException("Image %s is already approved".formatted(imageId));
        }
        if (image.getStatus() == ImageStatus.UNDER_REVIEW) {
            throw new ConflictException("Image %s is under review and cannot be edited".formatted(imageId));
        }

        if (completed) {
            image.recordCompletedAnnotation(userId, timeSpentSeconds);
        } else {
            image.recordDraft(timeSpentSeconds);
        }
        ledger.touchOwning(projectId, userId, imageId);
        aggregator.recompute(project);

        eventPublisher.publishEvent(ActivityEvent.of(ActivityAction.ANNOTATION_RECORDED, projectId, userId,
                Map.of("imageId", imageId, "completed", completed)));
        log.debug("Annotation on image {} by {} recorded (completed={})", imageId, userId, completed);
        return image;
    }
}
