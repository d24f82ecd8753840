package dev.labelflow.service;

import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.enums.AnnotationStatus;
import dev.labelflow.domain.enums.ImageReviewStatus;
import dev.labelflow.domain.enums.ProgressStatus;
import dev.labelflow.domain.valueobject.ProjectStats;
import dev.labelflow.repository.ProjectImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;

/**
 * Recomputes project counters and the derived progress status from image state.
 */
@Service
public class ProjectAggregator {

    private static final Logger log = LoggerFactory.getLogger(ProjectAggregator.class);

    private final ProjectImageRepository imageRepository;

    public ProjectAggregator(ProjectImageRepository imageRepository) {
        this.imageRepository = imageRepository;
    }

    /**
     * Counts the project's images and applies the result to {@code project}.
     * Runs in the caller's transaction so pending image changes are flushed
     * before counting.
     */
    public ProjectStats recompute(Project project) {
        ProjectStats stats = compute(
                imageRepository.countByProjectId(project.getId()),
                imageRepository.countByProjectIdAndAnnotationStatus(project.getId(), AnnotationStatus.COMPLETED),
                imageRepository.countByProjectIdAndReviewStatusIn(project.getId(),
                        EnumSet.of(ImageReviewStatus.APPROVED, ImageReviewStatus.FLAGGED)),
                imageRepository.countByProjectIdAndReviewStatus(project.getId(), ImageReviewStatus.APPROVED),
                hasAnnotationActivity(project));
        project.applyStats(stats.totalImages(), stats.annotatedImages(), stats.reviewedImages(),
                stats.approvedImages(), stats.completionPercentage(), stats.progressStatus());
        log.debug("Project {} stats: {}", project.getId(), stats);
        return stats;
    }

    static ProjectStats compute(long total, long annotated, long reviewed, long approved, boolean activity) {
        int percentage = total == 0 ? 0 : (int) Math.round(100.0 * approved / total);
        ProgressStatus progress;
        if (total > 0 && annotated == total && approved == total) {
            progress = ProgressStatus.COMPLETED;
        } else if (annotated > 0 || activity) {
            progress = ProgressStatus.IN_PROGRESS;
        } else {
            progress = ProgressStatus.CREATED;
        }
        return new ProjectStats((int) total, (int) annotated, (int) reviewed, (int) approved, percentage, progress);
    }

    private boolean hasAnnotationActivity(Project project) {
        return imageRepository.countByProjectIdAndAnnotationStatus(project.getId(), AnnotationStatus.IN_PROGRESS) > 0;
    }
}
