package dev.labelflow.repository;

import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.enums.AnnotationStatus;
import dev.labelflow.domain.enums.ImageReviewStatus;
import dev.labelflow.domain.enums.ImageStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProjectImageRepository extends JpaRepository<ProjectImage, UUID> {

    List<ProjectImage> findByProjectIdAndAssignedToIsNullOrderByUploadedAtAscIdAsc(UUID projectId);

    @Query("""
            SELECT i FROM ProjectImage i
            WHERE i.projectId = :projectId
              AND i.assignedTo IS NOT NULL
              AND i.annotationStatus <> dev.labelflow.domain.enums.AnnotationStatus.COMPLETED
              AND i.status <> dev.labelflow.domain.enums.ImageStatus.UNDER_REVIEW
            ORDER BY i.uploadedAt ASC, i.id ASC
            """)
    List<ProjectImage> findRedistributable(@Param("projectId") UUID projectId);

    @Query("""
            SELECT COUNT(i) FROM ProjectImage i
            WHERE i.projectId = :projectId
              AND i.assignedTo IS NOT NULL
              AND i.annotationStatus <> dev.labelflow.domain.enums.AnnotationStatus.COMPLETED
              AND i.status <> dev.labelflow.domain.enums.ImageStatus.UNDER_REVIEW
            """)
    long countRedistributableHeld(@Param("projectId") UUID projectId);

    List<ProjectImage> findByProjectIdAndAssignedTo(UUID projectId, UUID assignedTo);

    long countByProjectId(UUID projectId);

    long countByProjectIdAndAnnotationStatus(UUID projectId, AnnotationStatus annotationStatus);

    long countByProjectIdAndReviewStatus(UUID projectId, ImageReviewStatus reviewStatus);

    long countByProjectIdAndReviewStatusIn(UUID projectId, Collection<ImageReviewStatus> reviewStatuses);

    long countByProjectIdAndAssignedToIsNull(UUID projectId);

    long countByProjectIdAndAssignedToIsNotNull(UUID projectId);

    long countByProjectIdAndAssignedTo(UUID projectId, UUID assignedTo);

    long countByProjectIdAndAssignedToAndAnnotationStatus(UUID projectId, UUID assignedTo,
                                                          AnnotationStatus annotationStatus);

    long countByProjectIdAndAssignedToAndAnnotationStatusAndReviewStatus(UUID projectId, UUID assignedTo,
                                                                         AnnotationStatus annotationStatus,
                                                                         ImageReviewStatus reviewStatus);

    long countByProjectIdAndAssignedToAndAnnotationStatusAndReviewStatusNot(UUID projectId, UUID assignedTo,
                                                                            AnnotationStatus annotationStatus,
                                                                            ImageReviewStatus reviewStatus);

    long countByProjectIdAndAssignedToAndReviewStatus(UUID projectId, UUID assignedTo,
                                                      ImageReviewStatus reviewStatus);

    long countByProjectIdAndAssignedToAndStatus(UUID projectId, UUID assignedTo, ImageStatus status);

    long countByIdInAndReviewStatus(Collection<UUID> ids, ImageReviewStatus reviewStatus);

    Optional<ProjectImage> findTopByProjectIdAndAnnotatedByAndAnnotatedAtIsNotNullOrderByAnnotatedAtDesc(
            UUID projectId, UUID annotatedBy);

    @Query("""
            SELECT COALESCE(SUM(i.timeSpentSeconds), 0) FROM ProjectImage i
            WHERE i.projectId = :projectId AND i.annotatedBy = :userId
            """)
    long sumTimeSpentByAnnotator(@Param("projectId") UUID projectId, @Param("userId") UUID userId);
}
