package dev.labelflow.repository;

import dev.labelflow.domain.entity.ImageAssignment;
import dev.labelflow.domain.enums.AssignmentStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ImageAssignmentRepository extends JpaRepository<ImageAssignment, UUID> {

    Optional<ImageAssignment> findFirstByProjectIdAndUserIdAndStatusInOrderByAssignedAtAsc(
            UUID projectId, UUID userId, Collection<AssignmentStatus> statuses);

    List<ImageAssignment> findByProjectIdAndUserIdAndStatusIn(UUID projectId, UUID userId,
                                                              Collection<AssignmentStatus> statuses);

    /** Every batch in the project that still lists any of the given images. */
    @Query("""
            SELECT DISTINCT a FROM ImageAssignment a JOIN a.imageIds img
            WHERE a.projectId = :projectId AND img IN :imageIds
            """)
    List<ImageAssignment> findContainingAny(@Param("projectId") UUID projectId,
                                            @Param("imageIds") Collection<UUID> imageIds);

    @Query("""
            SELECT a FROM ImageAssignment a JOIN a.imageIds img
            WHERE a.projectId = :projectId AND a.userId = :userId AND img = :imageId
              AND a.status IN :statuses
            """)
    List<ImageAssignment> findOwningImage(@Param("projectId") UUID projectId, @Param("userId") UUID userId,
                                          @Param("imageId") UUID imageId,
                                          @Param("statuses") Collection<AssignmentStatus> statuses);

    Page<ImageAssignment> findByProjectIdOrderByAssignedAtDesc(UUID projectId, Pageable pageable);

    Page<ImageAssignment> findByProjectIdAndUserIdOrderByAssignedAtDesc(UUID projectId, UUID userId,
                                                                         Pageable pageable);

    Optional<ImageAssignment> findTopByProjectIdAndUserIdAndLastActivityIsNotNullOrderByLastActivityDesc(
            UUID projectId, UUID userId);
}
