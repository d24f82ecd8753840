package dev.labelflow.repository;

import dev.labelflow.domain.entity.SubmissionReview;
import dev.labelflow.domain.enums.SubmissionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubmissionReviewRepository extends JpaRepository<SubmissionReview, UUID> {

    boolean existsByProjectIdAndUserIdAndStatusIn(UUID projectId, UUID userId, Collection<SubmissionStatus> statuses);

    Optional<SubmissionReview> findFirstByProjectIdAndUserIdAndStatusIn(UUID projectId, UUID userId,
                                                                        Collection<SubmissionStatus> statuses);

    List<SubmissionReview> findByProjectIdAndStatusIn(UUID projectId, Collection<SubmissionStatus> statuses);

    Page<SubmissionReview> findByProjectIdOrderBySubmittedAtDesc(UUID projectId, Pageable pageable);

    Page<SubmissionReview> findByProjectIdAndStatusOrderBySubmittedAtDesc(UUID projectId, SubmissionStatus status,
                                                                          Pageable pageable);

    Page<SubmissionReview> findByProjectIdAndUserIdOrderBySubmittedAtDesc(UUID projectId, UUID userId,
                                                                          Pageable pageable);

    Page<SubmissionReview> findByProjectIdAndUserIdAndStatusOrderBySubmittedAtDesc(UUID projectId, UUID userId,
                                                                                   SubmissionStatus status,
                                                                                   Pageable pageable);

    Optional<SubmissionReview> findTopByProjectIdAndUserIdOrderBySubmittedAtDesc(UUID projectId, UUID userId);

    long countByProjectId(UUID projectId);

    long countByProjectIdAndStatus(UUID projectId, SubmissionStatus status);

    long countByProjectIdAndStatusIn(UUID projectId, Collection<SubmissionStatus> statuses);
}
