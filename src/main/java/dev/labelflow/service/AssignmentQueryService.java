package dev.labelflow.service;

import dev.labelflow.config.WorkflowProperties;
import dev.labelflow.domain.entity.ImageAssignment;
import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.entity.ProjectMember;
import dev.labelflow.domain.entity.SubmissionReview;
import dev.labelflow.domain.enums.AnnotationStatus;
import dev.labelflow.domain.enums.MemberRole;
import dev.labelflow.domain.valueobject.DistributionResult;
import dev.labelflow.dto.response.AssignmentMetricsResponse;
import dev.labelflow.dto.response.AssignmentMetricsResponse.UserProgress;
import dev.labelflow.dto.response.AssignmentResponse;
import dev.labelflow.dto.response.DistributionResponse;
import dev.labelflow.dto.response.PageResponse;
import dev.labelflow.exception.NotFoundException;
import dev.labelflow.repository.ImageAssignmentRepository;
import dev.labelflow.repository.ProjectImageRepository;
import dev.labelflow.repository.ProjectMemberRepository;
import dev.labelflow.repository.ProjectRepository;
import dev.labelflow.repository.SubmissionReviewRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Assignment listings and progress metrics. Read-only transactions.
 */
@Service
@Transactional(readOnly = true)
public class AssignmentQueryService {
    private final ProjectRepository projectRepository;
    private final ProjectMemberRepository memberRepository;
    private final ProjectImageRepository imageRepository;
    private final ImageAssignmentRepository assignmentRepository;
    private final SubmissionReviewRepository submissionRepository;
    private final WorkflowProperties properties;

    public AssignmentQueryService(ProjectRepository projectRepository, ProjectMemberRepository memberRepository,
                                  ProjectImageRepository imageRepository,
                                  ImageAssignmentRepository assignmentRepository,
                                  SubmissionReviewRepository submissionRepository, WorkflowProperties properties) {
        this.projectRepository = projectRepository;
        this.memberRepository = memberRepository;
        this.imageRepository = imageRepository;
        this.assignmentRepository = assignmentRepository;
        this.submissionRepository = submissionRepository;
        this.properties = properties;
    }

    public PageResponse<AssignmentResponse> listProjectAssignments(UUID projectId, int page, int size) {
        requireProject(projectId);
        return PageResponse.of(assignmentRepository
                .findByProjectIdOrderByAssignedAtDesc(projectId, PageRequest.of(page, properties.clampPageSize(size)))
                .map(AssignmentQueryService::toResponse));
    }

    public PageResponse<AssignmentResponse> listUserAssignments(UUID projectId, UUID userId, int page, int size) {
        requireProject(projectId);
        return PageResponse.of(assignmentRepository
                .findByProjectIdAndUserIdOrderByAssignedAtDesc(projectId, userId,
                        PageRequest.of(page, properties.clampPageSize(size)))
                .map(AssignmentQueryService::toResponse));
    }

    /**
     * Project-wide counts plus one entry per annotator, in membership order.
     * Redistributable counts unassigned images and held-but-unannotated ones
     * outside a pending review, which is exactly what a reset distribution
     * draws from.
     */
    public AssignmentMetricsResponse getAssignmentMetrics(UUID projectId) {
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> NotFoundException.of("Project", projectId));
        long unassigned = imageRepository.countByProjectIdAndAssignedToIsNull(projectId);
        long assigned = imageRepository.countByProjectIdAndAssignedToIsNotNull(projectId);
        long annotated = imageRepository.countByProjectIdAndAnnotationStatus(projectId, AnnotationStatus.COMPLETED);
        long heldUnannotated = imageRepository.countRedistributableHeld(projectId);

        List<UserProgress> users = memberRepository
                .findByProjectIdAndRoleOrderByAddedAtAscIdAsc(projectId, MemberRole.ANNOTATOR).stream()
                .map(member -> userProgress(projectId, member))
                .toList();
        return new AssignmentMetricsResponse(project.getTotalImages(), unassigned, assigned, annotated,
                unassigned + heldUnannotated, users);
    }

    private UserProgress userProgress(UUID projectId, ProjectMember member) {
        UUID userId = member.getUserId();
        long total = imageRepository.countByProjectIdAndAssignedTo(projectId, userId);
        long annotated = imageRepository.countByProjectIdAndAssignedToAndAnnotationStatus(
                projectId, userId, AnnotationStatus.COMPLETED);
        int progress = total > 0 ? (int) Math.round(100.0 * annotated / total) : 0;
        long timeSpent = imageRepository.sumTimeSpentByAnnotator(projectId, userId);
        long average = annotated > 0 ? Math.round((double) timeSpent / annotated) : 0;
        return new UserProgress(userId, total, annotated, total - annotated, progress, timeSpent, average,
                lastActivity(projectId, userId));
    }

    private Instant lastActivity(UUID projectId, UUID userId) {
        return Stream.of(
                        imageRepository.findTopByProjectIdAndAnnotatedByAndAnnotatedAtIsNotNullOrderByAnnotatedAtDesc(
                                projectId, userId).map(ProjectImage::getAnnotatedAt),
                        assignmentRepository.findTopByProjectIdAndUserIdAndLastActivityIsNotNullOrderByLastActivityDesc(
                                projectId, userId).map(ImageAssignment::getLastActivity),
                        submissionRepository.findTopByProjectIdAndUserIdOrderBySubmittedAtDesc(projectId, userId)
                                .map(SubmissionReview::getSubmittedAt))
                .flatMap(Optional::stream)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }

    private void requireProject(UUID projectId) {
        if (!projectRepository.existsById(projectId)) throw NotFoundException.of("Project", projectId);
    }

    static AssignmentResponse toResponse(ImageAssignment a) {
        return new AssignmentResponse(a.getId(), a.getProjectId(), a.getUserId(), a.getImageIds(), a.getStatus(),
                a.getTotalImages(), a.getCompletedImages(), a.getAssignedBy(), a.getAssignedAt(), a.getLastActivity());
    }

    public static DistributionResponse toResponse(DistributionResult r) {
        return new DistributionResponse(r.projectId(), r.mode().name(), r.reset(), r.poolSize(), r.distributed(),
                r.granted().stream().map(g -> new DistributionResponse.Allocation(g.userId(), g.count())).toList());
    }
}
