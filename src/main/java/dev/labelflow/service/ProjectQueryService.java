package dev.labelflow.service;

import dev.labelflow.config.WorkflowProperties;
import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.entity.ProjectMember;
import dev.labelflow.dto.response.ImageResponse;
import dev.labelflow.dto.response.MemberResponse;
import dev.labelflow.dto.response.PageResponse;
import dev.labelflow.dto.response.ProjectResponse;
import dev.labelflow.exception.NotFoundException;
import dev.labelflow.repository.ProjectImageRepository;
import dev.labelflow.repository.ProjectMemberRepository;
import dev.labelflow.repository.ProjectRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/** Read-side service with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class ProjectQueryService {
    private final ProjectRepository projectRepository;
    private final ProjectMemberRepository memberRepository;
    private final ProjectImageRepository imageRepository;
    private final WorkflowProperties properties;

    public ProjectQueryService(ProjectRepository projectRepository, ProjectMemberRepository memberRepository,
                               ProjectImageRepository imageRepository, WorkflowProperties properties) {
        this.projectRepository = projectRepository;
        this.memberRepository = memberRepository;
        this.imageRepository = imageRepository;
        this.properties = properties;
    }

    public ProjectResponse getProject(UUID projectId) {
        return projectRepository.findById(projectId)
                .map(ProjectQueryService::toResponse)
                .orElseThrow(() -> NotFoundException.of("Project", projectId));
    }

    public PageResponse<MemberResponse> listMembers(UUID projectId, int page, int size) {
        requireProject(projectId);
        return PageResponse.of(memberRepository
                .findByProjectIdOrderByAddedAtAsc(projectId, PageRequest.of(page, properties.clampPageSize(size)))
                .map(ProjectQueryService::toResponse));
    }

    public boolean isMember(UUID projectId, UUID userId) {
        return memberRepository.existsByProjectIdAndUserId(projectId, userId);
    }

    public ImageResponse getImage(UUID imageId) {
        return imageRepository.findById(imageId)
                .map(ProjectQueryService::toResponse)
                .orElseThrow(() -> NotFoundException.of("Image", imageId));
    }

    private void requireProject(UUID projectId) {
        if (!projectRepository.existsById(projectId)) throw NotFoundException.of("Project", projectId);
    }

    static ProjectResponse toResponse(Project p) {
        return new ProjectResponse(p.getId(), p.getName(), p.getDescription(),
                p.getClasses().stream()
                        .map(c -> new ProjectResponse.ClassSummary(c.getClassId(), c.getName(), c.getColor(), c.isCustom()))
                        .toList(),
                p.getStatus(), p.getProgressStatus(), p.getTotalImages(), p.getAnnotatedImages(),
                p.getReviewedImages(), p.getApprovedImages(), p.getCompletionPercentage(),
                p.getCreatedBy(), p.getCreatedAt(), p.getUpdatedAt(), p.getCompletedBy(), p.getCompletedAt());
    }

    public static MemberResponse toResponse(ProjectMember m) {
        return new MemberResponse(m.getId(), m.getProjectId(), m.getUserId(), m.getRole(), m.getAddedBy(),
                m.getAddedAt());
    }

    public static ImageResponse toResponse(ProjectImage i) {
        return new ImageResponse(i.getId(), i.getProjectId(), i.getFilename(), i.getStorageKey(), i.getStatus(),
                i.getAssignedTo(), i.getAnnotationStatus(), i.getAnnotatedBy(), i.getAnnotatedAt(),
                i.getTimeSpentSeconds(), i.getReviewStatus(), i.getReviewedBy(), i.getReviewedAt(),
                i.getCurrentSubmissionId(), i.getUploadedAt());
    }
}
