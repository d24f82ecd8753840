package dev.labelflow.service;

import dev.labelflow.config.WorkflowProperties;
import dev.labelflow.domain.entity.FlaggedImage;
import dev.labelflow.domain.entity.ImageFeedback;
import dev.labelflow.domain.entity.ReviewHistoryEntry;
import dev.labelflow.domain.entity.SubmissionReview;
import dev.labelflow.domain.enums.AnnotationStatus;
import dev.labelflow.domain.enums.ImageReviewStatus;
import dev.labelflow.domain.enums.ImageStatus;
import dev.labelflow.domain.enums.SubmissionStatus;
import dev.labelflow.dto.response.ImageFeedbackResponse;
import dev.labelflow.dto.response.PageResponse;
import dev.labelflow.dto.response.SubmissionResponse;
import dev.labelflow.dto.response.SubmissionStatsResponse;
import dev.labelflow.dto.response.UserSubmissionStatusResponse;
import dev.labelflow.exception.NotFoundException;
import dev.labelflow.repository.ProjectImageRepository;
import dev.labelflow.repository.ProjectRepository;
import dev.labelflow.repository.SubmissionReviewRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Read-side service with read-only transactions. */
@Service
@Transactional(readOnly = true)
public class SubmissionQueryService {
    private final ProjectRepository projectRepository;
    private final SubmissionReviewRepository submissionRepository;
    private final ProjectImageRepository imageRepository;
    private final WorkflowProperties properties;

    public SubmissionQueryService(ProjectRepository projectRepository, SubmissionReviewRepository submissionRepository,
                                  ProjectImageRepository imageRepository, WorkflowProperties properties) {
        this.projectRepository = projectRepository;
        this.submissionRepository = submissionRepository;
        this.imageRepository = imageRepository;
        this.properties = properties;
    }

    /**
     * Newest first. Either filter may be null.
     */
    public PageResponse<SubmissionResponse> listSubmissions(UUID projectId, UUID userId, SubmissionStatus status,
                                                            int page, int size) {
        requireProject(projectId);
        Pageable pageable = PageRequest.of(page, properties.clampPageSize(size));
        Page<SubmissionReview> result;
        if (userId != null && status != null) {
            result = submissionRepository.findByProjectIdAndUserIdAndStatusOrderBySubmittedAtDesc(
                    projectId, userId, status, pageable);
        } else if (userId != null) {
            result = submissionRepository.findByProjectIdAndUserIdOrderBySubmittedAtDesc(projectId, userId, pageable);
        } else if (status != null) {
            result = submissionRepository.findByProjectIdAndStatusOrderBySubmittedAtDesc(projectId, status, pageable);
        } else {
            result = submissionRepository.findByProjectIdOrderBySubmittedAtDesc(projectId, pageable);
        }
        return PageResponse.of(result.map(SubmissionQueryService::toResponse));
    }

    public SubmissionResponse getSubmission(UUID projectId, UUID submissionId) {
        return toResponse(findInProject(projectId, submissionId));
    }

    /** Owner of a submission, for access checks at the web layer. */
    public UUID ownerOf(UUID projectId, UUID submissionId) {
        return findInProject(projectId, submissionId).getUserId();
    }

    public ImageFeedbackResponse getImageFeedback(UUID projectId, UUID submissionId, UUID imageId) {
        SubmissionReview submission = findInProject(projectId, submissionId);
        if (!submission.includes(imageId)) {
            throw new NotFoundException("Image %s is not part of submission %s".formatted(imageId, submissionId));
        }
        Optional<FlaggedImage> flag = submission.getFlaggedImages().stream()
                .filter(f -> f.getImageId().equals(imageId))
                .findFirst();
        return new ImageFeedbackResponse(submissionId, imageId, flag.isPresent(),
                flag.map(FlaggedImage::getReason).orElse(null),
                submission.feedbackFor(imageId).orElse(null));
    }

    public SubmissionStatsResponse getStats(UUID projectId) {
        requireProject(projectId);
        return new SubmissionStatsResponse(
                submissionRepository.countByProjectId(projectId),
                submissionRepository.countByProjectIdAndStatusIn(projectId, SubmissionStatus.PENDING),
                submissionRepository.countByProjectIdAndStatus(projectId, SubmissionStatus.APPROVED),
                submissionRepository.countByProjectIdAndStatus(projectId, SubmissionStatus.REJECTED));
    }

    /**
     * The user's standing in the review cycle. {@code completed} counts
     * finished annotations not yet reviewed; progress is approved over assigned.
     */
    public UserSubmissionStatusResponse getUserStatus(UUID projectId, UUID userId) {
        requireProject(projectId);
        long assigned = imageRepository.countByProjectIdAndAssignedTo(projectId, userId);
        long completed = imageRepository.countByProjectIdAndAssignedToAndAnnotationStatusAndReviewStatus(
                projectId, userId, AnnotationStatus.COMPLETED, ImageReviewStatus.NOT_REVIEWED);
        long flagged = imageRepository.countByProjectIdAndAssignedToAndReviewStatus(
                projectId, userId, ImageReviewStatus.FLAGGED);
        long approved = imageRepository.countByProjectIdAndAssignedToAndReviewStatus(
                projectId, userId, ImageReviewStatus.APPROVED);
        long pendingReview = imageRepository.countByProjectIdAndAssignedToAndStatus(
                projectId, userId, ImageStatus.UNDER_REVIEW);
        UUID pendingSubmission = submissionRepository
                .findFirstByProjectIdAndUserIdAndStatusIn(projectId, userId, SubmissionStatus.PENDING)
                .map(SubmissionReview::getId)
                .orElse(null);
        int progress = assigned > 0 ? (int) Math.round(100.0 * approved / assigned) : 0;
        return new UserSubmissionStatusResponse(assigned, completed, flagged, approved, pendingReview, progress,
                pendingSubmission == null && completed > 0, pendingSubmission);
    }

    private SubmissionReview findInProject(UUID projectId, UUID submissionId) {
        return submissionRepository.findById(submissionId)
                .filter(s -> s.getProjectId().equals(projectId))
                .orElseThrow(() -> NotFoundException.of("Submission", submissionId));
    }

    private void requireProject(UUID projectId) {
        if (!projectRepository.existsById(projectId)) throw NotFoundException.of("Project", projectId);
    }

    static SubmissionResponse toResponse(SubmissionReview s) {
        return new SubmissionResponse(s.getId(), s.getProjectId(), s.getUserId(), s.getAssignmentId(),
                s.getImageIds(), s.getMessage(), s.getStatus(), s.getFeedback(),
                flags(s.getFlaggedImages()), feedback(s.getImageFeedback()),
                s.getReviewHistory().stream().map(SubmissionQueryService::toEntry).toList(),
                s.getSubmittedAt(), s.getReviewedBy(), s.getReviewedAt());
    }

    private static SubmissionResponse.HistoryEntry toEntry(ReviewHistoryEntry e) {
        return new SubmissionResponse.HistoryEntry(e.getReviewedBy(), e.getReviewedAt(), e.getStatus(),
                e.getFeedback(), flags(e.getFlaggedImages()), feedback(e.getImageFeedback()));
    }

    private static List<SubmissionResponse.Flag> flags(List<FlaggedImage> flagged) {
        return flagged.stream().map(f -> new SubmissionResponse.Flag(f.getImageId(), f.getReason())).toList();
    }

    private static List<SubmissionResponse.Feedback> feedback(List<ImageFeedback> feedback) {
        return feedback.stream().map(f -> new SubmissionResponse.Feedback(f.getImageId(), f.getFeedback())).toList();
    }
}
