package dev.labelflow.service;

import dev.labelflow.domain.entity.ImageAssignment;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.enums.AssignmentStatus;
import dev.labelflow.domain.enums.ImageReviewStatus;
import dev.labelflow.domain.enums.SubmissionStatus;
import dev.labelflow.repository.ImageAssignmentRepository;
import dev.labelflow.repository.ProjectImageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Owns {@link ImageAssignment} records.
 *
 * <p>Every method joins the caller's transaction, which is expected to hold the
 * project lock. Keeps two invariants: at most one pending record per
 * (project, user), and no image listed by two records at once.
 */
@Service
@Transactional(propagation = Propagation.MANDATORY)
public class AssignmentLedger {

    private static final Logger log = LoggerFactory.getLogger(AssignmentLedger.class);

    private final ImageAssignmentRepository assignmentRepository;
    private final ProjectImageRepository imageRepository;

    public AssignmentLedger(ImageAssignmentRepository assignmentRepository,
                            ProjectImageRepository imageRepository) {
        this.assignmentRepository = assignmentRepository;
        this.imageRepository = imageRepository;
    }

    /**
     * Removes the given images from every record that still lists them.
     * Records left empty are deleted.
     *
     * @return number of records touched
     */
    public int releaseImages(UUID projectId, Collection<UUID> imageIds) {
        if (imageIds.isEmpty()) return 0;
        List<ImageAssignment> holders = assignmentRepository.findContainingAny(projectId, imageIds);
        for (ImageAssignment assignment : holders) {
            if (assignment.removeImages(imageIds)) {
                assignmentRepository.delete(assignment);
                log.debug("Deleted emptied assignment {} of user {}", assignment.getId(), assignment.getUserId());
            } else {
                log.debug("Assignment {} shrunk to {} images", assignment.getId(), assignment.getTotalImages());
            }
        }
        assignmentRepository.flush();
        return holders.size();
    }

    /**
     * Grants images to a user: appends to the pending record or opens a new one,
     * then stamps ownership on each image.
     */
    public ImageAssignment grant(UUID projectId, UUID userId, List<ProjectImage> images, UUID actorId) {
        List<UUID> ids = images.stream().map(ProjectImage::getId).toList();
        ImageAssignment assignment = assignmentRepository
                .findFirstByProjectIdAndUserIdAndStatusInOrderByAssignedAtAsc(projectId, userId, AssignmentStatus.PENDING)
                .map(pending -> {
                    pending.addImages(ids);
                    return pending;
                })
                .orElseGet(() -> assignmentRepository.save(ImageAssignment.create(projectId, userId, ids, actorId)));
        images.forEach(image -> image.assignTo(userId));
        log.debug("Granted {} images to user {} in assignment {}", ids.size(), userId, assignment.getId());
        return assignment;
    }

    /**
     * Takes back everything a departing member holds. Images keep their
     * annotation attribution; pending records are deleted, submitted ones stay
     * for the review trail.
     *
     * @return number of images unassigned
     */
    public int reclaim(UUID projectId, UUID userId) {
        List<ProjectImage> held = imageRepository.findByProjectIdAndAssignedTo(projectId, userId);
        held.forEach(ProjectImage::unassign);
        List<ImageAssignment> pending = assignmentRepository
                .findByProjectIdAndUserIdAndStatusIn(projectId, userId, AssignmentStatus.PENDING);
        assignmentRepository.deleteAll(pending);
        log.info("Reclaimed {} images and {} pending assignments from user {} in project {}",
                held.size(), pending.size(), userId, projectId);
        return held.size();
    }

    /** Records annotation activity on the pending record owning the image, if any. */
    public void touchOwning(UUID projectId, UUID userId, UUID imageId) {
        assignmentRepository.findOwningImage(projectId, userId, imageId, AssignmentStatus.PENDING)
                .forEach(ImageAssignment::markInProgress);
    }

    /**
     * Mirrors a review decision onto the batch, then re-derives completion from
     * its images: when every image is approved the record is COMPLETED whatever
     * the latest decision said, so partial approvals over several rounds converge.
     */
    public void applyReview(ImageAssignment assignment, SubmissionStatus decision) {
        List<UUID> ids = assignment.getImageIds();
        int approved = ids.isEmpty() ? 0
                : (int) imageRepository.countByIdInAndReviewStatus(ids, ImageReviewStatus.APPROVED);
        assignment.applyDecision(decision, approved);
        if (!ids.isEmpty() && approved == ids.size()) {
            assignment.markFullyApproved();
            log.info("Assignment {} fully approved ({} images)", assignment.getId(), ids.size());
        }
    }
}
