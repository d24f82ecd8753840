package dev.labelflow.service;

import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectClass;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.entity.ProjectMember;
import dev.labelflow.domain.enums.ActivityAction;
import dev.labelflow.domain.enums.MemberRole;
import dev.labelflow.domain.event.ActivityEvent;
import dev.labelflow.exception.ConflictException;
import dev.labelflow.exception.NotFoundException;
import dev.labelflow.exception.ValidationException;
import dev.labelflow.repository.ProjectImageRepository;
import dev.labelflow.repository.ProjectMemberRepository;
import dev.labelflow.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Project lifecycle and membership.
 */
@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projectRepository;
    private final ProjectMemberRepository memberRepository;
    private final ProjectImageRepository imageRepository;
    private final ProjectLock projectLock;
    private final AssignmentLedger ledger;
    private final ProjectAggregator aggregator;
    private final ApplicationEventPublisher eventPublisher;

    public ProjectService(ProjectRepository projectRepository, ProjectMemberRepository memberRepository,
                          ProjectImageRepository imageRepository, ProjectLock projectLock, AssignmentLedger ledger,
                          ProjectAggregator aggregator, ApplicationEventPublisher eventPublisher) {
        this.projectRepository = projectRepository;
        this.memberRepository = memberRepository;
        this.imageRepository = imageRepository;
        this.projectLock = projectLock;
        this.ledger = ledger;
        this.aggregator = aggregator;
        this.eventPublisher = eventPublisher;
    }

    /** Creates the project; its creator joins as a reviewer. */
    @Transactional
    public Project createProject(String name, String description, List<ProjectClass> classes, UUID creatorId) {
        Project project = projectRepository.save(Project.create(name, description, classes, creatorId));
        memberRepository.save(ProjectMember.create(project.getId(), creatorId, MemberRole.REVIEWER, creatorId));
        eventPublisher.publishEvent(ActivityEvent.of(ActivityAction.PROJECT_CREATED, project.getId(), creatorId,
                Map.of("name", name, "classes", project.getClasses().size())));
        log.info("Created project {} '{}' by {}", project.getId(), name, creatorId);
        return project;
    }

    @Transactional
    public ProjectMember addMember(UUID projectId, UUID userId, MemberRole role, UUID actorId) {
        projectLock.acquire(projectId);
        if (role == null) {
            throw new ValidationException("Member role is required");
        }
        if (memberRepository.existsByProjectIdAndUserId(projectId, userId)) {
            throw new ConflictException("User %s is already a member of project %s".formatted(userId, projectId));
        }
        ProjectMember member = memberRepository.save(ProjectMember.create(projectId, userId, role, actorId));
        eventPublisher.publishEvent(ActivityEvent.of(ActivityAction.MEMBER_ADDED, projectId, actorId,
                Map.of("userId", userId, "role", role)));
        log.info("Added {} {} to project {}", role, userId, projectId);
        return member;
    }

    /**
     * Removes a member and reclaims the work they hold. Images go back to the
     * pool unassigned; who annotated them is kept.
     */
    @Transactional
    public void removeMember(UUID projectId, UUID userId, UUID actorId) {
        Project project = projectLock.acquire(projectId);
        ProjectMember member = memberRepository.findByProjectIdAndUserId(projectId, userId)
                .orElseThrow(() -> new NotFoundException(
                        "User %s is not a member of project %s".formatted(userId, projectId)));
        int reclaimed = ledger.reclaim(projectId, userId);
        memberRepository.delete(member);
        aggregator.recompute(project);
        eventPublisher.publishEvent(ActivityEvent.of(ActivityAction.MEMBER_REMOVED, projectId, actorId,
                Map.of("userId", userId, "role", member.getRole(), "reclaimedImages", reclaimed)));
        log.info("Removed {} {} from project {}; {} images returned to the pool",
                member.getRole(), userId, projectId, reclaimed);
    }

    /**
     * Registers already-stored images with the project. Only storage keys are
     * recorded; the bytes live in object storage.
     */
    @Transactional
    public List<ProjectImage> registerImages(UUID projectId, List<NewImage> images, UUID actorId) {
        Project project = projectLock.acquire(projectId);
        if (project.getStatus().isClosed()) {
            throw new ConflictException("Project %s is %s and no longer accepts images"
                    .formatted(projectId, project.getStatus()));
        }
        if (images == null || images.isEmpty()) {
            throw new ValidationException("At least one image is required");
        }
        List<ProjectImage> registered = imageRepository.saveAll(images.stream()
                .map(i -> ProjectImage.register(projectId, i.filename(), i.storageKey(), actorId))
                .toList());
        aggregator.recompute(project);
        eventPublisher.publishEvent(ActivityEvent.of(ActivityAction.IMAGES_REGISTERED, projectId, actorId,
                Map.of("count", registered.size())));
        log.info("Registered {} images in project {}", registered.size(), projectId);
        return registered;
    }

    @Transactional
    public Project archiveProject(UUID projectId, UUID actorId) {
        Project project = projectLock.acquire(projectId);
        project.markArchived();
        eventPublisher.publishEvent(ActivityEvent.of(ActivityAction.PROJECT_ARCHIVED, projectId, actorId, Map.of()));
        log.info("Archived project {} by {}", projectId, actorId);
        return project;
    }

    /** An image as handed over by the upload collaborator. */
    public record NewImage(String filename, String storageKey) {
    }
}
