package dev.labelflow.support;

import dev.labelflow.domain.entity.ImageAssignment;
import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectClass;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.enums.AssignmentStatus;
import dev.labelflow.domain.enums.MemberRole;
import dev.labelflow.domain.valueobject.UserAllocation;
import dev.labelflow.repository.ImageAssignmentRepository;
import dev.labelflow.repository.ProjectImageRepository;
import dev.labelflow.repository.ProjectMemberRepository;
import dev.labelflow.repository.ProjectRepository;
import dev.labelflow.repository.SubmissionReviewRepository;
import dev.labelflow.service.AnnotationProgressService;
import dev.labelflow.service.DistributionService;
import dev.labelflow.service.ProjectService;
import dev.labelflow.service.SubmissionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

/**
 * Base class for workflow tests against the Flyway schema on in-memory H2.
 *
 * <p>Each test runs in a transaction that is rolled back, so every test starts
 * from an empty database and builds its own project.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@ActiveProfiles("test")
@Transactional
public abstract class WorkflowTestSupport {

    @Autowired protected ProjectService projectService;
    @Autowired protected DistributionService distributionService;
    @Autowired protected SubmissionService submissionService;
    @Autowired protected AnnotationProgressService annotationService;

    @Autowired protected ProjectRepository projectRepository;
    @Autowired protected ProjectMemberRepository memberRepository;
    @Autowired protected ProjectImageRepository imageRepository;
    @Autowired protected ImageAssignmentRepository assignmentRepository;
    @Autowired protected SubmissionReviewRepository submissionRepository;

    protected final UUID admin = UUID.randomUUID();

    protected Project newProject() {
        return projectService.createProject("Street scenes", "Vehicles and pedestrians",
                List.of(ProjectClass.of("car", "#ff0000"), ProjectClass.of("person", "#00ff00")), admin);
    }

    protected UUID addAnnotator(Project project) {
        UUID userId = UUID.randomUUID();
        projectService.addMember(project.getId(), userId, MemberRole.ANNOTATOR, admin);
        return userId;
    }

    protected List<ProjectImage> registerImages(Project project, int count) {
        return projectService.registerImages(project.getId(), IntStream.range(0, count)
                .mapToObj(i -> new ProjectService.NewImage("img-%03d.jpg".formatted(i), "projects/%s/img-%03d.jpg"
                        .formatted(project.getId(), i)))
                .toList(), admin);
    }

    protected void assign(Project project, UUID userId, int count) {
        distributionService.distributeManual(project.getId(), List.of(new UserAllocation(userId, count)), admin, false);
    }

    /** Finishes the annotation of every image the user holds. */
    protected void annotateAll(Project project, UUID userId) {
        imageRepository.findByProjectIdAndAssignedTo(project.getId(), userId)
                .forEach(image -> annotationService.recordAnnotation(project.getId(), image.getId(), userId, true, 30));
    }

    protected ImageAssignment pendingAssignment(Project project, UUID userId) {
        return assignmentRepository.findFirstByProjectIdAndUserIdAndStatusInOrderByAssignedAtAsc(
                project.getId(), userId, AssignmentStatus.PENDING).orElseThrow();
    }

    protected List<ImageAssignment> assignmentsOf(Project project, UUID userId) {
        return assignmentRepository.findAll().stream()
                .filter(a -> a.getProjectId().equals(project.getId()) && a.getUserId().equals(userId))
                .toList();
    }

    protected ProjectImage image(UUID imageId) {
        return imageRepository.findById(imageId).orElseThrow();
    }

    protected Project project(UUID projectId) {
        return projectRepository.findById(projectId).orElseThrow();
    }
}
