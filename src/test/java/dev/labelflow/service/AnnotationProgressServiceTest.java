package dev.labelflow.service;

import dev.labelflow.domain.entity.ImageAssignment;
import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.entity.SubmissionReview;
import dev.labelflow.domain.enums.AnnotationStatus;
import dev.labelflow.domain.enums.AssignmentStatus;
import dev.labelflow.domain.enums.ImageStatus;
import dev.labelflow.domain.enums.ProjectStatus;
import dev.labelflow.exception.ConflictException;
import dev.labelflow.exception.ForbiddenException;
import dev.labelflow.support.WorkflowTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotationProgressServiceTest extends WorkflowTestSupport {

    private Project project;
    private UUID annotator;
    private UUID imageId;

    @BeforeEach
    void setUp() {
        project = newProject();
        annotator = addAnnotator(project);
        registerImages(project, 2);
        assign(project, annotator, 2);
        imageId = pendingAssignment(project, annotator).getImageIds().get(0);
    }

    @Test
    @DisplayName("a draft save starts the assignment and the project")
    void draftStartsWork() {
        annotationService.recordAnnotation(project.getId(), imageId, annotator, false, 15);

        ProjectImage image = image(imageId);
        assertThat(image.getAnnotationStatus()).isEqualTo(AnnotationStatus.IN_PROGRESS);
        assertThat(image.getAnnotatedBy()).isNull();
        assertThat(image.getTimeSpentSeconds()).isEqualTo(15);
        ImageAssignment assignment = pendingAssignment(project, annotator);
        assertThat(assignment.getStatus()).isEqualTo(AssignmentStatus.IN_PROGRESS);
        assertThat(assignment.getLastActivity()).isNotNull();
        assertThat(project(project.getId()).getStatus()).isEqualTo(ProjectStatus.IN_PROGRESS);
    }

    @Test
    @DisplayName("a completed save attributes the image and accumulates time")
    void completedSave() {
        annotationService.recordAnnotation(project.getId(), imageId, annotator, false, 10);
        annotationService.recordAnnotation(project.getId(), imageId, annotator, true, 20);

        ProjectImage image = image(imageId);
        assertThat(image.getStatus()).isEqualTo(ImageStatus.ANNOTATED);
        assertThat(image.getAnnotationStatus()).isEqualTo(AnnotationStatus.COMPLETED);
        assertThat(image.getAnnotatedBy()).isEqualTo(annotator);
        assertThat(image.getTimeSpentSeconds()).isEqualTo(30);
        assertThat(project(project.getId()).getAnnotatedImages()).isEqualTo(1);
    }

    @Test
    @DisplayName("only the assignee may annotate")
    void notAssignee() {
        UUID other = addAnnotator(project);

        assertThatThrownBy(() -> annotationService.recordAnnotation(project.getId(), imageId, other, true, 5))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("images under review are read-only")
    void underReview() {
        annotateAll(project, annotator);
        SubmissionReview submission = submissionService.submitForReview(project.getId(), annotator,
                pendingAssignment(project, annotator).getId(), "");

        assertThat(submission.getImageIds()).contains(imageId);
        assertThatThrownBy(() -> annotationService.recordAnnotation(project.getId(), imageId, annotator, true, 5))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("under review");
    }
}
