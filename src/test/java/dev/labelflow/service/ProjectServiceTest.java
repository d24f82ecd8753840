package dev.labelflow.service;

import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectClass;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.entity.ProjectMember;
import dev.labelflow.domain.enums.ImageStatus;
import dev.labelflow.domain.enums.MemberRole;
import dev.labelflow.domain.enums.ProgressStatus;
import dev.labelflow.domain.enums.ProjectStatus;
import dev.labelflow.exception.ConflictException;
import dev.labelflow.exception.NotFoundException;
import dev.labelflow.exception.ValidationException;
import dev.labelflow.support.WorkflowTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectServiceTest extends WorkflowTestSupport {

    @Nested
    @DisplayName("createProject")
    class Create {

        @Test
        @DisplayName("starts empty and makes the creator a reviewer")
        void creatorBecomesReviewer() {
            Project project = newProject();

            assertThat(project.getStatus()).isEqualTo(ProjectStatus.CREATED);
            assertThat(project.getProgressStatus()).isEqualTo(ProgressStatus.CREATED);
            assertThat(project.getClasses()).extracting(ProjectClass::getName).containsExactly("car", "person");
            ProjectMember creator = memberRepository.findByProjectIdAndUserId(project.getId(), admin).orElseThrow();
            assertThat(creator.getRole()).isEqualTo(MemberRole.REVIEWER);
        }

        @Test
        @DisplayName("requires a name")
        void blankName() {
            assertThatThrownBy(() -> projectService.createProject(" ", null, List.of(), admin))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("membership")
    class Membership {

        @Test
        @DisplayName("adding the same user twice is a conflict")
        void duplicateMember() {
            Project project = newProject();
            UUID annotator = addAnnotator(project);

            assertThatThrownBy(() -> projectService.addMember(project.getId(), annotator, MemberRole.REVIEWER, admin))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("already a member");
        }

        @Test
        @DisplayName("removing a member returns their work to the pool and keeps attribution")
        void removalReclaimsWork() {
            Project project = newProject();
            UUID leaving = addAnnotator(project);
            registerImages(project, 6);
            assign(project, leaving, 4);
            List<UUID> held = pendingAssignment(project, leaving).getImageIds();
            annotationService.recordAnnotation(project.getId(), held.get(0), leaving, true, 40);
            annotationService.recordAnnotation(project.getId(), held.get(1), leaving, true, 25);

            projectService.removeMember(project.getId(), leaving, admin);

            assertThat(held).allSatisfy(id -> {
                ProjectImage image = image(id);
                assertThat(image.getAssignedTo()).isNull();
                assertThat(image.getStatus()).isEqualTo(ImageStatus.UPLOADED);
            });
            assertThat(image(held.get(0)).getAnnotatedBy()).isEqualTo(leaving);
            assertThat(image(held.get(1)).getAnnotatedBy()).isEqualTo(leaving);
            assertThat(image(held.get(2)).getAnnotatedBy()).isNull();
            assertThat(assignmentsOf(project, leaving)).isEmpty();
            assertThat(memberRepository.existsByProjectIdAndUserId(project.getId(), leaving)).isFalse();
            assertThat(imageRepository.countByProjectIdAndAssignedToIsNull(project.getId())).isEqualTo(6);
        }

        @Test
        @DisplayName("removing someone who is not a member is NotFound")
        void removeUnknownMember() {
            Project project = newProject();

            assertThatThrownBy(() -> projectService.removeMember(project.getId(), UUID.randomUUID(), admin))
                    .isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("images and lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("registering images updates the counters")
        void registerUpdatesCounters() {
            Project project = newProject();

            registerImages(project, 3);

            assertThat(project(project.getId()).getTotalImages()).isEqualTo(3);
            assertThat(project(project.getId()).getCompletionPercentage()).isZero();
        }

        @Test
        @DisplayName("an empty image batch is rejected")
        void emptyBatch() {
            Project project = newProject();

            assertThatThrownBy(() -> projectService.registerImages(project.getId(), List.of(), admin))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("an archived project accepts no images and cannot be archived again")
        void archived() {
            Project project = newProject();
            projectService.archiveProject(project.getId(), admin);

            assertThatThrownBy(() -> registerImages(project, 1)).isInstanceOf(ConflictException.class);
            assertThatThrownBy(() -> projectService.archiveProject(project.getId(), admin))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
