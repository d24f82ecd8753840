package dev.labelflow.controller;

import dev.labelflow.config.SecurityConfig;
import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectMember;
import dev.labelflow.domain.enums.MemberRole;
import dev.labelflow.domain.enums.ProgressStatus;
import dev.labelflow.domain.enums.ProjectStatus;
import dev.labelflow.dto.response.ProjectResponse;
import dev.labelflow.exception.ConflictException;
import dev.labelflow.service.ProjectQueryService;
import dev.labelflow.service.ProjectService;
import dev.labelflow.service.SubmissionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ProjectController.class)
@Import(SecurityConfig.class)
class ProjectControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProjectService projectService;

    @MockitoBean
    private SubmissionService submissionService;

    @MockitoBean
    private ProjectQueryService queryService;

    private final UUID adminId = UUID.randomUUID();

    @Test
    @DisplayName("admins create projects and get 201")
    void create() throws Exception {
        Project project = Project.create("Birds", null, List.of(), adminId);
        when(projectService.createProject(eq("Birds"), any(), anyList(), eq(adminId))).thenReturn(project);
        when(queryService.getProject(project.getId())).thenReturn(response(project.getId(), ProjectStatus.CREATED));

        mockMvc.perform(post("/projects")
                        .header("X-Actor-Id", adminId.toString())
                        .header("X-Actor-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Birds", "classes": [{"name": "heron", "color": "#3366ff"}]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(project.getId().toString()))
                .andExpect(jsonPath("$.status").value("CREATED"));
    }

    @Test
    @DisplayName("regular users cannot create projects")
    void createForbidden() throws Exception {
        mockMvc.perform(post("/projects")
                        .header("X-Actor-Id", UUID.randomUUID().toString())
                        .header("X-Actor-Role", "USER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Birds\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("adding a member returns the membership")
    void addMember() throws Exception {
        UUID projectId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();
        when(projectService.addMember(projectId, userId, MemberRole.ANNOTATOR, adminId))
                .thenReturn(ProjectMember.create(projectId, userId, MemberRole.ANNOTATOR, adminId));

        mockMvc.perform(post("/projects/{projectId}/members", projectId)
                        .header("X-Actor-Id", adminId.toString())
                        .header("X-Actor-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\": \"%s\", \"role\": \"ANNOTATOR\"}".formatted(userId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.userId").value(userId.toString()))
                .andExpect(jsonPath("$.role").value("ANNOTATOR"));
    }

    @Test
    @DisplayName("removing a member answers 204")
    void removeMember() throws Exception {
        UUID projectId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();

        mockMvc.perform(delete("/projects/{projectId}/members/{userId}", projectId, userId)
                        .header("X-Actor-Id", adminId.toString())
                        .header("X-Actor-Role", "SUPER_ADMIN"))
                .andExpect(status().isNoContent());

        verify(projectService).removeMember(projectId, userId, adminId);
    }

    @Test
    @DisplayName("completing too early is a 409 with the approval count")
    void completeTooEarly() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(submissionService.completeProject(projectId, adminId)).thenThrow(new ConflictException(
                "Cannot mark project as complete. Only 9 out of 10 images are approved."));

        mockMvc.perform(post("/projects/{projectId}/complete", projectId)
                        .header("X-Actor-Id", adminId.toString())
                        .header("X-Actor-Role", "ADMIN"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.detail")
                        .value("Cannot mark project as complete. Only 9 out of 10 images are approved."));
    }

    @Test
    @DisplayName("completion returns the closed project")
    void complete() throws Exception {
        UUID projectId = UUID.randomUUID();
        when(queryService.getProject(projectId)).thenReturn(response(projectId, ProjectStatus.COMPLETED));

        mockMvc.perform(post("/projects/{projectId}/complete", projectId)
                        .header("X-Actor-Id", adminId.toString())
                        .header("X-Actor-Role", "ADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.completionPercentage").value(100));

        verify(submissionService).completeProject(projectId, adminId);
    }

    private ProjectResponse response(UUID id, ProjectStatus status) {
        boolean done = status == ProjectStatus.COMPLETED;
        return new ProjectResponse(id, "Birds", null, List.of(), status,
                done ? ProgressStatus.COMPLETED : ProgressStatus.CREATED, 0, 0, 0, 0, done ? 100 : 0,
                adminId, Instant.now(), Instant.now(), done ? adminId : null, null);
    }
}
