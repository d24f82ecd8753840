package dev.labelflow.controller;

import dev.labelflow.config.SecurityConfig;
import dev.labelflow.domain.valueobject.DistributionResult;
import dev.labelflow.domain.valueobject.DistributionResult.DistributionMode;
import dev.labelflow.domain.valueobject.UserAllocation;
import dev.labelflow.dto.response.PageResponse;
import dev.labelflow.exception.ValidationException;
import dev.labelflow.service.AssignmentQueryService;
import dev.labelflow.service.DistributionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AssignmentController.class)
@Import(SecurityConfig.class)
class AssignmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DistributionService distributionService;

    @MockitoBean
    private AssignmentQueryService queryService;

    private final UUID projectId = UUID.randomUUID();
    private final UUID adminId = UUID.randomUUID();

    @Test
    @DisplayName("smart distribution without a body does not reset")
    void smartWithoutBody() throws Exception {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        when(distributionService.distributeSmart(projectId, adminId, false)).thenReturn(new DistributionResult(
                projectId, DistributionMode.SMART, false, 7,
                List.of(new UserAllocation(a, 4), new UserAllocation(b, 3))));

        mockMvc.perform(post("/projects/{projectId}/assignments/smart", projectId)
                        .header("X-Actor-Id", adminId.toString())
                        .header("X-Actor-Role", "ADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("SMART"))
                .andExpect(jsonPath("$.distributed").value(7))
                .andExpect(jsonPath("$.allocations[0].userId").value(a.toString()))
                .andExpect(jsonPath("$.allocations[0].count").value(4))
                .andExpect(jsonPath("$.allocations[1].count").value(3));
    }

    @Test
    @DisplayName("manual distribution forwards allocations and the reset flag")
    void manual() throws Exception {
        UUID annotator = UUID.randomUUID();
        List<UserAllocation> allocations = List.of(new UserAllocation(annotator, 5));
        when(distributionService.distributeManual(projectId, allocations, adminId, true)).thenReturn(
                new DistributionResult(projectId, DistributionMode.MANUAL, true, 9, allocations));

        mockMvc.perform(post("/projects/{projectId}/assignments", projectId)
                        .header("X-Actor-Id", adminId.toString())
                        .header("X-Actor-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"allocations": [{"userId": "%s", "count": 5}], "resetDistribution": true}
                                """.formatted(annotator)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reset").value(true))
                .andExpect(jsonPath("$.poolSize").value(9));
    }

    @Test
    @DisplayName("an empty pool is a 400 with the service message")
    void emptyPool() throws Exception {
        when(distributionService.distributeSmart(projectId, adminId, false))
                .thenThrow(new ValidationException("No unassigned images available in project " + projectId));

        mockMvc.perform(post("/projects/{projectId}/assignments/smart", projectId)
                        .header("X-Actor-Id", adminId.toString())
                        .header("X-Actor-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resetDistribution\": false}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("No unassigned images available in project " + projectId));
    }

    @Test
    @DisplayName("annotators cannot distribute work")
    void annotatorForbidden() throws Exception {
        mockMvc.perform(post("/projects/{projectId}/assignments/smart", projectId)
                        .header("X-Actor-Id", UUID.randomUUID().toString()))
                .andExpect(status().isForbidden());

        verify(distributionService, never()).distributeSmart(any(), any(), anyBoolean());
    }

    @Test
    @DisplayName("any authenticated user may list their own assignments")
    void mine() throws Exception {
        UUID userId = UUID.randomUUID();
        when(queryService.listUserAssignments(projectId, userId, 0, 20))
                .thenReturn(new PageResponse<>(List.of(), 0, 20, 0, 0));

        mockMvc.perform(get("/projects/{projectId}/assignments/mine", projectId)
                        .header("X-Actor-Id", userId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").isEmpty());
    }

    @Test
    @DisplayName("malformed identity headers leave the caller anonymous")
    void malformedIdentity() throws Exception {
        mockMvc.perform(get("/projects/{projectId}/assignments/mine", projectId)
                        .header("X-Actor-Id", "not-a-uuid"))
                .andExpect(status().isUnauthorized());
    }
}
