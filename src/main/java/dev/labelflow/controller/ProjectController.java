package dev.labelflow.controller;

import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectClass;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.entity.ProjectMember;
import dev.labelflow.domain.valueobject.Actor;
import dev.labelflow.dto.request.AddMemberRequest;
import dev.labelflow.dto.request.CreateProjectRequest;
import dev.labelflow.dto.request.RegisterImagesRequest;
import dev.labelflow.dto.response.ImageResponse;
import dev.labelflow.dto.response.MemberResponse;
import dev.labelflow.dto.response.PageResponse;
import dev.labelflow.dto.response.ProjectResponse;
import dev.labelflow.service.ProjectQueryService;
import dev.labelflow.service.ProjectService;
import dev.labelflow.service.SubmissionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/projects")
public class ProjectController {
    private final ProjectService projectService;
    private final SubmissionService submissionService;
    private final ProjectQueryService queryService;

    public ProjectController(ProjectService projectService, SubmissionService submissionService,
                             ProjectQueryService queryService) {
        this.projectService = projectService;
        this.submissionService = submissionService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<ProjectResponse> createProject(@Valid @RequestBody CreateProjectRequest request,
                                                         @AuthenticationPrincipal Actor actor) {
        List<ProjectClass> classes = request.classes() == null ? List.of() : request.classes().stream()
                .map(c -> ProjectClass.of(c.name(), c.color()))
                .toList();
        Project project = projectService.createProject(request.name(), request.description(), classes, actor.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(queryService.getProject(project.getId()));
    }

    @GetMapping("/{projectId}")
    public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID projectId) {
        return ResponseEntity.ok(queryService.getProject(projectId));
    }

    @PostMapping("/{projectId}/images")
    public ResponseEntity<List<ImageResponse>> registerImages(@PathVariable UUID projectId,
                                                              @Valid @RequestBody RegisterImagesRequest request,
                                                              @AuthenticationPrincipal Actor actor) {
        List<ProjectImage> images = projectService.registerImages(projectId, request.images().stream()
                .map(i -> new ProjectService.NewImage(i.filename(), i.storageKey()))
                .toList(), actor.id());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(images.stream().map(ProjectQueryService::toResponse).toList());
    }

    @GetMapping("/{projectId}/members")
    public ResponseEntity<PageResponse<MemberResponse>> listMembers(@PathVariable UUID projectId,
                                                                    @RequestParam(defaultValue = "0") int page,
                                                                    @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(queryService.listMembers(projectId, page, size));
    }

    @PostMapping("/{projectId}/members")
    public ResponseEntity<MemberResponse> addMember(@PathVariable UUID projectId,
                                                    @Valid @RequestBody AddMemberRequest request,
                                                    @AuthenticationPrincipal Actor actor) {
        ProjectMember member = projectService.addMember(projectId, request.userId(), request.role(), actor.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectQueryService.toResponse(member));
    }

    @DeleteMapping("/{projectId}/members/{userId}")
    public ResponseEntity<Void> removeMember(@PathVariable UUID projectId, @PathVariable UUID userId,
                                             @AuthenticationPrincipal Actor actor) {
        projectService.removeMember(projectId, userId, actor.id());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{projectId}/complete")
    public ResponseEntity<ProjectResponse> completeProject(@PathVariable UUID projectId,
                                                           @AuthenticationPrincipal Actor actor) {
        submissionService.completeProject(projectId, actor.id());
        return ResponseEntity.ok(queryService.getProject(projectId));
    }

    @PostMapping("/{projectId}/archive")
    public ResponseEntity<ProjectResponse> archiveProject(@PathVariable UUID projectId,
                                                          @AuthenticationPrincipal Actor actor) {
        projectService.archiveProject(projectId, actor.id());
        return ResponseEntity.ok(queryService.getProject(projectId));
    }
}
