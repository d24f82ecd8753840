package dev.labelflow.controller;

import dev.labelflow.domain.valueobject.Actor;
import dev.labelflow.dto.request.AnnotationProgressRequest;
import dev.labelflow.dto.response.ImageResponse;
import dev.labelflow.service.AnnotationProgressService;
import dev.labelflow.service.ProjectQueryService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Receives save notifications from the annotation editor.
 */
@RestController
@RequestMapping("/projects/{projectId}/images/{imageId}/annotation")
public class AnnotationController {
    private final AnnotationProgressService annotationService;

    public AnnotationController(AnnotationProgressService annotationService) {
        this.annotationService = annotationService;
    }

    @PutMapping
    public ResponseEntity<ImageResponse> recordAnnotation(@PathVariable UUID projectId, @PathVariable UUID imageId,
                                                          @Valid @RequestBody AnnotationProgressRequest request,
                                                          @AuthenticationPrincipal Actor actor) {
        return ResponseEntity.ok(ProjectQueryService.toResponse(annotationService.recordAnnotation(
                projectId, imageId, actor.id(), request.completed(), request.timeSpentSeconds())));
    }
}
