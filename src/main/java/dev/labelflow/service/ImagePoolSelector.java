package dev.labelflow.service;

import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.exception.NotFoundException;
import dev.labelflow.repository.ProjectImageRepository;
import dev.labelflow.repository.ProjectRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Computes the images eligible for (re)assignment.
 *
 * <p>The pool is unassigned images first, then (on reset) images still held by
 * someone but not yet annotated. Both parts are ordered by (uploadedAt, id), so
 * the same snapshot always slices the same way. Callers that claim from the
 * pool must hold the project lock.
 */
@Service
public class ImagePoolSelector {

    private final ProjectRepository projectRepository;
    private final ProjectImageRepository imageRepository;

    public ImagePoolSelector(ProjectRepository projectRepository, ProjectImageRepository imageRepository) {
        this.projectRepository = projectRepository;
        this.imageRepository = imageRepository;
    }

    @Transactional(readOnly = true)
    public List<ProjectImage> selectPool(UUID projectId, boolean includeRedistributable) {
        if (!projectRepository.existsById(projectId)) {
            throw NotFoundException.of("Project", projectId);
        }
        List<ProjectImage> pool = new ArrayList<>(
                imageRepository.findByProjectIdAndAssignedToIsNullOrderByUploadedAtAscIdAsc(projectId));
        if (includeRedistributable) {
            pool.addAll(imageRepository.findRedistributable(projectId));
        }
        return pool;
    }
}
