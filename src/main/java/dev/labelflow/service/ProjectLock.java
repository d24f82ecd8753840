package dev.labelflow.service;

import dev.labelflow.domain.entity.Project;
import dev.labelflow.exception.NotFoundException;
import dev.labelflow.repository.ProjectRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Per-project serialization point for workflow writes.
 *
 * <p>Takes a row lock on the project that is held until the surrounding
 * transaction ends, so pool selection and claim, submission creation and
 * review decisions on one project never interleave.
 */
@Component
public class ProjectLock {

    private final ProjectRepository projectRepository;

    public ProjectLock(ProjectRepository projectRepository) {
        this.projectRepository = projectRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Project acquire(UUID projectId) {
        return projectRepository.findByIdForUpdate(projectId)
                .orElseThrow(() -> NotFoundException.of("Project", projectId));
    }
}
