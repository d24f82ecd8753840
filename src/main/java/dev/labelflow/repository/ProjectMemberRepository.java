package dev.labelflow.repository;

import dev.labelflow.domain.entity.ProjectMember;
import dev.labelflow.domain.enums.MemberRole;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProjectMemberRepository extends JpaRepository<ProjectMember, UUID> {

    /** Membership order used by smart distribution. */
    List<ProjectMember> findByProjectIdAndRoleOrderByAddedAtAscIdAsc(UUID projectId, MemberRole role);

    Page<ProjectMember> findByProjectIdOrderByAddedAtAsc(UUID projectId, Pageable pageable);

    Optional<ProjectMember> findByProjectIdAndUserId(UUID projectId, UUID userId);

    boolean existsByProjectIdAndUserId(UUID projectId, UUID userId);

    boolean existsByProjectIdAndUserIdAndRole(UUID projectId, UUID userId, MemberRole role);
}
