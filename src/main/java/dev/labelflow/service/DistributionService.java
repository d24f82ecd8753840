package dev.labelflow.service;

import dev.labelflow.domain.entity.Project;
import dev.labelflow.domain.entity.ProjectImage;
import dev.labelflow.domain.entity.ProjectMember;
import dev.labelflow.domain.enums.ActivityAction;
import dev.labelflow.domain.enums.MemberRole;
import dev.labelflow.domain.event.ActivityEvent;
import dev.labelflow.domain.valueobject.DistributionResult;
import dev.labelflow.domain.valueobject.DistributionResult.DistributionMode;
import dev.labelflow.domain.valueobject.UserAllocation;
import dev.labelflow.exception.ValidationException;
import dev.labelflow.repository.ProjectMemberRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Allocates pool images to annotators.
 *
 * <p>Both modes run the same claim under the project lock: validate every
 * target before touching anything, slice the pool in allocation order, release
 * moved images from whatever records still list them, then grant. A failure at
 * any point rolls the whole call back.
 */
@Service
public class DistributionService {

    private static final Logger log = LoggerFactory.getLogger(DistributionService.class);

    private final ProjectLock projectLock;
    private final ImagePoolSelector poolSelector;
    private final AssignmentLedger ledger;
    private final ProjectAggregator aggregator;
    private final ProjectMemberRepository memberRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    public DistributionService(ProjectLock projectLock, ImagePoolSelector poolSelector, AssignmentLedger ledger,
                               ProjectAggregator aggregator, ProjectMemberRepository memberRepository,
                               ApplicationEventPublisher eventPublisher, MeterRegistry meterRegistry) {
        this.projectLock = projectLock;
        this.poolSelector = poolSelector;
        this.ledger = ledger;
        this.aggregator = aggregator;
        this.memberRepository = memberRepository;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Hands out explicit per-user counts in the given order. Users asking for
     * zero images, or coming after the pool ran dry, get nothing.
     */
    @Transactional
    public DistributionResult distributeManual(UUID projectId, List<UserAllocation> allocations,
                                               UUID actorId, boolean reset) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Project project = projectLock.acquire(projectId);
        if (allocations == null || allocations.isEmpty()) {
            throw new ValidationException("At least one user allocation is required");
        }
        for (UserAllocation allocation : allocations) {
            if (!memberRepository.existsByProjectIdAndUserIdAndRole(projectId, allocation.userId(), MemberRole.ANNOTATOR)) {
                throw new ValidationException(
                        "User %s is not an annotator in project %s".formatted(allocation.userId(), projectId));
            }
        }
        List<ProjectImage> pool = requirePool(projectId, reset);

        DistributionResult result = claim(project, pool, allocations, actorId, reset, DistributionMode.MANUAL);
        sample.stop(meterRegistry.timer("labelflow.distribution.duration", "mode", "manual"));
        return result;
    }

    /**
     * Splits the pool evenly across annotators in membership order; the first
     * {@code pool mod annotators} members get one extra image.
     */
    @Transactional
    public DistributionResult distributeSmart(UUID projectId, UUID actorId, boolean reset) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Project project = projectLock.acquire(projectId);
        List<ProjectMember> annotators =
                memberRepository.findByProjectIdAndRoleOrderByAddedAtAscIdAsc(projectId, MemberRole.ANNOTATOR);
        if (annotators.isEmpty()) {
            throw new ValidationException("No annotators found in project %s".formatted(projectId));
        }
        List<ProjectImage> pool = requirePool(projectId, reset);

        List<UserAllocation> allocations = evenSplit(pool.size(),
                annotators.stream().map(ProjectMember::getUserId).toList());
        DistributionResult result = claim(project, pool, allocations, actorId, reset, DistributionMode.SMART);
        sample.stop(meterRegistry.timer("labelflow.distribution.duration", "mode", "smart"));
        return result;
    }

    static List<UserAllocation> evenSplit(int poolSize, List<UUID> userIds) {
        int base = poolSize / userIds.size();
        int remainder = poolSize % userIds.size();
        List<UserAllocation> allocations = new ArrayList<>(userIds.size());
        for (int i = 0; i < userIds.size(); i++) {
            allocations.add(new UserAllocation(userIds.get(i), base + (i < remainder ? 1 : 0)));
        }
        return allocations;
    }

    private List<ProjectImage> requirePool(UUID projectId, boolean reset) {
        List<ProjectImage> pool = poolSelector.selectPool(projectId, reset);
        if (pool.isEmpty()) {
            throw new ValidationException(reset
                    ? "No images available for redistribution in project %s".formatted(projectId)
                    : "No unassigned images available in project %s".formatted(projectId));
        }
        return pool;
    }

    private DistributionResult claim(Project project, List<ProjectImage> pool, List<UserAllocation> allocations,
                                     UUID actorId, boolean reset, DistributionMode mode) {
        UUID projectId = project.getId();
        List<Slice> slices = new ArrayList<>();
        int cursor = 0;
        for (UserAllocation allocation : allocations) {
            if (allocation.count() <= 0 || cursor >= pool.size()) continue;
            int end = Math.min(cursor + allocation.count(), pool.size());
            slices.add(new Slice(allocation.userId(), pool.subList(cursor, end)));
            cursor = end;
        }

        List<UUID> moved = slices.stream().flatMap(s -> s.images().stream()).map(ProjectImage::getId).toList();
        ledger.releaseImages(projectId, moved);

        List<UserAllocation> granted = new ArrayList<>();
        for (Slice slice : slices) {
            ledger.grant(projectId, slice.userId(), slice.images(), actorId);
            granted.add(new UserAllocation(slice.userId(), slice.images().size()));
        }
        aggregator.recompute(project);

        DistributionResult result = new DistributionResult(projectId, mode, reset, pool.size(), granted);
        meterRegistry.counter("labelflow.distribution.images", "mode", mode.name().toLowerCase(Locale.ROOT))
                .increment(result.distributed());
        eventPublisher.publishEvent(ActivityEvent.of(
                reset ? ActivityAction.IMAGES_REASSIGNED : ActivityAction.IMAGES_ASSIGNED, projectId, actorId,
                Map.of("mode", mode, "poolSize", pool.size(), "distributed", result.distributed(),
                        "users", granted.size())));
        log.info("Distributed {} of {} pool images to {} users in project {} (mode={}, reset={})",
                result.distributed(), pool.size(), granted.size(), projectId, mode, reset);
        return result;
    }

    private record Slice(UUID userId, List<ProjectImage> images) {
    }
}
