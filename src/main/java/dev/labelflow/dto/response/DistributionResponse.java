package dev.labelflow.dto.response;

import java.util.List;
import java.util.UUID;

public record DistributionResponse(
        UUID projectId, String mode, boolean reset, int poolSize, int distributed, List<Allocation> allocations
) {
    public record Allocation(UUID userId, int count) {}
}
