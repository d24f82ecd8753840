package dev.labelflow.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;

public record ManualDistributionRequest(
        @NotEmpty List<@Valid Allocation> allocations,
        boolean resetDistribution
) {
    public record Allocation(@NotNull UUID userId, int count) {}
}
