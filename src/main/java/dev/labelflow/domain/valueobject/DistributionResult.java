package dev.labelflow.domain.valueobject;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one distribution call. {@code granted} follows allocation order
 * and only lists users who received at least one image.
 */
public record DistributionResult(
        UUID projectId,
        DistributionMode mode,
        boolean reset,
        int poolSize,
        List<UserAllocation> granted
) {
    public enum DistributionMode { MANUAL, SMART }

    public DistributionResult {
        granted = List.copyOf(granted);
    }

    public int distributed() {
        return granted.stream().mapToInt(UserAllocation::count).sum();
    }
}
