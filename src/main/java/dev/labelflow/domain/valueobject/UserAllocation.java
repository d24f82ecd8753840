package dev.labelflow.domain.valueobject;

import java.util.UUID;

/** Number of images requested for (or granted to) one annotator. */
public record UserAllocation(UUID userId, int count) {
}
