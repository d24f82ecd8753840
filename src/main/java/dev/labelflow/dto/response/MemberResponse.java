package dev.labelflow.dto.response;

import dev.labelflow.domain.enums.MemberRole;
import java.time.Instant;
import java.util.UUID;

public record MemberResponse(UUID id, UUID projectId, UUID userId, MemberRole role, UUID addedBy, Instant addedAt) {
}
