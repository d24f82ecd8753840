package dev.labelflow.dto.request;

import dev.labelflow.domain.enums.MemberRole;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record AddMemberRequest(@NotNull UUID userId, @NotNull MemberRole role) {
}
