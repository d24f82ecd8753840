package dev.labelflow.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record SubmitRequest(@NotNull UUID assignmentId, @Size(max = 4000) String message) {
}
