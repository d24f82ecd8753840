package dev.labelflow.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CreateProjectRequest(
        @NotBlank @Size(max = 255) String name,
        @Size(max = 2000) String description,
        List<@Valid ClassDefinition> classes
) {
    public record ClassDefinition(@NotBlank @Size(max = 100) String name, @Size(max = 20) String color) {}
}
