package dev.labelflow.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

public record RegisterImagesRequest(@NotEmpty List<@Valid StoredImage> images) {

    public record StoredImage(@NotBlank @Size(max = 255) String filename,
                              @NotBlank @Size(max = 1024) String storageKey) {}
}
