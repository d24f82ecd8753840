package dev.labelflow.dto.request;

import jakarta.validation.constraints.PositiveOrZero;

public record AnnotationProgressRequest(boolean completed, @PositiveOrZero long timeSpentSeconds) {
}
