package dev.labelflow.dto.response;

public record SubmissionStatsResponse(long total, long pending, long approved, long rejected) {
}
