package dev.labelflow.dto.request;

public record SmartDistributionRequest(boolean resetDistribution) {
}
