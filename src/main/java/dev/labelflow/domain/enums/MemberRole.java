package dev.labelflow.domain.enums;

public enum MemberRole {
    ANNOTATOR, REVIEWER
}
