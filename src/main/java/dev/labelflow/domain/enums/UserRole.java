package dev.labelflow.domain.enums;

/**
 * Platform-level roles supplied by the authentication collaborator.
 */
public enum UserRole {
    USER, ADMIN, SUPER_ADMIN;

    public boolean isAdmin() {
        return this == ADMIN || this == SUPER_ADMIN;
    }
}
