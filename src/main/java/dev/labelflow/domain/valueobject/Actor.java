package dev.labelflow.domain.valueobject;

import dev.labelflow.domain.enums.UserRole;
import java.util.UUID;

/**
 * The authenticated caller as asserted by the upstream auth layer.
 */
public record Actor(UUID id, UserRole role, boolean officeUser) {

    public boolean isAdmin() {
        return role.isAdmin();
    }
}
