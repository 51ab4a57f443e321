package dev.catananti.reviewhub.entity;

import java.util.Optional;

/**
 * Closed set of roles carried in access tokens.
 */
public enum UserRole {
    USER,
    ADMIN,
    L1_APPROVER;

    public boolean matches(String role) {
        return this.name().equals(role);
    }

    /**
     * Resolve a role claim, ignoring unknown values.
     */
    public static Optional<UserRole> fromClaim(String role) {
        if (role == null) {
            return Optional.empty();
        }
        for (UserRole candidate : values()) {
            if (candidate.matches(role)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
