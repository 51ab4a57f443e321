package dev.catananti.reviewhub.security;

import dev.catananti.reviewhub.entity.UserRole;

/**
 * A verified caller. Placed in the security context as the authentication principal.
 */
public record Identity(Long userId, UserRole role) {

    public boolean isReviewer() {
        return role == UserRole.ADMIN || role == UserRole.L1_APPROVER;
    }
}
