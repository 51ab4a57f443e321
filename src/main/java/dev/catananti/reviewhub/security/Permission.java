package dev.catananti.reviewhub.security;

import dev.catananti.reviewhub.entity.UserRole;

import java.util.EnumSet;
import java.util.Set;

/**
 * Role-gated actions. Ownership checks are separate, see {@link AccessPolicy#requireAuthor}.
 */
public enum Permission {
    DECIDE_POST(UserRole.ADMIN, UserRole.L1_APPROVER),
    VIEW_PENDING_QUEUE(UserRole.ADMIN, UserRole.L1_APPROVER),
    VIEW_REVIEW_DETAILS(UserRole.ADMIN, UserRole.L1_APPROVER),
    SUBSCRIBE_NOTIFICATIONS(UserRole.ADMIN, UserRole.L1_APPROVER),
    VIEW_REALTIME_STATS(UserRole.ADMIN),
    FORCE_DISCONNECT(UserRole.ADMIN),
    DELETE_ANY_POST(UserRole.ADMIN);

    private final Set<UserRole> roles;

    Permission(UserRole first, UserRole... rest) {
        this.roles = EnumSet.of(first, rest);
    }

    public boolean isGrantedTo(UserRole role) {
        return role != null && roles.contains(role);
    }
}
