package dev.catananti.reviewhub.security;

import dev.catananti.reviewhub.entity.UserRole;
import dev.catananti.reviewhub.exception.UnauthorizedException;
import dev.catananti.reviewhub.store.PostSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single place where roles and ownership are checked.
 */
@Component
@Slf4j
public class AccessPolicy {

    public boolean allows(UserRole role, Permission permission) {
        return permission.isGrantedTo(role);
    }

    public boolean allows(Identity identity, Permission permission) {
        return identity != null && allows(identity.role(), permission);
    }

    public void require(Identity identity, Permission permission) {
        if (!allows(identity, permission)) {
            log.warn("Denied {} to {}", permission, identity);
            throw new UnauthorizedException("Not allowed to " + describe(permission));
        }
    }

    public void requireAuthor(Long callerId, PostSnapshot post) {
        if (!post.isAuthoredBy(callerId)) {
            log.warn("Denied author-only action on post {} to user {}", post.id(), callerId);
            throw new UnauthorizedException("Only the author may change post " + post.id());
        }
    }

    /**
     * Passes for the author of the post, or for anyone holding {@code override}.
     */
    public void requireAuthorOr(Identity identity, PostSnapshot post, Permission override) {
        if (identity != null && (post.isAuthoredBy(identity.userId()) || allows(identity, override))) {
            return;
        }
        log.warn("Denied {} on post {} to {}", override, post.id(), identity);
        throw new UnauthorizedException("Not allowed to change post " + post.id());
    }

    /**
     * Whether the caller may see review metadata (reviewer, rejection reason) of a post.
     */
    public boolean canSeeReviewDetails(Identity identity, Long postAuthorId) {
        if (identity == null) {
            return false;
        }
        return identity.userId().equals(postAuthorId) || allows(identity, Permission.VIEW_REVIEW_DETAILS);
    }

    private static String describe(Permission permission) {
        return permission.name().toLowerCase().replace('_', ' ');
    }
}
