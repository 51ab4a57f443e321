package dev.catananti.reviewhub.event;

import dev.catananti.reviewhub.entity.PostStatus;

/**
 * Outcome of a review.
 */
public enum Decision {
    APPROVED(PostStatus.APPROVED),
    REJECTED(PostStatus.REJECTED);

    private final PostStatus targetStatus;

    Decision(PostStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public PostStatus targetStatus() {
        return targetStatus;
    }
}
