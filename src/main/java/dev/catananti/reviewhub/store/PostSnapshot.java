package dev.catananti.reviewhub.store;

import dev.catananti.reviewhub.entity.Post;
import dev.catananti.reviewhub.entity.PostStatus;

/**
 * The fields of a post the workflow needs to decide a transition.
 */
public record PostSnapshot(Long id, Long authorId, PostStatus status, long revision) {

    public static PostSnapshot of(Post post) {
        return new PostSnapshot(post.getId(), post.getAuthorId(), PostStatus.valueOf(post.getStatus()),
                post.getRevision() == null ? 0L : post.getRevision());
    }

    public boolean isAuthoredBy(Long userId) {
        return authorId != null && authorId.equals(userId);
    }
}
