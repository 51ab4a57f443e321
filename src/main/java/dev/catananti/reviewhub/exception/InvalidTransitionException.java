package dev.catananti.reviewhub.exception;

import dev.catananti.reviewhub.entity.PostStatus;

public class InvalidTransitionException extends RuntimeException {

    private final PostStatus current;
    private final PostStatus target;

    public InvalidTransitionException(Long postId, PostStatus current, PostStatus target) {
        super(String.format("Post %d cannot move from %s to %s", postId, current, target));
        this.current = current;
        this.target = target;
    }

    public PostStatus getCurrent() {
        return current;
    }

    public PostStatus getTarget() {
        return target;
    }
}
