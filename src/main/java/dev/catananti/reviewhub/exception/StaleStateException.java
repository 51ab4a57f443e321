package dev.catananti.reviewhub.exception;

/**
 * A compare-and-set on a post lost against a concurrent transition. The caller should refetch.
 */
public class StaleStateException extends RuntimeException {

    public static final String CODE = "STALE_STATE";

    public StaleStateException(Long postId) {
        super("Post " + postId + " was modified concurrently");
    }
}
