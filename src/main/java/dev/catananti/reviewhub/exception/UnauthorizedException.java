package dev.catananti.reviewhub.exception;

/**
 * The caller is authenticated but its role or ownership does not allow the action.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
