package dev.catananti.reviewhub.exception;

/**
 * A push connection or room join was refused because the hub is closing or full.
 */
public class ConnectionRejectedException extends RuntimeException {

    public ConnectionRejectedException(String message) {
        super(message);
    }
}
