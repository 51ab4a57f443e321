package dev.catananti.reviewhub.exception;

/**
 * The caller presented no credentials, or credentials that could not be verified.
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
