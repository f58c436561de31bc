package io.statestream.subscribe;

/**
 * Thrown when a token cannot be resolved into an {@link Authorizer}, for example because it is
 * unknown or expired.
 */
public class TokenResolutionException extends Exception {

    private static final long serialVersionUID = 1L;

    public TokenResolutionException(String message) {
        super(message);
    }

    public TokenResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
