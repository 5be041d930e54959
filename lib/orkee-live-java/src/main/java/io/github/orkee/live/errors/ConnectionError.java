package io.github.orkee.live.errors;

/**
 * Thrown or reported when a network connection fails, is refused, or is closed by the server.
 */
public class ConnectionError extends LiveException {

    /**
     * Creates a new ConnectionError.
     *
     * @param message the error message
     */
    public ConnectionError(String message) {
        super(message);
    }

    /**
     * Creates a new ConnectionError with a cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public ConnectionError(String message, Throwable cause) {
        super(message, cause);
    }
}
