package io.github.orkee.live.errors;

/**
 * Thrown when a stream frame cannot be decoded into an event.
 */
public class DecodeError extends LiveException {

    /**
     * Creates a new DecodeError.
     *
     * @param message the error message
     */
    public DecodeError(String message) {
        super(message);
    }

    /**
     * Creates a new DecodeError with a cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public DecodeError(String message, Throwable cause) {
        super(message, cause);
    }
}
