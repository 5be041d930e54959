package io.github.orkee.live.errors;

/**
 * Base exception for all Orkee live-channel errors.
 */
public class LiveException extends RuntimeException {

    /**
     * Creates a new LiveException with a message.
     *
     * @param message the error message
     */
    public LiveException(String message) {
        super(message);
    }

    /**
     * Creates a new LiveException with a message and cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public LiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
