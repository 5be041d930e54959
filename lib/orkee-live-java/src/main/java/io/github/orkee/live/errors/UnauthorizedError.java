package io.github.orkee.live.errors;

/**
 * Thrown when authentication fails (HTTP 401).
 */
public class UnauthorizedError extends ApiError {

    /**
     * Creates a new UnauthorizedError.
     */
    public UnauthorizedError() {
        super(401, "unauthorized: invalid or missing token");
    }
}
