package io.github.orkee.live.errors;

/**
 * Thrown when a resource does not exist (HTTP 404).
 */
public class NotFoundError extends ApiError {

    private final String path;

    /**
     * Creates a new NotFoundError.
     *
     * @param path the request path that was not found
     */
    public NotFoundError(String path) {
        super(404, "not found: " + path);
        this.path = path;
    }

    /**
     * Returns the request path that was not found.
     *
     * @return the path
     */
    public String getPath() {
        return path;
    }
}
