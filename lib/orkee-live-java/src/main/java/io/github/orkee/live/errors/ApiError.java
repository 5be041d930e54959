package io.github.orkee.live.errors;

/**
 * Thrown when the API answers with a non-2xx status or an envelope with {@code success: false}.
 */
public class ApiError extends LiveException {

    private final int status;

    /**
     * Creates a new ApiError.
     *
     * @param status  the HTTP status, or 200 when the envelope itself reported failure
     * @param message the error message
     */
    public ApiError(int status, String message) {
        super(message);
        this.status = status;
    }

    /**
     * Returns the HTTP status of the failed response.
     *
     * @return the status code
     */
    public int getStatus() {
        return status;
    }
}
