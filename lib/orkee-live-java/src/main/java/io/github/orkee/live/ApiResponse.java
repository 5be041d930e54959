package io.github.orkee.live;

/**
 * JSON envelope returned by the REST API: {@code {"success": bool, "data": ..., "error": "..."}}.
 *
 * @param <T> the payload type
 */
public final class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final String error;

    /**
     * Creates a new envelope.
     *
     * @param success whether the call succeeded
     * @param data    the payload, may be null
     * @param error   the error message, may be null
     */
    public ApiResponse(boolean success, T data, String error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    /**
     * Returns whether the server reported success.
     *
     * @return the success flag
     */
    public boolean isSuccess() {
        return success;
    }

    /**
     * Returns the payload.
     *
     * @return the data, may be null
     */
    public T getData() {
        return data;
    }

    /**
     * Returns the error message sent with a failed response.
     *
     * @return the error, may be null
     */
    public String getError() {
        return error;
    }
}
