package io.github.orkee.live;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.github.orkee.live.errors.ApiError;
import io.github.orkee.live.errors.ConnectionError;
import io.github.orkee.live.errors.LiveException;
import io.github.orkee.live.errors.NotFoundError;
import io.github.orkee.live.errors.UnauthorizedError;

import java.lang.reflect.Type;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Fetches snapshots with a REST GET and unwraps the {@link ApiResponse} envelope.
 *
 * @param <R> the snapshot type
 */
public final class HttpSnapshotFetcher<R> implements SnapshotFetcher<R> {

    private static final String HEADER_AUTH = "Authorization";

    private final HttpClient httpClient;
    private final EndpointResolver endpoints;
    private final Function<String, String> pathForId;
    private final Type envelopeType;
    private final Gson gson;
    private final Duration timeout;

    /**
     * Creates a fetcher.
     *
     * @param httpClient   the HTTP client
     * @param endpoints    resolves paths against the server
     * @param pathForId    maps a resource id to its snapshot path
     * @param snapshotType the type of the envelope's {@code data}
     * @param gson         the JSON mapper
     * @param timeout      per-request timeout
     */
    public HttpSnapshotFetcher(HttpClient httpClient, EndpointResolver endpoints, Function<String, String> pathForId,
                               Type snapshotType, Gson gson, Duration timeout) {
        this.httpClient = httpClient;
        this.endpoints = endpoints;
        this.pathForId = pathForId;
        this.envelopeType = TypeToken.getParameterized(ApiResponse.class, snapshotType).getType();
        this.gson = gson;
        this.timeout = timeout;
    }

    @Override
    public CompletableFuture<R> fetch(String resourceId) {
        String path = pathForId.apply(resourceId);
        URI uri = endpoints.resource(path);

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        endpoints.token().ifPresent(token -> requestBuilder.header(HEADER_AUTH, "Bearer " + token));

        return httpClient.sendAsync(requestBuilder.build(), HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw new CompletionException(toConnectionError(error));
                    }
                    return unwrap(path, response);
                });
    }

    private R unwrap(String path, HttpResponse<String> response) {
        int status = response.statusCode();
        switch (status) {
            case 401:
                throw new UnauthorizedError();
            case 404:
                throw new NotFoundError(path);
            default:
                if (status < 200 || status >= 300) {
                    throw new ApiError(status, "HTTP " + status + ": " + response.body());
                }
        }

        ApiResponse<R> envelope;
        try {
            envelope = gson.fromJson(response.body(), envelopeType);
        } catch (JsonParseException e) {
            throw new ApiError(status, "malformed response from " + path + ": " + e.getMessage());
        }
        if (envelope == null) {
            throw new ApiError(status, "empty response from " + path);
        }
        if (!envelope.isSuccess()) {
            String message = envelope.getError() == null ? "request failed" : envelope.getError();
            throw new ApiError(status, message);
        }
        if (envelope.getData() == null) {
            throw new ApiError(status, "response from " + path + " has no data");
        }
        return envelope.getData();
    }

    private static LiveException toConnectionError(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof LiveException) {
            return (LiveException) cause;
        }
        if (cause instanceof java.net.http.HttpTimeoutException) {
            return new ConnectionError("request timeout", cause);
        }
        return new ConnectionError("request failed: " + cause.getMessage(), cause);
    }
}
