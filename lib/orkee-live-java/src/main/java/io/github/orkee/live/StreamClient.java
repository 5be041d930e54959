package io.github.orkee.live;

import java.net.URI;

/**
 * Opens push connections to event endpoints.
 * <p>
 * A stream client never retries on its own; reconnecting is decided by the
 * {@link ConnectionSupervisor}.
 */
@FunctionalInterface
public interface StreamClient {

    /**
     * Starts connecting to an event endpoint.
     *
     * @param uri      the endpoint, including any auth query parameter
     * @param listener receives the connection's signals
     * @return handle that closes the connection when cancelled
     * @throws io.github.orkee.live.errors.LiveException if the connection cannot even be attempted
     */
    Cancellable open(URI uri, StreamListener listener);
}
