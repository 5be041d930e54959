package io.github.orkee.live;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Live view of one server-side resource, kept current by streaming or, failing that, polling.
 * <p>
 * Use with try-with-resources for automatic cleanup:
 * <pre>{@code
 * try (Subscription<AgentRun, LiveEvent> sub = client.subscribeAgentRun("run-42")) {
 *     sub.addListener(new SubscriptionListener<>() {
 *         public void onEvent(LiveEvent event) {
 *             System.out.println(event.getType());
 *         }
 *     });
 *     ...
 * }
 * }</pre>
 * <p>
 * Connectivity problems never surface as exceptions; they are visible only through
 * {@link #mode()}. Errors reported by the server for the user appear in {@link #errorsByKey()}.
 *
 * @param <R> the snapshot type
 * @param <E> the event type
 */
public interface Subscription<R, E> extends AutoCloseable {

    /**
     * Starts following a resource. Following a different resource first tears down the
     * current one and clears events, errors, snapshot and retry count.
     * Following the resource already followed is a no-op.
     *
     * @param resourceId the resource id
     * @throws io.github.orkee.live.errors.LiveException if resourceId is empty
     */
    void subscribe(String resourceId);

    /**
     * Returns the followed resource id.
     *
     * @return the id, or null before the first subscribe
     */
    String resourceId();

    /**
     * Returns the current connection mode.
     *
     * @return the mode
     */
    ConnectionMode mode();

    /**
     * Checks if updates are flowing.
     *
     * @return true while streaming or polling
     */
    default boolean isConnected() {
        return mode().isConnected();
    }

    /**
     * Returns the number of stream retries since the last successful open.
     *
     * @return the retry count
     */
    int retryCount();

    /**
     * Returns the events received so far, in arrival order.
     *
     * @return an immutable copy of the event log
     */
    List<E> events();

    /**
     * Returns the latest snapshot.
     *
     * @return the snapshot, empty until one has been fetched
     */
    Optional<R> snapshot();

    /**
     * Returns sanitized user-facing errors keyed by the resource or context they belong to.
     *
     * @return an immutable copy of the errors
     */
    Map<String, String> errorsByKey();

    /**
     * Re-fetches the snapshot without touching the mode or retry count.
     *
     * @return future completed with the fetched snapshot, or empty if the fetch failed
     * or the subscription is not active
     */
    CompletableFuture<Optional<R>> refetch();

    /**
     * Registers a listener.
     *
     * @param listener the listener
     * @return handle that removes the listener
     */
    Cancellable addListener(SubscriptionListener<R, E> listener);

    /**
     * Stops following the resource and releases its stream and timers.
     * Safe to call multiple times.
     */
    void unsubscribe();

    /**
     * Same as {@link #unsubscribe()}.
     */
    @Override
    default void close() {
        unsubscribe();
    }
}
