package io.github.orkee.live;

/**
 * Receives state changes of a {@link Subscription}.
 * <p>
 * Callbacks run on the scheduler thread while the subscription's state is locked; they
 * must return quickly and must not block. Exceptions are logged and ignored.
 *
 * @param <R> the snapshot type
 * @param <E> the event type
 */
public interface SubscriptionListener<R, E> {

    /**
     * An event was appended.
     *
     * @param event the event
     */
    default void onEvent(E event) {
    }

    /**
     * The connection mode changed.
     *
     * @param previous the old mode
     * @param current  the new mode
     */
    default void onModeChanged(ConnectionMode previous, ConnectionMode current) {
    }

    /**
     * A new snapshot replaced the previous one.
     *
     * @param snapshot the snapshot
     */
    default void onSnapshot(R snapshot) {
    }

    /**
     * A user-facing error was reported.
     *
     * @param key     the resource or context the error belongs to
     * @param message the sanitized message
     */
    default void onError(String key, String message) {
    }

    /**
     * The subscription switched to another resource; events and errors were cleared.
     *
     * @param resourceId the new resource id
     */
    default void onReset(String resourceId) {
    }
}
