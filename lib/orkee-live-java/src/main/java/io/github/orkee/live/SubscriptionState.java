package io.github.orkee.live;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one subscription to one resource id.
 * <p>
 * Owned by a single {@link ConnectionSupervisor} and only touched while holding its lock.
 * A new record replaces this one when the resource id changes; once {@link #cleanedUp}
 * is set, no callback may change anything here.
 *
 * @param <R> the snapshot type
 * @param <E> the event type
 */
final class SubscriptionState<R, E> {

    final String resourceId;
    final List<E> events = new ArrayList<>();
    final Map<String, String> errorsByKey = new LinkedHashMap<>();

    ConnectionMode mode = ConnectionMode.DISCONNECTED;
    int retryCount;
    R snapshot;

    /** bumped on every connection attempt; signals from older attempts are ignored */
    int attempts;
    /** bumped on every idle watchdog arm */
    int idleArms;
    /** set while a poll fetch is outstanding; ticks are skipped until it answers */
    boolean pollInFlight;

    Cancellable retryTimer;
    Cancellable pollTimer;
    Cancellable idleTimer;
    Cancellable stream;

    boolean cleanedUp;

    SubscriptionState(String resourceId) {
        this.resourceId = resourceId;
    }
}
