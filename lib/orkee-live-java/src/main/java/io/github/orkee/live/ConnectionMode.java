package io.github.orkee.live;

/**
 * How a subscription is currently kept in sync with the server.
 * <p>
 * Within one subscription the mode only moves forward:
 * {@code DISCONNECTED -> CONNECTING -> STREAMING | POLLING}, with
 * {@code STREAMING -> CONNECTING} on a dropped stream. {@code POLLING} is left only
 * for {@code DISCONNECTED}, when the snapshot reports a terminal status or the
 * subscription is torn down.
 */
public enum ConnectionMode {

    /** Initial state, and the state after teardown or a terminal poll. */
    DISCONNECTED,

    /** Fetching the snapshot and opening the stream, or waiting to retry. */
    CONNECTING,

    /** A stream is open and events are being forwarded. */
    STREAMING,

    /** Retries are exhausted; the snapshot is re-fetched on a fixed interval. */
    POLLING;

    /**
     * Checks whether updates are flowing, either pushed or polled.
     *
     * @return true for {@link #STREAMING} and {@link #POLLING}
     */
    public boolean isConnected() {
        return this == STREAMING || this == POLLING;
    }
}
