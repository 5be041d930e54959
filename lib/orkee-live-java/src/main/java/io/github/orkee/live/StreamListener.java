package io.github.orkee.live;

/**
 * Signals from one stream connection.
 * <p>
 * Calls may arrive on any thread. After {@link #onError(Throwable)} the connection
 * sends nothing more.
 */
public interface StreamListener {

    /**
     * The server accepted the connection.
     */
    void onOpen();

    /**
     * A complete frame arrived.
     *
     * @param frame the raw frame text
     */
    void onMessage(String frame);

    /**
     * The connection failed or was closed by the server.
     *
     * @param error the cause
     */
    void onError(Throwable error);

    /**
     * A keep-alive without payload arrived.
     */
    default void onKeepAlive() {
    }
}
