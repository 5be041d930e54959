package io.github.orkee.live;

/**
 * Handle to a scheduled task, a listener registration or an open stream.
 */
@FunctionalInterface
public interface Cancellable {

    /** handle for work that was never scheduled */
    Cancellable NONE = () -> {
    };

    /**
     * Cancels the underlying work. Safe to call multiple times.
     */
    void cancel();
}
