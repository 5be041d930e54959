package io.github.orkee.live;

import java.time.Duration;

/**
 * Single-threaded event loop that runs every state change of a subscription.
 * <p>
 * Implementations must run tasks one at a time, in submission order for
 * {@link #execute(Runnable)}, so that subscription state never needs more than
 * one writer.
 */
public interface Scheduler {

    /**
     * Runs a task on the loop as soon as possible.
     *
     * @param task the task
     */
    void execute(Runnable task);

    /**
     * Runs a task once after a delay.
     *
     * @param task  the task
     * @param delay the delay
     * @return handle that prevents the task from running when cancelled
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Runs a task repeatedly, first after {@code initialDelay}, then every {@code period}.
     *
     * @param task         the task
     * @param initialDelay delay before the first run
     * @param period       interval between runs
     * @return handle that stops further runs when cancelled
     */
    Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);
}
