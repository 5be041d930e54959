package io.github.orkee.live;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link Scheduler} backed by a single daemon thread.
 * <p>
 * Tasks that throw are logged and do not stop the loop. Once closed, new tasks are
 * dropped with a debug message instead of failing the caller.
 */
public final class ExecutorScheduler implements Scheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorScheduler.class);

    private final ScheduledExecutorService executor;

    /**
     * Creates a scheduler with a thread named {@code orkee-live}.
     */
    public ExecutorScheduler() {
        this("orkee-live");
    }

    /**
     * Creates a scheduler with the given thread name.
     *
     * @param threadName name of the loop thread
     */
    public ExecutorScheduler(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("scheduler closed, dropping task");
        }
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        try {
            ScheduledFuture<?> future = executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("scheduler closed, dropping delayed task");
            return Cancellable.NONE;
        }
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        try {
            ScheduledFuture<?> future = executor.scheduleAtFixedRate(guarded(task),
                    initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("scheduler closed, dropping periodic task");
            return Cancellable.NONE;
        }
    }

    /**
     * Stops the loop thread. Pending tasks are discarded.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }

    // an escaping exception would cancel a periodic task silently
    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("scheduled task failed", e);
            }
        };
    }
}
