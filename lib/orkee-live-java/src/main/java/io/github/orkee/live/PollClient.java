package io.github.orkee.live;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs single snapshot fetches and never fails: errors are logged and reported as empty.
 * <p>
 * An empty result means "keep the previous snapshot". Scheduling repeated polls is the
 * {@link ConnectionSupervisor}'s job.
 *
 * @param <R> the snapshot type
 */
public final class PollClient<R> {

    private static final Logger log = LoggerFactory.getLogger(PollClient.class);

    private final SnapshotFetcher<R> fetcher;

    /**
     * Creates a poll client.
     *
     * @param fetcher fetches one snapshot
     */
    public PollClient(SnapshotFetcher<R> fetcher) {
        this.fetcher = fetcher;
    }

    /**
     * Fetches one snapshot.
     *
     * @param resourceId the resource
     * @return future completed with the snapshot, or empty if the fetch failed
     */
    public CompletableFuture<Optional<R>> fetch(String resourceId) {
        CompletableFuture<R> pending;
        try {
            pending = fetcher.fetch(resourceId);
        } catch (RuntimeException e) {
            log.warn("snapshot fetch for {} could not start: {}", resourceId, e.getMessage());
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return pending.handle((snapshot, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                log.warn("snapshot fetch for {} failed: {}", resourceId, cause.getMessage());
                return Optional.empty();
            }
            if (snapshot == null) {
                log.warn("snapshot fetch for {} returned nothing", resourceId);
            }
            return Optional.ofNullable(snapshot);
        });
    }
}
