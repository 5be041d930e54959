package io.github.orkee.live;

import java.util.concurrent.CompletableFuture;

/**
 * Fetches the current canonical state of a resource.
 *
 * @param <R> the snapshot type
 */
@FunctionalInterface
public interface SnapshotFetcher<R> {

    /**
     * Starts one fetch.
     *
     * @param resourceId the resource to fetch
     * @return future completed with the snapshot, or exceptionally with a
     * {@link io.github.orkee.live.errors.LiveException}
     */
    CompletableFuture<R> fetch(String resourceId);
}
