package io.github.orkee.live;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.github.orkee.live.errors.LiveException;

import java.io.Closeable;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Entry point for live subscriptions against the Orkee API.
 * <p>
 * Use {@link #builder(String)} to create instances.
 * <p>
 * Example usage:
 * <pre>{@code
 * try (LiveClient client = LiveClient.builder("http://localhost:4001")
 *         .tokenSupplier(tokens::current)
 *         .retryPolicy(RetryPolicy.fromSystemEnvironment())
 *         .build();
 *      Subscription<AgentRun, LiveEvent> run = client.subscribeAgentRun("run-42")) {
 *     ...
 *     run.snapshot().ifPresent(r -> System.out.println(r.getStatus()));
 * }
 * }</pre>
 */
public final class LiveClient implements Closeable {

    /** default timeout for snapshot requests and stream connects */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final EndpointResolver endpoints;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final StreamClient streamClient;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;
    private final Gson gson;
    private final List<Subscription<?, ?>> subscriptions = new CopyOnWriteArrayList<>();

    private LiveClient(Builder builder) {
        this.endpoints = new EndpointResolver(builder.baseUrl, builder.tokenSupplier);
        this.retryPolicy = builder.retryPolicy;
        this.timeout = builder.timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.streamClient = builder.streamClient != null ? builder.streamClient : new HttpStreamClient(httpClient);
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler ? new ExecutorScheduler() : builder.scheduler;
        this.gson = new GsonBuilder().create();
    }

    /**
     * Creates a new builder for the LiveClient.
     *
     * @param baseUrl the base URL of the Orkee server
     * @return a new builder
     */
    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    /**
     * Creates an idle subscription handle for a channel; call
     * {@link Subscription#subscribe(String)} to start following a resource.
     *
     * @param channel the channel
     * @param <R>     the snapshot type
     * @param <E>     the event type
     * @return the subscription
     */
    public <R, E> Subscription<R, E> newSubscription(Channel<R, E> channel) {
        Objects.requireNonNull(channel, "channel cannot be null");
        SnapshotFetcher<R> fetcher = new HttpSnapshotFetcher<>(httpClient, endpoints, channel::snapshotPath,
                channel.getSnapshotType(), gson, timeout);
        ConnectionSupervisor<R, E> subscription =
                new ConnectionSupervisor<>(channel, retryPolicy, scheduler, streamClient, fetcher, endpoints);
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * Subscribes to a resource of a channel.
     *
     * @param channel    the channel
     * @param resourceId the resource to follow
     * @param <R>        the snapshot type
     * @param <E>        the event type
     * @return the started subscription
     * @throws LiveException if resourceId is empty
     */
    public <R, E> Subscription<R, E> subscribe(Channel<R, E> channel, String resourceId) {
        if (resourceId == null || resourceId.isEmpty()) {
            throw new LiveException("resourceId cannot be empty");
        }
        Subscription<R, E> subscription = newSubscription(channel);
        subscription.subscribe(resourceId);
        return subscription;
    }

    /**
     * Follows one agent run and its event log.
     *
     * @param runId the run id
     * @return the started subscription
     * @throws LiveException if runId is empty
     */
    public Subscription<AgentRun, LiveEvent> subscribeAgentRun(String runId) {
        return subscribe(Channels.agentRun(), runId);
    }

    /**
     * Follows the set of running preview servers.
     *
     * @return the started subscription
     */
    public Subscription<ServerList, LiveEvent> subscribePreviewServers() {
        return subscribe(Channels.previewServers(), Channels.PREVIEW_SERVERS_ID);
    }

    /**
     * Returns the retry policy shared by this client's subscriptions.
     *
     * @return the policy
     */
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * Returns the base URL without a trailing slash.
     *
     * @return the base URL
     */
    public String getBaseUrl() {
        return endpoints.getBaseUrl();
    }

    /**
     * Unsubscribes every subscription this client created, closing their streams and timers,
     * then stops the client's own scheduler if it created one.
     */
    @Override
    public void close() {
        for (Subscription<?, ?> subscription : subscriptions) {
            subscription.unsubscribe();
        }
        subscriptions.clear();
        if (ownsScheduler) {
            ((ExecutorScheduler) scheduler).close();
        }
    }

    /**
     * Builder for creating LiveClient instances.
     */
    public static final class Builder {
        private final String baseUrl;
        private Supplier<String> tokenSupplier = () -> null;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration timeout = DEFAULT_TIMEOUT;
        private Scheduler scheduler;
        private StreamClient streamClient;

        private Builder(String baseUrl) {
            if (baseUrl == null || baseUrl.isEmpty()) {
                throw new LiveException("baseUrl cannot be empty");
            }
            this.baseUrl = baseUrl;
        }

        /**
         * Sets a fixed authentication token.
         *
         * @param token the token, or null for none
         * @return this builder
         */
        public Builder token(String token) {
            this.tokenSupplier = () -> token;
            return this;
        }

        /**
         * Sets where the authentication token comes from; asked on every connect and fetch.
         *
         * @param tokenSupplier supplies the current token, or null for none
         * @return this builder
         */
        public Builder tokenSupplier(Supplier<String> tokenSupplier) {
            this.tokenSupplier = Objects.requireNonNull(tokenSupplier, "tokenSupplier cannot be null");
            return this;
        }

        /**
         * Sets the retry and polling policy.
         *
         * @param retryPolicy the policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
            return this;
        }

        /**
         * Sets the timeout for snapshot requests and stream connects.
         *
         * @param timeout the timeout duration
         * @return this builder
         * @throws LiveException if timeout is not positive
         */
        public Builder timeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout cannot be null");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new LiveException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets the event loop. The client does not close a scheduler it was given.
         *
         * @param scheduler the scheduler
         * @return this builder
         */
        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
            return this;
        }

        /**
         * Replaces the HTTP stream transport.
         *
         * @param streamClient the stream client
         * @return this builder
         */
        public Builder streamClient(StreamClient streamClient) {
            this.streamClient = Objects.requireNonNull(streamClient, "streamClient cannot be null");
            return this;
        }

        /**
         * Builds the LiveClient instance.
         *
         * @return the configured client
         */
        public LiveClient build() {
            return new LiveClient(this);
        }
    }
}
