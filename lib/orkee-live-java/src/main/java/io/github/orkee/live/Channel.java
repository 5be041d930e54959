package io.github.orkee.live;

import io.github.orkee.live.errors.LiveException;

import java.lang.reflect.Type;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Describes one kind of live resource: where its stream and snapshot live, how its
 * events decode, and which snapshots and events are significant to the supervisor.
 * Use {@link #builder(String, Type, EventDecoder)} to create instances.
 *
 * @param <R> the snapshot type
 * @param <E> the event type
 */
public final class Channel<R, E> {

    private final String name;
    private final Type snapshotType;
    private final EventDecoder<E> decoder;
    private final Function<String, String> endpoint;
    private final Function<String, String> snapshotPath;
    private final Predicate<R> terminal;
    private final Predicate<E> completion;
    private final Predicate<E> heartbeat;
    private final Function<E, String> resourceIdOf;
    private final Function<E, String> reportedErrorOf;

    private Channel(Builder<R, E> builder) {
        this.name = builder.name;
        this.snapshotType = builder.snapshotType;
        this.decoder = builder.decoder;
        this.endpoint = builder.endpoint;
        this.snapshotPath = builder.snapshotPath == null ? builder.endpoint : builder.snapshotPath;
        this.terminal = builder.terminal;
        this.completion = builder.completion;
        this.heartbeat = builder.heartbeat;
        this.resourceIdOf = builder.resourceIdOf;
        this.reportedErrorOf = builder.reportedErrorOf;
    }

    /**
     * Creates a new builder.
     *
     * @param name         short name used in logs
     * @param snapshotType the snapshot type, used to decode REST responses
     * @param decoder      decodes stream frames
     * @param <R>          the snapshot type
     * @param <E>          the event type
     * @return a new builder
     */
    public static <R, E> Builder<R, E> builder(String name, Type snapshotType, EventDecoder<E> decoder) {
        return new Builder<>(name, snapshotType, decoder);
    }

    /**
     * Returns the channel name.
     *
     * @return the name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the snapshot type.
     *
     * @return the type of the REST payload
     */
    public Type getSnapshotType() {
        return snapshotType;
    }

    /**
     * Returns the frame decoder.
     *
     * @return the decoder
     */
    public EventDecoder<E> getDecoder() {
        return decoder;
    }

    /**
     * Returns the resource endpoint path for an id; the stream lives at {@code endpoint + "/events"}.
     *
     * @param resourceId the resource id
     * @return the endpoint path
     */
    public String endpoint(String resourceId) {
        return endpoint.apply(resourceId);
    }

    /**
     * Returns the snapshot path for an id.
     *
     * @param resourceId the resource id
     * @return the REST path
     */
    public String snapshotPath(String resourceId) {
        return snapshotPath.apply(resourceId);
    }

    /**
     * Checks if a snapshot reports a status after which nothing changes.
     *
     * @param snapshot the snapshot
     * @return true if polling can stop
     */
    public boolean isTerminal(R snapshot) {
        return terminal.test(snapshot);
    }

    /**
     * Checks if an event announces that the resource finished.
     *
     * @param event the event
     * @return true if the snapshot should be refreshed
     */
    public boolean isCompletion(E event) {
        return completion.test(event);
    }

    /**
     * Checks if an event only keeps the connection alive.
     *
     * @param event the event
     * @return true if the event is not recorded
     */
    public boolean isHeartbeat(E event) {
        return heartbeat.test(event);
    }

    /**
     * Returns the id of the resource an event is about.
     *
     * @param event the event
     * @return the id, or null if the event names none
     */
    public String resourceIdOf(E event) {
        return resourceIdOf.apply(event);
    }

    /**
     * Returns the user-facing error an event carries.
     *
     * @param event the event
     * @return the raw error, or null if the event is not an error report
     */
    public String reportedErrorOf(E event) {
        return reportedErrorOf.apply(event);
    }

    @Override
    public String toString() {
        return "Channel{" + name + '}';
    }

    /**
     * Builder for Channel.
     *
     * @param <R> the snapshot type
     * @param <E> the event type
     */
    public static final class Builder<R, E> {
        private final String name;
        private final Type snapshotType;
        private final EventDecoder<E> decoder;
        private Function<String, String> endpoint;
        private Function<String, String> snapshotPath;
        private Predicate<R> terminal = snapshot -> false;
        private Predicate<E> completion = event -> false;
        private Predicate<E> heartbeat = event -> false;
        private Function<E, String> resourceIdOf = event -> null;
        private Function<E, String> reportedErrorOf = event -> null;

        private Builder(String name, Type snapshotType, EventDecoder<E> decoder) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
            this.snapshotType = Objects.requireNonNull(snapshotType, "snapshotType cannot be null");
            this.decoder = Objects.requireNonNull(decoder, "decoder cannot be null");
        }

        /**
         * Sets the resource endpoint builder. Required.
         *
         * @param endpoint maps a resource id to its endpoint path
         * @return this builder
         */
        public Builder<R, E> endpoint(Function<String, String> endpoint) {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
            return this;
        }

        /**
         * Sets the snapshot path builder. Defaults to the endpoint.
         *
         * @param snapshotPath maps a resource id to its snapshot path
         * @return this builder
         */
        public Builder<R, E> snapshotPath(Function<String, String> snapshotPath) {
            this.snapshotPath = Objects.requireNonNull(snapshotPath, "snapshotPath cannot be null");
            return this;
        }

        /**
         * Sets the terminal-status predicate. Defaults to never terminal.
         *
         * @param terminal true for snapshots after which polling stops
         * @return this builder
         */
        public Builder<R, E> terminal(Predicate<R> terminal) {
            this.terminal = Objects.requireNonNull(terminal, "terminal cannot be null");
            return this;
        }

        /**
         * Sets the completion-event predicate. Defaults to none.
         *
         * @param completion true for events that trigger a snapshot refresh
         * @return this builder
         */
        public Builder<R, E> completion(Predicate<E> completion) {
            this.completion = Objects.requireNonNull(completion, "completion cannot be null");
            return this;
        }

        /**
         * Sets the heartbeat predicate. Defaults to none.
         *
         * @param heartbeat true for events that are not recorded
         * @return this builder
         */
        public Builder<R, E> heartbeat(Predicate<E> heartbeat) {
            this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat cannot be null");
            return this;
        }

        /**
         * Sets the resource-id extractor used to key reported errors.
         *
         * @param resourceIdOf returns the id an event is about, or null
         * @return this builder
         */
        public Builder<R, E> resourceIdOf(Function<E, String> resourceIdOf) {
            this.resourceIdOf = Objects.requireNonNull(resourceIdOf, "resourceIdOf cannot be null");
            return this;
        }

        /**
         * Sets the reported-error extractor.
         *
         * @param reportedErrorOf returns the raw user-facing error of an event, or null
         * @return this builder
         */
        public Builder<R, E> reportedErrorOf(Function<E, String> reportedErrorOf) {
            this.reportedErrorOf = Objects.requireNonNull(reportedErrorOf, "reportedErrorOf cannot be null");
            return this;
        }

        /**
         * Builds the Channel instance.
         *
         * @return the channel
         * @throws LiveException if no endpoint was set
         */
        public Channel<R, E> build() {
            if (endpoint == null) {
                throw new LiveException("endpoint is required for channel " + name);
            }
            return new Channel<>(this);
        }
    }
}
