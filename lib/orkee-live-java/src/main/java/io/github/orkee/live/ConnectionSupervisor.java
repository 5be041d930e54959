package io.github.orkee.live;

import io.github.orkee.live.errors.ConnectionError;
import io.github.orkee.live.errors.DecodeError;
import io.github.orkee.live.errors.LiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Keeps one subscription in sync: fetches a snapshot, opens a stream, retries a failed
 * stream after a fixed delay and, once retries are used up, polls the snapshot instead.
 * <p>
 * Every asynchronous signal (stream open, frame, error, timer, fetch result) is posted to
 * the {@link Scheduler} and handled under this object's lock. Handlers first check that
 * the subscription they were created for is still current and not cleaned up, so a late
 * network callback cannot change a torn-down subscription.
 * <p>
 * Nothing here throws for connectivity problems; they are logged and show up in
 * {@link #mode()} only.
 *
 * @param <R> the snapshot type
 * @param <E> the event type
 */
public final class ConnectionSupervisor<R, E> implements Subscription<R, E> {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final Channel<R, E> channel;
    private final RetryPolicy policy;
    private final Scheduler scheduler;
    private final StreamClient streamClient;
    private final PollClient<R> pollClient;
    private final EndpointResolver endpoints;
    private final List<SubscriptionListener<R, E>> listeners = new CopyOnWriteArrayList<>();

    // guarded by this
    private SubscriptionState<R, E> state;

    /**
     * Creates an idle supervisor; call {@link #subscribe(String)} to start.
     *
     * @param channel      describes the resource kind
     * @param policy       retry and polling settings
     * @param scheduler    event loop for all state changes
     * @param streamClient opens event streams
     * @param fetcher      fetches snapshots
     * @param endpoints    resolves stream URIs
     */
    public ConnectionSupervisor(Channel<R, E> channel, RetryPolicy policy, Scheduler scheduler,
                                StreamClient streamClient, SnapshotFetcher<R> fetcher, EndpointResolver endpoints) {
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.streamClient = Objects.requireNonNull(streamClient, "streamClient cannot be null");
        this.pollClient = new PollClient<>(Objects.requireNonNull(fetcher, "fetcher cannot be null"));
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints cannot be null");
    }

    @Override
    public synchronized void subscribe(String resourceId) {
        if (resourceId == null || resourceId.isEmpty()) {
            throw new LiveException("resourceId cannot be empty");
        }
        SubscriptionState<R, E> current = state;
        if (current != null && !current.cleanedUp && current.resourceId.equals(resourceId)) {
            return;
        }

        if (current != null) {
            teardown(current);
        }
        state = new SubscriptionState<>(resourceId);
        if (current != null) {
            notifyListeners(l -> l.onReset(resourceId));
        }
        log.debug("[{}] subscribing to {}", channel.getName(), resourceId);
        attempt(state);
    }

    @Override
    public synchronized void unsubscribe() {
        if (state == null || state.cleanedUp) {
            return;
        }
        log.debug("[{}] unsubscribing from {}", channel.getName(), state.resourceId);
        teardown(state);
    }

    @Override
    public synchronized CompletableFuture<Optional<R>> refetch() {
        if (state == null || state.cleanedUp) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return refreshSnapshot(state);
    }

    @Override
    public Cancellable addListener(SubscriptionListener<R, E> listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public synchronized String resourceId() {
        return state == null ? null : state.resourceId;
    }

    @Override
    public synchronized ConnectionMode mode() {
        return state == null ? ConnectionMode.DISCONNECTED : state.mode;
    }

    @Override
    public synchronized int retryCount() {
        return state == null ? 0 : state.retryCount;
    }

    @Override
    public synchronized List<E> events() {
        return state == null ? List.of() : List.copyOf(state.events);
    }

    @Override
    public synchronized Optional<R> snapshot() {
        return state == null ? Optional.empty() : Optional.ofNullable(state.snapshot);
    }

    @Override
    public synchronized Map<String, String> errorsByKey() {
        return state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state.errorsByKey));
    }

    /**
     * Returns the channel this supervisor follows.
     *
     * @return the channel
     */
    public Channel<R, E> getChannel() {
        return channel;
    }

    // ---- connecting ----

    // fetch the snapshot first, then open the stream
    private void attempt(SubscriptionState<R, E> s) {
        setMode(s, ConnectionMode.CONNECTING);
        int attempt = ++s.attempts;
        pollClient.fetch(s.resourceId).thenAccept(result -> scheduler.execute(() -> {
            synchronized (this) {
                if (!isActive(s)) {
                    return;
                }
                result.ifPresent(snapshot -> applySnapshot(s, snapshot));
                if (attempt != s.attempts || s.mode != ConnectionMode.CONNECTING) {
                    return;
                }
                if (s.snapshot != null && channel.isTerminal(s.snapshot)) {
                    finish(s, "resource already finished");
                    return;
                }
                openStream(s, attempt);
            }
        }));
    }

    private void openStream(SubscriptionState<R, E> s, int attempt) {
        closeStream(s);
        URI uri = endpoints.events(channel.endpoint(s.resourceId));
        try {
            s.stream = streamClient.open(uri, new AttemptListener(s, attempt));
        } catch (RuntimeException e) {
            log.debug("[{}] stream for {} could not be opened: {}", channel.getName(), s.resourceId, e.getMessage());
            onStreamFailure(s, e);
        }
    }

    private synchronized void handleOpen(SubscriptionState<R, E> s, int attempt) {
        if (!isCurrentStream(s, attempt)) {
            return;
        }
        log.info("[{}] stream open for {}", channel.getName(), s.resourceId);
        s.retryCount = 0;
        setMode(s, ConnectionMode.STREAMING);
        armIdleWatchdog(s, attempt);
    }

    private synchronized void handleMessage(SubscriptionState<R, E> s, int attempt, String frame) {
        if (!isCurrentStream(s, attempt)) {
            return;
        }
        armIdleWatchdog(s, attempt);

        E event;
        try {
            event = channel.getDecoder().decode(frame);
        } catch (DecodeError e) {
            log.warn("[{}] dropping frame for {}: {}", channel.getName(), s.resourceId, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.warn("[{}] decoder failed for {}", channel.getName(), s.resourceId, e);
            return;
        }
        if (event == null || channel.isHeartbeat(event)) {
            return;
        }

        s.events.add(event);
        notifyListeners(l -> l.onEvent(event));

        String reported = channel.reportedErrorOf(event);
        if (reported != null) {
            String key = channel.resourceIdOf(event);
            if (key == null || key.isEmpty()) {
                key = s.resourceId;
            }
            String message = ErrorSanitizer.sanitize(reported);
            s.errorsByKey.put(key, message);
            String errorKey = key;
            notifyListeners(l -> l.onError(errorKey, message));
        }

        if (channel.isCompletion(event)) {
            log.debug("[{}] completion event for {}, refreshing snapshot", channel.getName(), s.resourceId);
            refreshSnapshot(s);
        }
    }

    private synchronized void handleKeepAlive(SubscriptionState<R, E> s, int attempt) {
        if (isCurrentStream(s, attempt)) {
            armIdleWatchdog(s, attempt);
        }
    }

    private synchronized void handleStreamError(SubscriptionState<R, E> s, int attempt, Throwable error) {
        if (!isCurrentStream(s, attempt)) {
            return;
        }
        log.debug("[{}] stream for {} failed: {}", channel.getName(), s.resourceId, error.getMessage());
        closeStream(s);
        onStreamFailure(s, error);
    }

    private void onStreamFailure(SubscriptionState<R, E> s, Throwable error) {
        if (s.snapshot != null && channel.isTerminal(s.snapshot)) {
            finish(s, "stream ended after resource finished");
            return;
        }
        if (s.retryCount < policy.getMaxRetries()) {
            s.retryCount++;
            setMode(s, ConnectionMode.CONNECTING);
            log.debug("[{}] retry {}/{} for {} in {}ms", channel.getName(), s.retryCount, policy.getMaxRetries(),
                    s.resourceId, policy.getRetryDelay().toMillis());
            s.retryTimer = scheduler.schedule(() -> handleRetry(s), policy.getRetryDelay());
        } else {
            log.info("[{}] stream for {} unavailable after {} retries ({}), switching to polling",
                    channel.getName(), s.resourceId, s.retryCount, error.getMessage());
            startPolling(s);
        }
    }

    private synchronized void handleRetry(SubscriptionState<R, E> s) {
        if (!isActive(s) || s.retryTimer == null) {
            return;
        }
        s.retryTimer = null;
        attempt(s);
    }

    private void armIdleWatchdog(SubscriptionState<R, E> s, int attempt) {
        if (!policy.isIdleTimeoutEnabled()) {
            return;
        }
        cancel(s.idleTimer);
        int arm = ++s.idleArms;
        s.idleTimer = scheduler.schedule(() -> handleIdle(s, attempt, arm), policy.getIdleTimeout());
    }

    private synchronized void handleIdle(SubscriptionState<R, E> s, int attempt, int arm) {
        if (!isCurrentStream(s, attempt) || arm != s.idleArms) {
            return;
        }
        log.warn("[{}] no data on stream for {} in {}ms, reconnecting", channel.getName(), s.resourceId,
                policy.getIdleTimeout().toMillis());
        closeStream(s);
        onStreamFailure(s, new ConnectionError("stream idle"));
    }

    // ---- polling ----

    private void startPolling(SubscriptionState<R, E> s) {
        cancel(s.retryTimer);
        s.retryTimer = null;
        closeStream(s);
        setMode(s, ConnectionMode.POLLING);
        poll(s);
        s.pollTimer = scheduler.scheduleAtFixedRate(() -> poll(s), policy.getPollInterval(), policy.getPollInterval());
    }

    private synchronized void poll(SubscriptionState<R, E> s) {
        if (!isActive(s) || s.mode != ConnectionMode.POLLING) {
            return;
        }
        if (s.pollInFlight) {
            log.debug("[{}] previous poll for {} still pending, skipping tick", channel.getName(), s.resourceId);
            return;
        }
        log.debug("[{}] polling {}", channel.getName(), s.resourceId);
        s.pollInFlight = true;
        pollClient.fetch(s.resourceId).thenAccept(result -> scheduler.execute(() -> handlePoll(s, result)));
    }

    private synchronized void handlePoll(SubscriptionState<R, E> s, Optional<R> result) {
        s.pollInFlight = false;
        if (!isActive(s) || s.mode != ConnectionMode.POLLING || result.isEmpty()) {
            return;
        }
        R snapshot = result.get();
        applySnapshot(s, snapshot);
        if (channel.isTerminal(snapshot)) {
            finish(s, "terminal status");
        }
    }

    // ---- snapshots ----

    private CompletableFuture<Optional<R>> refreshSnapshot(SubscriptionState<R, E> s) {
        CompletableFuture<Optional<R>> done = new CompletableFuture<>();
        pollClient.fetch(s.resourceId).thenAccept(result -> scheduler.execute(() -> {
            boolean applied;
            synchronized (this) {
                applied = isActive(s);
                if (applied) {
                    result.ifPresent(snapshot -> applySnapshot(s, snapshot));
                }
            }
            done.complete(applied ? result : Optional.empty());
        }));
        return done;
    }

    private void applySnapshot(SubscriptionState<R, E> s, R snapshot) {
        s.snapshot = snapshot;
        notifyListeners(l -> l.onSnapshot(snapshot));
    }

    // ---- teardown ----

    // order matters: timers first, then the stream, then the flag
    private void teardown(SubscriptionState<R, E> s) {
        cancel(s.retryTimer);
        s.retryTimer = null;
        cancel(s.pollTimer);
        s.pollTimer = null;
        closeStream(s);
        s.cleanedUp = true;
        setMode(s, ConnectionMode.DISCONNECTED);
    }

    // stop updating without tearing down; refetch keeps working
    private void finish(SubscriptionState<R, E> s, String reason) {
        log.debug("[{}] {} is done ({}), disconnecting", channel.getName(), s.resourceId, reason);
        cancel(s.retryTimer);
        s.retryTimer = null;
        cancel(s.pollTimer);
        s.pollTimer = null;
        closeStream(s);
        setMode(s, ConnectionMode.DISCONNECTED);
    }

    private void closeStream(SubscriptionState<R, E> s) {
        cancel(s.idleTimer);
        s.idleTimer = null;
        Cancellable stream = s.stream;
        s.stream = null;
        cancel(stream);
    }

    // ---- helpers ----

    private boolean isActive(SubscriptionState<R, E> s) {
        return s == state && !s.cleanedUp;
    }

    private boolean isCurrentStream(SubscriptionState<R, E> s, int attempt) {
        return isActive(s) && attempt == s.attempts && s.stream != null;
    }

    private void setMode(SubscriptionState<R, E> s, ConnectionMode mode) {
        ConnectionMode previous = s.mode;
        if (previous == mode) {
            return;
        }
        s.mode = mode;
        log.debug("[{}] {}: {} -> {}", channel.getName(), s.resourceId, previous, mode);
        notifyListeners(l -> l.onModeChanged(previous, mode));
    }

    private void notifyListeners(Consumer<SubscriptionListener<R, E>> call) {
        for (SubscriptionListener<R, E> listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("[{}] listener failed", channel.getName(), e);
            }
        }
    }

    private static void cancel(Cancellable handle) {
        if (handle != null) {
            handle.cancel();
        }
    }

    @Override
    public synchronized String toString() {
        return "ConnectionSupervisor{" +
                "channel=" + channel.getName() +
                ", resourceId=" + (state == null ? null : state.resourceId) +
                ", mode=" + mode() +
                '}';
    }

    /**
     * Forwards one connection attempt's signals onto the scheduler.
     */
    private final class AttemptListener implements StreamListener {
        private final SubscriptionState<R, E> s;
        private final int attempt;

        AttemptListener(SubscriptionState<R, E> s, int attempt) {
            this.s = s;
            this.attempt = attempt;
        }

        @Override
        public void onOpen() {
            scheduler.execute(() -> handleOpen(s, attempt));
        }

        @Override
        public void onMessage(String frame) {
            scheduler.execute(() -> handleMessage(s, attempt, frame));
        }

        @Override
        public void onError(Throwable error) {
            scheduler.execute(() -> handleStreamError(s, attempt, error));
        }

        @Override
        public void onKeepAlive() {
            scheduler.execute(() -> handleKeepAlive(s, attempt));
        }
    }
}
