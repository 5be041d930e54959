package io.github.orkee.live;

import io.github.orkee.live.errors.ConnectionError;
import io.github.orkee.live.errors.LiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server-sent events over the JDK {@link HttpClient}.
 * <p>
 * Each connection is read by its own daemon thread. {@code data:} lines are joined and
 * dispatched on a blank line; a bare line starting with <code>{</code> is dispatched
 * as one NDJSON frame. Comment lines count as keep-alives. A non-200 answer or the end of
 * the body is reported through {@link StreamListener#onError(Throwable)}.
 */
public final class HttpStreamClient implements StreamClient {

    private static final Logger log = LoggerFactory.getLogger(HttpStreamClient.class);

    private final HttpClient httpClient;

    /**
     * Creates a stream client.
     *
     * @param connectTimeout timeout for establishing the TCP connection
     */
    public HttpStreamClient(Duration connectTimeout) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build());
    }

    /**
     * Creates a stream client over an existing HTTP client.
     *
     * @param httpClient the HTTP client
     */
    public HttpStreamClient(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Cancellable open(URI uri, StreamListener listener) {
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new LiveException("unsupported stream scheme: " + scheme);
        }
        Connection connection = new Connection(uri, listener);
        connection.start();
        return connection::close;
    }

    /**
     * One stream connection and its reader thread.
     */
    private final class Connection {
        private final URI uri;
        private final StreamListener listener;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final Thread workerThread;
        private volatile InputStream body;

        Connection(URI uri, StreamListener listener) {
            this.uri = uri;
            this.listener = listener;
            this.workerThread = new Thread(this::run, "orkee-live-stream");
            this.workerThread.setDaemon(true);
        }

        void start() {
            workerThread.start();
        }

        private void run() {
            try {
                readEvents();
                if (!closed.get()) {
                    listener.onError(new ConnectionError("stream closed by server"));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (!closed.get()) {
                    listener.onError(new ConnectionError("stream interrupted", e));
                }
            } catch (Exception e) {
                if (!closed.get()) {
                    listener.onError(e instanceof ConnectionError ? e : new ConnectionError("stream failed: " + e.getMessage(), e));
                }
            }
        }

        private void readEvents() throws IOException, InterruptedException {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "text/event-stream")
                    .GET()
                    .build();

            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            body = response.body();

            if (response.statusCode() != 200) {
                response.body().close();
                throw new ConnectionError("HTTP " + response.statusCode());
            }
            if (closed.get()) {
                response.body().close();
                return;
            }

            log.debug("stream opened: {}", uri.getPath());
            listener.onOpen();

            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {

                StringBuilder data = new StringBuilder();
                String line;
                while (!closed.get() && (line = reader.readLine()) != null) {
                    if (line.isEmpty()) {
                        // end of event
                        if (data.length() > 0) {
                            listener.onMessage(data.toString());
                            data.setLength(0);
                        }
                    } else if (line.startsWith(":")) {
                        listener.onKeepAlive();
                    } else if (line.startsWith("data:")) {
                        String value = line.substring(5);
                        if (value.startsWith(" ")) {
                            value = value.substring(1);
                        }
                        if (data.length() > 0) {
                            data.append('\n');
                        }
                        data.append(value);
                    } else if (line.startsWith("{") && data.length() == 0) {
                        listener.onMessage(line);
                    }
                    // event:, id: and retry: fields are not used; the JSON type is the discriminator
                }
            }
        }

        void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            workerThread.interrupt();
            InputStream stream = body;
            if (stream != null) {
                try {
                    stream.close();
                } catch (IOException e) {
                    log.debug("error closing stream body: {}", e.getMessage());
                }
            }
        }
    }
}
