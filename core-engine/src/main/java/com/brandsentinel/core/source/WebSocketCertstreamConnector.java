package com.brandsentinel.core.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CertstreamConnector} backed by the JDK {@link WebSocket} client.
 *
 * <p>
 * The asynchronous listener reassembles fragmented text frames and hands
 * complete messages to a blocking inbox, which
 * {@link CertstreamConnection#receive(Duration)} drains. A close frame or a
 * transport error is surfaced as an {@link IOException} on the next receive
 * and on every receive after that.
 * </p>
 *
 * @since 1.0.0
 */
public class WebSocketCertstreamConnector implements CertstreamConnector {

    private static final Logger LOG = LoggerFactory.getLogger(WebSocketCertstreamConnector.class);

    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(15);

    private final HttpClient client;
    private final Duration connectTimeout;

    public WebSocketCertstreamConnector() {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    /**
     * @param connectTimeout handshake timeout
     */
    public WebSocketCertstreamConnector(Duration connectTimeout) {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "Connect timeout must not be null");
        this.client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public CertstreamConnection connect(URI uri) throws IOException, InterruptedException {
        Objects.requireNonNull(uri, "URI must not be null");
        InboxListener listener = new InboxListener();
        try {
            WebSocket socket = client.newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(uri, listener)
                    .get(connectTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
            return new Connection(socket, listener.inbox);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IOException("Failed to connect to certstream at " + uri + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new IOException("Timed out connecting to certstream at " + uri, e);
        }
    }

    // ---------------------------------------------------------------
    // Listener and connection
    // ---------------------------------------------------------------

    /** Either a complete text message or a terminal failure. */
    private static final class Frame {
        final String text;
        final IOException failure;

        private Frame(String text, IOException failure) {
            this.text = text;
            this.failure = failure;
        }
    }

    private static final class InboxListener implements WebSocket.Listener {
        private final BlockingQueue<Frame> inbox = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                inbox.add(new Frame(partial.toString(), null));
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            inbox.add(new Frame(null,
                    new IOException("Connection closed by peer (" + statusCode + " " + reason + ")")));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            inbox.add(new Frame(null, new IOException("WebSocket error: " + error.getMessage(), error)));
        }
    }

    private static final class Connection implements CertstreamConnection {
        private final WebSocket socket;
        private final BlockingQueue<Frame> inbox;
        private volatile IOException terminal;

        private Connection(WebSocket socket, BlockingQueue<Frame> inbox) {
            this.socket = socket;
            this.inbox = inbox;
        }

        @Override
        public String receive(Duration timeout) throws IOException, InterruptedException {
            if (terminal != null) {
                throw terminal;
            }
            Frame frame = inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (frame == null) {
                return null;
            }
            if (frame.failure != null) {
                terminal = frame.failure;
                throw frame.failure;
            }
            return frame.text;
        }

        @Override
        public void close() {
            if (terminal == null) {
                terminal = new IOException("Connection closed");
            }
            try {
                socket.abort();
            } catch (RuntimeException e) {
                LOG.debug("Ignoring failure while aborting WebSocket: {}", e.getMessage());
            }
        }
    }
}
