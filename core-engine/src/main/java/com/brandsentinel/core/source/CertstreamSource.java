package com.brandsentinel.core.source;

import com.brandsentinel.core.model.Event;
import com.brandsentinel.core.pipeline.EventQueue;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import com.brandsentinel.core.pipeline.Source;
import com.brandsentinel.core.pipeline.StageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Streams newly issued certificates from a certstream WebSocket feed and
 * publishes one {@link Event} per domain that mentions a brand keyword.
 *
 * <h3>Connection lifecycle</h3>
 * <pre>
 *   DISCONNECTED ──connect──▶ CONNECTING ──ok──▶ STREAMING
 *        ▲                        │                  │
 *        └──── wait reconnectDelay ◀── error / idle ─┘
 * </pre>
 * <p>
 * Reconnection is retried forever at a fixed delay until the shutdown signal
 * fires or {@link #stop()} is called. A connection that delivers nothing for
 * the idle timeout is treated as failed.
 * </p>
 *
 * <h3>Back-pressure</h3>
 * <p>
 * Each event is offered to the queue for at most {@link #PUBLISH_TIMEOUT};
 * if the queue stays full the event is dropped with a warning and streaming
 * continues.
 * </p>
 *
 * @since 1.0.0
 */
public class CertstreamSource implements Source {

    private static final Logger LOG = LoggerFactory.getLogger(CertstreamSource.class);

    public static final String NAME = "certstream";
    public static final String EVENT_TYPE = "certificate_update";

    static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);
    static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(60);
    static final Duration PUBLISH_TIMEOUT = Duration.ofSeconds(1);
    static final Duration RECEIVE_SLICE = Duration.ofMillis(250);

    /** Connection state, exposed for diagnostics. */
    public enum State {
        DISCONNECTED,
        CONNECTING,
        STREAMING
    }

    private final URI url;
    private final DomainFilter filter;
    private final CertstreamConnector connector;
    private final Duration reconnectDelay;
    private final Duration idleTimeout;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicReference<CertstreamConnection> current = new AtomicReference<>();

    private volatile State state = State.DISCONNECTED;
    private volatile boolean stopRequested;

    /**
     * Source over the real WebSocket feed with default timings.
     */
    public CertstreamSource(String url, List<String> keywords) {
        this(url, keywords, new WebSocketCertstreamConnector(), DEFAULT_RECONNECT_DELAY, DEFAULT_IDLE_TIMEOUT);
    }

    /**
     * @param url            feed endpoint
     * @param keywords       brand keywords, at least one
     * @param connector      connection factory
     * @param reconnectDelay pause between connection attempts
     * @param idleTimeout    maximum silence before the connection is dropped
     */
    public CertstreamSource(String url,
                            List<String> keywords,
                            CertstreamConnector connector,
                            Duration reconnectDelay,
                            Duration idleTimeout) {
        Objects.requireNonNull(url, "URL must not be null");
        Objects.requireNonNull(keywords, "Keywords must not be null");
        this.url = URI.create(url);
        this.filter = new DomainFilter(keywords);
        if (filter.getKeywords().isEmpty()) {
            throw new IllegalArgumentException("Certstream source requires at least one keyword");
        }
        this.connector = Objects.requireNonNull(connector, "Connector must not be null");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "Reconnect delay must not be null");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "Idle timeout must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    public State state() {
        return state;
    }

    @Override
    public void start(ShutdownSignal signal, EventQueue queue) throws StageException {
        Objects.requireNonNull(signal, "Signal must not be null");
        Objects.requireNonNull(queue, "Queue must not be null");
        LOG.info("Connecting to certstream: {}", url);
        try {
            while (!shouldExit(signal)) {
                try {
                    stream(signal, queue);
                } catch (IOException e) {
                    if (shouldExit(signal)) {
                        break;
                    }
                    LOG.warn("Certstream connection failed: {}", e.getMessage());
                    LOG.info("Reconnecting in {} seconds", reconnectDelay.toSeconds());
                    if (signal.await(reconnectDelay)) {
                        break;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Certstream source interrupted");
        } finally {
            state = State.DISCONNECTED;
        }
        LOG.info("Certstream source stopped");
    }

    @Override
    public void stop() {
        stopRequested = true;
        CertstreamConnection connection = current.get();
        if (connection != null) {
            connection.close();
        }
    }

    // ---------------------------------------------------------------
    // Streaming
    // ---------------------------------------------------------------

    private boolean shouldExit(ShutdownSignal signal) {
        return stopRequested || signal.isCancelled();
    }

    private void stream(ShutdownSignal signal, EventQueue queue) throws IOException, InterruptedException {
        state = State.CONNECTING;
        CertstreamConnection connection = connector.connect(url);
        current.set(connection);
        try {
            state = State.STREAMING;
            LOG.info("Connected to certstream, monitoring keywords: {}", filter.getKeywords());

            long deadline = System.nanoTime() + idleTimeout.toNanos();
            while (!shouldExit(signal)) {
                String message = connection.receive(RECEIVE_SLICE);
                if (message == null) {
                    if (System.nanoTime() - deadline > 0) {
                        throw new IOException("No message received for " + idleTimeout.toSeconds() + "s");
                    }
                    continue;
                }
                deadline = System.nanoTime() + idleTimeout.toNanos();
                handleMessage(message, queue);
            }
        } finally {
            current.set(null);
            connection.close();
            state = State.DISCONNECTED;
        }
    }

    /**
     * Decode one feed message and publish an event for every matching domain.
     *
     * @return number of events accepted by the queue
     */
    int handleMessage(String raw, EventQueue queue) throws InterruptedException {
        CertstreamMessage message;
        try {
            message = mapper.readValue(raw, CertstreamMessage.class);
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to process cert entry: {}", e.getOriginalMessage());
            return 0;
        }
        if (!message.isCertificateUpdate()) {
            return 0;
        }

        String cn = message.commonName();
        String sans = message.subjectAltName();
        int accepted = 0;
        for (String domain : filter.extractDomains(cn, sans)) {
            List<String> matched = filter.matchedKeywords(domain);
            if (matched.isEmpty()) {
                continue;
            }
            Event event = Event.builder()
                    .id("cert_" + System.nanoTime() + "_" + sequence.incrementAndGet())
                    .source(NAME)
                    .type(EVENT_TYPE)
                    .domain(domain)
                    .data("cn", cn)
                    .data("sans", sans)
                    .data("update_type", message.updateType())
                    .metadata("matched_keywords", matched)
                    .build();

            switch (queue.publish(event, PUBLISH_TIMEOUT)) {
                case ACCEPTED:
                    accepted++;
                    LOG.info("New certificate: {} (matched: {})", domain, matched);
                    break;
                case DROPPED:
                    LOG.warn("Event queue full, dropping certificate: {}", domain);
                    break;
                default:
                    LOG.debug("Event queue closed, discarding certificate: {}", domain);
                    break;
            }
        }
        return accepted;
    }
}
