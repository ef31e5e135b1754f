package com.brandsentinel.core.source;

import com.brandsentinel.core.model.Event;
import com.brandsentinel.core.pipeline.EventQueue;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CertstreamSource}, driven by a scripted connection.
 */
class CertstreamSourceTest {

    private static final Duration SHORT = Duration.ofMillis(20);

    @Test
    @DisplayName("Should publish one event per matching domain")
    void shouldPublishMatchingDomains() throws Exception {
        CertstreamSource source = source(new ScriptedConnector());
        EventQueue queue = new EventQueue(10);

        int accepted = source.handleMessage(
                certificate("paypal-login.com", "DNS:paypal-login.com, DNS:www.paypal-login.com, DNS:*.paypal-login.com"),
                queue);

        assertThat(accepted).isEqualTo(2);
        Event first = queue.next(ShutdownSignal.create()).orElseThrow();
        assertThat(first.getDomain()).isEqualTo("paypal-login.com");
        assertThat(first.getSource()).isEqualTo("certstream");
        assertThat(first.getType()).isEqualTo("certificate_update");
        assertThat(first.getId()).startsWith("cert_");
        assertThat(first.getData())
                .containsEntry("cn", "paypal-login.com")
                .containsEntry("update_type", "X509LogEntry");
        assertThat(first.getMetadata().get("matched_keywords")).isEqualTo(List.of("paypal"));
        assertThat(queue.next(ShutdownSignal.create()).orElseThrow().getDomain())
                .isEqualTo("www.paypal-login.com");
    }

    @Test
    @DisplayName("Should ignore heartbeats, non-matching and undecodable messages")
    void shouldIgnoreIrrelevantMessages() throws Exception {
        CertstreamSource source = source(new ScriptedConnector());
        EventQueue queue = new EventQueue(10);

        assertThat(source.handleMessage("{\"message_type\":\"heartbeat\"}", queue)).isZero();
        assertThat(source.handleMessage(certificate("example.com", "DNS:example.com"), queue)).isZero();
        assertThat(source.handleMessage("{not json", queue)).isZero();
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("Should drop events when the queue stays full")
    void shouldDropWhenQueueFull() throws Exception {
        CertstreamSource source = source(new ScriptedConnector());
        EventQueue queue = new EventQueue(1);

        long start = System.nanoTime();
        int accepted = source.handleMessage(certificate("paypal-a.com", "DNS:paypal-b.com"), queue);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(accepted).isEqualTo(1);
        assertThat(queue.size()).isEqualTo(1);
        assertThat(elapsedMillis).isLessThan(3_000);
    }

    @Test
    @DisplayName("Should reconnect after a failed connection and stream events")
    void shouldReconnectAfterFailure() throws Exception {
        ScriptedConnector connector = new ScriptedConnector();
        connector.failures = 1;
        connector.messages.add(certificate("paypal-verify.com", ""));
        CertstreamSource source = source(connector);
        EventQueue queue = new EventQueue(10);
        ShutdownSignal signal = ShutdownSignal.create();

        CompletableFuture<Void> worker = runAsync(source, signal, queue);
        Event event = queue.next(signal).orElseThrow();
        signal.cancel();
        worker.get(5, TimeUnit.SECONDS);

        assertThat(event.getDomain()).isEqualTo("paypal-verify.com");
        assertThat(connector.attempts.get()).isEqualTo(2);
        assertThat(source.state()).isEqualTo(CertstreamSource.State.DISCONNECTED);
    }

    @Test
    @DisplayName("Should treat an idle connection as failed and reconnect")
    void shouldReconnectWhenIdle() throws Exception {
        ScriptedConnector connector = new ScriptedConnector();
        CertstreamSource source = new CertstreamSource("wss://example.test/", List.of("paypal"),
                connector, SHORT, Duration.ofMillis(50));
        ShutdownSignal signal = ShutdownSignal.create();

        CompletableFuture<Void> worker = runAsync(source, signal, new EventQueue(10));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (connector.attempts.get() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        signal.cancel();
        worker.get(5, TimeUnit.SECONDS);

        assertThat(connector.attempts.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    @DisplayName("Should return promptly when stopped while streaming")
    void shouldStopWhileStreaming() throws Exception {
        ScriptedConnector connector = new ScriptedConnector();
        CertstreamSource source = source(connector);
        ShutdownSignal signal = ShutdownSignal.create();

        CompletableFuture<Void> worker = runAsync(source, signal, new EventQueue(10));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (source.state() != CertstreamSource.State.STREAMING && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        source.stop();
        worker.get(5, TimeUnit.SECONDS);

        assertThat(connector.closed.get()).isGreaterThanOrEqualTo(1);
    }

    @Test
    @DisplayName("Should require at least one keyword")
    void shouldRequireKeywords() {
        assertThatThrownBy(() -> new CertstreamSource("wss://example.test/", List.of(" ")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("keyword");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static CertstreamSource source(CertstreamConnector connector) {
        return new CertstreamSource("wss://example.test/", List.of("paypal"), connector,
                SHORT, Duration.ofSeconds(60));
    }

    private static CompletableFuture<Void> runAsync(CertstreamSource source, ShutdownSignal signal,
                                                    EventQueue queue) {
        return CompletableFuture.runAsync(() -> {
            try {
                source.start(signal, queue);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
    }

    private static String certificate(String cn, String sans) {
        return "{\"message_type\":\"certificate_update\",\"data\":{\"update_type\":\"X509LogEntry\","
                + "\"leaf_cert\":{\"subject\":{\"CN\":\"" + cn + "\"},"
                + "\"extensions\":{\"subjectAltName\":\"" + sans + "\"}},\"seen\":1.0}}";
    }

    /** Fails the first {@code failures} attempts, then serves {@code messages} and goes silent. */
    private static final class ScriptedConnector implements CertstreamConnector {
        final List<String> messages = new ArrayList<>();
        final AtomicInteger attempts = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        int failures;

        @Override
        public CertstreamConnection connect(URI uri) throws IOException {
            if (attempts.incrementAndGet() <= failures) {
                throw new IOException("connection refused");
            }
            Deque<String> pending = new ArrayDeque<>(messages);
            return new CertstreamConnection() {
                @Override
                public String receive(Duration timeout) throws InterruptedException {
                    synchronized (pending) {
                        if (!pending.isEmpty()) {
                            return pending.poll();
                        }
                    }
                    Thread.sleep(Math.min(timeout.toMillis(), 10));
                    return null;
                }

                @Override
                public void close() {
                    closed.incrementAndGet();
                }
            };
        }
    }
}
