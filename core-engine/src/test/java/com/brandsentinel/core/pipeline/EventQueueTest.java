package com.brandsentinel.core.pipeline;

import com.brandsentinel.core.model.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventQueue}.
 */
class EventQueueTest {

    @Test
    @DisplayName("Should deliver events from one producer in publish order")
    void shouldPreserveFifoOrder() throws Exception {
        EventQueue queue = new EventQueue(100);
        ShutdownSignal signal = ShutdownSignal.create();

        CompletableFuture<Void> producer = CompletableFuture.runAsync(() -> {
            try {
                for (int i = 0; i < 500; i++) {
                    queue.publish(event(i), Duration.ofSeconds(5));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        List<String> received = new ArrayList<>();
        while (received.size() < 500) {
            received.add(queue.next(signal).orElseThrow().getId());
        }
        producer.get(5, TimeUnit.SECONDS);

        for (int i = 0; i < 500; i++) {
            assertThat(received.get(i)).isEqualTo("e" + i);
        }
    }

    @Test
    @DisplayName("Should drop within the timeout when the queue stays full")
    void shouldDropWhenFull() throws Exception {
        EventQueue queue = new EventQueue(1);
        queue.publish(event(0), Duration.ofMillis(10));

        long start = System.nanoTime();
        EventQueue.PublishResult result = queue.publish(event(1), Duration.ofMillis(100));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result).isEqualTo(EventQueue.PublishResult.DROPPED);
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(90).isLessThan(2_000);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse events and release consumers once closed")
    void shouldRejectAfterClose() throws Exception {
        EventQueue queue = new EventQueue(10);
        queue.publish(event(0), Duration.ofMillis(10));
        queue.publish(event(1), Duration.ofMillis(10));

        List<Event> abandoned = queue.close();

        assertThat(abandoned).extracting(Event::getId).containsExactly("e0", "e1");
        assertThat(queue.isClosed()).isTrue();
        assertThat(queue.publish(event(2), Duration.ofMillis(10))).isEqualTo(EventQueue.PublishResult.CLOSED);
        assertThat(queue.next(ShutdownSignal.create())).isEmpty();
    }

    @Test
    @DisplayName("Should not keep an event whose publish was waiting when the queue closed")
    void shouldRejectPendingPublishOnClose() throws Exception {
        EventQueue queue = new EventQueue(1);
        queue.publish(event(0), Duration.ofMillis(10));

        CompletableFuture<EventQueue.PublishResult> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.publish(event(1), Duration.ofSeconds(2));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        });
        Thread.sleep(200);
        List<Event> abandoned = queue.close();

        assertThat(pending.get(5, TimeUnit.SECONDS)).isEqualTo(EventQueue.PublishResult.CLOSED);
        assertThat(abandoned).extracting(Event::getId).containsExactly("e0");
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("Should stop waiting for events when the signal fires")
    void shouldReturnEmptyOnCancel() throws Exception {
        EventQueue queue = new EventQueue(10);
        ShutdownSignal signal = ShutdownSignal.create();

        CompletableFuture<Optional<Event>> consumer = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.next(signal);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        });
        signal.cancel();

        assertThat(consumer.get(2, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new EventQueue(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Event event(int i) {
        return Event.builder().id("e" + i).domain("paypal-" + i + ".com").build();
    }
}
