package com.brandsentinel.core.pipeline;

import com.brandsentinel.core.model.Event;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, closable FIFO between sources and the pipeline consumer.
 *
 * <h3>Backpressure</h3>
 * <p>
 * {@link #publish(Event, Duration)} waits at most the given timeout for
 * space. When the consumer falls behind the event is dropped and the caller
 * is told so; producers never block indefinitely.
 * </p>
 *
 * <h3>Closing</h3>
 * <p>
 * {@link #close()} is the normal end-of-stream signal. Further publishes are
 * rejected, events still queued are abandoned, and {@link #next(ShutdownSignal)}
 * returns empty.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventQueue {

    /** Default capacity of the engine's event queue. */
    public static final int DEFAULT_CAPACITY = 100;

    /** Upper bound on how long a consumer waits before rechecking close/cancel. */
    static final Duration POLL_SLICE = Duration.ofMillis(100);

    /** Outcome of a publish attempt. */
    public enum PublishResult {
        /** The event was enqueued. */
        ACCEPTED,
        /** The queue stayed full for the whole timeout; the event was dropped. */
        DROPPED,
        /** The queue is closed; the event was discarded. */
        CLOSED
    }

    private final BlockingQueue<Event> queue;
    private volatile boolean closed;

    /**
     * @param capacity maximum number of queued events; must be positive
     * @throws IllegalArgumentException if {@code capacity} is not positive
     */
    public EventQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be >= 1, got: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Try to enqueue an event, waiting at most {@code timeout} for space.
     *
     * @param event   the event; must not be {@code null}
     * @param timeout maximum wait for free capacity
     * @return the outcome
     * @throws InterruptedException if interrupted while waiting
     */
    public PublishResult publish(Event event, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(event, "Event must not be null");
        if (closed) {
            return PublishResult.CLOSED;
        }
        if (!queue.offer(event, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return closed ? PublishResult.CLOSED : PublishResult.DROPPED;
        }
        // close() may have drained the queue while this offer was waiting for the freed slot
        if (closed && queue.removeIf(queued -> queued == event)) {
            return PublishResult.CLOSED;
        }
        return PublishResult.ACCEPTED;
    }

    /**
     * Wait for the next event.
     *
     * @param signal shared cancellation signal
     * @return the next event, or empty once the queue is closed or the signal
     *         has fired
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Event> next(ShutdownSignal signal) throws InterruptedException {
        while (!closed && !signal.isCancelled()) {
            Event event = queue.poll(POLL_SLICE.toMillis(), TimeUnit.MILLISECONDS);
            if (event != null) {
                return closed ? Optional.empty() : Optional.of(event);
            }
        }
        return Optional.empty();
    }

    /**
     * Close the queue and discard anything still queued.
     *
     * @return the events that were abandoned
     */
    public List<Event> close() {
        closed = true;
        List<Event> abandoned = new ArrayList<>();
        queue.drainTo(abandoned);
        return abandoned;
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }
}
