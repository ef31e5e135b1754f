package com.brandsentinel.core.pipeline;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shared cancellation signal observed by every pipeline worker.
 *
 * <p>
 * Workers check the signal at each suspension point: timed sleeps and timers
 * use {@link #await(Duration)}, blocking reads poll in short slices and check
 * {@link #isCancelled()} between slices. Once fired, the signal stays fired.
 * </p>
 *
 * <p>
 * A signal may carry a deadline, after which it fires on its own.
 * </p>
 *
 * @since 1.0.0
 */
public final class ShutdownSignal {

    private final CountDownLatch fired = new CountDownLatch(1);
    private final Instant deadline;

    private ShutdownSignal(Instant deadline) {
        this.deadline = deadline;
    }

    /**
     * @return a signal that fires only when {@link #cancel()} is called
     */
    public static ShutdownSignal create() {
        return new ShutdownSignal(null);
    }

    /**
     * Create a signal that fires after {@code timeout} or on {@link #cancel()},
     * whichever comes first.
     *
     * @param timeout time until the signal fires on its own; must be positive
     * @return new signal
     * @throws IllegalArgumentException if {@code timeout} is not positive
     */
    public static ShutdownSignal withDeadline(Duration timeout) {
        Objects.requireNonNull(timeout, "Timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeout);
        }
        ShutdownSignal signal = new ShutdownSignal(Instant.now().plus(timeout));
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .execute(signal::cancel);
        return signal;
    }

    /**
     * Fire the signal. Idempotent.
     */
    public void cancel() {
        fired.countDown();
    }

    /**
     * @return {@code true} once the signal has fired
     */
    public boolean isCancelled() {
        return fired.getCount() == 0;
    }

    /**
     * Block until the signal fires.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void await() throws InterruptedException {
        fired.await();
    }

    /**
     * Block until the signal fires or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if the signal fired, {@code false} on timeout
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return fired.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * @return the instant at which the signal fires on its own, if any
     */
    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    @Override
    public String toString() {
        return "ShutdownSignal{cancelled=" + isCancelled() + ", deadline=" + deadline + '}';
    }
}
