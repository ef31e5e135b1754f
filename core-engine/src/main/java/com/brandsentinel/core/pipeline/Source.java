package com.brandsentinel.core.pipeline;

/**
 * Produces events into the engine's queue.
 *
 * <p>
 * A source owns its retry loop: {@link #start(ShutdownSignal, EventQueue)}
 * must not return because of a transient error, only when the signal fires
 * or a fatal error occurs.
 * </p>
 */
public interface Source {

    /**
     * @return source name used in logs and as the event source field
     */
    String name();

    /**
     * Run until the signal fires.
     *
     * @param signal shared cancellation signal
     * @param queue  destination of produced events
     * @throws StageException if the source fails fatally
     */
    void start(ShutdownSignal signal, EventQueue queue) throws StageException;

    /**
     * Request a graceful stop. Best effort; the signal is the primary path.
     */
    void stop();
}
