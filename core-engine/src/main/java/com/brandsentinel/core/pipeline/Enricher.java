package com.brandsentinel.core.pipeline;

import com.brandsentinel.core.model.Event;

/**
 * Adds data or metadata to an event before detection.
 *
 * <p>
 * Enrichers run in configured order and each sees the additions of the
 * previous ones. A failure is not fatal: the event continues with whatever
 * enrichment succeeded.
 * </p>
 */
public interface Enricher {

    String name();

    /**
     * @param signal shared cancellation signal
     * @param event  the event to enrich in place
     * @throws StageException if enrichment fails
     */
    void enrich(ShutdownSignal signal, Event event) throws StageException;
}
