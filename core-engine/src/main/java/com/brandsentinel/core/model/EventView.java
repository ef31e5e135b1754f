package com.brandsentinel.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of an {@link Event}.
 *
 * <p>
 * Detectors and enforcers only ever see events through this interface, so the
 * event is logically frozen once enrichment has finished.
 * </p>
 *
 * @since 1.0.0
 */
public interface EventView {

    /**
     * @return the event id, or {@code null} if none has been assigned yet
     */
    String getId();

    /** @return name of the source that produced the event */
    String getSource();

    /** @return event type tag, e.g. {@code certificate_update} */
    String getType();

    /** @return lower-cased domain the event refers to */
    String getDomain();

    /** @return instant at which the source observed the event */
    Instant getTimestamp();

    /** @return unmodifiable raw data captured by the source */
    Map<String, Object> getData();

    /** @return unmodifiable derived metadata (source and enrichers) */
    Map<String, Object> getMetadata();
}
