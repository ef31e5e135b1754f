package com.brandsentinel.core.storage;

import com.brandsentinel.core.model.DetectionResult;
import com.brandsentinel.core.model.Event;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-and-index store for events and detection results.
 *
 * <p>
 * Implementations keep their own copies of saved records, so later mutation
 * of an in-flight event does not leak into storage. Queries take a map of
 * field name to expected value; a record matches when every filter matches
 * (logical AND). An empty filter returns everything.
 * </p>
 *
 * <p>
 * Implementations must be safe for concurrent callers.
 * </p>
 *
 * @since 1.0.0
 */
public interface Storage extends AutoCloseable {

    /**
     * Persist a copy of the event, assigning an id if it has none.
     *
     * @param event the event to save
     * @return the id under which the event was stored
     * @throws StorageException if the event cannot be stored
     */
    String saveEvent(Event event) throws StorageException;

    /**
     * Persist the result, assigning an id if it has none.
     *
     * @param result the detection result to save
     * @return the id under which the result was stored
     * @throws StorageException if the result cannot be stored
     */
    String saveDetection(DetectionResult result) throws StorageException;

    /**
     * @param filters field name to expected value; may be empty
     * @return copies of matching events in insertion order
     * @throws StorageException if the query cannot be answered
     */
    List<Event> getEvents(Map<String, Object> filters) throws StorageException;

    /**
     * @param filters field name to expected value; may be empty
     * @return matching results in insertion order
     * @throws StorageException if the query cannot be answered
     */
    List<DetectionResult> getDetections(Map<String, Object> filters) throws StorageException;

    /**
     * @param id event id
     * @return copy of the stored event, if present
     * @throws StorageException if the lookup cannot be answered
     */
    Optional<Event> findEvent(String id) throws StorageException;

    /**
     * @param id detection id
     * @return the stored result, if present
     * @throws StorageException if the lookup cannot be answered
     */
    Optional<DetectionResult> findDetection(String id) throws StorageException;

    /**
     * Release the backend. Terminal: no further operation is valid afterwards.
     *
     * @throws StorageException if the backend fails to close
     */
    @Override
    void close() throws StorageException;
}
