package com.brandsentinel.core.storage;

import com.brandsentinel.core.model.DetectionResult;
import com.brandsentinel.core.model.Event;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory {@link Storage} reference implementation.
 *
 * <p>
 * Records are held in append-only lists, each with an id-to-position index
 * for direct lookup. Saves take the write lock, queries the read lock.
 * </p>
 *
 * <h3>Filters</h3>
 * <ul>
 * <li>events: {@code id}, {@code source}, {@code type}, {@code domain}</li>
 * <li>detections: {@code id}, {@code event_id}, {@code domain},
 * {@code brand}, {@code rule}, {@code is_threat}</li>
 * </ul>
 * <p>
 * Unknown filter keys are ignored.
 * </p>
 *
 * <p>
 * After {@link #close()} all data is discarded and every other call throws
 * {@link StorageException}.
 * </p>
 *
 * @since 1.0.0
 */
public class MemoryStorage implements Storage {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<Event> events = new ArrayList<>();
    private final List<DetectionResult> detections = new ArrayList<>();
    private final Map<String, Integer> eventIndex = new HashMap<>();
    private final Map<String, Integer> detectionIndex = new HashMap<>();

    private boolean closed;

    @Override
    public String saveEvent(Event event) throws StorageException {
        Objects.requireNonNull(event, "Event must not be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            Event stored = event.copy();
            int position = events.size();
            if (!stored.hasId()) {
                stored.assignId(generateId("event", position));
            }
            if (eventIndex.containsKey(stored.getId())) {
                throw new StorageException("Duplicate event id: " + stored.getId());
            }
            events.add(stored);
            eventIndex.put(stored.getId(), position);
            return stored.getId();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String saveDetection(DetectionResult result) throws StorageException {
        Objects.requireNonNull(result, "DetectionResult must not be null");
        lock.writeLock().lock();
        try {
            ensureOpen();
            int position = detections.size();
            DetectionResult stored = result.hasId()
                    ? result
                    : result.withId(generateId("detection", position));
            if (detectionIndex.containsKey(stored.getId())) {
                throw new StorageException("Duplicate detection id: " + stored.getId());
            }
            detections.add(stored);
            detectionIndex.put(stored.getId(), position);
            return stored.getId();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Event> getEvents(Map<String, Object> filters) throws StorageException {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<Event> matched = new ArrayList<>();
            for (Event event : events) {
                if (matchesEvent(event, filters)) {
                    matched.add(event.copy());
                }
            }
            return matched;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DetectionResult> getDetections(Map<String, Object> filters) throws StorageException {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<DetectionResult> matched = new ArrayList<>();
            for (DetectionResult detection : detections) {
                if (matchesDetection(detection, filters)) {
                    matched.add(detection);
                }
            }
            return matched;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Event> findEvent(String id) throws StorageException {
        lock.readLock().lock();
        try {
            ensureOpen();
            Integer position = eventIndex.get(id);
            return position == null ? Optional.empty() : Optional.of(events.get(position).copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<DetectionResult> findDetection(String id) throws StorageException {
        lock.readLock().lock();
        try {
            ensureOpen();
            Integer position = detectionIndex.get(id);
            return position == null ? Optional.empty() : Optional.of(detections.get(position));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            events.clear();
            detections.clear();
            eventIndex.clear();
            detectionIndex.clear();
            closed = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void ensureOpen() throws StorageException {
        if (closed) {
            throw new StorageException("Storage is closed");
        }
    }

    private static String generateId(String prefix, int position) {
        return prefix + "_" + position + "_" + System.nanoTime();
    }

    private static boolean matchesEvent(Event event, Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Object expected = filter.getValue();
            boolean matches = switch (filter.getKey()) {
                case "id" -> Objects.equals(event.getId(), expected);
                case "source" -> Objects.equals(event.getSource(), expected);
                case "type" -> Objects.equals(event.getType(), expected);
                case "domain" -> Objects.equals(event.getDomain(), expected);
                default -> true;
            };
            if (!matches) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesDetection(DetectionResult detection, Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Object expected = filter.getValue();
            boolean matches = switch (filter.getKey()) {
                case "id" -> Objects.equals(detection.getId(), expected);
                case "event_id" -> Objects.equals(detection.getEventId(), expected);
                case "domain" -> Objects.equals(detection.getDomain(), expected);
                case "brand" -> Objects.equals(detection.getBrand(), expected);
                case "rule" -> Objects.equals(detection.getRule(), expected);
                case "is_threat" -> Objects.equals(detection.isThreat(), expected);
                default -> true;
            };
            if (!matches) {
                return false;
            }
        }
        return true;
    }
}
