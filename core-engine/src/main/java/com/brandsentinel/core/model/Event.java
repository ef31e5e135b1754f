package com.brandsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One observed occurrence from a source, e.g. a freshly issued certificate
 * for a domain that contains a brand keyword.
 *
 * <p>
 * The domain is always stored lower-cased. Raw {@code data} and derived
 * {@code metadata} are open-ended maps that enrichers may add to (but never
 * remove from) through {@link #putData(String, Object)} and
 * {@link #putMetadata(String, Object)}.
 * </p>
 *
 * <h3>Identity</h3>
 * <p>
 * The id may be absent when the event is built. It is assigned exactly once,
 * either by the producer or by storage on first save; see
 * {@link #assignId(String)}.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. An event is handed from its
 * source to the single pipeline consumer through the event queue and is only
 * touched by that consumer afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public class Event implements EventView {

    private String id;
    private final String source;
    private final String type;
    private final String domain;
    private final Instant timestamp;
    private final Map<String, Object> data;
    private final Map<String, Object> metadata;

    private Event(Builder builder) {
        if (builder.domain == null || builder.domain.isBlank()) {
            throw new IllegalArgumentException("Event domain must not be null or blank");
        }
        this.id = builder.id == null || builder.id.isBlank() ? null : builder.id;
        this.source = builder.source;
        this.type = builder.type;
        this.domain = builder.domain.trim().toLowerCase(Locale.ROOT);
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.data = new LinkedHashMap<>(builder.data);
        this.metadata = new LinkedHashMap<>(builder.metadata);
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------

    @Override
    public String getId() {
        return id;
    }

    /**
     * @return {@code true} once an id has been assigned
     */
    public boolean hasId() {
        return id != null;
    }

    /**
     * Assign the event id. Ids are immutable once set.
     *
     * @param id the new id; must not be blank
     * @throws IllegalArgumentException if {@code id} is {@code null} or blank
     * @throws IllegalStateException    if the event already has an id
     */
    public void assignId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Event id must not be null or blank");
        }
        if (this.id != null) {
            throw new IllegalStateException(
                    "Event already has id '" + this.id + "', refusing to reassign to '" + id + "'");
        }
        this.id = id;
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    @Override
    public String getSource() {
        return source;
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    public String getDomain() {
        return domain;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(data);
    }

    @Override
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    // ---------------------------------------------------------------
    // Enrichment (add-only)
    // ---------------------------------------------------------------

    /**
     * Add or overwrite a raw data entry.
     *
     * @param key   data key; must not be {@code null}
     * @param value the value
     */
    public void putData(String key, Object value) {
        Objects.requireNonNull(key, "Data key must not be null");
        data.put(key, value);
    }

    /**
     * Add or overwrite a metadata entry.
     *
     * @param key   metadata key; must not be {@code null}
     * @param value the value
     */
    public void putMetadata(String key, Object value) {
        Objects.requireNonNull(key, "Metadata key must not be null");
        metadata.put(key, value);
    }

    // ---------------------------------------------------------------
    // Views and copies
    // ---------------------------------------------------------------

    /**
     * Return a read-only view backed by this event.
     *
     * @return view that exposes only getters
     */
    public EventView view() {
        return new ReadOnlyView(this);
    }

    /**
     * Return a copy with independent data and metadata maps. Nested values
     * are shared.
     *
     * @return copy of this event, including its id if assigned
     */
    public Event copy() {
        return builder()
                .id(id)
                .source(source)
                .type(type)
                .domain(domain)
                .timestamp(timestamp)
                .data(data)
                .metadata(metadata)
                .build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Event} instances.
     *
     * <p>
     * {@code domain} is <strong>required</strong>; the timestamp defaults to
     * the build instant.
     * </p>
     */
    public static class Builder {
        private String id;
        private String source;
        private String type;
        private String domain;
        private Instant timestamp;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            if (data != null) {
                this.data.putAll(data);
            }
            return this;
        }

        public Builder data(String key, Object value) {
            this.data.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        /**
         * Build the event.
         *
         * @return a new {@link Event}
         * @throws IllegalArgumentException if the domain is missing
         */
        public Event build() {
            return new Event(this);
        }
    }

    private static final class ReadOnlyView implements EventView {
        private final Event event;

        private ReadOnlyView(Event event) {
            this.event = event;
        }

        @Override
        public String getId() {
            return event.getId();
        }

        @Override
        public String getSource() {
            return event.getSource();
        }

        @Override
        public String getType() {
            return event.getType();
        }

        @Override
        public String getDomain() {
            return event.getDomain();
        }

        @Override
        public Instant getTimestamp() {
            return event.getTimestamp();
        }

        @Override
        public Map<String, Object> getData() {
            return event.getData();
        }

        @Override
        public Map<String, Object> getMetadata() {
            return event.getMetadata();
        }

        @Override
        public String toString() {
            return event.toString();
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Event that))
            return false;
        return Objects.equals(id, that.id)
                && Objects.equals(source, that.source)
                && Objects.equals(type, that.type)
                && Objects.equals(domain, that.domain)
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(data, that.data)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, source, type, domain, timestamp);
    }

    @Override
    public String toString() {
        return "Event{" +
                "id='" + id + '\'' +
                ", source='" + source + '\'' +
                ", type='" + type + '\'' +
                ", domain='" + domain + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
