package com.brandsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Verdict produced by one detector for one event.
 *
 * <p>
 * Results are immutable. A result whose {@link #isThreat()} flag is
 * {@code false} is persisted but never handed to enforcers.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code domain} and {@code rule} are required and
 * {@code confidence} must lie in {@code [0, 1]}; the builder throws otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult {

    private final String id;

    /** Id of the originating event; a weak reference, not a foreign key. */
    private final String eventId;

    private final String domain;
    private final boolean threat;
    private final double confidence;
    private final String brand;
    private final String rule;
    private final Instant detectedAt;
    private final Map<String, Object> metadata;

    private DetectionResult(Builder builder) {
        this.id = builder.id == null || builder.id.isBlank() ? null : builder.id;
        this.eventId = builder.eventId;
        this.domain = Objects.requireNonNull(builder.domain, "domain must not be null");
        this.threat = builder.threat;
        this.confidence = builder.confidence;
        this.brand = builder.brand;
        this.rule = Objects.requireNonNull(builder.rule, "rule must not be null");
        this.detectedAt = builder.detectedAt != null ? builder.detectedAt : Instant.now();
        // snapshot of the builder map
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));

        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "confidence must be in [0, 1] for rule '" + rule + "', got: " + confidence);
        }
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return a copy of this result carrying the given id.
     *
     * @param newId the id to assign; must not be blank
     * @return new result with every other field unchanged
     */
    public DetectionResult withId(String newId) {
        if (newId == null || newId.isBlank()) {
            throw new IllegalArgumentException("Detection id must not be null or blank");
        }
        return toBuilder().id(newId).build();
    }

    private Builder toBuilder() {
        return builder()
                .id(id)
                .eventId(eventId)
                .domain(domain)
                .threat(threat)
                .confidence(confidence)
                .brand(brand)
                .rule(rule)
                .detectedAt(detectedAt)
                .metadata(metadata);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionResult} instances.
     */
    public static class Builder {
        private String id;
        private String eventId;
        private String domain;
        private boolean threat;
        private double confidence;
        private String brand;
        private String rule;
        private Instant detectedAt;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder threat(boolean threat) {
            this.threat = threat;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder rule(String rule) {
            this.rule = rule;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
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
         * Build the result.
         *
         * @return a new {@link DetectionResult}
         * @throws NullPointerException     if {@code domain} or {@code rule} is
         *                                  {@code null}
         * @throws IllegalArgumentException if {@code confidence} is outside
         *                                  {@code [0, 1]}
         */
        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public boolean hasId() {
        return id != null;
    }

    public String getEventId() {
        return eventId;
    }

    public String getDomain() {
        return domain;
    }

    public boolean isThreat() {
        return threat;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getBrand() {
        return brand;
    }

    public String getRule() {
        return rule;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    /**
     * @return unmodifiable metadata map
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return threat == that.threat
                && Double.compare(confidence, that.confidence) == 0
                && Objects.equals(id, that.id)
                && Objects.equals(eventId, that.eventId)
                && Objects.equals(domain, that.domain)
                && Objects.equals(brand, that.brand)
                && Objects.equals(rule, that.rule)
                && Objects.equals(detectedAt, that.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, eventId, domain, rule, detectedAt);
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "id='" + id + '\'' +
                ", eventId='" + eventId + '\'' +
                ", domain='" + domain + '\'' +
                ", threat=" + threat +
                ", confidence=" + confidence +
                ", brand='" + brand + '\'' +
                ", rule='" + rule + '\'' +
                '}';
    }
}
