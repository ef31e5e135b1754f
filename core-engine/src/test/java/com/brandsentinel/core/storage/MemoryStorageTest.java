package com.brandsentinel.core.storage;

import com.brandsentinel.core.model.DetectionResult;
import com.brandsentinel.core.model.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MemoryStorage}.
 */
class MemoryStorageTest {

    private MemoryStorage storage;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorage();
    }

    @Test
    @DisplayName("Should assign unique non-empty ids to events without one")
    void shouldAssignUniqueIds() throws Exception {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            ids.add(storage.saveEvent(event("paypal-" + i + ".com")));
        }

        assertThat(ids).hasSize(50).allMatch(id -> id.startsWith("event_"));
    }

    @Test
    @DisplayName("Should keep an id supplied by the producer")
    void shouldKeepProducerId() throws Exception {
        Event event = Event.builder().id("cert_42").domain("paypal.evil.com").build();

        assertThat(storage.saveEvent(event)).isEqualTo("cert_42");
        assertThat(storage.findEvent("cert_42")).isPresent();
    }

    @Test
    @DisplayName("Should reject a duplicate event id")
    void shouldRejectDuplicateId() throws Exception {
        storage.saveEvent(Event.builder().id("cert_1").domain("a-paypal.com").build());

        assertThatThrownBy(() -> storage.saveEvent(Event.builder().id("cert_1").domain("b-paypal.com").build()))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("Should store a copy unaffected by later changes to the event")
    void shouldStoreCopy() throws Exception {
        Event event = event("paypal.evil.com");
        String id = storage.saveEvent(event);

        event.putData("html_title", "changed later");

        assertThat(event.hasId()).isFalse();
        assertThat(storage.findEvent(id).orElseThrow().getData()).doesNotContainKey("html_title");
    }

    @Test
    @DisplayName("Should filter events by domain preserving insertion order")
    void shouldFilterByDomainInOrder() throws Exception {
        String first = storage.saveEvent(event("paypal.evil.com"));
        storage.saveEvent(event("amazon.evil.com"));
        String third = storage.saveEvent(event("paypal.evil.com"));

        List<Event> found = storage.getEvents(Map.of("domain", "paypal.evil.com"));

        assertThat(found).extracting(Event::getId).containsExactly(first, third);
    }

    @Test
    @DisplayName("Should return everything for empty filters and ignore unknown keys")
    void shouldIgnoreUnknownFilterKeys() throws Exception {
        storage.saveEvent(event("paypal.evil.com"));
        storage.saveEvent(event("amazon.evil.com"));

        assertThat(storage.getEvents(Map.of())).hasSize(2);
        assertThat(storage.getEvents(Map.of("colour", "blue"))).hasSize(2);
        assertThat(storage.getEvents(Map.of("source", "certstream", "domain", "amazon.evil.com"))).hasSize(1);
    }

    @Test
    @DisplayName("Should filter detections by threat flag and brand")
    void shouldFilterDetections() throws Exception {
        storage.saveDetection(detection("paypal", true));
        storage.saveDetection(detection("paypal", false));
        String amazon = storage.saveDetection(detection("amazon", true));

        assertThat(storage.getDetections(Map.of("is_threat", true))).hasSize(2);
        assertThat(storage.getDetections(Map.of("brand", "amazon")))
                .extracting(DetectionResult::getId)
                .containsExactly(amazon);
        assertThat(storage.findDetection(amazon)).isPresent();
        assertThat(storage.findDetection("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should fail every call after close")
    void shouldFailAfterClose() throws Exception {
        storage.saveEvent(event("paypal.evil.com"));

        storage.close();
        storage.close();

        assertThatThrownBy(() -> storage.getEvents(Map.of()))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("closed");
        assertThatThrownBy(() -> storage.saveEvent(event("paypal.evil.com")))
                .isInstanceOf(StorageException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Event event(String domain) {
        return Event.builder()
                .source("certstream")
                .type("certificate_update")
                .domain(domain)
                .build();
    }

    private static DetectionResult detection(String brand, boolean threat) {
        return DetectionResult.builder()
                .domain(brand + ".evil.com")
                .brand(brand)
                .rule("favicon_similarity")
                .threat(threat)
                .confidence(threat ? 1.0 : 0.0)
                .build();
    }
}
