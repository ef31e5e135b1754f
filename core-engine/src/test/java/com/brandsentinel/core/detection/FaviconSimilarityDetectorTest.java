package com.brandsentinel.core.detection;

import com.brandsentinel.core.enrichment.FaviconEnricher;
import com.brandsentinel.core.enrichment.HttpFetcher;
import com.brandsentinel.core.enrichment.HttpFixture;
import com.brandsentinel.core.model.DetectionResult;
import com.brandsentinel.core.model.Event;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FaviconSimilarityDetector}.
 */
class FaviconSimilarityDetectorTest {

    private static final byte[] PAYPAL_ICON = {1, 2, 3, 4};
    private static final byte[] OTHER_ICON = {9, 9, 9};

    private HttpFixture http;
    private FaviconSimilarityDetector detector;

    @BeforeEach
    void setUp() throws Exception {
        http = new HttpFixture().serve("/ref/paypal.ico", PAYPAL_ICON);
        detector = new FaviconSimilarityDetector(
                new HttpFetcher(Duration.ofSeconds(2), null),
                Map.of("paypal", http.url("/ref/paypal.ico"), "amazon", http.url("/ref/missing.ico")),
                0.85);
    }

    @AfterEach
    void tearDown() {
        http.close();
    }

    @Test
    @DisplayName("Should flag a domain serving the brand's favicon")
    void shouldFlagIdenticalFavicon() throws Exception {
        Event event = event(PAYPAL_ICON, "paypal");
        event.assignId("cert_1");

        List<DetectionResult> results = detector.detect(ShutdownSignal.create(), event.view());

        assertThat(results).hasSize(1);
        DetectionResult result = results.get(0);
        assertThat(result.isThreat()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(1.0);
        assertThat(result.getBrand()).isEqualTo("paypal");
        assertThat(result.getRule()).isEqualTo("favicon_similarity");
        assertThat(result.getEventId()).isEqualTo("cert_1");
        assertThat(result.getDomain()).isEqualTo("paypal-login.com");
    }

    @Test
    @DisplayName("Should report a non-threat for a different favicon")
    void shouldNotFlagDifferentFavicon() throws Exception {
        List<DetectionResult> results = detector.detect(ShutdownSignal.create(), event(OTHER_ICON, "paypal").view());

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.isThreat()).isFalse();
            assertThat(result.getConfidence()).isZero();
        });
    }

    @Test
    @DisplayName("Should produce nothing for events without a favicon fingerprint")
    void shouldSkipEventsWithoutFavicon() throws Exception {
        Event event = Event.builder().domain("paypal-login.com").metadata("matched_keywords", List.of("paypal")).build();

        assertThat(detector.detect(ShutdownSignal.create(), event.view())).isEmpty();
    }

    @Test
    @DisplayName("Should skip brands whose reference favicon is unavailable")
    void shouldSkipUnavailableReference() throws Exception {
        assertThat(detector.detect(ShutdownSignal.create(), event(PAYPAL_ICON, "amazon").view())).isEmpty();
    }

    @Test
    @DisplayName("Should fetch each reference favicon only once")
    void shouldCacheReference() throws Exception {
        detector.detect(ShutdownSignal.create(), event(PAYPAL_ICON, "paypal").view());
        int afterFirst = http.requestCount();

        detector.detect(ShutdownSignal.create(), event(OTHER_ICON, "paypal").view());

        assertThat(http.requestCount()).isEqualTo(afterFirst);
    }

    @Test
    @DisplayName("Should reject a threshold outside [0, 1]")
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new FaviconSimilarityDetector(
                new HttpFetcher(Duration.ofSeconds(1), null), Map.of(), 1.2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Event event(byte[] icon, String keyword) {
        return Event.builder()
                .domain("paypal-login.com")
                .data(FaviconEnricher.SHA256_KEY, HttpFetcher.sha256Hex(icon))
                .metadata("matched_keywords", List.of(keyword))
                .build();
    }
}
