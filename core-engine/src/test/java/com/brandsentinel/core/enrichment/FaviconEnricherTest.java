package com.brandsentinel.core.enrichment;

import com.brandsentinel.core.model.Event;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import com.brandsentinel.core.pipeline.StageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FaviconEnricher}.
 */
class FaviconEnricherTest {

    private static final byte[] ICON = {0, 0, 1, 0, 1, 0, 16, 16};

    private HttpFixture http;
    private FaviconEnricher enricher;

    @BeforeEach
    void setUp() throws Exception {
        http = new HttpFixture();
        enricher = new FaviconEnricher(new HttpFetcher(Duration.ofSeconds(2), null), http.template("/favicon.ico"));
    }

    @AfterEach
    void tearDown() {
        http.close();
    }

    @Test
    @DisplayName("Should record the favicon fingerprint and size")
    void shouldFingerprintFavicon() throws Exception {
        http.serve("/paypal-login.com/favicon.ico", ICON);
        Event event = Event.builder().domain("paypal-login.com").build();

        enricher.enrich(ShutdownSignal.create(), event);

        assertThat(event.getData())
                .containsEntry(FaviconEnricher.SHA256_KEY, HttpFetcher.sha256Hex(ICON))
                .containsEntry(FaviconEnricher.SIZE_KEY, ICON.length);
        assertThat(event.getData().get(FaviconEnricher.SHA256_KEY).toString()).hasSize(64);
    }

    @Test
    @DisplayName("Should fail when the site has no favicon")
    void shouldFailWithoutFavicon() {
        Event event = Event.builder().domain("no-icon-paypal.com").build();

        assertThatThrownBy(() -> enricher.enrich(ShutdownSignal.create(), event))
                .isInstanceOf(StageException.class);
        assertThat(event.getData()).doesNotContainKey(FaviconEnricher.SHA256_KEY);
    }
}
