package com.brandsentinel.core.enforcement;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.brandsentinel.core.model.DetectionResult;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LoggerEnforcer}.
 */
class LoggerEnforcerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(LoggerEnforcer.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void setUp() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    @DisplayName("Should log the threat")
    void shouldLogThreat() {
        new LoggerEnforcer().enforce(ShutdownSignal.create(), threat(), false);

        assertThat(appender.list).singleElement().satisfies(event -> {
            assertThat(event.getFormattedMessage())
                    .startsWith("Threat on paypal-login.com")
                    .contains("brand=paypal")
                    .contains("confidence=1.00");
        });
    }

    @Test
    @DisplayName("Should prefix the log line in dry-run mode")
    void shouldPrefixDryRun() {
        new LoggerEnforcer().enforce(ShutdownSignal.create(), threat(), true);

        assertThat(appender.list).singleElement()
                .satisfies(event -> assertThat(event.getFormattedMessage()).startsWith("[DRY-RUN] Threat on"));
    }

    private static DetectionResult threat() {
        return DetectionResult.builder()
                .domain("paypal-login.com")
                .brand("paypal")
                .rule("favicon_similarity")
                .threat(true)
                .confidence(1.0)
                .build();
    }
}
