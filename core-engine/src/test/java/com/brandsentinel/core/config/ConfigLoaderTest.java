package com.brandsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        SentinelConfig config = ConfigLoader.fromClasspath("test-config.yml");

        SentinelConfig.CertstreamConfig certstream = config.getMonitoring().getSources().getCertstream();
        assertThat(certstream.isEnabled()).isTrue();
        assertThat(certstream.getKeywords()).containsExactly("paypal", "amazon");
        assertThat(certstream.getUrl()).isEqualTo("wss://certstream.calidog.io/");
        assertThat(config.getEnrichment().getHtmlContent().getTimeout()).isEqualTo("3s");
        assertThat(config.getRules().getFaviconSimilarity().getThreshold()).isEqualTo(0.9);
        assertThat(config.getRules().getFaviconSimilarity().getReferenceFavicons())
                .containsEntry("paypal", "https://www.paypal.com/favicon.ico");
        assertThat(config.getEngine().getQueueCapacity()).isEqualTo(10);
        assertThat(config.isDryRun()).isTrue();
    }

    @Test
    @DisplayName("Should fill defaults for omitted sections")
    void shouldApplyDefaults() {
        SentinelConfig config = ConfigLoader.fromString("dryRun: false\n", name -> null);

        assertThat(config.getStorage().getType()).isEqualTo("memory");
        assertThat(config.getLogging().getLevel()).isEqualTo("info");
        assertThat(config.getEnrichment().getHtmlContent().getTimeout()).isEqualTo("10s");
        assertThat(config.getEnrichment().getHtmlContent().getUserAgent()).isEqualTo("BrandSentinel/1.0");
        assertThat(config.getEnrichment().getFavicon().getTimeout()).isEqualTo("5s");
        assertThat(config.getRules().getFaviconSimilarity().getThreshold()).isEqualTo(0.85);
        assertThat(config.getEnforcement().getEmailAbuse().getSmtp().getPort()).isEqualTo(587);
        assertThat(config.getEngine().getQueueCapacity()).isEqualTo(100);
        assertThat(config.getEngine().getStatsInterval()).isEqualTo("30s");
    }

    @Test
    @DisplayName("Should expand environment placeholders, unset ones to empty")
    void shouldExpandEnvironment() {
        Map<String, String> env = Map.of("SMTP_PASSWORD", "s3cret");

        String expanded = ConfigLoader.expandEnvironment(
                "password: ${SMTP_PASSWORD}\nuser: $SMTP_USER\n", env::get);

        assertThat(expanded).isEqualTo("password: s3cret\nuser: \n");
    }

    @Test
    @DisplayName("Should collect every validation error into one failure")
    void shouldCollectValidationErrors() {
        String yaml = String.join("\n",
                "monitoring:",
                "  sources:",
                "    certstream:",
                "      enabled: true",
                "storage:",
                "  type: redis",
                "logging:",
                "  level: verbose",
                "enforcement:",
                "  emailAbuse:",
                "    enabled: true",
                "");

        assertThatThrownBy(() -> ConfigLoader.fromString(yaml, name -> null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid storage type")
                .hasMessageContaining("Invalid log level")
                .hasMessageContaining("at least one non-blank keyword")
                .hasMessageContaining("SMTP host is required");
    }

    @Test
    @DisplayName("Should reject an out-of-range similarity threshold")
    void shouldRejectThreshold() {
        String yaml = "rules:\n  faviconSimilarity:\n    enabled: true\n    threshold: 1.5\n";

        assertThatThrownBy(() -> ConfigLoader.fromString(yaml, name -> null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("threshold");
    }

    @Test
    @DisplayName("Should wrap malformed YAML in IllegalStateException")
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> ConfigLoader.fromString("storage: [unclosed", name -> null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the configuration file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigLoader.fromFile(dir.resolve("missing.yml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should write a loadable sample and refuse to overwrite it")
    void shouldWriteSample(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("brand-sentinel.yml");

        ConfigLoader.writeSample(target);

        assertThat(Files.readString(target)).contains("certstream").contains("faviconSimilarity");
        SentinelConfig config = ConfigLoader.fromFile(target);
        assertThat(config.getMonitoring().getSources().getCertstream().getKeywords()).contains("paypal");
        assertThatThrownBy(() -> ConfigLoader.writeSample(target))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already exists");
    }
}
