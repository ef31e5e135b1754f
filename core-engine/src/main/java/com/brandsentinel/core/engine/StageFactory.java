package com.brandsentinel.core.engine;

import com.brandsentinel.core.config.Durations;
import com.brandsentinel.core.config.SentinelConfig;
import com.brandsentinel.core.detection.FaviconSimilarityDetector;
import com.brandsentinel.core.enforcement.EmailAbuseEnforcer;
import com.brandsentinel.core.enforcement.LoggerEnforcer;
import com.brandsentinel.core.enrichment.FaviconEnricher;
import com.brandsentinel.core.enrichment.HtmlContentEnricher;
import com.brandsentinel.core.enrichment.HttpFetcher;
import com.brandsentinel.core.pipeline.Detector;
import com.brandsentinel.core.pipeline.Enforcer;
import com.brandsentinel.core.pipeline.Enricher;
import com.brandsentinel.core.pipeline.Source;
import com.brandsentinel.core.source.CertstreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds the enabled stage variants from a {@link SentinelConfig}.
 *
 * <p>
 * Stage order within each kind is fixed: enrichers run HTML content before
 * favicon, enforcers run the logger before email. A disabled variant is
 * simply absent. This is the single point of extension when adding a new
 * variant.
 * </p>
 *
 * @since 1.0.0
 */
public final class StageFactory {

    private static final Logger LOG = LoggerFactory.getLogger(StageFactory.class);

    private StageFactory() {
        // utility class, not instantiable
    }

    /**
     * @throws IllegalArgumentException if an enabled source is misconfigured
     */
    public static List<Source> createSources(SentinelConfig config) {
        Objects.requireNonNull(config, "Config must not be null");
        List<Source> sources = new ArrayList<>();
        SentinelConfig.CertstreamConfig certstream = config.getMonitoring().getSources().getCertstream();
        if (certstream.isEnabled()) {
            sources.add(new CertstreamSource(certstream.getUrl(), certstream.getKeywords()));
        }
        return created("source", sources);
    }

    public static List<Enricher> createEnrichers(SentinelConfig config) {
        Objects.requireNonNull(config, "Config must not be null");
        List<Enricher> enrichers = new ArrayList<>();
        SentinelConfig.HtmlContentConfig html = config.getEnrichment().getHtmlContent();
        if (html.isEnabled()) {
            HttpFetcher fetcher = new HttpFetcher(Durations.parse(html.getTimeout()), html.getUserAgent());
            enrichers.add(new HtmlContentEnricher(fetcher, html.getUrlTemplate()));
        }
        SentinelConfig.FaviconConfig favicon = config.getEnrichment().getFavicon();
        if (favicon.isEnabled()) {
            HttpFetcher fetcher = new HttpFetcher(Durations.parse(favicon.getTimeout()), html.getUserAgent());
            enrichers.add(new FaviconEnricher(fetcher, favicon.getUrlTemplate()));
        }
        return created("enricher", enrichers);
    }

    public static List<Detector> createDetectors(SentinelConfig config) {
        Objects.requireNonNull(config, "Config must not be null");
        List<Detector> detectors = new ArrayList<>();
        SentinelConfig.FaviconSimilarityConfig similarity = config.getRules().getFaviconSimilarity();
        if (similarity.isEnabled()) {
            SentinelConfig.FaviconConfig favicon = config.getEnrichment().getFavicon();
            HttpFetcher fetcher = new HttpFetcher(Durations.parse(favicon.getTimeout()),
                    config.getEnrichment().getHtmlContent().getUserAgent());
            detectors.add(new FaviconSimilarityDetector(fetcher, similarity.getReferenceFavicons(),
                    similarity.getThreshold()));
            if (!favicon.isEnabled()) {
                LOG.warn("Detector '{}' is enabled but the '{}' enricher is not; it will never fire",
                        FaviconSimilarityDetector.NAME, FaviconEnricher.NAME);
            }
        }
        return created("detector", detectors);
    }

    /**
     * @throws IllegalArgumentException if email enforcement lacks SMTP settings
     */
    public static List<Enforcer> createEnforcers(SentinelConfig config) {
        Objects.requireNonNull(config, "Config must not be null");
        List<Enforcer> enforcers = new ArrayList<>();
        if (config.getEnforcement().getLogger().isEnabled()) {
            enforcers.add(new LoggerEnforcer());
        }
        SentinelConfig.EmailAbuseConfig email = config.getEnforcement().getEmailAbuse();
        if (email.isEnabled()) {
            enforcers.add(new EmailAbuseEnforcer(email));
        }
        return created("enforcer", enforcers);
    }

    private static <T> List<T> created(String kind, List<T> stages) {
        LOG.info("Created {} {}(s)", stages.size(), kind);
        return Collections.unmodifiableList(stages);
    }
}
