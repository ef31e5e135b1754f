package com.brandsentinel.core.detection;

import com.brandsentinel.core.enrichment.FaviconEnricher;
import com.brandsentinel.core.enrichment.HttpFetcher;
import com.brandsentinel.core.model.DetectionResult;
import com.brandsentinel.core.model.EventView;
import com.brandsentinel.core.pipeline.Detector;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import com.brandsentinel.core.pipeline.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flags domains whose favicon is identical to a protected brand's favicon.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Skip events without a {@code favicon_sha256} data entry.</li>
 *   <li>For each keyword in the event's {@code matched_keywords} that has a
 *       reference favicon URL, fingerprint the reference (fetched once and
 *       cached).</li>
 *   <li>Similarity is {@code 1.0} for an identical fingerprint, else
 *       {@code 0.0}. The result is a threat when similarity reaches the
 *       threshold.</li>
 * </ol>
 *
 * <p>
 * A reference that cannot be fetched is skipped for this event and retried
 * on the next one.
 * </p>
 *
 * @since 1.0.0
 */
public class FaviconSimilarityDetector implements Detector {

    private static final Logger LOG = LoggerFactory.getLogger(FaviconSimilarityDetector.class);

    public static final String NAME = "favicon_similarity";
    public static final double DEFAULT_THRESHOLD = 0.85;

    private final HttpFetcher fetcher;
    private final Map<String, String> referenceUrls;
    private final double threshold;
    private final Map<String, String> referenceFingerprints = new ConcurrentHashMap<>();

    /**
     * @param fetcher       HTTP client for reference favicons
     * @param referenceUrls brand keyword to reference favicon URL
     * @param threshold     similarity at or above which a result is a threat
     */
    public FaviconSimilarityDetector(HttpFetcher fetcher, Map<String, String> referenceUrls, double threshold) {
        this.fetcher = Objects.requireNonNull(fetcher, "Fetcher must not be null");
        Objects.requireNonNull(referenceUrls, "Reference URLs must not be null");
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Threshold must be within [0, 1], got: " + threshold);
        }
        this.threshold = threshold;
        Map<String, String> normalized = new LinkedHashMap<>();
        referenceUrls.forEach((brand, url) -> {
            if (brand != null && url != null && !url.isBlank()) {
                normalized.put(brand.toLowerCase(Locale.ROOT), url);
            }
        });
        this.referenceUrls = normalized;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<DetectionResult> detect(ShutdownSignal signal, EventView event) throws StageException {
        Object candidate = event.getData().get(FaviconEnricher.SHA256_KEY);
        if (candidate == null) {
            return List.of();
        }
        String fingerprint = candidate.toString();

        List<DetectionResult> results = new ArrayList<>();
        for (String brand : matchedKeywords(event)) {
            String referenceUrl = referenceUrls.get(brand.toLowerCase(Locale.ROOT));
            if (referenceUrl == null) {
                continue;
            }
            Optional<String> reference = referenceFingerprint(brand, referenceUrl);
            if (reference.isEmpty()) {
                continue;
            }
            double similarity = reference.get().equals(fingerprint) ? 1.0 : 0.0;
            results.add(DetectionResult.builder()
                    .eventId(event.getId())
                    .domain(event.getDomain())
                    .brand(brand)
                    .rule(NAME)
                    .threat(similarity >= threshold)
                    .confidence(similarity)
                    .metadata("favicon_sha256", fingerprint)
                    .metadata("reference_sha256", reference.get())
                    .metadata("threshold", threshold)
                    .build());
        }
        return results;
    }

    private static List<String> matchedKeywords(EventView event) {
        Object raw = event.getMetadata().get("matched_keywords");
        if (!(raw instanceof Collection)) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>();
        for (Object keyword : (Collection<?>) raw) {
            if (keyword != null) {
                keywords.add(keyword.toString());
            }
        }
        return keywords;
    }

    private Optional<String> referenceFingerprint(String brand, String url) throws StageException {
        String cached = referenceFingerprints.get(url);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            HttpFetcher.Response response = fetcher.get(url);
            if (!response.isSuccess() || response.body().length == 0) {
                LOG.warn("Reference favicon for '{}' unavailable (HTTP {})", brand, response.status());
                return Optional.empty();
            }
            String fingerprint = HttpFetcher.sha256Hex(response.body());
            referenceFingerprints.put(url, fingerprint);
            LOG.info("Cached reference favicon for '{}': {}", brand, fingerprint);
            return Optional.of(fingerprint);
        } catch (IOException e) {
            LOG.warn("Failed to fetch reference favicon for '{}': {}", brand, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageException("Interrupted while fetching reference favicon for " + brand, e);
        }
    }

    public double getThreshold() {
        return threshold;
    }
}
