package com.brandsentinel.core.enrichment;

import com.brandsentinel.core.model.Event;
import com.brandsentinel.core.pipeline.Enricher;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import com.brandsentinel.core.pipeline.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Downloads the domain's favicon and records its SHA-256 fingerprint as
 * {@code favicon_sha256} along with {@code favicon_size}.
 */
public class FaviconEnricher implements Enricher {

    private static final Logger LOG = LoggerFactory.getLogger(FaviconEnricher.class);

    public static final String NAME = "favicon";
    public static final String DEFAULT_URL_TEMPLATE = "https://%s/favicon.ico";

    public static final String SHA256_KEY = "favicon_sha256";
    public static final String SIZE_KEY = "favicon_size";

    private final HttpFetcher fetcher;
    private final String urlTemplate;

    public FaviconEnricher(HttpFetcher fetcher, String urlTemplate) {
        this.fetcher = Objects.requireNonNull(fetcher, "Fetcher must not be null");
        this.urlTemplate = urlTemplate == null || urlTemplate.isBlank() ? DEFAULT_URL_TEMPLATE : urlTemplate;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void enrich(ShutdownSignal signal, Event event) throws StageException {
        String url = HttpFetcher.expand(urlTemplate, event.getDomain());
        HttpFetcher.Response response;
        try {
            response = fetcher.get(url);
        } catch (IOException e) {
            throw new StageException("Failed to fetch favicon " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageException("Interrupted while fetching favicon " + url, e);
        }
        if (!response.isSuccess()) {
            throw new StageException("Unexpected HTTP status " + response.status() + " from " + url);
        }
        if (response.body().length == 0) {
            throw new StageException("Empty favicon at " + url);
        }

        String fingerprint = HttpFetcher.sha256Hex(response.body());
        event.putData(SHA256_KEY, fingerprint);
        event.putData(SIZE_KEY, response.body().length);
        LOG.debug("Favicon for {}: {} ({} bytes)", event.getDomain(), fingerprint, response.body().length);
    }
}
