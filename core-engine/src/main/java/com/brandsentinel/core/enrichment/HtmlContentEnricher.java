package com.brandsentinel.core.enrichment;

import com.brandsentinel.core.model.Event;
import com.brandsentinel.core.pipeline.Enricher;
import com.brandsentinel.core.pipeline.ShutdownSignal;
import com.brandsentinel.core.pipeline.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches the landing page of the event's domain and records basic facts
 * about it.
 *
 * <p>
 * Adds {@code html_status}, {@code html_length} (bytes) and
 * {@code html_title} (empty if the page has none) to the event data.
 * A non-2xx response or an I/O failure is a {@link StageException}; the
 * event keeps whatever it had before.
 * </p>
 *
 * @since 1.0.0
 */
public class HtmlContentEnricher implements Enricher {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlContentEnricher.class);

    public static final String NAME = "html_content";
    public static final String DEFAULT_URL_TEMPLATE = "https://%s/";

    private static final Pattern TITLE = Pattern.compile("<title[^>]*>(.*?)</title>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final int MAX_TITLE_LENGTH = 200;

    private final HttpFetcher fetcher;
    private final String urlTemplate;

    public HtmlContentEnricher(HttpFetcher fetcher, String urlTemplate) {
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
            throw new StageException("Failed to fetch " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageException("Interrupted while fetching " + url, e);
        }
        if (!response.isSuccess()) {
            throw new StageException("Unexpected HTTP status " + response.status() + " from " + url);
        }

        String title = extractTitle(response.bodyAsString());
        event.putData("html_status", response.status());
        event.putData("html_length", response.body().length);
        event.putData("html_title", title);
        LOG.debug("Enriched {} with HTML content (status={}, title='{}')",
                event.getDomain(), response.status(), title);
    }

    static String extractTitle(String html) {
        Matcher matcher = TITLE.matcher(html);
        if (!matcher.find()) {
            return "";
        }
        String title = matcher.group(1).replaceAll("\\s+", " ").trim();
        return title.length() > MAX_TITLE_LENGTH ? title.substring(0, MAX_TITLE_LENGTH) : title;
    }
}
