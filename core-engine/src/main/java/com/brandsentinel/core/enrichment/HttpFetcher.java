package com.brandsentinel.core.enrichment;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Small blocking HTTP GET helper shared by the enrichers and the favicon
 * detector.
 *
 * <p>
 * Redirects are followed. Both the connect and the whole-request timeout are
 * set to the configured timeout. Bodies larger than the configured limit are
 * not buffered; the request fails instead. Thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpFetcher {

    public static final String DEFAULT_USER_AGENT = "BrandSentinel/1.0";

    /** Largest response body read into memory: 2 MiB. */
    public static final int DEFAULT_MAX_BODY_BYTES = 2 * 1024 * 1024;

    private final HttpClient client;
    private final Duration timeout;
    private final String userAgent;
    private final int maxBodyBytes;

    public HttpFetcher(Duration timeout, String userAgent) {
        this(timeout, userAgent, DEFAULT_MAX_BODY_BYTES);
    }

    /**
     * @param timeout      connect and request timeout
     * @param userAgent    User-Agent header; blank means {@link #DEFAULT_USER_AGENT}
     * @param maxBodyBytes largest body accepted; must be positive
     * @throws IllegalArgumentException if {@code maxBodyBytes} is not positive
     */
    public HttpFetcher(Duration timeout, String userAgent, int maxBodyBytes) {
        if (maxBodyBytes < 1) {
            throw new IllegalArgumentException("Max body size must be >= 1, got: " + maxBodyBytes);
        }
        this.timeout = Objects.requireNonNull(timeout, "Timeout must not be null");
        this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
        this.maxBodyBytes = maxBodyBytes;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Build the URL for a domain from a {@code %s} template.
     */
    public static String expand(String urlTemplate, String domain) {
        return String.format(Locale.ROOT, urlTemplate, domain);
    }

    /**
     * Issue a GET request and read the body, up to the size limit.
     *
     * @param url absolute URL
     * @return status and body
     * @throws IOException          on connection, timeout or protocol failure,
     *                              or when the body exceeds the size limit
     * @throws InterruptedException if interrupted while waiting
     */
    public Response get(String url) throws IOException, InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + url, e);
        }
        HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        try (InputStream in = response.body()) {
            byte[] body = in.readNBytes(maxBodyBytes + 1);
            if (body.length > maxBodyBytes) {
                throw new IOException("Response body from " + url + " exceeds " + maxBodyBytes + " bytes");
            }
            return new Response(response.statusCode(), body);
        }
    }

    /**
     * @return lower-case hex SHA-256 of the given bytes
     */
    public static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Status code and raw body of a completed request. */
    public static final class Response {
        private final int status;
        private final byte[] body;

        Response(int status, byte[] body) {
            this.status = status;
            this.body = body != null ? body : new byte[0];
        }

        public int status() {
            return status;
        }

        public byte[] body() {
            return body;
        }

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }

        public String bodyAsString() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }
}
