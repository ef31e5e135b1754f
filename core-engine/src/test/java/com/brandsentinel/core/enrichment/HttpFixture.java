package com.brandsentinel.core.enrichment;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Local HTTP server serving canned responses by path, for enricher and
 * detector tests.
 */
public final class HttpFixture implements AutoCloseable {

    private final HttpServer server;
    private final Map<String, byte[]> bodies = new ConcurrentHashMap<>();
    private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
    private final AtomicInteger requests = new AtomicInteger();

    public HttpFixture() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            requests.incrementAndGet();
            String path = exchange.getRequestURI().getPath();
            byte[] body = bodies.getOrDefault(path, new byte[0]);
            int status = statuses.getOrDefault(path, bodies.containsKey(path) ? 200 : 404);
            exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
    }

    public HttpFixture serve(String path, byte[] body) {
        bodies.put(path, body);
        return this;
    }

    public HttpFixture serve(String path, int status, byte[] body) {
        statuses.put(path, status);
        bodies.put(path, body);
        return this;
    }

    /** @return URL template whose {@code %s} becomes the first path segment */
    public String template(String suffix) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/%s" + suffix;
    }

    public String url(String path) {
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    public int requestCount() {
        return requests.get();
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
