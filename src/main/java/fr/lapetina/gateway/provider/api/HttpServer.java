package fr.lapetina.gateway.provider.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.gateway.provider.api.Authenticator.Credentials;
import fr.lapetina.gateway.provider.api.dto.ApiError;
import fr.lapetina.gateway.provider.domain.exception.AuthenticationException;
import fr.lapetina.gateway.provider.domain.exception.ProviderException;
import fr.lapetina.gateway.provider.domain.model.ConfigBundle;
import fr.lapetina.gateway.provider.domain.model.ProviderIndex;
import fr.lapetina.gateway.provider.domain.model.Resolution;
import fr.lapetina.gateway.provider.engine.ConfigurationEngine;
import fr.lapetina.gateway.provider.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /                       - Service banner
 * - GET /api/v1/healthz         - Health check
 * - GET /api/v1/config          - Bundle matching the request metadata (ETag aware)
 * - GET /api/v1/config/stats    - Provider statistics
 * - GET|POST /api/v1/config/reload - Reload every configuration
 * - GET /metrics                - Prometheus metrics endpoint
 *
 * Every /api/v1/config endpoint authenticates against the source the request
 * metadata resolves to.
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String SERVICE_NAME = "config-provider";
    static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final String CONFIG_PATH = "/api/v1/config";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final ConfigurationEngine engine;
    private final MetadataExtractor metadataExtractor;
    private final Authenticator authenticator;
    private final MetricsRegistry metricsRegistry;
    private final long cacheMaxAgeSeconds;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int workerThreads,
            ConfigurationEngine engine,
            MetadataExtractor metadataExtractor,
            Authenticator authenticator,
            MetricsRegistry metricsRegistry,
            Duration cacheTtl,
            boolean exposeMetrics
    ) throws IOException {
        this.engine = engine;
        this.metadataExtractor = metadataExtractor;
        this.authenticator = authenticator;
        this.metricsRegistry = metricsRegistry;
        this.cacheMaxAgeSeconds = cacheTtl.toSeconds();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "http-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        // Register handlers
        server.createContext("/", new RootHandler());
        server.createContext("/api/v1/healthz", new HealthHandler());
        server.createContext(CONFIG_PATH, new ConfigHandler());
        if (exposeMetrics) {
            server.createContext("/metrics", new MetricsHandler());
        }

        log.info("HTTP server configured on {}:{}", host, getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * The bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== ROOT HANDLER ====================

    private class RootHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"/".equals(exchange.getRequestURI().getPath())) {
                sendError(exchange, "root", 404, "Not Found", null);
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, "root", 405, "Method Not Allowed", null);
                return;
            }
            sendJson(exchange, "root", 200, Map.of("service", SERVICE_NAME));
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, "healthz", 405, "Method Not Allowed", null);
                return;
            }

            ProviderIndex index = engine.currentIndex();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "healthy");
            health.put("service", SERVICE_NAME);
            health.put("configsLoaded", index.size());
            health.put("generation", index.getGeneration());
            sendJson(exchange, "healthz", 200, health);
        }
    }

    // ==================== CONFIG HANDLER ====================

    private class ConfigHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = exchange.getRequestHeaders().getFirst(REQUEST_ID_HEADER);
            if (requestId == null || requestId.isBlank()) {
                requestId = UUID.randomUUID().toString();
            }
            MDC.put("requestId", requestId);
            exchange.getResponseHeaders().set(REQUEST_ID_HEADER, requestId);

            String path = exchange.getRequestURI().getPath();
            if (path.length() > CONFIG_PATH.length() && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            String method = exchange.getRequestMethod();
            String endpoint = "config";

            try {
                if (path.equals(CONFIG_PATH)) {
                    if (!"GET".equalsIgnoreCase(method)) {
                        sendError(exchange, endpoint, 405, "Method Not Allowed", null);
                        return;
                    }
                    handleGetConfig(exchange);
                } else if (path.equals(CONFIG_PATH + "/stats")) {
                    endpoint = "stats";
                    if (!"GET".equalsIgnoreCase(method)) {
                        sendError(exchange, endpoint, 405, "Method Not Allowed", null);
                        return;
                    }
                    resolveAndAuthenticate(exchange);
                    sendJson(exchange, endpoint, 200, engine.stats());
                } else if (path.equals(CONFIG_PATH + "/reload")) {
                    endpoint = "reload";
                    if (!"GET".equalsIgnoreCase(method) && !"POST".equalsIgnoreCase(method)) {
                        sendError(exchange, endpoint, 405, "Method Not Allowed", null);
                        return;
                    }
                    handleReload(exchange);
                } else {
                    sendError(exchange, "unknown", 404, "Not Found", null);
                }
            } catch (ProviderException e) {
                handleProviderError(exchange, endpoint, e);
            } catch (Exception e) {
                log.error("Error handling {} {}", method, path, e);
                sendError(exchange, endpoint, 500, "Internal server error", e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        private void handleGetConfig(HttpExchange exchange) throws IOException {
            Resolution resolution = resolveAndAuthenticate(exchange);
            ConfigBundle bundle = resolution.bundle();

            String etag = "\"" + bundle.fingerprint() + "\"";
            exchange.getResponseHeaders().set("ETag", etag);
            exchange.getResponseHeaders().set("Cache-Control", "private, max-age=" + cacheMaxAgeSeconds);

            if (EntityTags.matches(exchange.getRequestHeaders().getFirst("If-None-Match"), bundle.fingerprint())) {
                metricsRegistry.incrementRequestCount("config", 304);
                exchange.sendResponseHeaders(304, -1);
                exchange.close();
                return;
            }

            sendJson(exchange, "config", 200, bundle);
        }

        private void handleReload(HttpExchange exchange) throws IOException {
            resolveAndAuthenticate(exchange);
            try {
                ProviderIndex index = engine.reload();
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("status", "reloaded");
                body.put("timestamp", index.getLastReloadAt());
                body.put("generation", index.getGeneration());
                sendJson(exchange, "reload", 200, body);
            } catch (ProviderException e) {
                sendError(exchange, "reload", 500, "Reload failed", e.getMessage());
            }
        }

        private Resolution resolveAndAuthenticate(HttpExchange exchange) {
            Map<String, String> metadata = metadataExtractor.extract(
                    exchange.getRequestURI().getRawQuery(), exchange.getRequestHeaders());
            Resolution resolution = engine.resolve(metadata);

            Credentials credentials = Credentials.fromHeaders(exchange.getRequestHeaders());
            if (!authenticator.isAllowed(resolution.source().getAuthRequirement(), credentials)) {
                metricsRegistry.incrementAuthFailures();
                log.warn("Authentication failed for config {}", resolution.source().getId());
                if (resolution.source().getAuthRequirement().hasBasicAuth()) {
                    exchange.getResponseHeaders().set("WWW-Authenticate", "Basic realm=\"" + SERVICE_NAME + "\"");
                }
                throw new AuthenticationException(resolution.source().getId());
            }
            return resolution;
        }

        private void handleProviderError(HttpExchange exchange, String endpoint, ProviderException e) throws IOException {
            switch (e.getErrorType()) {
                case NOT_FOUND -> sendError(exchange, endpoint, 404, "Config not found", e.getMessage());
                case UNAUTHORIZED -> sendError(exchange, endpoint, 401, "Unauthorized", e.getMessage());
                case INTERNAL_ERROR -> {
                    log.error("Index inconsistency: {}", e.getMessage(), e);
                    sendError(exchange, endpoint, 500, "Internal server error", null);
                }
                default -> sendError(exchange, endpoint, 500, "Internal server error", e.getMessage());
            }
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, "metrics", 405, "Method Not Allowed", null);
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, String endpoint, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        metricsRegistry.incrementRequestCount(endpoint, statusCode);
    }

    private void sendError(HttpExchange exchange, String endpoint, int statusCode, String message, String details)
            throws IOException {
        sendJson(exchange, endpoint, statusCode, new ApiError(message, details));
    }
}
