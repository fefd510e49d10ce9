package io.trading.replica.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.replica.config.ReplicaConfig;
import io.trading.replica.core.HealthMonitor;
import io.trading.replica.publish.InMemoryPublishSink;
import io.trading.replica.session.SessionId;
import io.trading.replica.session.SessionState;
import io.trading.replica.session.StreamSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * HTTP server for exposing Prometheus metrics and REST API.
 * Serves metrics, health, status, config and latest book endpoints.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    static final String BOOKS_PATH = "/api/books/";

    private final int port;
    private final ReplicaMetrics metrics;
    private final ReplicaConfig config;
    private final HealthMonitor healthMonitor;
    private final Supplier<Collection<StreamSession>> sessions;
    private final InMemoryPublishSink books;
    private final CollectorRegistry registry;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    public MetricsServer(
        int port,
        ReplicaMetrics metrics,
        ReplicaConfig config,
        HealthMonitor healthMonitor,
        Supplier<Collection<StreamSession>> sessions,
        InMemoryPublishSink books
    ) {
        this.port = port;
        this.metrics = metrics;
        this.config = config;
        this.healthMonitor = healthMonitor;
        this.sessions = sessions;
        this.books = books;
        this.registry = metrics.getRegistry();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        // Metrics endpoint (Prometheus)
        server.createContext("/metrics", handleMetrics());

        // Health endpoint (simple)
        server.createContext("/health", handleHealthSimple());

        // REST API endpoints
        server.createContext("/api/status", handleStatus());
        server.createContext("/api/health", handleHealth());
        server.createContext("/api/config", handleConfig());
        server.createContext(BOOKS_PATH, handleBook());

        server.setExecutor(null);
        server.start();

        LOGGER.info("HTTP server started on port {}", getPort());
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", port);
        LOGGER.info("  Health:     http://localhost:{}/health", port);
        LOGGER.info("  API Status: http://localhost:{}/api/status", port);
        LOGGER.info("  API Health: http://localhost:{}/api/health", port);
        LOGGER.info("  API Config: http://localhost:{}/api/config", port);
        LOGGER.info("  API Books:  http://localhost:{}{}<SYMBOL>", port, BOOKS_PATH);
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                send(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString().getBytes(StandardCharsets.UTF_8));
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleHealthSimple() {
        return exchange -> {
            try {
                send(exchange, 200, "text/plain", "OK".getBytes(StandardCharsets.UTF_8));
            } catch (Exception e) {
                LOGGER.error("Error serving health", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                List<SessionStatusInfo> sessionInfos = new ArrayList<>();
                for (StreamSession session : sessions.get()) {
                    SessionId id = session.id();
                    sessionInfos.add(new SessionStatusInfo(
                        id.value(),
                        id.symbol(),
                        id.kind().name(),
                        session.state().name(),
                        session.streamUri().toString(),
                        (long) metrics.getFramesReceived(id),
                        (long) metrics.getDeltasApplied(id),
                        (long) metrics.getSnapshotFetches(id),
                        session.failure().map(Throwable::toString).orElse(null)
                    ));
                }

                StatusResponse statusResponse = new StatusResponse(
                    config.replicaId(),
                    System.currentTimeMillis() - startTime,
                    sessionInfos,
                    new ArrayList<>(books.symbols())
                );

                sendJsonResponse(exchange, 200, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(statusResponse));
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                List<String> down = new ArrayList<>();
                for (StreamSession session : sessions.get()) {
                    if (session.state() != SessionState.OPEN) {
                        down.add(session.id().value());
                    }
                }
                boolean healthy = healthMonitor.isHealthy();
                String message = healthy ? "All sessions open" : "Sessions not open: " + down;

                HealthResponse health = new HealthResponse(healthy, message);
                sendJsonResponse(exchange, healthy ? 200 : 503, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(health));
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleConfig() {
        return exchange -> {
            try {
                ConfigInfo configInfo = new ConfigInfo(
                    config.replicaId(),
                    config.symbols(),
                    config.depthLimit(),
                    config.pacingMs(),
                    config.snapshotTimeoutMs(),
                    config.publishDepth(),
                    config.publishSink().name(),
                    config.aeronDir(),
                    config.metricsPort(),
                    config.healthCheckMs()
                );

                sendJsonResponse(exchange, 200, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(configInfo));
            } catch (Exception e) {
                LOGGER.error("Error handling config request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleBook() {
        return exchange -> {
            try {
                String symbol = symbolFromPath(exchange.getRequestURI().getPath());
                Optional<byte[]> payload = symbol.isEmpty() ? Optional.empty() : books.latest(symbol);
                if (payload.isPresent()) {
                    send(exchange, 200, "application/json", payload.get());
                } else {
                    ErrorResponse error = new ErrorResponse("No book published for '" + symbol + "'");
                    sendJsonResponse(exchange, 404, objectMapper.writeValueAsString(error));
                }
            } catch (Exception e) {
                LOGGER.error("Error handling book request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    static String symbolFromPath(String path) {
        if (path == null || !path.startsWith(BOOKS_PATH)) {
            return "";
        }
        String symbol = path.substring(BOOKS_PATH.length());
        int slash = symbol.indexOf('/');
        if (slash >= 0) {
            symbol = symbol.substring(0, slash);
        }
        return symbol.toUpperCase(Locale.ROOT);
    }

    private void sendJsonResponse(HttpExchange exchange, int statusCode, String response) throws IOException {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        send(exchange, statusCode, "application/json", response.getBytes(StandardCharsets.UTF_8));
    }

    private void send(HttpExchange exchange, int statusCode, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }

    private record StatusResponse(String replicaId, long uptimeMs, List<SessionStatusInfo> sessions, List<String> publishedSymbols) {}
    private record SessionStatusInfo(String id, String symbol, String market, String state, String streamUri,
                                     long framesReceived, long deltasApplied, long snapshotFetches, String failure) {}
    private record ErrorResponse(String error) {}
    private record HealthResponse(boolean healthy, String message) {}
    private record ConfigInfo(String replicaId, List<String> symbols, int depthLimit, int pacingMs, int snapshotTimeoutMs,
                              int publishDepth, String publishSink, String aeronDir, int metricsPort, int healthCheckMs) {}
}
