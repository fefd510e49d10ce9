package io.trading.replica.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.replica.config.ReplicaConfig;
import io.trading.replica.core.HealthMonitor;
import io.trading.replica.netty.NettyRestClient;
import io.trading.replica.publish.InMemoryPublishSink;
import io.trading.replica.session.SessionContext;
import io.trading.replica.session.SessionId;
import io.trading.replica.session.StreamSession;
import io.trading.replica.transport.RestResponse;
import io.trading.replica.transport.StreamConnection;
import io.trading.replica.transport.StreamTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicBoolean btcOpen = new AtomicBoolean(true);
    private final SessionId btc = SessionId.forSymbol("BTCUSDT");

    private ScheduledExecutorService dispatcher;
    private InMemoryPublishSink books;
    private HealthMonitor healthMonitor;
    private MetricsServer server;
    private NettyRestClient client;

    @BeforeEach
    void setUp() throws IOException {
        dispatcher = Executors.newSingleThreadScheduledExecutor();
        ReplicaMetrics metrics = new ReplicaMetrics();
        ReplicaConfig config = ReplicaConfig.builder()
            .replicaId("replica-test")
            .addSymbol("BTCUSDT")
            .build();

        // Never started, so it reports CREATED
        StreamSession session = new StreamSession(btc, config.streamUri(btc), new SessionContext(
            new IdleTransport(),
            (symbol, kind, depthLimit) -> {
                throw new AssertionError("no snapshot expected");
            },
            (id, frame, book) -> { },
            dispatcher,
            metrics,
            config.depthLimit(),
            config.pacingMs()
        ));

        books = new InMemoryPublishSink();
        healthMonitor = new HealthMonitor(60_000);
        healthMonitor.registerSession(btc, new HealthMonitor.SessionChecker() {
            @Override
            public boolean isOpen() {
                return btcOpen.get();
            }

            @Override
            public long getFrameCount() {
                return 0;
            }
        });

        server = new MetricsServer(0, metrics, config, healthMonitor, () -> List.of(session), books);
        server.start();
        client = new NettyRestClient(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.close();
        healthMonitor.close();
        dispatcher.shutdownNow();
    }

    private RestResponse get(String path) throws IOException {
        return client.get(URI.create("http://127.0.0.1:" + server.getPort() + path));
    }

    @Test
    void testBookEndpointReturnsLatestPayload() throws IOException {
        books.publish("BTCUSDT", "{\"symbol\":\"BTCUSDT\",\"spread\":2.5}".getBytes(StandardCharsets.UTF_8));

        RestResponse response = get("/api/books/btcusdt");

        assertEquals(200, response.statusCode());
        assertEquals("{\"symbol\":\"BTCUSDT\",\"spread\":2.5}", response.body());
    }

    @Test
    void testBookEndpointReturnsNotFoundAsValidJson() throws IOException {
        RestResponse missing = get("/api/books/ETHUSDT");
        assertEquals(404, missing.statusCode());
        assertEquals("No book published for 'ETHUSDT'", objectMapper.readTree(missing.body()).get("error").asText());

        RestResponse quoted = get("/api/books/a%22b");
        assertEquals(404, quoted.statusCode());
        assertEquals("No book published for 'A\"B'", objectMapper.readTree(quoted.body()).get("error").asText());
    }

    @Test
    void testHealthReportsSessionsNotOpen() throws IOException {
        RestResponse healthy = get("/api/health");
        assertEquals(200, healthy.statusCode());
        assertTrue(objectMapper.readTree(healthy.body()).get("healthy").asBoolean());

        btcOpen.set(false);
        RestResponse unhealthy = get("/api/health");

        assertEquals(503, unhealthy.statusCode());
        JsonNode body = objectMapper.readTree(unhealthy.body());
        assertFalse(body.get("healthy").asBoolean());
        assertTrue(body.get("message").asText().contains("depth_btcusdt"));
    }

    @Test
    void testStatusListsSessionsAndPublishedSymbols() throws IOException {
        books.publish("BTCUSDT", "{}".getBytes(StandardCharsets.UTF_8));

        RestResponse response = get("/api/status");

        assertEquals(200, response.statusCode());
        JsonNode status = objectMapper.readTree(response.body());
        assertEquals("replica-test", status.get("replicaId").asText());
        JsonNode session = status.get("sessions").get(0);
        assertEquals("depth_btcusdt", session.get("id").asText());
        assertEquals("SPOT", session.get("market").asText());
        assertEquals("CREATED", session.get("state").asText());
        assertEquals("wss://stream.binance.com:9443/ws/btcusdt@depth", session.get("streamUri").asText());
        assertEquals("BTCUSDT", status.get("publishedSymbols").get(0).asText());
    }

    @Test
    void testPrometheusEndpoint() throws IOException {
        RestResponse response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("replica_publish_failures_total"));
    }

    @Test
    void testSymbolFromPath() {
        assertEquals("BTCUSDT", MetricsServer.symbolFromPath("/api/books/btcusdt"));
        assertEquals("BTCUSD_PERP", MetricsServer.symbolFromPath("/api/books/BTCUSD_PERP/"));
        assertEquals("", MetricsServer.symbolFromPath("/api/books/"));
        assertEquals("", MetricsServer.symbolFromPath("/api/status"));
    }

    private static final class IdleTransport implements StreamTransport {
        @Override
        public CompletableFuture<StreamConnection> connect(URI uri, String name) {
            return new CompletableFuture<>();
        }

        @Override
        public void close() {
        }
    }
}
