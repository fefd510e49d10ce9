package io.trading.replica.netty;

import com.sun.net.httpserver.HttpServer;
import io.trading.replica.transport.RestResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client against a local HTTP server.
 */
class NettyRestClientTest {

    private static final String SNAPSHOT = "{\"lastUpdateId\":1,\"bids\":[],\"asks\":[]}";

    private HttpServer server;
    private NettyRestClient client;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v3/depth", exchange -> {
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            byte[] body = SNAPSHOT.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.createContext("/missing", exchange -> {
            byte[] body = "{\"code\":-1121}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(400, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        client = new NettyRestClient(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.stop(0);
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + pathAndQuery);
    }

    @Test
    void testGetReturnsStatusAndBody() throws IOException {
        RestResponse response = client.get(uri("/api/v3/depth?symbol=BTCUSDT&limit=1000"));

        assertEquals(200, response.statusCode());
        assertTrue(response.isSuccess());
        assertEquals(SNAPSHOT, response.body());
        assertEquals("symbol=BTCUSDT&limit=1000", lastQuery.get());
    }

    @Test
    void testErrorStatusIsReturnedNotThrown() throws IOException {
        RestResponse response = client.get(uri("/missing"));

        assertEquals(400, response.statusCode());
        assertFalse(response.isSuccess());
        assertEquals("{\"code\":-1121}", response.body());
    }

    @Test
    void testConnectionRefusedFails() {
        int port = server.getAddress().getPort();
        server.stop(0);

        assertThrows(IOException.class, () -> client.get(URI.create("http://127.0.0.1:" + port + "/api/v3/depth")));
    }

    @Test
    void testSchemeDefaults() {
        assertTrue(NettySslContexts.isSecure(URI.create("wss://stream.binance.com:9443/ws/btcusdt@depth")));
        assertFalse(NettySslContexts.isSecure(URI.create("http://localhost/depth")));
        assertEquals(9443, NettySslContexts.port(URI.create("wss://stream.binance.com:9443/ws")));
        assertEquals(443, NettySslContexts.port(URI.create("https://api.binance.com/api/v3/depth")));
        assertEquals(80, NettySslContexts.port(URI.create("ws://localhost/ws")));
    }
}
