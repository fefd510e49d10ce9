package io.trading.replica.core;

import io.trading.replica.config.ReplicaConfig;
import io.trading.replica.session.SessionId;
import io.trading.replica.session.SessionState;
import io.trading.replica.session.StreamSession;
import io.trading.replica.transport.RestClient;
import io.trading.replica.transport.RestResponse;
import io.trading.replica.transport.StreamConnection;
import io.trading.replica.transport.StreamTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wires the controller with scripted transports; the HTTP server is never started.
 */
class ReplicaControllerTest {

    private static final String SNAPSHOT = "{\"lastUpdateId\":10,\"bids\":[[\"100.0\",\"2\"]],\"asks\":[[\"101.0\",\"3\"]]}";

    private final List<URI> connected = new CopyOnWriteArrayList<>();
    private final List<URI> snapshotRequests = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<String>> idleReceives = new CopyOnWriteArrayList<>();
    private ReplicaController controller;

    /**
     * Replays one depth update for the connected symbol, then waits forever.
     */
    private class ScriptedConnection implements StreamConnection {
        private final Queue<String> frames = new ArrayDeque<>();

        ScriptedConnection(SessionId id) {
            String update = "{\"e\":\"depthUpdate\",\"E\":1704067200000,\"s\":\"" + id.symbol() + "\","
                + "\"b\":[[\"100.0\",\"0\"],[\"99.5\",\"4\"]],\"a\":[[\"101.0\",\"0\"],[\"102.0\",\"1\"]]}";
            if (id.kind().isEnveloped()) {
                update = "{\"stream\":\"" + id.symbol().toLowerCase() + "@depth\",\"data\":" + update + "}";
            }
            frames.add(update);
        }

        @Override
        public synchronized CompletableFuture<String> receive() {
            String frame = frames.poll();
            if (frame != null) {
                return CompletableFuture.completedFuture(frame);
            }
            CompletableFuture<String> idle = new CompletableFuture<>();
            idleReceives.add(idle);
            return idle;
        }

        @Override
        public boolean isOpen() {
            return true;
        }

        @Override
        public void close() {
        }
    }

    private final StreamTransport transport = new StreamTransport() {
        @Override
        public CompletableFuture<StreamConnection> connect(URI uri, String name) {
            connected.add(uri);
            String symbol = name.startsWith("depth_perp_")
                ? name.substring("depth_perp_".length())
                : name.substring("depth_".length());
            SessionId id = SessionId.forSymbol(symbol);
            return CompletableFuture.completedFuture(new ScriptedConnection(id));
        }

        @Override
        public void close() {
        }
    };

    private final RestClient restClient = new RestClient() {
        @Override
        public RestResponse get(URI uri) {
            snapshotRequests.add(uri);
            return new RestResponse(200, SNAPSHOT);
        }

        @Override
        public void close() {
        }
    };

    @AfterEach
    void tearDown() {
        if (controller != null) {
            controller.close();
        }
    }

    @Test
    void testSessionsReplicateAndPublish() throws Exception {
        ReplicaConfig config = ReplicaConfig.builder()
            .addSymbol("BTCUSDT")
            .addSymbol("btcusdt")
            .addSymbol("BTCUSD_PERP")
            .pacingMs(0)
            .build();
        controller = new ReplicaController(config, transport, restClient);

        List<Boolean> started = config.sessionIds().stream().map(controller::startSession).toList();

        assertEquals(List.of(true, false, true), started);
        awaitPublished("BTCUSDT");
        awaitPublished("BTCUSD_PERP");

        assertEquals(2, connected.size());
        assertEquals(2, snapshotRequests.size());
        assertTrue(snapshotRequests.contains(URI.create("https://dapi.binance.com/dapi/v1/depth?symbol=BTCUSD_PERP&limit=1000")));
        assertEquals(2, controller.getRegistry().openSessionIds().size());
        assertEquals(1.0, controller.getMetrics().getSnapshotFetches(SessionId.forSymbol("BTCUSDT")));
    }

    @Test
    void testShutdownClosesEverySession() throws Exception {
        ReplicaConfig config = ReplicaConfig.builder()
            .addSymbol("BTCUSDT")
            .addSymbol("ETHUSDT")
            .pacingMs(0)
            .build();
        controller = new ReplicaController(config, transport, restClient);
        config.sessionIds().forEach(controller::startSession);
        awaitPublished("BTCUSDT");
        awaitPublished("ETHUSDT");

        controller.shutdown();

        for (StreamSession session : controller.getSessions()) {
            assertEquals(SessionState.CLOSED, session.terminationFuture().get(5, TimeUnit.SECONDS));
        }
        assertTrue(controller.getRegistry().isShutdown());
        assertTrue(controller.getRegistry().openSessionIds().isEmpty());
        assertTrue(idleReceives.stream().allMatch(CompletableFuture::isCancelled));
        controller = null;
    }

    @Test
    void testSessionStillConnectingIsNotHealthy() throws Exception {
        CompletableFuture<StreamConnection> handshake = new CompletableFuture<>();
        StreamTransport slowTransport = new StreamTransport() {
            @Override
            public CompletableFuture<StreamConnection> connect(URI uri, String name) {
                return handshake;
            }

            @Override
            public void close() {
            }
        };
        ReplicaConfig config = ReplicaConfig.builder()
            .addSymbol("BTCUSDT")
            .pacingMs(0)
            .build();
        controller = new ReplicaController(config, slowTransport, restClient);
        SessionId id = SessionId.forSymbol("BTCUSDT");

        assertTrue(controller.startSession(id));

        assertTrue(controller.getRegistry().isOpen(id));
        assertEquals(SessionState.CONNECTING, controller.getSessions().iterator().next().state());
        assertFalse(controller.getHealthMonitor().isHealthy());

        handshake.complete(transport.connect(URI.create("wss://stream.test/ws/btcusdt@depth"), id.value()).join());
        awaitPublished("BTCUSDT");
        assertTrue(controller.getHealthMonitor().isHealthy());
    }

    private void awaitPublished(String symbol) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (controller.getBooks().latest(symbol).isEmpty()) {
            if (System.nanoTime() > deadline) {
                fail("No book published for " + symbol);
            }
            Thread.sleep(10);
        }
    }
}
