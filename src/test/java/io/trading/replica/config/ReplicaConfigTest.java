package io.trading.replica.config;

import io.trading.replica.model.MarketKind;
import io.trading.replica.session.SessionId;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReplicaConfigTest {

    @Test
    void testDefaultsFromEmptyEnvironment() {
        ReplicaConfig config = ReplicaConfig.fromEnv(key -> null);

        assertEquals("replica-0", config.replicaId());
        assertEquals(List.of("BTCUSDT", "ETHUSDT"), config.symbols());
        assertEquals(1000, config.depthLimit());
        assertEquals(100, config.pacingMs());
        assertEquals(10_000, config.snapshotTimeoutMs());
        assertEquals(0, config.publishDepth());
        assertEquals(PublishSinkType.MEMORY, config.publishSink());
        assertEquals("/dev/shm/depth-replica-replica-0", config.aeronDir());
        assertEquals(9090, config.metricsPort());
        assertEquals("https://api.binance.com/api/v3/depth", config.restUrl(MarketKind.SPOT));
        assertEquals("https://dapi.binance.com/dapi/v1/depth", config.restUrl(MarketKind.DERIVATIVE));
    }

    @Test
    void testEnvironmentOverrides() {
        Map<String, String> env = Map.of(
            "REPLICA_ID", "replica-7",
            "SYMBOLS", " btcusdt ; BTCUSD_PERP,,ethusdt",
            "PACING_MS", "0",
            "PUBLISH_SINK", "Aeron",
            "PUBLISH_DEPTH", "20",
            "SPOT_REST_URL", "http://localhost:8080/api/v3/depth"
        );

        ReplicaConfig config = ReplicaConfig.fromEnv(env::get);

        assertEquals("replica-7", config.replicaId());
        assertEquals(List.of("BTCUSDT", "BTCUSD_PERP", "ETHUSDT"), config.symbols());
        assertEquals(0, config.pacingMs());
        assertEquals(PublishSinkType.AERON, config.publishSink());
        assertEquals(20, config.publishDepth());
        assertEquals("/dev/shm/depth-replica-replica-7", config.aeronDir());
        assertEquals("http://localhost:8080/api/v3/depth", config.restUrl(MarketKind.SPOT));
        assertEquals("https://dapi.binance.com/dapi/v1/depth", config.restUrl(MarketKind.DERIVATIVE));
    }

    @Test
    void testInvalidNumberFallsBackToDefault() {
        ReplicaConfig config = ReplicaConfig.fromEnv(Map.of("DEPTH_LIMIT", "lots")::get);

        assertEquals(1000, config.depthLimit());
    }

    @Test
    void testStreamUris() {
        ReplicaConfig config = ReplicaConfig.builder()
            .addSymbol("BTCUSDT")
            .addSymbol("BTCUSD_PERP")
            .build();

        List<SessionId> ids = config.sessionIds();
        assertEquals(URI.create("wss://stream.binance.com:9443/ws/btcusdt@depth"), config.streamUri(ids.get(0)));
        assertEquals(URI.create("wss://dstream.binance.com/stream?streams=btcusd_perp@depth"), config.streamUri(ids.get(1)));
    }

    @Test
    void testStreamUrlOverride() {
        ReplicaConfig config = ReplicaConfig.builder()
            .addSymbol("BTCUSDT")
            .streamUrlTemplate(MarketKind.SPOT, "ws://localhost:9000/ws/%s@depth")
            .build();

        assertEquals(URI.create("ws://localhost:9000/ws/btcusdt@depth"), config.streamUri(SessionId.forSymbol("BTCUSDT")));
        assertThrows(IllegalArgumentException.class, () -> ReplicaConfig.builder()
            .addSymbol("BTCUSDT")
            .streamUrlTemplate(MarketKind.SPOT, "ws://localhost:9000/ws/btcusdt@depth")
            .build());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalStateException.class, () -> ReplicaConfig.builder().build());
        assertThrows(IllegalArgumentException.class, () -> ReplicaConfig.builder().addSymbol("BTCUSDT").depthLimit(0).build());
        assertThrows(IllegalArgumentException.class, () -> ReplicaConfig.builder().addSymbol("BTCUSDT").pacingMs(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ReplicaConfig.builder().addSymbol("BTCUSDT").metricsPort(70000).build());
        assertThrows(IllegalArgumentException.class, () -> ReplicaConfig.builder().addSymbol(" ").build());
        assertThrows(IllegalArgumentException.class, () -> ReplicaConfig.fromEnv(Map.of("PUBLISH_SINK", "kafka")::get));
    }
}
