package io.trading.replica.snapshot;

import io.trading.replica.model.DepthSnapshot;
import io.trading.replica.model.MarketKind;
import io.trading.replica.transport.RestClient;
import io.trading.replica.transport.RestResponse;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BinanceSnapshotFetcherTest {

    private static final String SNAPSHOT = "{\"lastUpdateId\":42,\"bids\":[[\"100.0\",\"2\"]],\"asks\":[[\"101.0\",\"3\"]]}";

    /**
     * Returns a canned response and records the requested URIs.
     */
    private static class StubRestClient implements RestClient {
        private final List<URI> requests = new ArrayList<>();
        private final RestResponse response;
        private final IOException failure;

        StubRestClient(RestResponse response) {
            this.response = response;
            this.failure = null;
        }

        StubRestClient(IOException failure) {
            this.response = null;
            this.failure = failure;
        }

        @Override
        public RestResponse get(URI uri) throws IOException {
            requests.add(uri);
            if (failure != null) {
                throw failure;
            }
            return response;
        }

        @Override
        public void close() {
        }
    }

    @Test
    void testFetchSpotSnapshot() {
        StubRestClient client = new StubRestClient(new RestResponse(200, SNAPSHOT));
        BinanceSnapshotFetcher fetcher = new BinanceSnapshotFetcher(client);

        DepthSnapshot snapshot = fetcher.fetch("BTCUSDT", MarketKind.SPOT, 1000);

        assertEquals(42, snapshot.lastUpdateId());
        assertEquals(1, snapshot.bids().size());
        assertEquals(URI.create("https://api.binance.com/api/v3/depth?symbol=BTCUSDT&limit=1000"), client.requests.get(0));
    }

    @Test
    void testFetchDerivativeSnapshotUsesDerivativeEndpoint() {
        StubRestClient client = new StubRestClient(new RestResponse(200, SNAPSHOT));
        BinanceSnapshotFetcher fetcher = new BinanceSnapshotFetcher(client);

        fetcher.fetch("BTCUSD_PERP", MarketKind.DERIVATIVE, 500);

        assertEquals(URI.create("https://dapi.binance.com/dapi/v1/depth?symbol=BTCUSD_PERP&limit=500"), client.requests.get(0));
    }

    @Test
    void testNonSuccessStatusFails() {
        String body = "{\"code\":-1121,\"msg\":\"Invalid symbol.\"}";
        BinanceSnapshotFetcher fetcher = new BinanceSnapshotFetcher(new StubRestClient(new RestResponse(400, body)));

        SnapshotFetchException error = assertThrows(SnapshotFetchException.class,
            () -> fetcher.fetch("NOPE", MarketKind.SPOT, 1000));

        assertEquals(400, error.getStatusCode());
        assertEquals(body, error.getResponseBody());
        assertTrue(error.getMessage().contains("Invalid symbol."));
    }

    @Test
    void testTransportFailureFails() {
        IOException cause = new IOException("connect timed out");
        BinanceSnapshotFetcher fetcher = new BinanceSnapshotFetcher(new StubRestClient(cause));

        SnapshotFetchException error = assertThrows(SnapshotFetchException.class,
            () -> fetcher.fetch("BTCUSDT", MarketKind.SPOT, 1000));

        assertEquals(SnapshotFetchException.NO_STATUS, error.getStatusCode());
        assertSame(cause, error.getCause());
    }

    @Test
    void testMissingEndpointIsRejected() {
        StubRestClient client = new StubRestClient(new RestResponse(200, SNAPSHOT));

        assertThrows(IllegalArgumentException.class,
            () -> new BinanceSnapshotFetcher(client, Map.of(MarketKind.SPOT, "http://localhost/depth")));
        assertThrows(IllegalArgumentException.class,
            () -> new BinanceSnapshotFetcher(client).fetch("BTCUSDT", MarketKind.SPOT, 0));
    }
}
