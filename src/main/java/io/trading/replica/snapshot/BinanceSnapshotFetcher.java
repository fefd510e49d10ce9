package io.trading.replica.snapshot;

import io.trading.replica.model.DepthSnapshot;
import io.trading.replica.model.MarketKind;
import io.trading.replica.transport.RestClient;
import io.trading.replica.transport.RestResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fetches depth snapshots from the Binance REST API.
 * Spot: GET /api/v3/depth, coin-margined derivatives: GET /dapi/v1/depth.
 */
public class BinanceSnapshotFetcher implements SnapshotFetcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceSnapshotFetcher.class);

    private final RestClient restClient;
    private final Map<MarketKind, String> restUrls;
    private final DepthSnapshotParser parser = new DepthSnapshotParser();

    /**
     * Creates a fetcher against the production endpoints.
     */
    public BinanceSnapshotFetcher(RestClient restClient) {
        this(restClient, defaultUrls());
    }

    /**
     * Creates a fetcher with explicit endpoints per market kind.
     *
     * @param restClient Client used to issue the GET requests
     * @param restUrls   Depth endpoint per market kind, without query string
     */
    public BinanceSnapshotFetcher(RestClient restClient, Map<MarketKind, String> restUrls) {
        if (restClient == null) {
            throw new IllegalArgumentException("restClient cannot be null");
        }
        for (MarketKind kind : MarketKind.values()) {
            if (restUrls == null || !restUrls.containsKey(kind)) {
                throw new IllegalArgumentException("Missing REST url for " + kind);
            }
        }
        this.restClient = restClient;
        this.restUrls = new EnumMap<>(restUrls);
    }

    @Override
    public DepthSnapshot fetch(String symbol, MarketKind kind, int depthLimit) {
        if (depthLimit <= 0) {
            throw new IllegalArgumentException("depthLimit must be positive");
        }

        URI uri = buildUri(symbol, kind, depthLimit);
        LOGGER.info("[{}] Fetching depth snapshot: {}", symbol, uri);

        RestResponse response;
        try {
            response = restClient.get(uri);
        } catch (IOException e) {
            throw new SnapshotFetchException(
                "Snapshot request failed for " + symbol, SnapshotFetchException.NO_STATUS, "", e);
        }

        if (!response.isSuccess()) {
            throw new SnapshotFetchException(
                "Snapshot request rejected for " + symbol, response.statusCode(), response.body());
        }

        DepthSnapshot snapshot = parser.parse(symbol, response);
        LOGGER.info("[{}] Snapshot received: lastUpdateId={}, bids={}, asks={}",
            symbol, snapshot.lastUpdateId(), snapshot.bids().size(), snapshot.asks().size());
        return snapshot;
    }

    URI buildUri(String symbol, MarketKind kind, int depthLimit) {
        String query = "symbol=" + URLEncoder.encode(symbol, StandardCharsets.UTF_8)
            + "&limit=" + depthLimit;
        return URI.create(restUrls.get(kind) + "?" + query);
    }

    private static Map<MarketKind, String> defaultUrls() {
        Map<MarketKind, String> urls = new EnumMap<>(MarketKind.class);
        for (MarketKind kind : MarketKind.values()) {
            urls.put(kind, kind.getDefaultRestUrl());
        }
        return urls;
    }
}
