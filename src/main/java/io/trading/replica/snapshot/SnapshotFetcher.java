package io.trading.replica.snapshot;

import io.trading.replica.model.DepthSnapshot;
import io.trading.replica.model.MarketKind;

/**
 * One-shot retrieval of a full order book for a symbol.
 */
public interface SnapshotFetcher {

    /**
     * Fetches the current order book synchronously.
     *
     * @param symbol     Trading pair symbol (e.g. "BTCUSDT", "BTCUSD_PERP")
     * @param kind       Market kind selecting the REST endpoint
     * @param depthLimit Maximum number of levels per side
     * @return the snapshot; levels are not guaranteed to be sorted
     * @throws SnapshotFetchException on non-2xx responses, transport failures or malformed bodies
     */
    DepthSnapshot fetch(String symbol, MarketKind kind, int depthLimit);
}
