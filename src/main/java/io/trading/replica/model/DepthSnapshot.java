package io.trading.replica.model;

import java.util.List;

/**
 * Point-in-time order book returned by the REST depth endpoint.
 *
 * @param symbol       Trading pair symbol
 * @param lastUpdateId Exchange update id the snapshot reflects (-1 if absent)
 * @param bids         Bid levels, in the order received
 * @param asks         Ask levels, in the order received
 */
public record DepthSnapshot(
    String symbol,
    long lastUpdateId,
    List<OrderBookLevel> bids,
    List<OrderBookLevel> asks
) {
    public DepthSnapshot {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (bids == null) {
            throw new IllegalArgumentException("bids cannot be null");
        }
        if (asks == null) {
            throw new IllegalArgumentException("asks cannot be null");
        }
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }
}
