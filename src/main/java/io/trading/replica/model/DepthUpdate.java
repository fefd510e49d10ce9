package io.trading.replica.model;

import java.util.List;

/**
 * Incremental depth update decoded from a stream frame.
 * Each level carries the new absolute quantity at its price; zero means remove.
 *
 * @param symbol        Trading pair symbol
 * @param eventTime     Exchange event time in milliseconds
 * @param firstUpdateId First update id in the event (-1 if absent)
 * @param finalUpdateId Final update id in the event (-1 if absent)
 * @param bids          Bid level updates, in the order received
 * @param asks          Ask level updates, in the order received
 */
public record DepthUpdate(
    String symbol,
    long eventTime,
    long firstUpdateId,
    long finalUpdateId,
    List<OrderBookLevel> bids,
    List<OrderBookLevel> asks
) {
    public DepthUpdate {
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
