package io.trading.replica.publish;

import java.math.BigDecimal;
import java.util.List;

/**
 * Book state published after each depth update.
 *
 * @param symbol       Exchange symbol (e.g. BTCUSDT)
 * @param eventTime    Exchange event time in epoch milliseconds
 * @param exchangeTime Event time as ISO-8601 UTC
 * @param spread       Best ask minus best bid, null while either side is empty
 * @param crossed      Whether the best bid is at or above the best ask
 * @param bids         Bid levels, best first, as [price, quantity]
 * @param asks         Ask levels, best first, as [price, quantity]
 */
public record BookSnapshotPayload(
    String symbol,
    long eventTime,
    String exchangeTime,
    BigDecimal spread,
    boolean crossed,
    List<List<BigDecimal>> bids,
    List<List<BigDecimal>> asks
) {
    public BookSnapshotPayload {
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }
}
