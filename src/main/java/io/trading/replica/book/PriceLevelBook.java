package io.trading.replica.book;

import io.trading.replica.model.DepthSnapshot;
import io.trading.replica.model.DepthUpdate;
import io.trading.replica.model.OrderBookLevel;
import io.trading.replica.model.Side;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-symbol replica of an order book: price to quantity for each side.
 *
 * Invariants:
 * - no level with quantity <= 0 is ever stored (absence means no liquidity)
 * - bids read in descending price order, asks in ascending price order
 *
 * Prices compare numerically, so "100.0" and "100.00" address the same level.
 * Instances are confined to the owning session's dispatch thread and are not thread-safe.
 */
public class PriceLevelBook {

    private final String symbol;
    private final TreeMap<BigDecimal, BigDecimal> bids = new TreeMap<>(Collections.reverseOrder());
    private final TreeMap<BigDecimal, BigDecimal> asks = new TreeMap<>();

    public PriceLevelBook(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Seeds an empty book from a REST snapshot.
     *
     * @throws IllegalStateException if either side already holds levels
     */
    public void applySnapshot(DepthSnapshot snapshot) {
        applySnapshot(snapshot.bids(), snapshot.asks());
    }

    /**
     * Seeds an empty book with the given levels. Levels without liquidity are skipped.
     *
     * @throws IllegalStateException if either side already holds levels
     */
    public void applySnapshot(List<OrderBookLevel> bidLevels, List<OrderBookLevel> askLevels) {
        if (!isEmpty()) {
            throw new IllegalStateException(
                "Snapshot applied to non-empty book " + symbol
                    + " (bids=" + bids.size() + ", asks=" + asks.size() + ")"
            );
        }
        for (OrderBookLevel level : bidLevels) {
            if (level.hasLiquidity()) {
                bids.put(level.price(), level.quantity());
            }
        }
        for (OrderBookLevel level : askLevels) {
            if (level.hasLiquidity()) {
                asks.put(level.price(), level.quantity());
            }
        }
    }

    /**
     * Applies every level of a depth update, asks first and then bids.
     */
    public void applyUpdate(DepthUpdate update) {
        for (OrderBookLevel level : update.asks()) {
            applyDelta(Side.ASK, level.price(), level.quantity());
        }
        for (OrderBookLevel level : update.bids()) {
            applyDelta(Side.BID, level.price(), level.quantity());
        }
    }

    /**
     * Sets the absolute quantity at a price. A non-positive quantity removes the level;
     * removing a level that is not present is a no-op.
     */
    public void applyDelta(Side side, BigDecimal price, BigDecimal quantity) {
        TreeMap<BigDecimal, BigDecimal> levels = side == Side.BID ? bids : asks;
        if (quantity.signum() > 0) {
            levels.put(price, quantity);
        } else {
            levels.remove(price);
        }
    }

    public Optional<BigDecimal> bestBid() {
        return bids.isEmpty() ? Optional.empty() : Optional.of(bids.firstKey());
    }

    public Optional<BigDecimal> bestAsk() {
        return asks.isEmpty() ? Optional.empty() : Optional.of(asks.firstKey());
    }

    /**
     * Best ask minus best bid, present only when both sides hold liquidity.
     */
    public Optional<BigDecimal> spread() {
        if (bids.isEmpty() || asks.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(asks.firstKey().subtract(bids.firstKey()));
    }

    /**
     * Whether the best bid reaches or exceeds the best ask. Not corrected here,
     * only reported for downstream consumers.
     */
    public boolean isCrossed() {
        return !bids.isEmpty() && !asks.isEmpty() && bids.firstKey().compareTo(asks.firstKey()) >= 0;
    }

    /**
     * Whether both sides are empty (the book has not been seeded yet).
     */
    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }

    public int bidLevelCount() {
        return bids.size();
    }

    public int askLevelCount() {
        return asks.size();
    }

    /**
     * Quantity resting at a price, if any.
     */
    public Optional<BigDecimal> quantityAt(Side side, BigDecimal price) {
        TreeMap<BigDecimal, BigDecimal> levels = side == Side.BID ? bids : asks;
        return Optional.ofNullable(levels.get(price));
    }

    /**
     * All bid levels, best (highest) first.
     */
    public List<OrderBookLevel> bids() {
        return levels(bids, Integer.MAX_VALUE);
    }

    /**
     * All ask levels, best (lowest) first.
     */
    public List<OrderBookLevel> asks() {
        return levels(asks, Integer.MAX_VALUE);
    }

    /**
     * Top {@code depth} bid levels; a depth of 0 or less returns the whole side.
     */
    public List<OrderBookLevel> bids(int depth) {
        return levels(bids, depth);
    }

    /**
     * Top {@code depth} ask levels; a depth of 0 or less returns the whole side.
     */
    public List<OrderBookLevel> asks(int depth) {
        return levels(asks, depth);
    }

    private static List<OrderBookLevel> levels(TreeMap<BigDecimal, BigDecimal> side, int depth) {
        int limit = depth <= 0 ? side.size() : Math.min(depth, side.size());
        List<OrderBookLevel> result = new ArrayList<>(limit);
        for (Map.Entry<BigDecimal, BigDecimal> entry : side.entrySet()) {
            if (result.size() >= limit) {
                break;
            }
            result.add(new OrderBookLevel(entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "PriceLevelBook{" + symbol
            + ", bids=" + bids.size()
            + ", asks=" + asks.size()
            + ", bestBid=" + bestBid().map(BigDecimal::toPlainString).orElse("-")
            + ", bestAsk=" + bestAsk().map(BigDecimal::toPlainString).orElse("-")
            + '}';
    }
}
