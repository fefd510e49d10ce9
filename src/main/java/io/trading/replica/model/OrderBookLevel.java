package io.trading.replica.model;

import java.math.BigDecimal;

/**
 * Single price level in an order book.
 *
 * A quantity of zero is legal here: depth updates use it to signal removal of the level.
 *
 * @param price    Price level
 * @param quantity Absolute quantity resting at this price
 */
public record OrderBookLevel(
    BigDecimal price,
    BigDecimal quantity
) {
    public OrderBookLevel {
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
        if (quantity == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price cannot be negative");
        }
    }

    /**
     * Parses a level from the exchange's string pair representation.
     */
    public static OrderBookLevel of(String price, String quantity) {
        return new OrderBookLevel(new BigDecimal(price), new BigDecimal(quantity));
    }

    /**
     * Returns whether this level carries liquidity.
     */
    public boolean hasLiquidity() {
        return quantity.signum() > 0;
    }
}
