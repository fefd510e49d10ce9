package io.trading.replica.model;

/**
 * Order book side.
 */
public enum Side {
    BID,
    ASK
}
