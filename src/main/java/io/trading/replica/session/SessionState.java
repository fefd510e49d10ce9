package io.trading.replica.session;

/**
 * Lifecycle of a stream session.
 */
public enum SessionState {
    CREATED,
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
