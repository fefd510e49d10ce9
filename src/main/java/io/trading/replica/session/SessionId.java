package io.trading.replica.session;

import io.trading.replica.model.MarketKind;

import java.util.Locale;

/**
 * Identity of a stream session: market kind plus symbol.
 * Renders as {@code depth_btcusdt} (spot) or {@code depth_perp_btcusd_perp} (derivative).
 *
 * @param kind   Market kind
 * @param symbol Symbol, normalized to upper case
 */
public record SessionId(
    MarketKind kind,
    String symbol
) {
    public SessionId {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        symbol = symbol.toUpperCase(Locale.ROOT);
    }

    /**
     * Session id for a configured symbol, with the market kind derived from the symbol.
     */
    public static SessionId forSymbol(String symbol) {
        return new SessionId(MarketKind.fromSymbol(symbol), symbol);
    }

    public String value() {
        return kind.getSessionIdPrefix() + symbol.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return value();
    }
}
