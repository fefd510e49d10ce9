package io.trading.replica.model;

/**
 * Market kind of a replicated symbol. Determines the REST and stream endpoints,
 * the session id prefix and whether stream frames carry an extra {@code data} envelope.
 */
public enum MarketKind {
    SPOT(
        "Spot",
        "https://api.binance.com/api/v3/depth",
        "wss://stream.binance.com:9443/ws/%s@depth",
        "depth_",
        false
    ),
    DERIVATIVE(
        "Derivative",
        "https://dapi.binance.com/dapi/v1/depth",
        "wss://dstream.binance.com/stream?streams=%s@depth",
        "depth_perp_",
        true
    );

    private final String displayName;
    private final String defaultRestUrl;
    private final String defaultStreamUrlTemplate;
    private final String sessionIdPrefix;
    private final boolean enveloped;

    MarketKind(
        String displayName,
        String defaultRestUrl,
        String defaultStreamUrlTemplate,
        String sessionIdPrefix,
        boolean enveloped
    ) {
        this.displayName = displayName;
        this.defaultRestUrl = defaultRestUrl;
        this.defaultStreamUrlTemplate = defaultStreamUrlTemplate;
        this.sessionIdPrefix = sessionIdPrefix;
        this.enveloped = enveloped;
    }

    /**
     * Resolves the market kind of a configured symbol.
     * Perpetual contracts carry an underscore (e.g. "BTCUSD_PERP"), spot pairs do not.
     */
    public static MarketKind fromSymbol(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        return symbol.indexOf('_') >= 0 ? DERIVATIVE : SPOT;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDefaultRestUrl() {
        return defaultRestUrl;
    }

    /**
     * Stream URL template with a single {@code %s} placeholder for the lower-case symbol.
     */
    public String getDefaultStreamUrlTemplate() {
        return defaultStreamUrlTemplate;
    }

    public String getSessionIdPrefix() {
        return sessionIdPrefix;
    }

    /**
     * Whether stream frames wrap the event payload under a {@code data} field.
     */
    public boolean isEnveloped() {
        return enveloped;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
