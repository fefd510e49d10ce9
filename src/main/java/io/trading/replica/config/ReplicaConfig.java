package io.trading.replica.config;

import io.trading.replica.model.MarketKind;
import io.trading.replica.session.SessionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for the depth replica process.
 *
 * @param replicaId          Unique replica instance identifier
 * @param symbols            Symbols to replicate, upper case; an underscore marks a derivative
 * @param depthLimit         Levels requested from the REST snapshot
 * @param pacingMs           Delay between processing a frame and the next receive
 * @param snapshotTimeoutMs  Timeout of one REST snapshot request
 * @param publishDepth       Levels per side in published payloads, 0 for the full book
 * @param publishSink        Publish destination
 * @param aeronDir           Aeron directory for the embedded media driver
 * @param metricsPort        Port for the Prometheus metrics and status HTTP server
 * @param healthCheckMs      Health check interval in milliseconds
 * @param restUrls           REST snapshot endpoint per market kind
 * @param streamUrlTemplates Stream URL per market kind, {@code %s} standing for the lower-case symbol
 */
public record ReplicaConfig(
    String replicaId,
    List<String> symbols,
    int depthLimit,
    int pacingMs,
    int snapshotTimeoutMs,
    int publishDepth,
    PublishSinkType publishSink,
    String aeronDir,
    int metricsPort,
    int healthCheckMs,
    Map<MarketKind, String> restUrls,
    Map<MarketKind, String> streamUrlTemplates
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReplicaConfig.class);

    static final String DEFAULT_REPLICA_ID = "replica-0";
    static final String DEFAULT_SYMBOLS = "BTCUSDT,ETHUSDT";
    static final int DEFAULT_DEPTH_LIMIT = 1000;
    static final int DEFAULT_PACING_MS = 100;
    static final int DEFAULT_SNAPSHOT_TIMEOUT_MS = 10_000;
    static final int DEFAULT_PUBLISH_DEPTH = 0;
    static final int DEFAULT_METRICS_PORT = 9090;
    static final int DEFAULT_HEALTH_CHECK_MS = 5000;

    public ReplicaConfig {
        if (replicaId == null || replicaId.isEmpty()) {
            throw new IllegalArgumentException("replicaId cannot be null or empty");
        }
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("symbols cannot be null or empty");
        }
        for (String symbol : symbols) {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("symbols cannot contain blank entries");
            }
        }
        if (depthLimit <= 0) {
            throw new IllegalArgumentException("depthLimit must be positive");
        }
        if (pacingMs < 0) {
            throw new IllegalArgumentException("pacingMs cannot be negative");
        }
        if (snapshotTimeoutMs <= 0) {
            throw new IllegalArgumentException("snapshotTimeoutMs must be positive");
        }
        if (publishDepth < 0) {
            throw new IllegalArgumentException("publishDepth cannot be negative");
        }
        if (publishSink == null) {
            throw new IllegalArgumentException("publishSink cannot be null");
        }
        if (aeronDir == null || aeronDir.isEmpty()) {
            throw new IllegalArgumentException("aeronDir cannot be null or empty");
        }
        if (metricsPort < 1 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 1 and 65535");
        }
        if (healthCheckMs <= 0) {
            throw new IllegalArgumentException("healthCheckMs must be positive");
        }
        symbols = symbols.stream()
            .map(symbol -> symbol.trim().toUpperCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableList());
        restUrls = completeUrls(restUrls, MarketKind::getDefaultRestUrl);
        streamUrlTemplates = completeUrls(streamUrlTemplates, MarketKind::getDefaultStreamUrlTemplate);
        for (String template : streamUrlTemplates.values()) {
            if (!template.contains("%s")) {
                throw new IllegalArgumentException("stream URL must contain a %s symbol placeholder: " + template);
            }
        }
    }

    private static Map<MarketKind, String> completeUrls(Map<MarketKind, String> urls, Function<MarketKind, String> defaults) {
        Map<MarketKind, String> complete = new EnumMap<>(MarketKind.class);
        for (MarketKind kind : MarketKind.values()) {
            String url = urls == null ? null : urls.get(kind);
            complete.put(kind, url == null || url.isEmpty() ? defaults.apply(kind) : url);
        }
        return Map.copyOf(complete);
    }

    /**
     * Session ids of the configured symbols, in configuration order.
     */
    public List<SessionId> sessionIds() {
        List<SessionId> ids = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            ids.add(SessionId.forSymbol(symbol));
        }
        return ids;
    }

    /**
     * Depth stream URI of a session.
     */
    public URI streamUri(SessionId id) {
        return URI.create(String.format(streamUrlTemplates.get(id.kind()), id.symbol().toLowerCase(Locale.ROOT)));
    }

    public String restUrl(MarketKind kind) {
        return restUrls.get(kind);
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - REPLICA_ID: Replica instance ID (default: "replica-0")
     * - SYMBOLS: Symbols, comma or semicolon separated (default: "BTCUSDT,ETHUSDT")
     * - DEPTH_LIMIT: Snapshot depth (default: 1000)
     * - PACING_MS: Delay between receives (default: 100)
     * - SNAPSHOT_TIMEOUT_MS: REST snapshot timeout (default: 10000)
     * - PUBLISH_DEPTH: Published levels per side, 0 = full book (default: 0)
     * - PUBLISH_SINK: "memory" or "aeron" (default: "memory")
     * - AERON_DIR: Aeron directory (default: "/dev/shm/depth-replica-{replicaId}")
     * - METRICS_PORT: HTTP port (default: 9090)
     * - HEALTH_CHECK_MS: Health check interval (default: 5000)
     * - SPOT_REST_URL, DERIVATIVE_REST_URL: REST snapshot endpoints
     * - SPOT_STREAM_URL, DERIVATIVE_STREAM_URL: Stream URL templates with a %s symbol placeholder
     */
    public static ReplicaConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    static ReplicaConfig fromEnv(Function<String, String> env) {
        String replicaId = stringEnv(env, "REPLICA_ID", DEFAULT_REPLICA_ID);

        Map<MarketKind, String> restUrls = new EnumMap<>(MarketKind.class);
        restUrls.put(MarketKind.SPOT, env.apply("SPOT_REST_URL"));
        restUrls.put(MarketKind.DERIVATIVE, env.apply("DERIVATIVE_REST_URL"));

        Map<MarketKind, String> streamUrls = new EnumMap<>(MarketKind.class);
        streamUrls.put(MarketKind.SPOT, env.apply("SPOT_STREAM_URL"));
        streamUrls.put(MarketKind.DERIVATIVE, env.apply("DERIVATIVE_STREAM_URL"));

        return new ReplicaConfig(
            replicaId,
            parseSymbols(stringEnv(env, "SYMBOLS", DEFAULT_SYMBOLS)),
            parseIntEnv(env, "DEPTH_LIMIT", DEFAULT_DEPTH_LIMIT),
            parseIntEnv(env, "PACING_MS", DEFAULT_PACING_MS),
            parseIntEnv(env, "SNAPSHOT_TIMEOUT_MS", DEFAULT_SNAPSHOT_TIMEOUT_MS),
            parseIntEnv(env, "PUBLISH_DEPTH", DEFAULT_PUBLISH_DEPTH),
            PublishSinkType.fromString(stringEnv(env, "PUBLISH_SINK", "memory")),
            stringEnv(env, "AERON_DIR", "/dev/shm/depth-replica-" + replicaId),
            parseIntEnv(env, "METRICS_PORT", DEFAULT_METRICS_PORT),
            parseIntEnv(env, "HEALTH_CHECK_MS", DEFAULT_HEALTH_CHECK_MS),
            restUrls,
            streamUrls
        );
    }

    static List<String> parseSymbols(String value) {
        return Arrays.stream(value.split("[,;]"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }

    private static String stringEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static int parseIntEnv(Function<String, String> env, String key, int defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Creates a new builder for ReplicaConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ReplicaConfig.
     */
    public static class Builder {
        private String replicaId = DEFAULT_REPLICA_ID;
        private final List<String> symbols = new ArrayList<>();
        private int depthLimit = DEFAULT_DEPTH_LIMIT;
        private int pacingMs = DEFAULT_PACING_MS;
        private int snapshotTimeoutMs = DEFAULT_SNAPSHOT_TIMEOUT_MS;
        private int publishDepth = DEFAULT_PUBLISH_DEPTH;
        private PublishSinkType publishSink = PublishSinkType.MEMORY;
        private String aeronDir;
        private int metricsPort = DEFAULT_METRICS_PORT;
        private int healthCheckMs = DEFAULT_HEALTH_CHECK_MS;
        private final Map<MarketKind, String> restUrls = new EnumMap<>(MarketKind.class);
        private final Map<MarketKind, String> streamUrlTemplates = new EnumMap<>(MarketKind.class);

        public Builder replicaId(String replicaId) {
            this.replicaId = replicaId;
            return this;
        }

        public Builder addSymbol(String symbol) {
            this.symbols.add(symbol);
            return this;
        }

        public Builder depthLimit(int depthLimit) {
            this.depthLimit = depthLimit;
            return this;
        }

        public Builder pacingMs(int pacingMs) {
            this.pacingMs = pacingMs;
            return this;
        }

        public Builder snapshotTimeoutMs(int snapshotTimeoutMs) {
            this.snapshotTimeoutMs = snapshotTimeoutMs;
            return this;
        }

        public Builder publishDepth(int publishDepth) {
            this.publishDepth = publishDepth;
            return this;
        }

        public Builder publishSink(PublishSinkType publishSink) {
            this.publishSink = publishSink;
            return this;
        }

        public Builder aeronDir(String aeronDir) {
            this.aeronDir = aeronDir;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder healthCheckMs(int healthCheckMs) {
            this.healthCheckMs = healthCheckMs;
            return this;
        }

        public Builder restUrl(MarketKind kind, String url) {
            this.restUrls.put(kind, url);
            return this;
        }

        public Builder streamUrlTemplate(MarketKind kind, String template) {
            this.streamUrlTemplates.put(kind, template);
            return this;
        }

        public ReplicaConfig build() {
            if (aeronDir == null || aeronDir.isEmpty()) {
                aeronDir = "/dev/shm/depth-replica-" + replicaId;
            }
            if (symbols.isEmpty()) {
                throw new IllegalStateException("At least one symbol must be added");
            }
            return new ReplicaConfig(
                replicaId,
                List.copyOf(symbols),
                depthLimit,
                pacingMs,
                snapshotTimeoutMs,
                publishDepth,
                publishSink,
                aeronDir,
                metricsPort,
                healthCheckMs,
                restUrls,
                streamUrlTemplates
            );
        }
    }
}
