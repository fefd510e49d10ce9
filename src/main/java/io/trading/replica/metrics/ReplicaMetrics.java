package io.trading.replica.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.Summary;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.replica.session.SessionId;

/**
 * Prometheus metrics collector for the depth replicas.
 *
 * Tracks:
 * - Frames received and deltas applied per session
 * - Snapshot bootstraps per session
 * - Session and listener errors
 * - Session liveness
 * - Frame processing latency
 * - Published payload counts and sizes
 */
public class ReplicaMetrics {

    private final CollectorRegistry registry;

    // Counters
    private final Counter framesReceived;
    private final Counter deltasApplied;
    private final Counter snapshotFetches;
    private final Counter sessionErrors;
    private final Counter listenerErrors;
    private final Counter payloadsPublished;
    private final Counter publishFailures;

    // Gauges
    private final Gauge sessionOpen;

    // Summary (latency tracking)
    private final Summary frameLatency;

    // Histogram (payload size distribution)
    private final Histogram payloadSize;

    /**
     * Creates metrics on a private registry (no JVM collectors).
     */
    public ReplicaMetrics() {
        this(new CollectorRegistry(), false);
    }

    /**
     * @param registry        Registry to register collectors with
     * @param includeJvmStats Whether to register the hotspot collectors (GC, memory, threads)
     */
    public ReplicaMetrics(CollectorRegistry registry, boolean includeJvmStats) {
        this.registry = registry;
        if (includeJvmStats) {
            DefaultExports.register(registry);
        }

        this.framesReceived = Counter.build()
            .name("replica_frames_received_total")
            .help("Total number of stream frames received")
            .labelNames("session")
            .register(registry);

        this.deltasApplied = Counter.build()
            .name("replica_deltas_applied_total")
            .help("Total number of price level deltas merged into books")
            .labelNames("session")
            .register(registry);

        this.snapshotFetches = Counter.build()
            .name("replica_snapshot_fetches_total")
            .help("Total number of REST snapshot bootstraps")
            .labelNames("session")
            .register(registry);

        this.sessionErrors = Counter.build()
            .name("replica_session_errors_total")
            .help("Total number of sessions terminated by an error")
            .labelNames("session", "error")
            .register(registry);

        this.listenerErrors = Counter.build()
            .name("replica_listener_errors_total")
            .help("Total number of frame listener failures")
            .labelNames("session")
            .register(registry);

        this.payloadsPublished = Counter.build()
            .name("replica_payloads_published_total")
            .help("Total number of book payloads handed to the publish sink")
            .labelNames("symbol")
            .register(registry);

        this.publishFailures = Counter.build()
            .name("replica_publish_failures_total")
            .help("Total number of rejected publications")
            .register(registry);

        // Session liveness gauge (1 = open, 0 = closed)
        this.sessionOpen = Gauge.build()
            .name("replica_session_open")
            .help("Session liveness (1 = open, 0 = closed)")
            .labelNames("session", "market")
            .register(registry);

        this.frameLatency = Summary.build()
            .name("replica_frame_processing_milliseconds")
            .help("Frame parse, merge and callback latency in milliseconds")
            .labelNames("session")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register(registry);

        this.payloadSize = Histogram.build()
            .name("replica_payload_size_bytes")
            .help("Published payload size distribution in bytes")
            .buckets(1_000, 10_000, 50_000, 100_000, 500_000)
            .register(registry);
    }

    public void recordFrameReceived(SessionId sessionId) {
        framesReceived.labels(sessionId.value()).inc();
    }

    public void recordDeltasApplied(SessionId sessionId, int count) {
        deltasApplied.labels(sessionId.value()).inc(count);
    }

    public void recordSnapshotFetch(SessionId sessionId) {
        snapshotFetches.labels(sessionId.value()).inc();
    }

    /**
     * Records a session terminated by an error.
     *
     * @param errorType Short error classification (e.g. "malformed_frame")
     */
    public void recordSessionError(SessionId sessionId, String errorType) {
        sessionErrors.labels(sessionId.value(), errorType).inc();
    }

    public void recordListenerError(SessionId sessionId) {
        listenerErrors.labels(sessionId.value()).inc();
    }

    public void recordPayloadPublished(String symbol, int sizeBytes) {
        payloadsPublished.labels(symbol).inc();
        payloadSize.observe(sizeBytes);
    }

    public void recordPublishFailure() {
        publishFailures.inc();
    }

    public void setSessionOpen(SessionId sessionId, boolean open) {
        sessionOpen.labels(sessionId.value(), sessionId.kind().name()).set(open ? 1 : 0);
    }

    public void recordFrameLatency(SessionId sessionId, double latencyMs) {
        frameLatency.labels(sessionId.value()).observe(latencyMs);
    }

    public double getFramesReceived(SessionId sessionId) {
        return framesReceived.labels(sessionId.value()).get();
    }

    public double getDeltasApplied(SessionId sessionId) {
        return deltasApplied.labels(sessionId.value()).get();
    }

    public double getSnapshotFetches(SessionId sessionId) {
        return snapshotFetches.labels(sessionId.value()).get();
    }

    public double getSessionErrors(SessionId sessionId, String errorType) {
        return sessionErrors.labels(sessionId.value(), errorType).get();
    }

    public double getListenerErrors(SessionId sessionId) {
        return listenerErrors.labels(sessionId.value()).get();
    }

    /**
     * Returns the CollectorRegistry for the HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
