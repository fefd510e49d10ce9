package io.trading.replica.session;

import io.trading.replica.metrics.ReplicaMetrics;
import io.trading.replica.snapshot.SnapshotFetcher;
import io.trading.replica.transport.StreamTransport;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Collaborators and settings shared by every stream session.
 *
 * @param transport       Opens the websocket connections
 * @param snapshotFetcher Bootstraps empty books
 * @param listener        Receives every frame after merge
 * @param dispatcher      Single-threaded executor all session steps run on
 * @param metrics         Metrics sink
 * @param depthLimit      Snapshot depth requested on bootstrap
 * @param pacingMs        Delay between processing a frame and issuing the next receive
 */
public record SessionContext(
    StreamTransport transport,
    SnapshotFetcher snapshotFetcher,
    FrameListener listener,
    ScheduledExecutorService dispatcher,
    ReplicaMetrics metrics,
    int depthLimit,
    long pacingMs
) {
    public SessionContext {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (snapshotFetcher == null) {
            throw new IllegalArgumentException("snapshotFetcher cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (depthLimit <= 0) {
            throw new IllegalArgumentException("depthLimit must be positive");
        }
        if (pacingMs < 0) {
            throw new IllegalArgumentException("pacingMs cannot be negative");
        }
    }
}
