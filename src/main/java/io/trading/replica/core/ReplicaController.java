package io.trading.replica.core;

import io.prometheus.client.CollectorRegistry;
import io.trading.replica.config.PublishSinkType;
import io.trading.replica.config.ReplicaConfig;
import io.trading.replica.metrics.MetricsServer;
import io.trading.replica.metrics.ReplicaMetrics;
import io.trading.replica.model.MarketKind;
import io.trading.replica.netty.NettyRestClient;
import io.trading.replica.netty.NettyStreamTransport;
import io.trading.replica.publish.AeronPublishSink;
import io.trading.replica.publish.BookSnapshotPublisher;
import io.trading.replica.publish.CompositePublishSink;
import io.trading.replica.publish.InMemoryPublishSink;
import io.trading.replica.publish.PayloadEncoder;
import io.trading.replica.publish.PublishSink;
import io.trading.replica.session.SessionContext;
import io.trading.replica.session.SessionId;
import io.trading.replica.session.SessionRegistry;
import io.trading.replica.session.SessionState;
import io.trading.replica.session.StreamSession;
import io.trading.replica.snapshot.BinanceSnapshotFetcher;
import io.trading.replica.snapshot.SnapshotFetcher;
import io.trading.replica.transport.RestClient;
import io.trading.replica.transport.StreamTransport;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main controller for the depth replica.
 * Owns the transports, the dispatcher thread, the session registry and the publish sinks,
 * and starts one stream session per configured symbol.
 */
public class ReplicaController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplicaController.class);

    private final ReplicaConfig config;
    private final StreamTransport transport;
    private final RestClient restClient;
    private final ScheduledExecutorService dispatcher;
    private final SessionRegistry registry;
    private final ReplicaMetrics metrics;
    private final InMemoryPublishSink books;
    private final PublishSink sink;
    private final SessionContext sessionContext;
    private final HealthMonitor healthMonitor;
    private final MetricsServer metricsServer;
    private final ShutdownSignalBarrier shutdownBarrier;
    private final Map<SessionId, StreamSession> sessions = new LinkedHashMap<>();

    public ReplicaController(ReplicaConfig config) {
        this(
            config,
            new NettyStreamTransport(1, true),
            new NettyRestClient(Duration.ofMillis(config.snapshotTimeoutMs()))
        );
    }

    ReplicaController(ReplicaConfig config, StreamTransport transport, RestClient restClient) {
        this.config = config;
        this.transport = transport;
        this.restClient = restClient;
        this.metrics = new ReplicaMetrics(new CollectorRegistry(), true);
        this.registry = new SessionRegistry();
        this.dispatcher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "depth-dispatcher");
            thread.setDaemon(true);
            return thread;
        });

        this.books = new InMemoryPublishSink();
        this.sink = createSink(config, books);

        Map<MarketKind, String> restUrls = new EnumMap<>(MarketKind.class);
        for (MarketKind kind : MarketKind.values()) {
            restUrls.put(kind, config.restUrl(kind));
        }
        SnapshotFetcher fetcher = new BinanceSnapshotFetcher(restClient, restUrls);
        BookSnapshotPublisher publisher = new BookSnapshotPublisher(sink, new PayloadEncoder(), metrics, config.publishDepth());

        this.sessionContext = new SessionContext(
            transport,
            fetcher,
            publisher,
            dispatcher,
            metrics,
            config.depthLimit(),
            config.pacingMs()
        );
        this.healthMonitor = new HealthMonitor(config.healthCheckMs());
        this.metricsServer = new MetricsServer(config.metricsPort(), metrics, config, healthMonitor, this::getSessions, books);
        this.shutdownBarrier = new ShutdownSignalBarrier();

        LOGGER.info("Replica controller initialized: {}", config.replicaId());
    }

    private static PublishSink createSink(ReplicaConfig config, InMemoryPublishSink books) {
        if (config.publishSink() == PublishSinkType.AERON) {
            return new CompositePublishSink(List.of(books, new AeronPublishSink(config.aeronDir())));
        }
        return books;
    }

    /**
     * Starts the health monitor, the HTTP server and one session per configured symbol.
     */
    public void start() throws IOException {
        LOGGER.info("Starting depth replica...");

        healthMonitor.start();
        metricsServer.start();

        for (SessionId id : config.sessionIds()) {
            startSession(id);
        }

        LOGGER.info("Depth replica started with {} sessions", sessions.size());
        logStatus();
    }

    /**
     * Opens the stream for one symbol. Ignored with a warning if its session is already open.
     *
     * @return true if a new session was started
     */
    public boolean startSession(SessionId id) {
        StreamSession session = new StreamSession(id, config.streamUri(id), sessionContext);
        if (!registry.start(session)) {
            return false;
        }

        synchronized (sessions) {
            sessions.put(id, session);
        }
        healthMonitor.registerSession(id, new HealthMonitor.SessionChecker() {
            @Override
            public boolean isOpen() {
                return session.state() == SessionState.OPEN;
            }

            @Override
            public long getFrameCount() {
                return (long) metrics.getFramesReceived(id);
            }
        });
        return true;
    }

    /**
     * Waits for shutdown signal.
     */
    public void waitForShutdown() {
        LOGGER.info("Replica running. Press Ctrl+C to shutdown.");
        shutdownBarrier.await();

        LOGGER.info("Shutdown signal received");
    }

    /**
     * Closes every stream, then the dispatcher, transports, sinks and HTTP server.
     */
    public void shutdown() {
        LOGGER.info("Shutting down depth replica...");

        registry.shutdown();

        // Let the sessions observe their cancelled receives before the dispatcher stops
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }

        CloseHelper.closeAll(transport, restClient, sink, healthMonitor, metricsServer);

        LOGGER.info("Depth replica shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Logs current replica status.
     */
    public void logStatus() {
        LOGGER.info("=== Replica Status ===");
        LOGGER.info("Replica ID: {}", config.replicaId());
        LOGGER.info("Publish Sink: {}", config.publishSink());
        LOGGER.info("Open Sessions: {}", registry.openSessionIds());
        for (StreamSession session : getSessions()) {
            LOGGER.info("{}: state={}, frames={}, snapshots={}",
                session.id(),
                session.state(),
                (long) metrics.getFramesReceived(session.id()),
                (long) metrics.getSnapshotFetches(session.id())
            );
        }
        healthMonitor.logSummary();
        LOGGER.info("=====================");
    }

    /**
     * Sessions started by this controller, including those that have since closed.
     */
    public Collection<StreamSession> getSessions() {
        synchronized (sessions) {
            return new ArrayList<>(sessions.values());
        }
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public InMemoryPublishSink getBooks() {
        return books;
    }

    public ReplicaMetrics getMetrics() {
        return metrics;
    }

    HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    /**
     * Gets the shutdown barrier for external signal handling.
     */
    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }
}
