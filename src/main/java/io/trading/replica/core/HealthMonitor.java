package io.trading.replica.core;

import io.trading.replica.session.SessionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically checks the configured sessions and reports those that are no longer open.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    private final long checkIntervalMs;
    private final ScheduledExecutorService scheduler;
    private final Map<SessionId, SessionStats> statsMap;

    private volatile boolean running = false;

    public HealthMonitor(long checkIntervalMs) {
        this.checkIntervalMs = checkIntervalMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
        this.statsMap = new ConcurrentHashMap<>();
    }

    /**
     * Registers a session for monitoring.
     */
    public void registerSession(SessionId sessionId, SessionChecker checker) {
        statsMap.put(sessionId, new SessionStats(sessionId, checker));
    }

    public void start() {
        if (running) {
            return;
        }

        running = true;
        scheduler.scheduleAtFixedRate(
            this::performHealthCheck,
            checkIntervalMs,
            checkIntervalMs,
            TimeUnit.MILLISECONDS
        );

        LOGGER.info("Health monitor started (interval: {} ms)", checkIntervalMs);
    }

    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Health monitor stopped");
    }

    /**
     * Checks every registered session once.
     */
    void performHealthCheck() {
        for (SessionStats stats : statsMap.values()) {
            boolean open = stats.checker.isOpen();
            stats.update(open);

            if (!open) {
                LOGGER.warn("[HealthMonitor] {} is not open (down for {} checks)", stats.sessionId, stats.downChecks);
            }
        }
    }

    /**
     * Whether every registered session is open.
     */
    public boolean isHealthy() {
        for (SessionStats stats : statsMap.values()) {
            if (!stats.checker.isOpen()) {
                return false;
            }
        }
        return true;
    }

    public void logSummary() {
        LOGGER.info("=== Health Monitor Summary ===");
        for (SessionStats stats : statsMap.values()) {
            LOGGER.info("{}: open={}, frames={}, downChecks={}, lastDown={}",
                stats.sessionId,
                stats.checker.isOpen(),
                stats.checker.getFrameCount(),
                stats.downChecks,
                stats.lastDownTime
            );
        }
        LOGGER.info("=============================");
    }

    public SessionStats getStats(SessionId sessionId) {
        return statsMap.get(sessionId);
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Interface for checking session status.
     */
    public interface SessionChecker {
        boolean isOpen();
        long getFrameCount();
    }

    /**
     * Statistics for a session.
     */
    public static class SessionStats {
        private final SessionId sessionId;
        private final SessionChecker checker;
        private volatile long downChecks = 0;
        private volatile long lastDownTime = 0;

        public SessionStats(SessionId sessionId, SessionChecker checker) {
            this.sessionId = sessionId;
            this.checker = checker;
        }

        private void update(boolean open) {
            if (!open) {
                downChecks++;
                lastDownTime = System.currentTimeMillis();
            }
        }

        public SessionId getSessionId() {
            return sessionId;
        }

        public long getDownChecks() {
            return downChecks;
        }

        public long getLastDownTime() {
            return lastDownTime;
        }

        public long getFrameCount() {
            return checker.getFrameCount();
        }
    }
}
