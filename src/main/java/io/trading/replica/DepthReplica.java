package io.trading.replica;

import io.trading.replica.config.ReplicaConfig;
import io.trading.replica.core.ReplicaController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the depth replica application.
 */
public class DepthReplica {

    private static final Logger LOGGER = LoggerFactory.getLogger(DepthReplica.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Depth Replica Starting...");
        LOGGER.info("========================================");

        try {
            // Load configuration from environment variables
            ReplicaConfig config = ReplicaConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Replica ID: {}", config.replicaId());
            LOGGER.info("  Symbols: {}", config.symbols());
            LOGGER.info("  Depth Limit: {}", config.depthLimit());
            LOGGER.info("  Pacing: {} ms", config.pacingMs());
            LOGGER.info("  Publish Sink: {}", config.publishSink());

            ReplicaController controller = new ReplicaController(config);
            controller.start();

            // Setup shutdown hooks for graceful termination
            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            controller.waitForShutdown();

            controller.close();

        } catch (Exception e) {
            LOGGER.error("Fatal error in depth replica", e);
            System.exit(1);
        }

        LOGGER.info("Depth replica exited");
    }
}
