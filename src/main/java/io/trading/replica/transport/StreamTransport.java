package io.trading.replica.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens websocket connections to exchange streaming endpoints.
 */
public interface StreamTransport extends AutoCloseable {

    /**
     * Opens a connection. The future completes once the websocket handshake is done,
     * or exceptionally with {@link StreamConnectionException}.
     *
     * @param uri  Stream endpoint
     * @param name Friendly name used in log lines
     */
    CompletableFuture<StreamConnection> connect(URI uri, String name);

    @Override
    void close();
}
