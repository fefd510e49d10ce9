package io.trading.replica.transport;

import java.util.concurrent.CompletableFuture;

/**
 * An open websocket connection delivering text frames one receive at a time.
 */
public interface StreamConnection extends AutoCloseable {

    /**
     * Requests the next text frame.
     * Frames that arrived while no receive was outstanding are returned in arrival order.
     *
     * The returned future fails with {@link StreamConnectionException} when the socket is
     * closed or drops. Cancelling it abandons the receive without closing the socket.
     *
     * @throws IllegalStateException if a previous receive is still outstanding
     */
    CompletableFuture<String> receive();

    /**
     * Returns whether the underlying socket is still usable.
     */
    boolean isOpen();

    /**
     * Releases the socket. Idempotent.
     */
    @Override
    void close();
}
