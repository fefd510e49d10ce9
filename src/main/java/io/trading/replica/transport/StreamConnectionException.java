package io.trading.replica.transport;

import java.io.IOException;

/**
 * Transport-level failure of a stream connection: handshake failure, socket drop
 * or a close frame from the server. Never used for cancellation.
 */
public class StreamConnectionException extends IOException {

    public StreamConnectionException(String message) {
        super(message);
    }

    public StreamConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
