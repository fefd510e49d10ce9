package io.trading.replica.publish;

/**
 * Destination for encoded book payloads.
 */
public interface PublishSink extends AutoCloseable {

    /**
     * Publishes one payload for a symbol.
     *
     * @return true if the payload was accepted
     */
    boolean publish(String symbol, byte[] payload);

    @Override
    void close();
}
