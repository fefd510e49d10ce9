package io.trading.replica.transport;

import java.io.IOException;
import java.net.URI;

/**
 * Minimal blocking REST client.
 */
public interface RestClient extends AutoCloseable {

    /**
     * Issues a GET request and waits for the full response.
     *
     * @throws IOException on connection failure or timeout
     */
    RestResponse get(URI uri) throws IOException;

    @Override
    void close();
}
