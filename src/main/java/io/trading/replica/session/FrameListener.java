package io.trading.replica.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.replica.book.PriceLevelBook;

/**
 * Consumer of received frames. Invoked inline on the session dispatcher once per
 * frame, after any depth update it carries has been merged into the book.
 * Implementations must not block.
 */
@FunctionalInterface
public interface FrameListener {

    /**
     * @param sessionId Session that received the frame
     * @param frame     Parsed frame, with the derivative {@code data} envelope removed
     * @param book      The session's book; valid only for the duration of the call
     */
    void onFrame(SessionId sessionId, JsonNode frame, PriceLevelBook book);
}
