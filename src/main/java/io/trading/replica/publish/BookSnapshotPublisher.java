package io.trading.replica.publish;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.replica.book.PriceLevelBook;
import io.trading.replica.metrics.ReplicaMetrics;
import io.trading.replica.model.OrderBookLevel;
import io.trading.replica.session.DepthFrameParser;
import io.trading.replica.session.FrameListener;
import io.trading.replica.session.SessionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Frame listener that publishes the merged book after every depth update.
 *
 * Frames that are not depth updates, or that carry no event time or symbol, are skipped.
 */
public class BookSnapshotPublisher implements FrameListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(BookSnapshotPublisher.class);

    private final PublishSink sink;
    private final PayloadEncoder encoder;
    private final ReplicaMetrics metrics;
    private final int publishDepth;

    /**
     * @param publishDepth Levels per side to publish, 0 for the full book
     */
    public BookSnapshotPublisher(PublishSink sink, PayloadEncoder encoder, ReplicaMetrics metrics, int publishDepth) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (encoder == null) {
            throw new IllegalArgumentException("encoder cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (publishDepth < 0) {
            throw new IllegalArgumentException("publishDepth cannot be negative");
        }
        this.sink = sink;
        this.encoder = encoder;
        this.metrics = metrics;
        this.publishDepth = publishDepth;
    }

    @Override
    public void onFrame(SessionId sessionId, JsonNode frame, PriceLevelBook book) {
        if (!DepthFrameParser.DEPTH_UPDATE_EVENT.equals(frame.path("e").asText(null))) {
            return;
        }
        JsonNode eventTime = frame.get("E");
        JsonNode symbol = frame.get("s");
        if (eventTime == null || !eventTime.canConvertToLong() || symbol == null || !symbol.isTextual()) {
            LOGGER.debug("[{}] Depth frame without event time or symbol, not publishing", sessionId);
            return;
        }

        BookSnapshotPayload payload = toPayload(symbol.asText(), eventTime.asLong(), book);
        byte[] bytes = encoder.encode(payload);
        if (sink.publish(payload.symbol(), bytes)) {
            metrics.recordPayloadPublished(payload.symbol(), bytes.length);
        } else {
            metrics.recordPublishFailure();
        }
    }

    BookSnapshotPayload toPayload(String symbol, long eventTime, PriceLevelBook book) {
        return new BookSnapshotPayload(
            symbol,
            eventTime,
            Instant.ofEpochMilli(eventTime).toString(),
            book.spread().orElse(null),
            book.isCrossed(),
            toRows(book.bids(publishDepth)),
            toRows(book.asks(publishDepth))
        );
    }

    private static List<List<BigDecimal>> toRows(List<OrderBookLevel> levels) {
        List<List<BigDecimal>> rows = new ArrayList<>(levels.size());
        for (OrderBookLevel level : levels) {
            rows.add(List.of(level.price(), level.quantity()));
        }
        return rows;
    }
}
