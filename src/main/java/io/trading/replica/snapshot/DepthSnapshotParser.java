package io.trading.replica.snapshot;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.trading.replica.model.DepthSnapshot;
import io.trading.replica.model.OrderBookLevel;
import io.trading.replica.transport.RestResponse;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Streaming parser for REST depth snapshots.
 *
 * Expected body:
 * <pre>
 * {"lastUpdateId":1027024,"bids":[["4.00000000","431.00000000"]],"asks":[["4.00000200","12.00000000"]]}
 * </pre>
 * Derivative snapshots carry extra fields ({@code E}, {@code T}, {@code symbol}, {@code pair})
 * which are skipped. Level arrays may hold more than two entries; only price and quantity are read.
 */
public class DepthSnapshotParser {

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    /**
     * Parses a snapshot body.
     *
     * @throws SnapshotFetchException if the body is not a well-formed depth snapshot
     */
    public DepthSnapshot parse(String symbol, RestResponse response) {
        int status = response.statusCode();
        String body = response.body();
        if (body.isBlank()) {
            throw malformed("Empty snapshot body", status, body, null);
        }

        try (JsonParser parser = JSON_FACTORY.createParser(body)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw malformed("Snapshot body is not a JSON object", status, body, null);
            }

            long lastUpdateId = -1;
            List<OrderBookLevel> bids = null;
            List<OrderBookLevel> asks = null;

            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String fieldName = parser.getCurrentName();
                JsonToken valueToken = parser.nextToken();

                switch (fieldName) {
                    case "lastUpdateId" -> {
                        if (valueToken != JsonToken.VALUE_NUMBER_INT) {
                            throw malformed("lastUpdateId is not an integer", status, body, null);
                        }
                        lastUpdateId = parser.getLongValue();
                    }
                    case "bids" -> bids = readLevels(parser, status, body);
                    case "asks" -> asks = readLevels(parser, status, body);
                    default -> parser.skipChildren();
                }
            }

            if (bids == null || asks == null) {
                throw malformed("Snapshot is missing bids or asks", status, body, null);
            }
            return new DepthSnapshot(symbol, lastUpdateId, bids, asks);
        } catch (IOException | IllegalArgumentException e) {
            throw malformed("Unparseable snapshot body", status, body, e);
        }
    }

    private List<OrderBookLevel> readLevels(JsonParser parser, int status, String body) throws IOException {
        if (parser.currentToken() != JsonToken.START_ARRAY) {
            throw malformed("Level list is not an array", status, body, null);
        }

        List<OrderBookLevel> levels = new ArrayList<>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token != JsonToken.START_ARRAY) {
                throw malformed("Level entry is not an array", status, body, null);
            }
            BigDecimal price = readDecimal(parser, status, body);
            BigDecimal quantity = readDecimal(parser, status, body);
            levels.add(new OrderBookLevel(price, quantity));

            // Skip any trailing entries of the level array
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token == null) {
                    throw malformed("Truncated level entry", status, body, null);
                }
                parser.skipChildren();
            }
        }
        return levels;
    }

    private BigDecimal readDecimal(JsonParser parser, int status, String body) throws IOException {
        JsonToken token = parser.nextToken();
        if (token == JsonToken.VALUE_STRING) {
            return new BigDecimal(parser.getText());
        }
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return parser.getDecimalValue();
        }
        throw malformed("Level value is not a decimal: " + token, status, body, null);
    }

    private static SnapshotFetchException malformed(String message, int status, String body, Throwable cause) {
        return new SnapshotFetchException(message, status, body, cause);
    }
}
