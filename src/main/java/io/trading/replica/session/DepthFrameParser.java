package io.trading.replica.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.replica.model.DepthUpdate;
import io.trading.replica.model.MarketKind;
import io.trading.replica.model.OrderBookLevel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes depth stream frames.
 *
 * Spot frame:
 * <pre>
 * {"e":"depthUpdate","E":1704067200000,"s":"BTCUSDT","U":157,"u":160,
 *  "b":[["0.0024","10"]],"a":[["0.0026","100"]]}
 * </pre>
 * Derivative (combined stream) frames wrap the same payload:
 * {@code {"stream":"btcusd_perp@depth","data":{...}}}.
 */
public class DepthFrameParser {

    public static final String DEPTH_UPDATE_EVENT = "depthUpdate";

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    /**
     * Parses frame text into a JSON object.
     *
     * @throws MalformedFrameException if the text is not a JSON object
     */
    public JsonNode parse(String text) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Frame is not valid JSON", text, e);
        }
        if (frame == null || !frame.isObject()) {
            throw new MalformedFrameException("Frame is not a JSON object", text);
        }
        return frame;
    }

    /**
     * Strips the combined-stream envelope for market kinds that use one.
     *
     * @throws MalformedFrameException if an enveloped frame has no {@code data} object
     */
    public JsonNode unwrap(JsonNode frame, MarketKind kind) {
        if (!kind.isEnveloped()) {
            return frame;
        }
        JsonNode data = frame.get("data");
        if (data == null || !data.isObject()) {
            throw new MalformedFrameException("Enveloped frame has no data object", frame.toString());
        }
        return data;
    }

    /**
     * Whether the payload is a depth update event.
     */
    public boolean isDepthUpdate(JsonNode payload) {
        return DEPTH_UPDATE_EVENT.equals(payload.path("e").asText(null));
    }

    /**
     * Decodes a depth update payload.
     *
     * @throws MalformedFrameException if the symbol or either level list is missing or invalid
     */
    public DepthUpdate toDepthUpdate(JsonNode payload) {
        JsonNode symbol = payload.get("s");
        if (symbol == null || !symbol.isTextual() || symbol.asText().isEmpty()) {
            throw new MalformedFrameException("Depth update has no symbol", payload.toString());
        }

        return new DepthUpdate(
            symbol.asText(),
            payload.path("E").asLong(-1),
            payload.path("U").asLong(-1),
            payload.path("u").asLong(-1),
            readLevels(payload, "b"),
            readLevels(payload, "a")
        );
    }

    private List<OrderBookLevel> readLevels(JsonNode payload, String field) {
        JsonNode levels = payload.get(field);
        if (levels == null || !levels.isArray()) {
            throw new MalformedFrameException("Depth update field '" + field + "' is not an array", payload.toString());
        }

        List<OrderBookLevel> result = new ArrayList<>(levels.size());
        for (JsonNode level : levels) {
            if (!level.isArray() || level.size() < 2) {
                throw new MalformedFrameException("Invalid level in '" + field + "': " + level, payload.toString());
            }
            try {
                result.add(new OrderBookLevel(decimal(level.get(0)), decimal(level.get(1))));
            } catch (IllegalArgumentException e) {
                throw new MalformedFrameException("Invalid level in '" + field + "': " + level, payload.toString(), e);
            }
        }
        return result;
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node.isTextual()) {
            return new BigDecimal(node.asText());
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        throw new IllegalArgumentException("Not a decimal: " + node);
    }
}
