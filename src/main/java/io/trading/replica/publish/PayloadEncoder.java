package io.trading.replica.publish;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * JSON encoder for published book payloads.
 * Thread-safe and reusable.
 */
public class PayloadEncoder {

    private final ObjectMapper objectMapper;

    public PayloadEncoder() {
        // Plain decimal notation for prices like 1E-8
        this.objectMapper = new ObjectMapper()
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    public byte[] encode(BookSnapshotPayload payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode payload for " + payload.symbol(), e);
        }
    }

    public BookSnapshotPayload decode(byte[] bytes) {
        try {
            return objectMapper.readValue(bytes, BookSnapshotPayload.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid book payload", e);
        }
    }
}
