package io.trading.replica.publish;

import org.agrona.ExpandableArrayBuffer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PublishSinkTest {

    @Test
    void testInMemorySinkKeepsLatestPayloadPerSymbol() {
        InMemoryPublishSink sink = new InMemoryPublishSink();

        sink.publish("BTCUSDT", bytes("first"));
        sink.publish("btcusdt", bytes("second"));
        sink.publish("ETHUSDT", bytes("eth"));

        assertEquals("second", new String(sink.latest("BTCUSDT").orElseThrow(), StandardCharsets.UTF_8));
        assertEquals(Set.of("BTCUSDT", "ETHUSDT"), sink.symbols());
        assertTrue(sink.latest("BNBUSDT").isEmpty());

        sink.close();
        assertTrue(sink.symbols().isEmpty());
    }

    @Test
    void testInMemorySinkIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            InMemoryPublishSink sink = new InMemoryPublishSink();
            sink.publish("linkusdt", bytes("link"));

            assertEquals(Set.of("LINKUSDT"), sink.symbols());
            assertTrue(sink.latest("LINKUSDT").isPresent());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testInMemorySinkCopiesPayload() {
        InMemoryPublishSink sink = new InMemoryPublishSink();
        byte[] payload = bytes("abc");

        sink.publish("BTCUSDT", payload);
        payload[0] = 'z';

        assertEquals("abc", new String(sink.latest("BTCUSDT").orElseThrow(), StandardCharsets.UTF_8));
    }

    @Test
    void testCompositeSinkFansOut() {
        InMemoryPublishSink first = new InMemoryPublishSink();
        InMemoryPublishSink second = new InMemoryPublishSink();
        CompositePublishSink composite = new CompositePublishSink(List.of(first, second));

        assertTrue(composite.publish("BTCUSDT", bytes("book")));

        assertTrue(first.latest("BTCUSDT").isPresent());
        assertTrue(second.latest("BTCUSDT").isPresent());
        assertThrows(IllegalArgumentException.class, () -> new CompositePublishSink(List.of()));
    }

    @Test
    void testAeronFraming() {
        ExpandableArrayBuffer buffer = new ExpandableArrayBuffer(16);

        int length = AeronPublishSink.encode(buffer, "BTCUSDT", bytes("{\"a\":1}"));

        assertEquals(Integer.BYTES + 7 + 7, length);
        assertEquals(7, buffer.getInt(0));
        assertEquals("BTCUSDT", buffer.getStringWithoutLengthUtf8(Integer.BYTES, 7));
        assertEquals("{\"a\":1}", buffer.getStringWithoutLengthUtf8(Integer.BYTES + 7, 7));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
