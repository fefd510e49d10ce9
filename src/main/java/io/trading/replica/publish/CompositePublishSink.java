package io.trading.replica.publish;

import org.agrona.CloseHelper;

import java.util.List;

/**
 * Fans a payload out to several sinks. Accepted if every sink accepted it.
 */
public class CompositePublishSink implements PublishSink {

    private final List<PublishSink> sinks;

    public CompositePublishSink(List<PublishSink> sinks) {
        if (sinks == null || sinks.isEmpty()) {
            throw new IllegalArgumentException("sinks cannot be null or empty");
        }
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public boolean publish(String symbol, byte[] payload) {
        boolean accepted = true;
        for (PublishSink sink : sinks) {
            accepted &= sink.publish(symbol, payload);
        }
        return accepted;
    }

    @Override
    public void close() {
        CloseHelper.closeAll(sinks);
    }
}
