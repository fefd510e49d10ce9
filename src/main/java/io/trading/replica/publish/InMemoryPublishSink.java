package io.trading.replica.publish;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps the latest payload per symbol. Backs the book lookup endpoint.
 */
public class InMemoryPublishSink implements PublishSink {

    private final ConcurrentMap<String, byte[]> latest = new ConcurrentHashMap<>();

    @Override
    public boolean publish(String symbol, byte[] payload) {
        latest.put(symbol.toUpperCase(Locale.ROOT), payload.clone());
        return true;
    }

    public Optional<byte[]> latest(String symbol) {
        byte[] payload = latest.get(symbol.toUpperCase(Locale.ROOT));
        return payload == null ? Optional.empty() : Optional.of(payload.clone());
    }

    public Set<String> symbols() {
        return new TreeSet<>(latest.keySet());
    }

    @Override
    public void close() {
        latest.clear();
    }
}
