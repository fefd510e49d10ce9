package io.trading.replica.session;

import io.trading.replica.model.DepthSnapshot;
import io.trading.replica.model.MarketKind;
import io.trading.replica.model.OrderBookLevel;
import io.trading.replica.snapshot.SnapshotFetchException;
import io.trading.replica.snapshot.SnapshotFetcher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Returns a fixed two-level snapshot for every symbol and records each request.
 */
class FakeSnapshotFetcher implements SnapshotFetcher {

    record Request(String symbol, MarketKind kind, int depthLimit) {}

    private final List<Request> requests = new CopyOnWriteArrayList<>();
    private volatile SnapshotFetchException failure;

    @Override
    public DepthSnapshot fetch(String symbol, MarketKind kind, int depthLimit) {
        requests.add(new Request(symbol, kind, depthLimit));
        if (failure != null) {
            throw failure;
        }
        return new DepthSnapshot(
            symbol,
            1000,
            List.of(OrderBookLevel.of("100.0", "1.0"), OrderBookLevel.of("99.0", "2.0")),
            List.of(OrderBookLevel.of("101.0", "1.0"), OrderBookLevel.of("102.0", "3.0"))
        );
    }

    void failWith(SnapshotFetchException exception) {
        this.failure = exception;
    }

    List<Request> requests() {
        return requests;
    }
}
