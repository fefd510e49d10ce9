package io.trading.replica.session;

import io.trading.replica.transport.StreamConnection;
import io.trading.replica.transport.StreamConnectionException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;

/**
 * Scripted stream connection: frames pushed by the test are handed out one receive at a time.
 */
class FakeStreamConnection implements StreamConnection {

    private final Queue<String> frames = new ArrayDeque<>();
    private final List<CompletableFuture<String>> issued = new ArrayList<>();
    private CompletableFuture<String> pending;
    private Throwable failure;
    private boolean closed;
    private int receiveCount;

    synchronized void push(String frame) {
        if (pending != null && pending.complete(frame)) {
            pending = null;
            return;
        }
        frames.add(frame);
    }

    synchronized void fail(Throwable cause) {
        failure = cause;
        if (pending != null) {
            pending.completeExceptionally(cause);
            pending = null;
        }
    }

    @Override
    public synchronized CompletableFuture<String> receive() {
        if (pending != null && !pending.isDone()) {
            throw new IllegalStateException("receive already outstanding");
        }
        receiveCount++;
        String frame = frames.poll();
        if (frame != null) {
            return CompletableFuture.completedFuture(frame);
        }
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        if (closed) {
            return CompletableFuture.failedFuture(new StreamConnectionException("closed"));
        }
        pending = new CompletableFuture<>();
        issued.add(pending);
        return pending;
    }

    synchronized boolean hasPendingReceive() {
        return pending != null && !pending.isDone();
    }

    synchronized long cancelledReceives() {
        return issued.stream().filter(CompletableFuture::isCancelled).count();
    }

    synchronized int receiveCount() {
        return receiveCount;
    }

    @Override
    public synchronized boolean isOpen() {
        return !closed && failure == null;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }
}
