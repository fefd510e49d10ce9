package io.trading.replica.netty;

import io.netty.channel.Channel;
import io.trading.replica.transport.StreamConnection;
import io.trading.replica.transport.StreamConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;

/**
 * Bridges Netty's push-style frame delivery to single-outstanding receives.
 *
 * Frames are pushed from the channel's event loop; receives are issued from the
 * session dispatcher. Both sides synchronize on this instance.
 */
class NettyStreamConnection implements StreamConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyStreamConnection.class);

    private final String name;
    private final Queue<String> frames = new ArrayDeque<>();

    private Channel channel;
    private CompletableFuture<String> pending;
    private StreamConnectionException closeCause;

    NettyStreamConnection(String name) {
        this.name = name;
    }

    synchronized void attach(Channel channel) {
        this.channel = channel;
    }

    @Override
    public synchronized CompletableFuture<String> receive() {
        if (pending != null && !pending.isDone()) {
            throw new IllegalStateException(name + ": receive already outstanding");
        }
        pending = null;

        String frame = frames.poll();
        if (frame != null) {
            return CompletableFuture.completedFuture(frame);
        }
        if (closeCause != null) {
            return CompletableFuture.failedFuture(closeCause);
        }

        pending = new CompletableFuture<>();
        return pending;
    }

    @Override
    public synchronized boolean isOpen() {
        return closeCause == null && channel != null && channel.isActive();
    }

    @Override
    public void close() {
        Channel toClose;
        synchronized (this) {
            if (closeCause == null) {
                closeCause = new StreamConnectionException(name + ": connection closed locally");
            }
            failPending();
            toClose = channel;
            channel = null;
        }
        if (toClose != null) {
            toClose.close();
            LOGGER.info("{}: Closed", name);
        }
    }

    /**
     * Called on the event loop for every text frame.
     * A cancelled receive does not consume the frame; it stays queued for the next receive.
     */
    synchronized void onFrame(String text) {
        if (pending != null && pending.complete(text)) {
            pending = null;
            return;
        }
        frames.add(text);
    }

    synchronized void onError(Throwable cause) {
        if (closeCause == null) {
            closeCause = new StreamConnectionException(name + ": transport error", cause);
        }
        failPending();
    }

    synchronized void onDisconnected() {
        if (closeCause == null) {
            closeCause = new StreamConnectionException(name + ": connection closed by peer");
        }
        failPending();
    }

    synchronized int queuedFrames() {
        return frames.size();
    }

    private void failPending() {
        if (pending != null) {
            pending.completeExceptionally(closeCause);
            pending = null;
        }
    }
}
