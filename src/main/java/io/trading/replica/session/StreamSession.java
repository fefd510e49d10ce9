package io.trading.replica.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.replica.book.PriceLevelBook;
import io.trading.replica.model.DepthSnapshot;
import io.trading.replica.model.DepthUpdate;
import io.trading.replica.snapshot.SnapshotFetchException;
import io.trading.replica.transport.StreamConnection;
import io.trading.replica.transport.StreamConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Replicates the order book of one symbol from one depth stream.
 *
 * Lifecycle: CREATED -> CONNECTING -> OPEN -> CLOSING -> CLOSED.
 * While open the session keeps exactly one receive outstanding. Each frame is parsed,
 * merged into the book (bootstrapping it from a REST snapshot on the first update
 * that finds it empty), handed to the frame listener, and after the pacing delay the
 * next receive is issued. The loop ends when the registry no longer lists the session
 * as open, when a receive is cancelled, or on the first error.
 *
 * All steps run on the shared dispatcher thread.
 */
public class StreamSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamSession.class);

    private final SessionId id;
    private final URI streamUri;
    private final SessionContext context;
    private final PriceLevelBook book;
    private final DepthFrameParser parser = new DepthFrameParser();
    private final CompletableFuture<SessionState> termination = new CompletableFuture<>();

    private volatile SessionState state = SessionState.CREATED;
    private volatile Throwable failure;
    private SessionRegistry registry;
    private StreamConnection connection;

    public StreamSession(SessionId id, URI streamUri, SessionContext context) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (streamUri == null) {
            throw new IllegalArgumentException("streamUri cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.id = id;
        this.streamUri = streamUri;
        this.context = context;
        this.book = new PriceLevelBook(id.symbol());
    }

    public SessionId id() {
        return id;
    }

    public URI streamUri() {
        return streamUri;
    }

    public SessionState state() {
        return state;
    }

    /**
     * The session's book. Only safe to read from the dispatcher thread.
     */
    public PriceLevelBook book() {
        return book;
    }

    /**
     * The error that terminated the session, if any.
     */
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Completes with {@link SessionState#CLOSED} once the session has shut down cleanly,
     * or exceptionally with the error that terminated it.
     */
    public CompletableFuture<SessionState> terminationFuture() {
        return termination;
    }

    /**
     * Starts connecting. Called by the registry after it claimed this session's id.
     */
    void start(SessionRegistry owner) {
        if (state != SessionState.CREATED) {
            throw new IllegalStateException("Session " + id + " already started (state=" + state + ")");
        }
        this.registry = owner;
        this.state = SessionState.CONNECTING;
        LOGGER.info("[{}] Starting stream: {}", id, streamUri);

        try {
            context.dispatcher().execute(this::connect);
        } catch (RejectedExecutionException e) {
            terminate(e);
        }
    }

    private void connect() {
        CompletableFuture<StreamConnection> connecting;
        try {
            connecting = context.transport().connect(streamUri, id.value());
        } catch (RuntimeException e) {
            // e.g. a stream URL whose host cannot be resolved from the URI
            terminate(e);
            return;
        }
        connecting.whenCompleteAsync(this::onConnected, context.dispatcher());
    }

    private void onConnected(StreamConnection openedConnection, Throwable error) {
        if (error != null) {
            terminate(unwrap(error));
            return;
        }

        this.connection = openedConnection;
        if (!registry.isOpen(id, this)) {
            LOGGER.info("[{}] Session closed while connecting", id);
            close();
            return;
        }

        state = SessionState.OPEN;
        context.metrics().setSessionOpen(id, true);
        LOGGER.info("[{}] Session open", id);
        receiveNext();
    }

    private void receiveNext() {
        if (state != SessionState.OPEN) {
            return;
        }
        if (!registry.isOpen(id, this)) {
            LOGGER.info("[{}] Session no longer open, stopping", id);
            close();
            return;
        }

        CompletableFuture<String> receive;
        try {
            receive = connection.receive();
        } catch (RuntimeException e) {
            terminate(e);
            return;
        }

        if (!registry.recordPending(id, this, receive)) {
            // Closed between the open check and recording the receive
            receive.cancel(true);
            close();
            return;
        }

        receive.whenCompleteAsync((frame, error) -> onReceived(receive, frame, error), context.dispatcher());
    }

    private void onReceived(CompletableFuture<String> receive, String frame, Throwable error) {
        registry.clearPending(id, receive);

        if (error != null) {
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) {
                LOGGER.info("[{}] Receive cancelled, closing session", id);
                close();
            } else {
                terminate(cause);
            }
            return;
        }

        long startNanos = System.nanoTime();
        try {
            process(frame);
        } catch (RuntimeException e) {
            terminate(e);
            return;
        }
        context.metrics().recordFrameLatency(id, (System.nanoTime() - startNanos) / 1_000_000.0);

        scheduleNextReceive();
    }

    /**
     * Parses one frame, merges any depth update it carries and notifies the listener.
     */
    void process(String text) {
        context.metrics().recordFrameReceived(id);

        JsonNode frame = parser.parse(text);
        JsonNode payload = parser.unwrap(frame, id.kind());

        if (parser.isDepthUpdate(payload)) {
            DepthUpdate update = parser.toDepthUpdate(payload);
            if (book.isEmpty()) {
                bootstrap(update.symbol());
            }
            book.applyUpdate(update);
            context.metrics().recordDeltasApplied(id, update.bids().size() + update.asks().size());
            LOGGER.debug("[{}] Applied update U={} u={} ({} bids, {} asks)",
                id, update.firstUpdateId(), update.finalUpdateId(), update.bids().size(), update.asks().size());
        }

        try {
            context.listener().onFrame(id, payload, book);
        } catch (RuntimeException e) {
            context.metrics().recordListenerError(id);
            LOGGER.error("[{}] Frame listener failed", id, e);
        }
    }

    private void bootstrap(String symbol) {
        // No update id comparison: the snapshot may postdate the update applied on top of it
        DepthSnapshot snapshot = context.snapshotFetcher().fetch(symbol, id.kind(), context.depthLimit());
        book.applySnapshot(snapshot);
        context.metrics().recordSnapshotFetch(id);
        LOGGER.info("[{}] Book bootstrapped from snapshot lastUpdateId={}: {}", id, snapshot.lastUpdateId(), book);
    }

    private void scheduleNextReceive() {
        try {
            if (context.pacingMs() > 0) {
                context.dispatcher().schedule(this::receiveNext, context.pacingMs(), TimeUnit.MILLISECONDS);
            } else {
                context.dispatcher().execute(this::receiveNext);
            }
        } catch (RejectedExecutionException e) {
            LOGGER.info("[{}] Dispatcher stopped, closing session", id);
            close();
        }
    }

    private void terminate(Throwable cause) {
        failure = cause;
        String errorType = errorType(cause);
        context.metrics().recordSessionError(id, errorType);

        if (cause instanceof SnapshotFetchException fetchError) {
            LOGGER.error("[{}] Snapshot bootstrap failed (status={}), stopping session: {}",
                id, fetchError.getStatusCode(), fetchError.getResponseBody(), fetchError);
        } else if (cause instanceof MalformedFrameException malformed) {
            LOGGER.error("[{}] Malformed frame, stopping session: {}", id, malformed.getFrame(), malformed);
        } else if (cause instanceof StreamConnectionException) {
            LOGGER.error("[{}] Connection lost, stopping session", id, cause);
        } else {
            LOGGER.error("[{}] Session failed", id, cause);
        }

        close();
    }

    private void close() {
        if (state == SessionState.CLOSED) {
            return;
        }
        state = SessionState.CLOSING;

        if (connection != null) {
            connection.close();
        }
        if (registry != null) {
            registry.deregister(id, this);
        }
        context.metrics().setSessionOpen(id, false);

        state = SessionState.CLOSED;
        LOGGER.info("[{}] Session closed", id);

        if (failure != null) {
            termination.completeExceptionally(failure);
        } else {
            termination.complete(SessionState.CLOSED);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String errorType(Throwable cause) {
        if (cause instanceof SnapshotFetchException) {
            return "snapshot_fetch";
        }
        if (cause instanceof MalformedFrameException) {
            return "malformed_frame";
        }
        if (cause instanceof StreamConnectionException) {
            return "connection";
        }
        return "internal";
    }

    @Override
    public String toString() {
        return "StreamSession{" + id + ", state=" + state + '}';
    }
}
