package io.trading.replica.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Process-wide table of live stream sessions.
 *
 * Guarantees at most one session per id and at most one pending receive per open
 * session. Mutated by the controller thread (start, shutdown) and read by every
 * session step on the dispatcher; all access is serialized on this instance.
 */
public class SessionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<SessionId, StreamSession> open = new LinkedHashMap<>();
    private final Map<SessionId, CompletableFuture<?>> pending = new HashMap<>();
    private boolean shutdown = false;

    /**
     * Claims the session's id and starts its run loop.
     * Starting an id that is already open is a logged no-op.
     *
     * @return true if the session was started
     */
    public boolean start(StreamSession session) {
        try {
            claim(session);
        } catch (DuplicateSessionException e) {
            LOGGER.warn("Socket {} already opened, ignoring new session", e.getSessionId());
            return false;
        } catch (IllegalStateException e) {
            LOGGER.warn("Not starting {}: {}", session.id(), e.getMessage());
            return false;
        }

        try {
            session.start(this);
        } catch (RuntimeException e) {
            deregister(session.id(), session);
            throw e;
        }
        return true;
    }

    private synchronized void claim(StreamSession session) {
        if (shutdown) {
            throw new IllegalStateException("registry is shut down");
        }
        if (open.containsKey(session.id())) {
            throw new DuplicateSessionException(session.id());
        }
        open.put(session.id(), session);
    }

    /**
     * Closes one session: removes it from the open set and cancels its pending receive.
     *
     * @return true if the session was open
     */
    public boolean cancel(SessionId id) {
        CompletableFuture<?> receive;
        synchronized (this) {
            if (open.remove(id) == null) {
                return false;
            }
            receive = pending.remove(id);
        }
        if (receive != null) {
            receive.cancel(true);
        }
        LOGGER.info("Cancelled session {}", id);
        return true;
    }

    /**
     * Cancels every pending receive and clears the open set. Sessions observe the
     * closure on their next step; this method does not wait for them.
     */
    public void shutdown() {
        List<CompletableFuture<?>> receives;
        int sessionCount;
        synchronized (this) {
            shutdown = true;
            receives = new ArrayList<>(pending.values());
            sessionCount = open.size();
            pending.clear();
            open.clear();
        }

        LOGGER.info("Closing all streams ({} sessions, {} pending receives)", sessionCount, receives.size());
        for (CompletableFuture<?> receive : receives) {
            receive.cancel(true);
        }
        LOGGER.info("Closed all streams");
    }

    public synchronized boolean isOpen(SessionId id) {
        return open.containsKey(id);
    }

    /**
     * Whether the id is open and held by this particular session instance.
     */
    synchronized boolean isOpen(SessionId id, StreamSession session) {
        return open.get(id) == session;
    }

    /**
     * Records the session's outstanding receive.
     *
     * @return false if the session is no longer open; the caller must not wait on the receive
     * @throws IllegalStateException if another receive is still pending for the id
     */
    synchronized boolean recordPending(SessionId id, StreamSession session, CompletableFuture<?> receive) {
        if (open.get(id) != session) {
            return false;
        }
        CompletableFuture<?> previous = pending.get(id);
        if (previous != null && !previous.isDone()) {
            throw new IllegalStateException("Session " + id + " already has a pending receive");
        }
        pending.put(id, receive);
        return true;
    }

    synchronized void clearPending(SessionId id, CompletableFuture<?> receive) {
        pending.remove(id, receive);
    }

    /**
     * Removes a terminated session so its id can be started again.
     */
    synchronized void deregister(SessionId id, StreamSession session) {
        if (open.remove(id, session)) {
            pending.remove(id);
        }
    }

    public synchronized Set<SessionId> openSessionIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(open.keySet()));
    }

    public synchronized Optional<StreamSession> session(SessionId id) {
        return Optional.ofNullable(open.get(id));
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }
}
