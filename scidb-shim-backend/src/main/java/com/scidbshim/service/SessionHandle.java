package com.scidbshim.service;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caller-owned handle to one authenticated backend session.
 *
 * <p>The wrapped connection object is opaque. Each lifecycle step holds the handle's lock
 * for its whole backend round trip, so steps from different threads never interleave on
 * one session. {@link ConnectionManager#disconnect} invalidates the handle.
 */
public final class SessionHandle {
    private final String sessionId;
    private final String host;
    private final int port;
    private final String username;
    private final boolean admin;
    private final OffsetDateTime createdAt;
    private final Object connection;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicBoolean open = new AtomicBoolean(true);

    SessionHandle(String sessionId, String host, int port, String username, boolean admin, Object connection) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.host = host;
        this.port = port;
        this.username = username;
        this.admin = admin;
        this.connection = Objects.requireNonNull(connection, "connection");
        this.createdAt = OffsetDateTime.now();
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /**
     * @return user name of a fixed credential pair, or null when credentials were resolved
     *         interactively
     */
    public String getUsername() {
        return username;
    }

    public boolean isAdmin() {
        return admin;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public boolean isOpen() {
        return open.get();
    }

    Object connection() {
        return connection;
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    /**
     * Flip the handle to closed.
     *
     * @return true for the caller that closed it, false if it was already closed
     */
    boolean markClosed() {
        return open.compareAndSet(true, false);
    }

    @Override
    public String toString() {
        return "SessionHandle[" + sessionId + ", " + host + ":" + port + (open.get() ? "" : ", closed") + "]";
    }
}
