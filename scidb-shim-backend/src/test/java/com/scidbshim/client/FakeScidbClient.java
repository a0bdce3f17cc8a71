package com.scidbshim.client;

import com.scidbshim.model.QueryId;
import com.scidbshim.model.QueryResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory client for tests. Counts allocations and frees per result instance, so a
 * double free shows up in {@link #getDoubleFrees()}, and lets a test script failures.
 *
 * <p>Queries whose text contains {@code rollback} fail execution with a
 * {@link RollbackException}; queries containing {@code fail(} fail with a {@link ScidbException}.
 */
public class FakeScidbClient implements ScidbClient {

    public static final long COORDINATOR_ID = 1L;

    /**
     * Connection object handed out by {@link #connect}.
     */
    public static final class FakeConnection {
        private final String host;
        private final int port;
        private final SessionProperties properties;
        private volatile boolean closed;

        FakeConnection(String host, int port, SessionProperties properties) {
            this.host = host;
            this.port = port;
            this.properties = properties;
        }

        public String getHost() {
            return host;
        }

        public int getPort() {
            return port;
        }

        public SessionProperties getProperties() {
            return properties;
        }

        public boolean isClosed() {
            return closed;
        }
    }

    private final AtomicLong nextQueryId = new AtomicLong(100);
    private final Set<QueryResult> live = Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));
    private final AtomicInteger allocations = new AtomicInteger();
    private final AtomicInteger frees = new AtomicInteger();
    private final AtomicInteger doubleFrees = new AtomicInteger();
    private final AtomicInteger disconnects = new AtomicInteger();

    private final List<SessionProperties> connectProperties = Collections.synchronizedList(new ArrayList<>());
    private final List<String> preparedQueries = Collections.synchronizedList(new ArrayList<>());
    private final List<String> executedQueries = Collections.synchronizedList(new ArrayList<>());
    private final List<QueryId> completedQueries = Collections.synchronizedList(new ArrayList<>());
    private final List<Boolean> aflFlags = Collections.synchronizedList(new ArrayList<>());

    private volatile ScidbException connectFailure;
    private volatile boolean connectReturnsNull;
    private volatile ScidbException disconnectFailure;
    private volatile boolean allocationFails;
    private volatile Exception prepareFailure;
    private volatile Exception executeFailure;
    private volatile Exception completeFailure;
    private volatile RuntimeException freeFailure;
    private volatile boolean autoCommit;

    @Override
    public Object connect(SessionProperties properties, String host, int port) throws ScidbException {
        connectProperties.add(properties);
        if (connectFailure != null) {
            throw connectFailure;
        }
        if (connectReturnsNull) {
            return null;
        }
        return new FakeConnection(host, port, properties);
    }

    @Override
    public void disconnect(Object connection) throws ScidbException {
        if (disconnectFailure != null) {
            throw disconnectFailure;
        }
        ((FakeConnection) connection).closed = true;
        disconnects.incrementAndGet();
    }

    @Override
    public QueryResult newQueryResult() {
        if (allocationFails) {
            return null;
        }
        QueryResult result = new QueryResult();
        live.add(result);
        allocations.incrementAndGet();
        return result;
    }

    @Override
    public void freeQueryResult(QueryResult result) {
        if (live.remove(result)) {
            frees.incrementAndGet();
        } else {
            doubleFrees.incrementAndGet();
        }
        if (freeFailure != null) {
            throw freeFailure;
        }
    }

    @Override
    public void prepareQuery(String query, boolean afl, String programOptions, QueryResult result, Object connection)
            throws ScidbException {
        preparedQueries.add(query);
        aflFlags.add(afl);
        rethrow(prepareFailure);
        result.setQueryId(QueryId.of(COORDINATOR_ID, nextQueryId.getAndIncrement()));
    }

    @Override
    public void executeQuery(String query, boolean afl, QueryResult result, Object connection) throws ScidbException {
        executedQueries.add(query);
        if (query != null && query.contains("rollback")) {
            throw new RollbackException("transaction rolled back");
        }
        if (query != null && query.contains("fail(")) {
            throw new ScidbException(0, 0L, "scripted failure");
        }
        rethrow(executeFailure);
        result.setAutoCommit(autoCommit);
    }

    @Override
    public void completeQuery(QueryId queryId, Object connection) throws ScidbException {
        completedQueries.add(queryId);
        rethrow(completeFailure);
    }

    private static void rethrow(Exception failure) throws ScidbException {
        if (failure instanceof ScidbException) {
            throw (ScidbException) failure;
        }
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
    }

    public void failConnect(ScidbException e) {
        this.connectFailure = e;
    }

    public void returnNullConnection() {
        this.connectReturnsNull = true;
    }

    public void failDisconnect(ScidbException e) {
        this.disconnectFailure = e;
    }

    public void failAllocation() {
        this.allocationFails = true;
    }

    public void failPrepare(Exception e) {
        this.prepareFailure = e;
    }

    public void failExecute(Exception e) {
        this.executeFailure = e;
    }

    public void failComplete(Exception e) {
        this.completeFailure = e;
    }

    public void failFree(RuntimeException e) {
        this.freeFailure = e;
    }

    public void setAutoCommit(boolean autoCommit) {
        this.autoCommit = autoCommit;
    }

    public int getAllocations() {
        return allocations.get();
    }

    public int getFrees() {
        return frees.get();
    }

    public int getDoubleFrees() {
        return doubleFrees.get();
    }

    public int getLiveResults() {
        return live.size();
    }

    public int getDisconnects() {
        return disconnects.get();
    }

    public SessionProperties getLastConnectProperties() {
        synchronized (connectProperties) {
            return connectProperties.isEmpty() ? null : connectProperties.get(connectProperties.size() - 1);
        }
    }

    public List<String> getPreparedQueries() {
        return List.copyOf(preparedQueries);
    }

    public List<String> getExecutedQueries() {
        return List.copyOf(executedQueries);
    }

    public List<QueryId> getCompletedQueries() {
        return List.copyOf(completedQueries);
    }

    public List<Boolean> getAflFlags() {
        return List.copyOf(aflFlags);
    }
}
