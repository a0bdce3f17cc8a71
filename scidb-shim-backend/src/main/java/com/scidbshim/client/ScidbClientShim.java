package com.scidbshim.client;

import com.scidbshim.model.QueryId;
import com.scidbshim.model.QueryResult;

import java.util.Objects;

/**
 * {@link ScidbClient} wrapper for clients loaded from a plugin class loader.
 *
 * <p>Each call runs with the plugin's class loader as the thread context class loader, since
 * client libraries commonly resolve their own resources through it. Everything else is
 * delegated unchanged.
 */
public class ScidbClientShim implements ScidbClient {
    private final ScidbClient delegate;
    private final ClassLoader classLoader;

    /**
     * Create a client shim.
     *
     * @param delegate actual client
     * @param classLoader class loader the client was loaded from
     */
    public ScidbClientShim(ScidbClient delegate, ClassLoader classLoader) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.classLoader = classLoader != null ? classLoader : delegate.getClass().getClassLoader();
    }

    public ScidbClient getDelegate() {
        return delegate;
    }

    @Override
    public Object connect(SessionProperties properties, String host, int port) throws ScidbException {
        ClassLoader previous = enter();
        try {
            return delegate.connect(properties, host, port);
        } finally {
            leave(previous);
        }
    }

    @Override
    public void disconnect(Object connection) throws ScidbException {
        ClassLoader previous = enter();
        try {
            delegate.disconnect(connection);
        } finally {
            leave(previous);
        }
    }

    @Override
    public QueryResult newQueryResult() {
        ClassLoader previous = enter();
        try {
            return delegate.newQueryResult();
        } finally {
            leave(previous);
        }
    }

    @Override
    public void freeQueryResult(QueryResult result) {
        ClassLoader previous = enter();
        try {
            delegate.freeQueryResult(result);
        } finally {
            leave(previous);
        }
    }

    @Override
    public void prepareQuery(String query, boolean afl, String programOptions, QueryResult result, Object connection)
            throws ScidbException {
        ClassLoader previous = enter();
        try {
            delegate.prepareQuery(query, afl, programOptions, result, connection);
        } finally {
            leave(previous);
        }
    }

    @Override
    public void executeQuery(String query, boolean afl, QueryResult result, Object connection) throws ScidbException {
        ClassLoader previous = enter();
        try {
            delegate.executeQuery(query, afl, result, connection);
        } finally {
            leave(previous);
        }
    }

    @Override
    public void completeQuery(QueryId queryId, Object connection) throws ScidbException {
        ClassLoader previous = enter();
        try {
            delegate.completeQuery(queryId, connection);
        } finally {
            leave(previous);
        }
    }

    private ClassLoader enter() {
        Thread current = Thread.currentThread();
        ClassLoader previous = current.getContextClassLoader();
        current.setContextClassLoader(classLoader);
        return previous;
    }

    private static void leave(ClassLoader previous) {
        Thread.currentThread().setContextClassLoader(previous);
    }
}
