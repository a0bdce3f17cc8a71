package com.scidbshim.client;

import com.scidbshim.model.QueryId;
import com.scidbshim.model.QueryResult;

/**
 * Blocking client for a SciDB cluster.
 *
 * <p>Every method except {@link #newQueryResult()} and {@link #freeQueryResult(QueryResult)}
 * performs a network round trip. Connections are opaque objects issued by
 * {@link #connect}; callers only pass them back. Implementations are loaded at runtime by
 * {@link ScidbClientLoader}.
 */
public interface ScidbClient {

    /**
     * Open an authenticated session.
     *
     * @param properties credentials and priority for this session
     * @param host coordinator host
     * @param port coordinator port
     * @return opaque connection object, never shared with another session
     * @throws ScidbException if the backend refuses the connection
     */
    Object connect(SessionProperties properties, String host, int port) throws ScidbException;

    /**
     * Close a session opened by {@link #connect}. The connection object is invalid afterwards.
     *
     * @param connection connection to close
     * @throws ScidbException if the backend reports a failure while closing
     */
    void disconnect(Object connection) throws ScidbException;

    /**
     * Allocate an empty query result.
     *
     * @return new query result, or null if none could be allocated
     */
    QueryResult newQueryResult();

    /**
     * Release a query result allocated by {@link #newQueryResult()}.
     *
     * @param result query result to release
     */
    void freeQueryResult(QueryResult result);

    /**
     * Parse and plan a query without executing it. On success the result carries a valid
     * query id and the backend's auto-commit decision.
     *
     * @param query query text
     * @param afl true for AFL, false for AQL
     * @param programOptions backend program options, usually empty
     * @param result query result to populate
     * @param connection session connection
     * @throws ScidbException if the query cannot be prepared
     */
    void prepareQuery(String query, boolean afl, String programOptions, QueryResult result, Object connection)
            throws ScidbException;

    /**
     * Execute a previously prepared query.
     *
     * @param query query text
     * @param afl true for AFL, false for AQL
     * @param result prepared query result
     * @param connection session connection
     * @throws RollbackException if the statement rolled back the open transaction
     * @throws ScidbException if execution fails
     */
    void executeQuery(String query, boolean afl, QueryResult result, Object connection) throws ScidbException;

    /**
     * Commit a query that the backend did not commit implicitly.
     *
     * @param queryId query to complete
     * @param connection session connection
     * @throws ScidbException if completion fails
     */
    void completeQuery(QueryId queryId, Object connection) throws ScidbException;
}
