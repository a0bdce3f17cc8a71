package com.scidbshim.service;

import com.scidbshim.client.RollbackException;
import com.scidbshim.client.ScidbClient;
import com.scidbshim.client.ScidbException;
import com.scidbshim.model.QueryId;
import com.scidbshim.model.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Drives one query through prepare, execute and complete.
 *
 * <p>No backend exception leaves this class: each step returns a {@link ShimStatus} and the
 * backend's message. Whichever branch a query takes, its {@link QueryResult} is freed exactly
 * once, and always before a failure is returned.
 */
@Slf4j
@Service
public class QueryLifecycleController {

    static final String MDC_QUERY_ID = "query_id";

    private static final String NO_CONNECTION_MESSAGE = "SciDB connection not open";
    private static final String INVALID_RESULT_MESSAGE = "Invalid query result object.";

    private final ScidbClient client;

    public QueryLifecycleController(ScidbClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Allocate an unprepared query result.
     *
     * @param language dialect the query will be sent in
     * @return new handle, or null if the client could not allocate a result
     */
    public QueryResultHandle allocate(QueryLanguage language) {
        QueryResult result;
        try {
            result = client.newQueryResult();
        } catch (RuntimeException e) {
            log.error("Query result allocation failed", e);
            return null;
        }
        if (result == null) {
            log.error("Query result allocation returned nothing");
            return null;
        }
        return new QueryResultHandle(client, result, language);
    }

    public PrepareResult prepare(SessionHandle session, String query) {
        return prepare(session, query, QueryLanguage.AFL);
    }

    /**
     * Allocate a query result and prepare the query into it.
     *
     * @param session open session
     * @param query query text
     * @param language dialect of the query text
     * @return prepared handle and query id, or the failure
     */
    public PrepareResult prepare(SessionHandle session, String query, QueryLanguage language) {
        if (!isOpen(session)) {
            return PrepareResult.failed(ShimStatus.NO_SCIDB_CONNECTION, NO_CONNECTION_MESSAGE);
        }
        QueryResultHandle handle = allocate(language);
        if (handle == null) {
            return PrepareResult.failed(ShimStatus.NO_QUERY_RESULT_OBJ, "Invalid query result pointer");
        }
        return prepareInto(session, query, handle);
    }

    /**
     * Prepare a query into a handle from {@link #allocate}. The handle is freed if preparation
     * fails.
     *
     * @param session open session
     * @param query query text
     * @param handle unprepared handle
     * @return prepared handle and query id, or the failure
     */
    public PrepareResult prepareInto(SessionHandle session, String query, QueryResultHandle handle) {
        if (handle == null || handle.isReleased()) {
            return PrepareResult.failed(ShimStatus.NO_QUERY_RESULT_OBJ, "Invalid query result pointer");
        }
        if (!isOpen(session)) {
            handle.release(QueryState.PREPARE_FAILED);
            return PrepareResult.failed(ShimStatus.NO_SCIDB_CONNECTION, NO_CONNECTION_MESSAGE);
        }
        if (handle.getState() != QueryState.UNPREPARED) {
            handle.release(QueryState.PREPARE_FAILED);
            return PrepareResult.failed(ShimStatus.PREPARATION_ERROR, "Query result already used: " + handle.getState());
        }

        session.lock();
        try {
            if (!session.isOpen()) {
                handle.release(QueryState.PREPARE_FAILED);
                return PrepareResult.failed(ShimStatus.NO_SCIDB_CONNECTION, NO_CONNECTION_MESSAGE);
            }
            client.prepareQuery(query, handle.getLanguage().isAfl(), "", handle.resource(), session.connection());
        } catch (ScidbException | RuntimeException e) {
            handle.release(QueryState.PREPARE_FAILED);
            log.warn("SciDB prepare failed: session_id={}, error={}", session.getSessionId(), e.getMessage());
            return PrepareResult.failed(ShimStatus.PREPARATION_ERROR, e.getMessage());
        } finally {
            session.unlock();
        }

        handle.transition(QueryState.PREPARED);
        log.debug("Prepared SciDB query: session_id={}, query_id={}", session.getSessionId(), handle.getQueryId());
        return PrepareResult.prepared(handle);
    }

    /**
     * Execute a prepared query.
     *
     * <p>On success the caller must still call {@link #complete}. On rollback or failure the
     * handle has been released and must not be completed. A handle that was already executed
     * is rejected but kept, so it can still be completed.
     *
     * @param session session the query was prepared on
     * @param query query text
     * @param handle prepared handle
     * @param fetch whether result rows are to be streamed back
     * @return step result
     */
    public QueryStepResult execute(SessionHandle session, String query, QueryResultHandle handle, boolean fetch) {
        if (handle == null || handle.isReleased()) {
            return new QueryStepResult(ShimStatus.NO_QUERY_RESULT_OBJ, QueryId.NONE, INVALID_RESULT_MESSAGE);
        }
        QueryId queryId = handle.getQueryId();
        if (!isOpen(session)) {
            handle.release(QueryState.EXECUTE_FAILED);
            return new QueryStepResult(ShimStatus.NO_SCIDB_CONNECTION, queryId, NO_CONNECTION_MESSAGE);
        }
        if (handle.getState() == QueryState.EXECUTED) {
            return new QueryStepResult(ShimStatus.EXECUTION_ERROR, queryId, "Query already executed; complete it first");
        }
        if (handle.getState() != QueryState.PREPARED) {
            QueryState state = handle.getState();
            handle.release(QueryState.EXECUTE_FAILED);
            return new QueryStepResult(ShimStatus.EXECUTION_ERROR, queryId, "Query is not prepared: " + state);
        }

        MDC.put(MDC_QUERY_ID, queryId.toString());
        session.lock();
        try {
            if (!session.isOpen()) {
                handle.release(QueryState.EXECUTE_FAILED);
                return new QueryStepResult(ShimStatus.NO_SCIDB_CONNECTION, queryId, NO_CONNECTION_MESSAGE);
            }
            QueryResult result = handle.resource();
            result.setFetch(fetch);
            client.executeQuery(query, handle.getLanguage().isAfl(), result, session.connection());
            handle.transition(QueryState.EXECUTED);
            log.debug("Executed SciDB query: session_id={}, auto_commit={}", session.getSessionId(), result.isAutoCommit());
            return new QueryStepResult(ShimStatus.EXECUTION_SUCCESS, handle.getQueryId(), "");
        } catch (RollbackException e) {
            handle.release(QueryState.ROLLED_BACK);
            log.info("SciDB transaction rolled back: session_id={}", session.getSessionId());
            return new QueryStepResult(ShimStatus.TRANSACTION_ROLLBACK, queryId, "");
        } catch (ScidbException | RuntimeException e) {
            handle.release(QueryState.EXECUTE_FAILED);
            log.warn("SciDB execute failed: session_id={}, error={}", session.getSessionId(), e.getMessage());
            return new QueryStepResult(ShimStatus.EXECUTION_ERROR, queryId, e.getMessage());
        } finally {
            session.unlock();
            MDC.remove(MDC_QUERY_ID);
        }
    }

    /**
     * Complete an executed query and release its result.
     *
     * <p>A handle with no valid query id (already completed, rolled back or failed) yields
     * {@link ShimStatus#COMPLETION_INVALID} without contacting the backend. Auto-committed
     * queries are released without a round trip and succeed even if the session has closed
     * since. Completion is attempted once and the result is released whether it succeeds or not.
     *
     * @param session session the query ran on
     * @param handle executed handle
     * @return step result
     */
    public QueryStepResult complete(SessionHandle session, QueryResultHandle handle) {
        if (handle == null) {
            return new QueryStepResult(ShimStatus.NO_QUERY_RESULT_OBJ, QueryId.NONE, INVALID_RESULT_MESSAGE);
        }
        QueryId queryId = handle.getQueryId();
        if (!queryId.isValid()) {
            handle.release(QueryState.COMPLETED);
            return new QueryStepResult(ShimStatus.COMPLETION_INVALID, queryId, "");
        }

        MDC.put(MDC_QUERY_ID, queryId.toString());
        try {
            QueryResult result = handle.resource();
            if (result == null) {
                // Released by another thread since the id was read.
                return new QueryStepResult(ShimStatus.COMPLETION_INVALID, QueryId.NONE, "");
            }
            if (result.isAutoCommit()) {
                handle.release(QueryState.COMPLETED);
                log.debug("SciDB query auto-committed: query_id={}", queryId);
                return new QueryStepResult(ShimStatus.COMPLETION_SUCCESS, queryId, "");
            }
            if (!isOpen(session)) {
                handle.release(QueryState.COMPLETED);
                return new QueryStepResult(ShimStatus.NO_SCIDB_CONNECTION, queryId, NO_CONNECTION_MESSAGE);
            }

            session.lock();
            try {
                if (!session.isOpen()) {
                    return new QueryStepResult(ShimStatus.NO_SCIDB_CONNECTION, queryId, NO_CONNECTION_MESSAGE);
                }
                client.completeQuery(queryId, session.connection());
            } catch (ScidbException | RuntimeException e) {
                log.warn("SciDB complete failed: session_id={}, error={}", session.getSessionId(), e.getMessage());
                return new QueryStepResult(ShimStatus.COMPLETION_ERROR, queryId, e.getMessage());
            } finally {
                session.unlock();
                handle.release(QueryState.COMPLETED);
            }
            log.debug("Completed SciDB query: session_id={}", session.getSessionId());
            return new QueryStepResult(ShimStatus.COMPLETION_SUCCESS, queryId, "");
        } finally {
            MDC.remove(MDC_QUERY_ID);
        }
    }

    /**
     * Free a handle outside the normal lifecycle, e.g. one that was allocated but never
     * prepared. Safe to call on a handle that is already released.
     *
     * @param handle handle to free, may be null
     * @return true if this call freed the result
     */
    public boolean release(QueryResultHandle handle) {
        if (handle == null) {
            return false;
        }
        QueryState state = handle.getState();
        return handle.release(state.isTerminal() ? state : QueryState.COMPLETED);
    }

    private static boolean isOpen(SessionHandle session) {
        return session != null && session.isOpen();
    }
}
