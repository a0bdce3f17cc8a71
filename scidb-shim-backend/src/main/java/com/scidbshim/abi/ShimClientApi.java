package com.scidbshim.abi;

import com.scidbshim.config.ShimProperties;
import com.scidbshim.model.QueryId;
import com.scidbshim.service.ConnectResult;
import com.scidbshim.service.ConnectionManager;
import com.scidbshim.service.PrepareResult;
import com.scidbshim.service.QueryLanguage;
import com.scidbshim.service.QueryLifecycleController;
import com.scidbshim.service.QueryResultHandle;
import com.scidbshim.service.QueryStepResult;
import com.scidbshim.service.SessionHandle;
import com.scidbshim.service.ShimStatus;
import org.springframework.stereotype.Component;

/**
 * Int-coded client surface for callers that cannot take status objects or exceptions.
 *
 * <p>Every function returns a {@link ShimStatus} code and writes error text into a
 * caller-supplied {@link ErrorBuffer}. Session and query-result handles cross as opaque
 * values in {@link OpaqueRef} slots; callers only pass them back unchanged.
 *
 * <pre>
 * scidbConnect          -> ConnectionManager.connect
 * scidbDisconnect       -> ConnectionManager.disconnect (0 success, 1 failure)
 * initQueryResult       -> QueryLifecycleController.allocate
 * prepareQuery          -> QueryLifecycleController.prepareInto
 * executePreparedQuery  -> QueryLifecycleController.execute
 * completeQuery         -> QueryLifecycleController.complete
 * executeQuery          -> prepare + execute + complete
 * </pre>
 */
@Component
public class ShimClientApi {
    private final ConnectionManager connectionManager;
    private final QueryLifecycleController controller;
    private final int errorBufferSize;

    public ShimClientApi(ConnectionManager connectionManager, QueryLifecycleController controller, ShimProperties properties) {
        this.connectionManager = connectionManager;
        this.controller = controller;
        this.errorBufferSize = properties.getErrorBufferSize();
    }

    /**
     * @return an empty error buffer of the configured capacity
     */
    public ErrorBuffer newErrorBuffer() {
        return new ErrorBuffer(errorBufferSize);
    }

    /**
     * Connect to a coordinator.
     *
     * @param host coordinator host
     * @param port coordinator port
     * @param username user name, may be null
     * @param password password, may be null
     * @param isAdmin request admin priority
     * @param con receives the session handle, or null on failure
     * @return {@link ShimStatus#CONNECTION_SUCCESSFUL}, {@link ShimStatus#ERROR_CANT_CONNECT} or
     *         {@link ShimStatus#ERROR_AUTHENTICATION} code
     */
    public int scidbConnect(String host, int port, String username, String password, boolean isAdmin,
                            OpaqueRef<SessionHandle> con) {
        ConnectResult result = connectionManager.connect(host, port, username, password, isAdmin);
        con.set(result.getHandle());
        return result.getStatus().getCode();
    }

    /**
     * @param con session to close; invalid afterwards
     * @return 0 on success, 1 on failure
     */
    public int scidbDisconnect(SessionHandle con) {
        return connectionManager.disconnect(con) ? 0 : 1;
    }

    /**
     * @return a new unprepared AFL query result, or null if none could be allocated
     */
    public QueryResultHandle initQueryResult() {
        return controller.allocate(QueryLanguage.AFL);
    }

    public void freeQueryResult(QueryResultHandle queryResult) {
        controller.release(queryResult);
    }

    public QueryId queryResultToId(QueryResultHandle queryResult) {
        return queryResult != null ? queryResult.getQueryId() : QueryId.NONE;
    }

    /**
     * Prepare a query into the result held by {@code queryResult}. On failure the result is
     * freed and the slot cleared.
     *
     * @return {@link ShimStatus#PREPARATION_SUCCESS}, {@link ShimStatus#NO_QUERY_RESULT_OBJ},
     *         {@link ShimStatus#PREPARATION_ERROR} or {@link ShimStatus#NO_SCIDB_CONNECTION} code
     */
    public int prepareQuery(SessionHandle con, String query, OpaqueRef<QueryResultHandle> queryResult, ErrorBuffer err) {
        err.clear();
        PrepareResult result = controller.prepareInto(con, query, queryResult.get());
        if (!result.isPrepared()) {
            queryResult.clear();
            err.write(result.getMessage());
        }
        return result.getStatus().getCode();
    }

    /**
     * Execute a prepared query. On rollback or failure the result is freed but the slot keeps
     * the released handle, so a {@link #completeQuery} issued anyway reports
     * {@link ShimStatus#COMPLETION_INVALID}. Only {@link ShimStatus#EXECUTION_SUCCESS} needs a
     * completion.
     */
    public int executePreparedQuery(SessionHandle con, String query, OpaqueRef<QueryResultHandle> queryResult,
                                    boolean fetch, ErrorBuffer err) {
        err.clear();
        QueryStepResult result = controller.execute(con, query, queryResult.get(), fetch);
        if (!result.requiresCompletion()) {
            err.write(result.getMessage());
        }
        return result.getStatus().getCode();
    }

    /**
     * Complete an executed query. The slot keeps the released handle, so a repeated call
     * reports {@link ShimStatus#COMPLETION_INVALID} instead of freeing twice.
     */
    public int completeQuery(SessionHandle con, OpaqueRef<QueryResultHandle> queryResult, ErrorBuffer err) {
        err.clear();
        QueryStepResult result = controller.complete(con, queryResult.get());
        err.write(result.getMessage());
        return result.getStatus().getCode();
    }

    /**
     * Run a query from prepare to completion.
     *
     * @param con open session
     * @param query query text
     * @param afl true for AFL, false for AQL
     * @param err receives the error text of the failing step
     * @return id of the query, or {@link QueryId#NONE} on failure
     */
    public QueryId executeQuery(SessionHandle con, String query, boolean afl, ErrorBuffer err) {
        err.clear();
        PrepareResult prepared = controller.prepare(con, query, afl ? QueryLanguage.AFL : QueryLanguage.AQL);
        if (!prepared.isPrepared()) {
            err.write(prepared.getMessage());
            return QueryId.NONE;
        }

        QueryResultHandle handle = prepared.getHandle();
        QueryStepResult executed = controller.execute(con, query, handle, true);
        if (executed.getStatus() == ShimStatus.TRANSACTION_ROLLBACK) {
            return executed.getQueryId();
        }
        if (!executed.requiresCompletion()) {
            err.write(executed.getMessage());
            return QueryId.NONE;
        }

        QueryStepResult completed = controller.complete(con, handle);
        if (completed.isUserVisibleFailure()) {
            err.write(completed.getMessage());
            return QueryId.NONE;
        }
        return completed.getQueryId();
    }
}
