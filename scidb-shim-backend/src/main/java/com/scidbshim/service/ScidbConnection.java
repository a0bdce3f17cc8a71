package com.scidbshim.service;

import com.scidbshim.model.QueryId;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * One open session with exception-based query methods.
 *
 * <p>Closing the connection disconnects the session. Methods called after close fail with
 * {@link ShimStatus#NO_SCIDB_CONNECTION}.
 */
@Slf4j
public class ScidbConnection implements AutoCloseable {
    private final SessionHandle session;
    private final ConnectionManager connectionManager;
    private final QueryLifecycleController controller;

    ScidbConnection(SessionHandle session, ConnectionManager connectionManager, QueryLifecycleController controller) {
        this.session = Objects.requireNonNull(session, "session");
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.controller = Objects.requireNonNull(controller, "controller");
    }

    public SessionHandle getSession() {
        return session;
    }

    public boolean isOpen() {
        return session.isOpen();
    }

    /**
     * Prepare a query.
     *
     * @param query AFL query text
     * @return prepared handle
     */
    public QueryResultHandle prepareQuery(String query) {
        return prepareQuery(query, QueryLanguage.AFL);
    }

    public QueryResultHandle prepareQuery(String query, QueryLanguage language) {
        PrepareResult result = controller.prepare(session, query, language);
        if (!result.isPrepared()) {
            throw new ShimQueryException(result.getStatus(), result.getMessage());
        }
        return result.getHandle();
    }

    /**
     * Execute a prepared query.
     *
     * @param query query text
     * @param handle prepared handle
     * @return step result; {@link ShimStatus#TRANSACTION_ROLLBACK} is returned, not thrown
     */
    public QueryStepResult executePreparedQuery(String query, QueryResultHandle handle) {
        QueryStepResult result = controller.execute(session, query, handle, true);
        if (result.isUserVisibleFailure()) {
            throw new ShimQueryException(result.getStatus(), result.getMessage());
        }
        return result;
    }

    public QueryStepResult completeQuery(QueryResultHandle handle) {
        QueryStepResult result = controller.complete(session, handle);
        if (result.isUserVisibleFailure()) {
            throw new ShimQueryException(result.getStatus(), result.getMessage());
        }
        return result;
    }

    /**
     * Prepare, execute and complete a query.
     *
     * <p>A rolled back transaction counts as success: the rollback statement's id is returned
     * and no completion is issued.
     *
     * @param query AFL query text
     * @return id of the executed query
     */
    public QueryId executeQuery(String query) {
        QueryResultHandle handle = prepareQuery(query);
        QueryStepResult executed = executePreparedQuery(query, handle);
        if (!executed.requiresCompletion()) {
            return executed.getQueryId();
        }
        return completeQuery(handle).getQueryId();
    }

    /**
     * Run an AFL expression and have the backend save its output to a local Arrow buffer.
     *
     * @param afl AFL expression producing an array
     * @return the AIO query holding the buffer file and the query id
     */
    public AioQuery executeAioQuery(String afl) {
        AioQuery aio = AioQuery.create();
        try {
            aio.setQueryId(executeQuery(aio.wrap(afl)));
            return aio;
        } catch (RuntimeException e) {
            aio.close();
            throw e;
        }
    }

    @Override
    public void close() {
        if (session.isOpen() && !connectionManager.disconnect(session)) {
            log.warn("SciDB session did not disconnect cleanly: session_id={}", session.getSessionId());
        }
    }
}
