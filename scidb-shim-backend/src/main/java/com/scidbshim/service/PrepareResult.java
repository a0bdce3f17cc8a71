package com.scidbshim.service;

import com.scidbshim.model.QueryId;

/**
 * Outcome of a prepare step. On failure the handle is null and the query result has
 * already been freed.
 */
public final class PrepareResult {
    private final QueryResultHandle handle;
    private final QueryId queryId;
    private final ShimStatus status;
    private final String message;

    private PrepareResult(QueryResultHandle handle, QueryId queryId, ShimStatus status, String message) {
        this.handle = handle;
        this.queryId = queryId != null ? queryId : QueryId.NONE;
        this.status = status;
        this.message = message != null ? message : "";
    }

    static PrepareResult prepared(QueryResultHandle handle) {
        return new PrepareResult(handle, handle.getQueryId(), ShimStatus.PREPARATION_SUCCESS, "");
    }

    static PrepareResult failed(ShimStatus status, String message) {
        return new PrepareResult(null, QueryId.NONE, status, message);
    }

    public QueryResultHandle getHandle() {
        return handle;
    }

    public QueryId getQueryId() {
        return queryId;
    }

    public ShimStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public boolean isPrepared() {
        return status == ShimStatus.PREPARATION_SUCCESS;
    }

    public ShimFailure getFailure() {
        return ShimFailure.fromStatus(status);
    }
}
