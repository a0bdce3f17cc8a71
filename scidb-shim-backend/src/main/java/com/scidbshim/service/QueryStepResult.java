package com.scidbshim.service;

import com.scidbshim.model.QueryId;

/**
 * Outcome of an execute or complete step.
 */
public final class QueryStepResult {
    private final ShimStatus status;
    private final QueryId queryId;
    private final String message;

    QueryStepResult(ShimStatus status, QueryId queryId, String message) {
        this.status = status;
        this.queryId = queryId != null ? queryId : QueryId.NONE;
        this.message = message != null ? message : "";
    }

    public ShimStatus getStatus() {
        return status;
    }

    /**
     * @return the query this step acted on; for a rollback, the id of the rollback statement
     */
    public QueryId getQueryId() {
        return queryId;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Only a successful execute leaves a query that still needs {@code complete}.
     *
     * @return true if the caller must call complete next
     */
    public boolean requiresCompletion() {
        return status == ShimStatus.EXECUTION_SUCCESS;
    }

    public boolean isUserVisibleFailure() {
        return status.isUserVisibleFailure();
    }

    public ShimFailure getFailure() {
        return ShimFailure.fromStatus(status);
    }

    @Override
    public String toString() {
        return "QueryStepResult[" + status + ", " + queryId + (message.isEmpty() ? "" : ", " + message) + "]";
    }
}
