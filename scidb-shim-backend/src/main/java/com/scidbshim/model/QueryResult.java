package com.scidbshim.model;

import lombok.Data;

/**
 * Backend-side state of one prepared or executing query.
 *
 * <p>Instances are allocated by {@link com.scidbshim.client.ScidbClient#newQueryResult()} and
 * populated by the client during prepare and execute. They are never shared between
 * lifecycles; ownership lives in {@link com.scidbshim.service.QueryResultHandle}.
 */
@Data
public class QueryResult {
    private QueryId queryId = QueryId.NONE;
    private boolean autoCommit;
    private boolean fetch;
}
