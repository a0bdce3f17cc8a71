package com.scidbshim.service;

import com.scidbshim.client.ScidbClient;
import com.scidbshim.model.QueryId;
import com.scidbshim.model.QueryResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sole owner of one backend {@link QueryResult}.
 *
 * <p>The result is freed through {@link #release(QueryState)}, which takes it out of the handle
 * atomically. After that the handle holds no result and reports {@link QueryId#NONE}, so
 * a second release, or a release racing from another thread, frees nothing.
 */
@Slf4j
public final class QueryResultHandle {
    private final ScidbClient client;
    private final QueryLanguage language;
    private final AtomicReference<QueryResult> resource;
    private volatile QueryState state = QueryState.UNPREPARED;

    QueryResultHandle(ScidbClient client, QueryResult resource, QueryLanguage language) {
        this.client = Objects.requireNonNull(client, "client");
        this.resource = new AtomicReference<>(Objects.requireNonNull(resource, "resource"));
        this.language = language != null ? language : QueryLanguage.AFL;
    }

    /**
     * @return the id assigned at prepare time, or {@link QueryId#NONE} before prepare and
     *         after release
     */
    public QueryId getQueryId() {
        QueryResult r = resource.get();
        if (r == null || r.getQueryId() == null) {
            return QueryId.NONE;
        }
        return r.getQueryId();
    }

    public QueryState getState() {
        return state;
    }

    public QueryLanguage getLanguage() {
        return language;
    }

    public boolean isReleased() {
        return resource.get() == null;
    }

    QueryResult resource() {
        return resource.get();
    }

    void transition(QueryState next) {
        this.state = next;
    }

    /**
     * Free the backend result if this handle still owns it.
     *
     * @param terminal state to record
     * @return true if this call freed the result
     */
    boolean release(QueryState terminal) {
        QueryResult r = resource.getAndSet(null);
        if (r == null) {
            return false;
        }
        state = terminal;
        try {
            client.freeQueryResult(r);
        } catch (RuntimeException e) {
            // The handle no longer references the result either way.
            log.warn("Failed to free query result: query_id={}, state={}", r.getQueryId(), terminal, e);
        }
        return true;
    }

    @Override
    public String toString() {
        return "QueryResultHandle[" + getQueryId() + ", " + state + "]";
    }
}
