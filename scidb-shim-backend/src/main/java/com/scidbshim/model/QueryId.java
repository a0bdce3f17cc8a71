package com.scidbshim.model;

import lombok.Data;

/**
 * Cluster-wide identifier of one query instance: the coordinating instance id plus the
 * query id local to that coordinator.
 *
 * <p>Both halves are unsigned 64-bit values carried in a {@code long}. {@link #NONE} (0/0)
 * is the "no query" value returned by failed operations.
 */
@Data
public final class QueryId {
    public static final QueryId NONE = new QueryId(0L, 0L);

    private final long coordinatorId;
    private final long queryId;

    public static QueryId of(long coordinatorId, long queryId) {
        if (coordinatorId == 0L && queryId == 0L) {
            return NONE;
        }
        return new QueryId(coordinatorId, queryId);
    }

    /**
     * A query id is valid once the backend has assigned a non-zero local id.
     *
     * @return true if this id names a real query
     */
    public boolean isValid() {
        return queryId != 0L;
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(coordinatorId) + "." + Long.toUnsignedString(queryId);
    }
}
