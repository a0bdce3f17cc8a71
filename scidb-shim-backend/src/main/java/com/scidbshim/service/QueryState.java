package com.scidbshim.service;

/**
 * Lifecycle state of one query result.
 */
public enum QueryState {
    UNPREPARED,
    PREPARED,
    EXECUTED,
    COMPLETED,
    PREPARE_FAILED,
    EXECUTE_FAILED,
    ROLLED_BACK;

    /**
     * Terminal states are only entered together with the release of the query result.
     *
     * @return true if no further step is possible
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == PREPARE_FAILED || this == EXECUTE_FAILED || this == ROLLED_BACK;
    }
}
