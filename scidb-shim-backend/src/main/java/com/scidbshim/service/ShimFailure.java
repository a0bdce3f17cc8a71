package com.scidbshim.service;

/**
 * Closed set of failure kinds a lifecycle step can end in.
 *
 * <p>{@link #ROLLBACK_SUCCESS} is kept apart from {@link #EXECUTE_FAILURE}: the statement asked
 * for a rollback and got one.
 */
public enum ShimFailure {
    AUTHENTICATION_FAILURE(ShimStatus.ERROR_AUTHENTICATION),
    CONNECT_FAILURE(ShimStatus.ERROR_CANT_CONNECT),
    NO_QUERY_RESULT(ShimStatus.NO_QUERY_RESULT_OBJ),
    PREPARE_FAILURE(ShimStatus.PREPARATION_ERROR),
    EXECUTE_FAILURE(ShimStatus.EXECUTION_ERROR),
    ROLLBACK_SUCCESS(ShimStatus.TRANSACTION_ROLLBACK),
    COMPLETE_FAILURE(ShimStatus.COMPLETION_ERROR),
    NO_CONNECTION(ShimStatus.NO_SCIDB_CONNECTION),
    IO_FAILURE(ShimStatus.IO_ERROR);

    private final ShimStatus status;

    ShimFailure(ShimStatus status) {
        this.status = status;
    }

    public ShimStatus getStatus() {
        return status;
    }

    /**
     * Map a status back to its failure kind.
     *
     * @param status status
     * @return failure kind, or null for success statuses and {@link ShimStatus#COMPLETION_INVALID}
     */
    public static ShimFailure fromStatus(ShimStatus status) {
        if (status == null) {
            return null;
        }
        for (ShimFailure f : values()) {
            if (f.status == status) {
                return f;
            }
        }
        return null;
    }
}
