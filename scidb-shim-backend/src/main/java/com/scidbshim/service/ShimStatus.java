package com.scidbshim.service;

/**
 * Status codes reported by every lifecycle operation.
 *
 * <p>Integer values are stable: callers multiplex on one integer domain, so codes are only
 * unique within a phase. {@link #NO_SCIDB_CONNECTION} and {@link #IO_ERROR} are reserved for
 * transport problems seen by the calling service.
 */
public enum ShimStatus {
    CONNECTION_SUCCESSFUL(0, false),
    ERROR_CANT_CONNECT(-1, true),
    ERROR_AUTHENTICATION(-2, true),

    PREPARATION_SUCCESS(0, false),
    NO_QUERY_RESULT_OBJ(-1, true),
    PREPARATION_ERROR(-2, true),

    EXECUTION_SUCCESS(0, false),
    TRANSACTION_ROLLBACK(-3, false),
    EXECUTION_ERROR(-4, true),

    COMPLETION_SUCCESS(0, false),
    COMPLETION_INVALID(-5, false),
    COMPLETION_ERROR(-6, true),

    NO_SCIDB_CONNECTION(-7, true),
    IO_ERROR(-8, true);

    private final int code;
    private final boolean userVisibleFailure;

    ShimStatus(int code, boolean userVisibleFailure) {
        this.code = code;
        this.userVisibleFailure = userVisibleFailure;
    }

    public int getCode() {
        return code;
    }

    /**
     * Whether this status must be shown to the end user as a failure. Rollback and
     * invalid-completion outcomes are success-shaped and return false.
     *
     * @return true for real failures
     */
    public boolean isUserVisibleFailure() {
        return userVisibleFailure;
    }

    public boolean isSuccess() {
        return code == 0;
    }
}
