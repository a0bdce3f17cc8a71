package com.scidbshim.client;

/**
 * Thrown by {@link ScidbClient#executeQuery} when the executed statement was a user
 * requested rollback and the open transaction was rolled back successfully.
 *
 * <p>This is not an execution failure. The query must not be completed afterwards.
 */
public class RollbackException extends ScidbException {

    public RollbackException(String message) {
        super(0, 0L, message);
    }
}
