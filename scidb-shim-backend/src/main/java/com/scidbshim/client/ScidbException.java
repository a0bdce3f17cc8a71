package com.scidbshim.client;

/**
 * Failure reported by a {@link ScidbClient}.
 *
 * <p>Carries the backend's short (category) and long (specific) error codes. The message is
 * the backend's own text and is surfaced to callers verbatim.
 */
public class ScidbException extends Exception {
    private final int shortErrorCode;
    private final long longErrorCode;

    public ScidbException(int shortErrorCode, long longErrorCode, String message) {
        super(message);
        this.shortErrorCode = shortErrorCode;
        this.longErrorCode = longErrorCode;
    }

    public ScidbException(int shortErrorCode, long longErrorCode, String message, Throwable cause) {
        super(message, cause);
        this.shortErrorCode = shortErrorCode;
        this.longErrorCode = longErrorCode;
    }

    public int getShortErrorCode() {
        return shortErrorCode;
    }

    public long getLongErrorCode() {
        return longErrorCode;
    }
}
