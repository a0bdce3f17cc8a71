package com.scidbshim.service;

/**
 * Thrown by {@link ScidbConnection} when a lifecycle step ends in a failure status.
 *
 * <p>Carries the status code and failure kind so callers can branch without parsing the
 * message, e.g. to re-prompt for credentials on {@link ShimFailure#AUTHENTICATION_FAILURE}.
 */
public class ShimQueryException extends RuntimeException {
    private final ShimStatus status;

    public ShimQueryException(ShimStatus status, String explanation) {
        super(buildMessage(status, explanation));
        this.status = status;
    }

    public ShimQueryException(ShimStatus status, String explanation, Throwable cause) {
        super(buildMessage(status, explanation), cause);
        this.status = status;
    }

    public ShimStatus getStatus() {
        return status;
    }

    public int getCode() {
        return status.getCode();
    }

    public ShimFailure getFailure() {
        return ShimFailure.fromStatus(status);
    }

    private static String buildMessage(ShimStatus status, String explanation) {
        String phase = status == ShimStatus.ERROR_AUTHENTICATION || status == ShimStatus.ERROR_CANT_CONNECT
                ? "connection"
                : "query";
        String msg = "error code " + status.getCode() + " (" + status + ") encountered during SciDB " + phase;
        if (explanation != null && !explanation.isBlank()) {
            msg += "; message: " + explanation;
        }
        return msg;
    }
}
