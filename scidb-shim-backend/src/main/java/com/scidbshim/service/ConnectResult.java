package com.scidbshim.service;

/**
 * Outcome of {@link ConnectionManager#connect}. The handle is non-null only on success and
 * is authoritative regardless of the status.
 */
public final class ConnectResult {
    private final SessionHandle handle;
    private final ShimStatus status;
    private final String message;

    private ConnectResult(SessionHandle handle, ShimStatus status, String message) {
        this.handle = handle;
        this.status = status;
        this.message = message != null ? message : "";
    }

    static ConnectResult connected(SessionHandle handle) {
        return new ConnectResult(handle, ShimStatus.CONNECTION_SUCCESSFUL, "");
    }

    static ConnectResult failed(ShimStatus status, String message) {
        return new ConnectResult(null, status, message);
    }

    public SessionHandle getHandle() {
        return handle;
    }

    public ShimStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public boolean isConnected() {
        return handle != null;
    }

    public ShimFailure getFailure() {
        return ShimFailure.fromStatus(status);
    }
}
