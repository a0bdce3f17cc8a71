package com.scidbshim.client;

/**
 * Per-connect session settings handed to {@link ScidbClient#connect}.
 *
 * <p>Either a fixed {@link Credential} or a credential callback is configured, never both.
 * A new instance is built for every connect attempt.
 */
public class SessionProperties {

    /**
     * Session priority requested from the backend.
     */
    public enum Priority {
        NORMAL,
        ADMIN
    }

    private Credential credential;
    private CredentialCallback credentialCallback;
    private boolean deferredCredentials;
    private Priority priority = Priority.NORMAL;

    public void setCredential(Credential credential) {
        this.credential = credential;
        this.credentialCallback = null;
        this.deferredCredentials = false;
    }

    /**
     * Defer credential resolution to the callback, or to the client library when the
     * callback is null.
     *
     * @param callback callback, may be null
     */
    public void setCredentialCallback(CredentialCallback callback) {
        this.credential = null;
        this.credentialCallback = callback;
        this.deferredCredentials = true;
    }

    public Credential getCredential() {
        return credential;
    }

    public CredentialCallback getCredentialCallback() {
        return credentialCallback;
    }

    public boolean hasDeferredCredentials() {
        return deferredCredentials;
    }

    public Priority getPriority() {
        return priority;
    }

    public void setPriority(Priority priority) {
        this.priority = priority != null ? priority : Priority.NORMAL;
    }
}
