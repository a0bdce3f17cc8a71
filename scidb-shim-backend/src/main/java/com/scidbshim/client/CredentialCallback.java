package com.scidbshim.client;

/**
 * Supplies credentials on demand when the backend asks for them during connect.
 *
 * <p>A session configured with a callback (possibly {@code null}, meaning "let the client
 * library resolve credentials itself") does not carry a fixed credential pair.
 */
@FunctionalInterface
public interface CredentialCallback {
    /**
     * Resolve the credential for the given user hint.
     *
     * @param userHint user name suggested by the backend, may be null
     * @return credential to present
     */
    Credential resolve(String userHint);
}
