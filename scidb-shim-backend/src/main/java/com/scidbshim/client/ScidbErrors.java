package com.scidbshim.client;

/**
 * Backend error codes the adapter needs to recognise.
 *
 * <p>Values follow the SciDB error tables; only the codes used for classification are
 * listed here.
 */
public final class ScidbErrors {

    private ScidbErrors() {
    }

    /** Short code for network-level failures. */
    public static final int SCIDB_SE_NETWORK = 5;

    /** Short code for authentication failures. */
    public static final int SCIDB_SE_AUTHENTICATION = 53;

    /** Long code for rejected credentials. */
    public static final long SCIDB_LE_AUTHENTICATION_ERROR = 375L;

    /** Long code for a refused or dropped connection. */
    public static final long SCIDB_LE_CONNECTION_ERROR = 105L;
}
