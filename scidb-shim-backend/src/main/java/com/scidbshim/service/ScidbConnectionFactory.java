package com.scidbshim.service;

import com.scidbshim.config.ShimProperties;
import org.springframework.stereotype.Service;

/**
 * Opens {@link ScidbConnection}s, either with explicit parameters or with the configured
 * {@code shim.scidb.*} settings.
 */
@Service
public class ScidbConnectionFactory {
    private final ConnectionManager connectionManager;
    private final QueryLifecycleController controller;
    private final ShimProperties properties;

    public ScidbConnectionFactory(
            ConnectionManager connectionManager,
            QueryLifecycleController controller,
            ShimProperties properties
    ) {
        this.connectionManager = connectionManager;
        this.controller = controller;
        this.properties = properties;
    }

    /**
     * @return connection using the configured host, port, credentials and priority
     * @throws ShimQueryException if the connection cannot be established
     */
    public ScidbConnection openDefault() {
        ShimProperties.Scidb scidb = properties.getScidb();
        return open(scidb.getHost(), scidb.getPort(), blankToNull(scidb.getUsername()),
                blankToNull(scidb.getPassword()), scidb.isAdmin());
    }

    public ScidbConnection open(String host, int port, String username, String password, boolean admin) {
        ConnectResult result = connectionManager.connect(host, port, username, password, admin);
        if (!result.isConnected()) {
            throw new ShimQueryException(result.getStatus(), result.getMessage());
        }
        return new ScidbConnection(result.getHandle(), connectionManager, controller);
    }

    // unset environment placeholders bind as empty strings
    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
