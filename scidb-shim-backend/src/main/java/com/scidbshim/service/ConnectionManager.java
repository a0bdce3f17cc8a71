package com.scidbshim.service;

import com.scidbshim.client.Credential;
import com.scidbshim.client.ScidbClient;
import com.scidbshim.client.ScidbErrors;
import com.scidbshim.client.ScidbException;
import com.scidbshim.client.SessionProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens and closes backend sessions.
 *
 * <p>Every connect builds its session properties from scratch, so admin priority is only ever
 * what the current call asked for. Sessions still open at shutdown are disconnected.
 */
@Slf4j
@Service
public class ConnectionManager {
    private final ScidbClient client;
    private final Map<String, SessionHandle> sessions = new ConcurrentHashMap<>();

    public ConnectionManager(ScidbClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Connect to a coordinator.
     *
     * <p>When either the user name or the password is missing the session resolves
     * credentials interactively instead of presenting a fixed pair.
     *
     * @param host coordinator host
     * @param port coordinator port
     * @param username user name, may be null
     * @param password password, may be null
     * @param isAdmin request admin session priority
     * @return result holding the session handle, or a null handle and the failure status
     */
    public ConnectResult connect(String host, int port, String username, String password, boolean isAdmin) {
        SessionProperties props = new SessionProperties();
        boolean fixedCredentials = username != null && password != null;
        if (fixedCredentials) {
            props.setCredential(new Credential(username, password));
        } else {
            props.setCredentialCallback(null);
        }
        if (isAdmin) {
            props.setPriority(SessionProperties.Priority.ADMIN);
        }

        Object connection;
        try {
            connection = client.connect(props, host, port);
        } catch (ScidbException e) {
            ShimStatus status = e.getLongErrorCode() == ScidbErrors.SCIDB_LE_AUTHENTICATION_ERROR
                    ? ShimStatus.ERROR_AUTHENTICATION
                    : ShimStatus.ERROR_CANT_CONNECT;
            log.warn("SciDB connect failed: host={}, port={}, user={}, status={}, error={}",
                    host, port, username, status, e.getMessage());
            return ConnectResult.failed(status, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("SciDB connect failed: host={}, port={}, user={}", host, port, username, e);
            return ConnectResult.failed(ShimStatus.ERROR_CANT_CONNECT, e.getMessage());
        }

        if (connection == null) {
            log.warn("SciDB client returned no connection: host={}, port={}", host, port);
            return ConnectResult.failed(ShimStatus.ERROR_CANT_CONNECT, "SciDB client returned no connection");
        }

        SessionHandle handle = new SessionHandle(
                UUID.randomUUID().toString(),
                host,
                port,
                fixedCredentials ? username : null,
                isAdmin,
                connection
        );
        sessions.put(handle.getSessionId(), handle);
        log.info("Connected to SciDB: session_id={}, host={}, port={}, admin={}", handle.getSessionId(), host, port, isAdmin);
        return ConnectResult.connected(handle);
    }

    /**
     * Close a session. The handle is invalid afterwards whatever the outcome.
     *
     * @param handle session to close
     * @return true if the backend closed the session
     */
    public boolean disconnect(SessionHandle handle) {
        if (handle == null) {
            log.warn("Disconnect called without a session handle");
            return false;
        }

        handle.lock();
        try {
            if (!handle.markClosed()) {
                log.warn("Disconnect called on a closed session: session_id={}", handle.getSessionId());
                return false;
            }
            sessions.remove(handle.getSessionId());
            client.disconnect(handle.connection());
            log.info("Disconnected from SciDB: session_id={}", handle.getSessionId());
            return true;
        } catch (ScidbException | RuntimeException e) {
            log.error("SciDB disconnect failed: session_id={}", handle.getSessionId(), e);
            return false;
        } finally {
            handle.unlock();
        }
    }

    /**
     * @return sessions opened by this manager and not yet disconnected
     */
    public List<SessionHandle> openSessions() {
        return new ArrayList<>(sessions.values());
    }

    @PreDestroy
    public void closeAll() {
        for (SessionHandle handle : openSessions()) {
            disconnect(handle);
        }
    }
}
