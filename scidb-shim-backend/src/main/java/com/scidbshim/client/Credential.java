package com.scidbshim.client;

import java.util.Objects;

/**
 * Fixed username/password pair presented to the backend at connect time.
 */
public final class Credential {
    private final String username;
    private final String password;

    public Credential(String username, String password) {
        this.username = Objects.requireNonNull(username, "username");
        this.password = Objects.requireNonNull(password, "password");
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        return "Credential[username=" + username + "]";
    }
}
