package com.scidbshim.service;

/**
 * Query dialect sent to the backend. Only toggles the backend's language flag.
 */
public enum QueryLanguage {
    AFL,
    AQL;

    public boolean isAfl() {
        return this == AFL;
    }
}
