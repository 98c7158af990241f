package com.example.crosstab.exception;

public class ConnectionNotFoundException extends RuntimeException {
    public ConnectionNotFoundException(String connectionId) {
        super("Connection not found on this pod: " + connectionId);
    }
}
