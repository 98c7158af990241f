package com.example.crosstab.exception;

/**
 * The presented recovery token is unknown, expired, spent or over its attempt budget.
 */
public class RecoveryExhaustedException extends RuntimeException {
    public RecoveryExhaustedException(String message) {
        super(message);
    }
}
