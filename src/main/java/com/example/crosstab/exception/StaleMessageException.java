package com.example.crosstab.exception;

public class StaleMessageException extends RuntimeException {
    public StaleMessageException(String message) {
        super(message);
    }
}
