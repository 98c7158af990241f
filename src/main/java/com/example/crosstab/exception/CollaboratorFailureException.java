package com.example.crosstab.exception;

public class CollaboratorFailureException extends RuntimeException {
    public CollaboratorFailureException(String message) {
        super(message);
    }

    public CollaboratorFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
