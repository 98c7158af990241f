package com.example.crosstab.exception;

import com.example.crosstab.util.Constants.ErrorCode;

/**
 * A client message that cannot be honoured: unknown event, malformed payload or a forbidden action.
 */
public class ProtocolException extends RuntimeException {

    private final ErrorCode code;

    public ProtocolException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
