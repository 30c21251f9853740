package com.expenseflow.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable failure kinds returned to clients in {@link ProblemResponse#code()}.
 */
public enum ErrorKind {

    INVALID_TRANSITION("InvalidTransition", HttpStatus.CONFLICT),
    MISSING_COMMENT("MissingComment", HttpStatus.UNPROCESSABLE_ENTITY),
    NOT_FOUND("NotFound", HttpStatus.NOT_FOUND),
    STALE_CONFLICT("StaleConflict", HttpStatus.CONFLICT),
    STORAGE_FAILURE("StorageFailure", HttpStatus.SERVICE_UNAVAILABLE);

    private final String code;
    private final HttpStatus status;

    ErrorKind(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }
}
