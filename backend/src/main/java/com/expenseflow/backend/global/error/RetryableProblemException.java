package com.expenseflow.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Transient failure; the whole operation can be retried after {@link #getRetryAfterSeconds()}.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds) {
        super(status, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RetryableProblemException storageFailure(String detail, int retryAfterSeconds) {
        ErrorKind kind = ErrorKind.STORAGE_FAILURE;
        return new RetryableProblemException(kind.status(), kind.code(), detail, retryAfterSeconds);
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
