package com.expenseflow.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;

    public ProblemException(ErrorKind kind, String detail) {
        this(kind.status(), kind.code(), detail);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public static ProblemException invalidTransition(String detail) {
        return new ProblemException(ErrorKind.INVALID_TRANSITION, detail);
    }

    public static ProblemException missingComment(String detail) {
        return new ProblemException(ErrorKind.MISSING_COMMENT, detail);
    }

    public static ProblemException notFound(String detail) {
        return new ProblemException(ErrorKind.NOT_FOUND, detail);
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}
