package com.expenseflow.backend.global.error;

import com.expenseflow.backend.global.web.RequestIdFilter;

import org.springframework.http.HttpStatus;

/**
 * Error body shared by every endpoint. {@code code} is the value clients branch on; {@code requestId}
 * matches the {@code X-Request-Id} header and the server log line.
 */
public record ProblemResponse(
        String type,
        String title,
        int status,
        String code,
        String detail,
        String instance,
        String requestId
) {

    private static final String TYPE_PREFIX = "urn:expenseflow:error:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String resolvedCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String resolvedDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                TYPE_PREFIX + resolvedCode,
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                resolvedCode,
                resolvedDetail,
                instance,
                RequestIdFilter.currentRequestId().orElse(null)
        );
    }

    public static ProblemResponse of(ErrorKind kind, String detail, String instance) {
        return of(kind.status(), kind.code(), detail, instance);
    }
}
