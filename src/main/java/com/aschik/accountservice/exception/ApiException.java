package com.aschik.accountservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying HTTP semantics for RFC 7807 responses.
 * Throw these from services/controllers; GlobalExceptionHandler maps them.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String type;   // e.g., https://aschik.dev/problems/not-found
    private final String title;
    private final ErrorCode errorCode;

    protected ApiException(HttpStatus status, ErrorCode errorCode, String slug, String title, String detail) {
        this(status, errorCode, slug, title, detail, null);
    }

    protected ApiException(HttpStatus status, ErrorCode errorCode, String slug, String title, String detail,
                           Throwable cause) {
        super(detail, cause);
        this.status = status;
        this.errorCode = errorCode;
        this.type = ProblemTypes.uri(slug);
        this.title = title;
    }

    public String code() { return errorCode.name(); }
}
