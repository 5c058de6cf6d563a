package com.aschik.accountservice.exception;

import org.springframework.http.HttpStatus;

public final class ResourceExceptions {

    private ResourceExceptions() {}

    /** 404 – target resource (file, object) does not exist. */
    public static final class NotFound extends ApiException {
        public NotFound(String detail) {
            super(HttpStatus.NOT_FOUND, ErrorCode.NOT_FOUND,
                    "not-found", "Resource Not Found", detail);
        }
    }
}
