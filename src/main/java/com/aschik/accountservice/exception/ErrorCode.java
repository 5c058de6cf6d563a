package com.aschik.accountservice.exception;

/**
 * Machine-readable error kinds. The web layer maps responses from these,
 * never from message text.
 */
public enum ErrorCode {
    VALIDATION_ERROR,
    INVALID_OR_EXPIRED_CODE,
    EMAIL_ALREADY_VERIFIED,
    USER_NOT_FOUND,
    USER_ALREADY_EXISTS,
    INVALID_CREDENTIALS,
    INVALID_TOKEN,
    UNAUTHORIZED,
    FORBIDDEN,
    ADMIN_NOT_CONFIGURED,
    NOT_FOUND,
    CONFLICT,
    METHOD_NOT_ALLOWED,
    UNSUPPORTED_MEDIA_TYPE,
    RATE_LIMITED,
    NO_FILE_UPLOADED,
    INVALID_FILE_TYPE,
    FILE_TOO_LARGE,
    TOO_MANY_FILES,
    STORAGE_ERROR,
    TRANSPORT_ERROR,
    STORAGE_UNAVAILABLE,
    UPSTREAM_ERROR,
    INTERNAL_ERROR
}
