package com.aschik.accountservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Account-domain exceptions (registration, login, verification lifecycle).
 *
 * Conventions:
 *  - type:  https://aschik.dev/problems/<slug>
 */
public final class UserExceptions {

    private UserExceptions() {}

    /** 404 – no account for the given email or id. */
    public static final class UserNotFound extends ApiException {
        public UserNotFound(String detail) {
            super(HttpStatus.NOT_FOUND, ErrorCode.USER_NOT_FOUND,
                    "user-not-found", "User Not Found", detail);
        }
    }

    /** 409 – email or username already taken. */
    public static final class UserAlreadyExists extends ApiException {
        public UserAlreadyExists(String detail) {
            super(HttpStatus.CONFLICT, ErrorCode.USER_ALREADY_EXISTS,
                    "user-already-exists", "User Already Exists", detail);
        }
    }

    /** 400 – verification requested for an address that is already verified. */
    public static final class EmailAlreadyVerified extends ApiException {
        public EmailAlreadyVerified() {
            super(HttpStatus.BAD_REQUEST, ErrorCode.EMAIL_ALREADY_VERIFIED,
                    "email-already-verified", "Email Already Verified", "Email is already verified");
        }
    }

    /** 401 – unknown email or wrong password, indistinguishable on purpose. */
    public static final class InvalidCredentials extends ApiException {
        public InvalidCredentials() {
            super(HttpStatus.UNAUTHORIZED, ErrorCode.INVALID_CREDENTIALS,
                    "invalid-credentials", "Invalid Credentials", "Invalid email or password");
        }
    }

    /** 401 – bearer token unusable (bad signature, expired, revoked, wrong type). */
    public static final class InvalidToken extends ApiException {
        public InvalidToken(String detail) {
            super(HttpStatus.UNAUTHORIZED, ErrorCode.INVALID_TOKEN,
                    "invalid-token", "Invalid Token", detail);
        }
    }

    /** 503 – admin login attempted while no admin identity is configured. */
    public static final class AdminNotConfigured extends ApiException {
        public AdminNotConfigured() {
            super(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.ADMIN_NOT_CONFIGURED,
                    "admin-not-configured", "Admin Not Configured",
                    "Admin authentication is not configured");
        }
    }
}
