package com.aschik.accountservice.SecurityConfig;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a handler (or every handler of a controller) as counted against a
 * per-IP fixed window. Budgets live in {@code app.rate-limit.*}.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RateLimit {

    Policy value() default Policy.API;

    enum Policy {
        /** Sign-in and admin login: 5 per 15 minutes. */
        LOGIN("Too many login attempts from this IP, please try again later"),
        /** Account creation: 3 per hour. */
        SIGNUP("Too many accounts created from this IP, please try again later"),
        /** Passcode issuance and verification: 3 per 15 minutes. */
        OTP("Too many OTP requests from this IP, please try again later"),
        /** Everything else: 100 per 15 minutes. */
        API("Too many requests from this IP, please try again later");

        private final String message;

        Policy(String message) { this.message = message; }

        public String message() { return message; }
    }
}
