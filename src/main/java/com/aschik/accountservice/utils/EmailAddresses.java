package com.aschik.accountservice.utils;

import com.aschik.accountservice.exception.RequestExceptions;

import java.util.Locale;
import java.util.regex.Pattern;

/** Normalization and syntax checks for email addresses used as account keys. */
public final class EmailAddresses {

    private static final Pattern SYNTAX = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final int MAX_LENGTH = 100;

    private EmailAddresses() {}

    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String email) {
        return email != null && email.length() <= MAX_LENGTH && SYNTAX.matcher(email.trim()).matches();
    }

    /** Normalizes and rejects malformed input with a 400. */
    public static String requireValid(String email) {
        if (!isValid(email)) {
            throw new RequestExceptions.ValidationFailed("Invalid email format");
        }
        return normalize(email);
    }
}
