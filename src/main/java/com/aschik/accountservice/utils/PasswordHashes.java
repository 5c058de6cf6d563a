package com.aschik.accountservice.utils;

/** Shape checks for stored password values. */
public final class PasswordHashes {

    private static final int BCRYPT_LENGTH = 60;

    private PasswordHashes() {}

    /** True for a modular-crypt BCrypt hash ($2a$, $2b$ or $2y$). */
    public static boolean isBcrypt(String value) {
        return value != null
                && value.length() == BCRYPT_LENGTH
                && (value.startsWith("$2a$") || value.startsWith("$2b$") || value.startsWith("$2y$"));
    }
}
