package com.aschik.accountservice.utils;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Produces numeric one-time codes. Each digit is drawn independently from a
 * {@link SecureRandom}, so leading zeros are as likely as any other digit.
 */
@Component
public class PasscodeGenerator {

    private final SecureRandom random;

    public PasscodeGenerator() {
        this(new SecureRandom());
    }

    PasscodeGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Passcode length must be positive: " + length);
        }
        char[] digits = new char[length];
        for (int i = 0; i < length; i++) {
            digits[i] = (char) ('0' + random.nextInt(10));
        }
        return new String(digits);
    }
}
