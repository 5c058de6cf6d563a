package com.aschik.accountservice.utils;

import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PasscodeGeneratorTest {

    @Test
    void should_generate_digits_of_the_requested_length() {
        PasscodeGenerator generator = new PasscodeGenerator();

        for (int length : new int[]{4, 6, 10}) {
            assertThat(generator.generate(length)).matches("\\d{" + length + "}");
        }
    }

    @Test
    void should_keep_leading_zeros() {
        SecureRandom zeros = new SecureRandom() {
            @Override
            public int nextInt(int bound) {
                return 0;
            }
        };

        assertThat(new PasscodeGenerator(zeros).generate(6)).isEqualTo("000000");
    }

    @Test
    void should_vary_between_calls() {
        PasscodeGenerator generator = new PasscodeGenerator();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            seen.add(generator.generate(6));
        }
        assertThat(seen).hasSizeGreaterThan(40);
    }

    @Test
    void should_reject_non_positive_length() {
        assertThrows(IllegalArgumentException.class, () -> new PasscodeGenerator().generate(0));
    }
}
