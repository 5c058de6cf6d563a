package com.aschik.accountservice.utils;

import com.aschik.accountservice.exception.RequestExceptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EmailAddressesTest {

    @Test
    void requireValid_should_trim_and_lowercase() {
        assertThat(EmailAddresses.requireValid("  John.Doe@Example.ORG ")).isEqualTo("john.doe@example.org");
    }

    @Test
    void isValid_should_reject_malformed_addresses() {
        assertThat(EmailAddresses.isValid("plainaddress")).isFalse();
        assertThat(EmailAddresses.isValid("a@b")).isFalse();
        assertThat(EmailAddresses.isValid("a b@c.de")).isFalse();
        assertThat(EmailAddresses.isValid(null)).isFalse();
        assertThat(EmailAddresses.isValid("x".repeat(95) + "@a.com")).isFalse();
        assertThat(EmailAddresses.isValid("a@b.co")).isTrue();
    }

    @Test
    void requireValid_should_fail_with_validation_error() {
        RequestExceptions.ValidationFailed ex = assertThrows(RequestExceptions.ValidationFailed.class,
                () -> EmailAddresses.requireValid("nope"));
        assertThat(ex.getMessage()).isEqualTo("Invalid email format");
    }
}
