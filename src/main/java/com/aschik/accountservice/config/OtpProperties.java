package com.aschik.accountservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Passcode settings, bound once from {@code app.otp.*}.
 *
 * @param length           number of digits per code
 * @param expiresInMinutes validity window from issuance
 * @param purgeCron        schedule of the expired-row sweep
 */
@ConfigurationProperties(prefix = "app.otp")
public record OtpProperties(
        @DefaultValue("6") int length,
        @DefaultValue("10") int expiresInMinutes,
        @DefaultValue("0 15 * * * *") String purgeCron
) {

    public OtpProperties {
        if (length < 4 || length > 10) {
            throw new IllegalArgumentException("app.otp.length must be between 4 and 10");
        }
        if (expiresInMinutes < 0) {
            throw new IllegalArgumentException("app.otp.expires-in-minutes must not be negative");
        }
    }
}
