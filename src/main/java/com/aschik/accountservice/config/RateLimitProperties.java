package com.aschik.accountservice.config;

import com.aschik.accountservice.SecurityConfig.RateLimit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Fixed-window limits per client IP. Each policy has its own window and budget;
 * unset policies fall back to the limits below.
 * <p>
 * {@code trustedProxies} lists the socket addresses whose forwarding headers are
 * believed. Empty means the socket address is always the client.
 */
@ConfigurationProperties(prefix = "app.rate-limit")
public record RateLimitProperties(
        @DefaultValue("true") boolean enabled,
        Window login,
        Window signup,
        Window otp,
        Window api,
        List<String> trustedProxies
) {

    public RateLimitProperties {
        login  = login  != null ? login  : new Window(5, Duration.ofMinutes(15));
        signup = signup != null ? signup : new Window(3, Duration.ofHours(1));
        otp    = otp    != null ? otp    : new Window(3, Duration.ofMinutes(15));
        api    = api    != null ? api    : new Window(100, Duration.ofMinutes(15));
        trustedProxies = trustedProxies != null ? List.copyOf(trustedProxies) : List.of();
    }

    public Window window(RateLimit.Policy policy) {
        return switch (policy) {
            case LOGIN -> login;
            case SIGNUP -> signup;
            case OTP -> otp;
            case API -> api;
        };
    }

    public record Window(int maxRequests, Duration period) {}
}
