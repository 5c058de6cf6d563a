package com.aschik.accountservice.service;

import com.aschik.accountservice.SecurityConfig.RateLimit;

public interface RateLimiter {

    /**
     * Counts one request for (policy, client) in the current window.
     *
     * @return seconds until the window resets when the limit is exceeded, or 0 when allowed
     */
    long tryAcquire(RateLimit.Policy policy, String clientKey);
}
