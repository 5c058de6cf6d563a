package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.SecurityConfig.RateLimit;
import com.aschik.accountservice.config.RateLimitProperties;
import com.aschik.accountservice.service.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Fixed window per (policy, client): INCR the window key, set its TTL on the
 * first hit. Redis outages let traffic through.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisFixedWindowRateLimiter implements RateLimiter {

    private static final String KEY_PREFIX = "rate_limit:";

    private final StringRedisTemplate redis;
    private final RateLimitProperties properties;

    @Override
    public long tryAcquire(RateLimit.Policy policy, String clientKey) {
        if (!properties.enabled()) {
            return 0;
        }
        RateLimitProperties.Window window = properties.window(policy);
        String key = KEY_PREFIX + policy.name().toLowerCase(Locale.ROOT) + ":" + clientKey;
        try {
            Long count = redis.opsForValue().increment(key);
            if (count != null && count == 1L) {
                redis.expire(key, window.period());
            }
            if (count == null || count <= window.maxRequests()) {
                return 0;
            }
            Long ttl = redis.getExpire(key, TimeUnit.SECONDS);
            if (ttl == null || ttl < 0) {
                // window key lost its TTL (crash between INCR and EXPIRE); restart it
                redis.expire(key, window.period());
                return window.period().toSeconds();
            }
            return Math.max(1, ttl);
        } catch (DataAccessException e) {
            log.warn("Rate limiter unavailable, allowing request for {}: {}", policy, e.getMessage());
            return 0;
        }
    }
}
