package com.aschik.accountservice.SecurityConfig;

import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Date;
import java.util.concurrent.TimeUnit;

/**
 * Revoked access tokens, kept in Redis until their natural expiry.
 * Keyed by JTI, or by SHA-256 of the raw token when it has none.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenBlacklistConfig {

    private static final String KEY_PREFIX = "jwt:bl:";
    private static final long   SKEW_MS    = 5_000L;
    private static final long   MIN_TTL_MS = 100L;

    private final StringRedisTemplate redis;
    private final JwtTokenProviderConfig jwtService;

    /**
     * Blacklist a token until its expiration.
     *
     * @return false when the token could not be recorded (unparseable or Redis down)
     */
    public boolean addToBlacklist(@NonNull String token) {
        try {
            if (token.isBlank()) return false;

            Date exp = jwtService.extractExpiration(token);
            if (exp == null) return false;

            long ttlMs = (exp.getTime() - System.currentTimeMillis()) + SKEW_MS;
            if (ttlMs < MIN_TTL_MS) ttlMs = MIN_TTL_MS;

            redis.opsForValue().set(keyFor(token), "1", ttlMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (IllegalArgumentException e) {
            log.debug("Blacklist skip: invalid token");
            return false;
        } catch (DataAccessException dae) {
            log.warn("Redis unavailable while blacklisting token", dae);
            return false;
        }
    }

    /** Fails open on Redis errors; signature and expiry checks still apply. */
    public boolean isBlacklisted(@NonNull String token) {
        try {
            if (token.isBlank()) return false;
            return Boolean.TRUE.equals(redis.hasKey(keyFor(token)));
        } catch (IllegalArgumentException e) {
            log.debug("Blacklist check: invalid token");
            return false;
        } catch (DataAccessException dae) {
            log.warn("Redis unavailable during blacklist check", dae);
            return false;
        }
    }

    private String keyFor(String token) {
        String jti = jwtService.extractClaim(token, Claims::getId);
        if (jti != null && !jti.isBlank()) {
            return KEY_PREFIX + "jti:" + jti;
        }
        return KEY_PREFIX + "sha:" + sha256Url(token);
    }

    private String sha256Url(String data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(dig);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
