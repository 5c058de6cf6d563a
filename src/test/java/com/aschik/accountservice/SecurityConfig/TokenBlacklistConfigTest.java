package com.aschik.accountservice.SecurityConfig;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;

class TokenBlacklistConfigTest {

    private static final String SECRET = "dGVzdC1vbmx5LXNlY3JldC1mb3ItdW5pdC10ZXN0cy0wMTIzNDU2Nzg5";

    private StringRedisTemplate redis;
    private ValueOperations<String, String> values;
    private JwtTokenProviderConfig jwt;
    private TokenBlacklistConfig blacklist;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = Mockito.mock(StringRedisTemplate.class);
        values = Mockito.mock(ValueOperations.class);
        Mockito.when(redis.opsForValue()).thenReturn(values);
        jwt = new JwtTokenProviderConfig(SECRET, 60_000L);
        blacklist = new TokenBlacklistConfig(redis, jwt);
    }

    @Test
    void should_record_tokens_by_jti_until_expiry() {
        String token = jwt.generateToken("alice@example.com");
        String jti = jwt.requireValidClaims(token).getId();

        assertThat(blacklist.addToBlacklist(token)).isTrue();

        Mockito.verify(values).set(eq("jwt:bl:jti:" + jti), eq("1"), anyLong(), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void should_look_up_revocations_by_jti() {
        String token = jwt.generateToken("alice@example.com");
        Mockito.when(redis.hasKey(startsWith("jwt:bl:jti:"))).thenReturn(true);

        assertThat(blacklist.isBlacklisted(token)).isTrue();
    }

    @Test
    void should_fail_open_when_redis_is_down() {
        String token = jwt.generateToken("alice@example.com");
        Mockito.when(redis.hasKey(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        Mockito.doThrow(new RedisConnectionFailureException("down"))
                .when(values).set(anyString(), anyString(), anyLong(), Mockito.any(TimeUnit.class));

        assertThat(blacklist.isBlacklisted(token)).isFalse();
        assertThat(blacklist.addToBlacklist(token)).isFalse();
    }

    @Test
    void should_ignore_unparseable_tokens() {
        assertThat(blacklist.addToBlacklist("garbage")).isFalse();
        assertThat(blacklist.isBlacklisted("garbage")).isFalse();
        assertThat(blacklist.addToBlacklist(" ")).isFalse();
    }
}
