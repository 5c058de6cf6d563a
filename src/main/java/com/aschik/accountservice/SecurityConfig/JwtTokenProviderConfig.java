package com.aschik.accountservice.SecurityConfig;

import com.aschik.accountservice.exception.UserExceptions;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.*;
import java.util.function.Function;

/**
 * HS256 access tokens. Subject is the email; the {@code type} claim separates
 * account tokens ({@code user}) from static-admin tokens ({@code admin}).
 */
@Slf4j
@Component
public class JwtTokenProviderConfig {

    public static final String TYPE_CLAIM = "type";

    public enum TokenType {
        USER("user"), ADMIN("admin");

        private final String claim;

        TokenType(String claim) { this.claim = claim; }

        public String claim() { return claim; }

        static Optional<TokenType> fromClaim(Object value) {
            return Arrays.stream(values()).filter(t -> t.claim.equals(value)).findFirst();
        }
    }

    @Value("${token.key.secret}")
    private String secret; // Base64-encoded HMAC secret

    @Value("${token.key.jwtExpiration}")
    private long jwtExpiration; // milliseconds

    // enforced only when configured
    @Value("${token.key.issuer:}")
    private String issuerOpt;

    @Value("${token.key.audience:}")
    private String audienceOpt;

    private SecretKey signingKey;
    private JwtParser jwtParser;

    public JwtTokenProviderConfig() {
    }

    /** For wiring outside the container (tests, tools). */
    public JwtTokenProviderConfig(String secret, long jwtExpiration) {
        this.secret = secret;
        this.jwtExpiration = jwtExpiration;
        init();
    }

    @PostConstruct
    void init() {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must be provided (base64).");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret.trim());
        } catch (DecodingException | IllegalArgumentException e) {
            throw new IllegalStateException("JWT secret must be valid Base64.", e);
        }
        // HS256 requires >= 256-bit (32 bytes) key
        if (keyBytes.length < 32) {
            throw new IllegalStateException("JWT secret too short for HS256. Provide >= 256-bit Base64 key.");
        }

        signingKey = Keys.hmacShaKeyFor(keyBytes);

        var parserBuilder = Jwts.parser()
                .verifyWith(signingKey)
                .clockSkewSeconds(30);

        if (issuerOpt != null && !issuerOpt.isBlank()) {
            parserBuilder = parserBuilder.requireIssuer(issuerOpt);
        }
        if (audienceOpt != null && !audienceOpt.isBlank()) {
            parserBuilder = parserBuilder.requireAudience(audienceOpt);
        }
        jwtParser = parserBuilder.build();
    }

    public String extractEmail(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    public Date extractExpiration(String token) {
        return extractClaim(token, Claims::getExpiration);
    }

    /** Token type, or empty for tokens minted without one. */
    public Optional<TokenType> extractType(String token) {
        return TokenType.fromClaim(extractClaim(token, c -> c.get(TYPE_CLAIM)));
    }

    public <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
        return claimsResolver.apply(extractAllClaims(token));
    }

    /**
     * Verified claims of a token the client handed back to us.
     *
     * @throws UserExceptions.InvalidToken on bad signature, expiry or malformed input
     */
    public Claims requireValidClaims(String token) {
        try {
            return extractAllClaims(token);
        } catch (IllegalArgumentException e) {
            throw new UserExceptions.InvalidToken("Invalid or expired token");
        }
    }

    /** Verifies signature and required claims. */
    private Claims extractAllClaims(String token) {
        try {
            return jwtParser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid JWT token: {}", e.getMessage());
            throw new IllegalArgumentException("Failed to parse JWT token.", e);
        }
    }

    /**
     * Validate the token against the user details and ensure it is not expired.
     * {@code userDetails.getUsername()} is the email for local accounts.
     */
    public boolean validateToken(String token, UserDetails userDetails) {
        try {
            Claims claims = extractAllClaims(token);
            String subjectEmail = claims.getSubject();
            Date exp = claims.getExpiration();
            if (subjectEmail == null || userDetails == null) return false;
            if (exp != null && exp.before(new Date())) return false;
            return subjectEmail.equalsIgnoreCase(userDetails.getUsername());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public String generateToken(String email) {
        return createToken(new HashMap<>(Map.of(TYPE_CLAIM, TokenType.USER.claim())), email);
    }

    public String generateAdminToken(String email, String role) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(TYPE_CLAIM, TokenType.ADMIN.claim());
        claims.put("role", role);
        return createToken(claims, email);
    }

    private String createToken(Map<String, Object> claims, String email) {
        long now = System.currentTimeMillis();
        Date issuedAt = new Date(now);
        Date expiration = new Date(now + Math.max(0, jwtExpiration));

        if (issuerOpt != null && !issuerOpt.isBlank()) {
            claims.putIfAbsent("iss", issuerOpt);
        }
        if (audienceOpt != null && !audienceOpt.isBlank()) {
            claims.putIfAbsent("aud", audienceOpt);
        }
        // JWT ID keys the revocation list
        claims.putIfAbsent("jti", UUID.randomUUID().toString().replace("-", ""));

        return Jwts.builder()
                .claims(claims)
                .subject(email)
                .issuedAt(issuedAt)
                .notBefore(issuedAt)
                .expiration(expiration)
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    public long getTokenValiditySeconds() {
        return jwtExpiration / 1000;
    }
}
