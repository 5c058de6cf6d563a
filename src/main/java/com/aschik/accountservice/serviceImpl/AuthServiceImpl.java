package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.SecurityConfig.JwtTokenProviderConfig;
import com.aschik.accountservice.SecurityConfig.TokenBlacklistConfig;
import com.aschik.accountservice.dto.LoginRequest;
import com.aschik.accountservice.dto.LoginResponse;
import com.aschik.accountservice.dto.UserSummary;
import com.aschik.accountservice.entity.User;
import com.aschik.accountservice.exception.UserExceptions;
import com.aschik.accountservice.repository.UserRepository;
import com.aschik.accountservice.service.AuthService;
import com.aschik.accountservice.utils.EmailAddresses;
import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.AuthenticationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    static final String TOKEN_TYPE = "Bearer";

    private final AuthenticationManager authenticationManager;
    private final UserRepository userRepository;
    private final JwtTokenProviderConfig jwtTokenProvider;
    private final TokenBlacklistConfig tokenBlacklist;
    private final Clock clock;

    @Override
    public LoginResponse login(LoginRequest request) {
        if (request.getEmail() == null || request.getPassword() == null) {
            throw new UserExceptions.InvalidCredentials();
        }
        final String email = EmailAddresses.normalize(request.getEmail());

        try {
            authenticationManager.authenticate(
                    new UsernamePasswordAuthenticationToken(email, request.getPassword()));
        } catch (AuthenticationException ex) {
            // unknown email, wrong password, locked and disabled all look the same
            log.debug("Login rejected for {}: {}", email, ex.getClass().getSimpleName());
            throw new UserExceptions.InvalidCredentials();
        }

        User user = userRepository.findByEmail(email)
                .filter(u -> !u.isDeleted())
                .orElseThrow(UserExceptions.InvalidCredentials::new);

        if (!user.isEmailVerified()) {
            log.info("Login for {} deferred until the email is verified", email);
            return LoginResponse.builder()
                    .requiresVerification(true)
                    .email(email)
                    .build();
        }

        log.info("Login success for email={}", email);
        return issueFor(user);
    }

    @Override
    public LoginResponse refresh(String token) {
        if (token == null || token.isBlank()) {
            throw new UserExceptions.InvalidToken("Refresh token is required");
        }
        Claims claims = jwtTokenProvider.requireValidClaims(token);

        if (!JwtTokenProviderConfig.TokenType.USER.claim().equals(claims.get(JwtTokenProviderConfig.TYPE_CLAIM))) {
            throw new UserExceptions.InvalidToken("Invalid or expired token");
        }
        if (tokenBlacklist.isBlacklisted(token)) {
            throw new UserExceptions.InvalidToken("Token has been revoked");
        }

        User user = userRepository.findByEmail(claims.getSubject())
                .filter(u -> !u.isDeleted() && u.isEnabled() && !u.isLocked() && u.isEmailVerified())
                .orElseThrow(() -> new UserExceptions.InvalidToken("Invalid or expired token"));

        LoginResponse response = issueFor(user);
        tokenBlacklist.addToBlacklist(token);
        log.debug("Refreshed token for {}", user.getEmail());
        return response;
    }

    @Override
    public void logout(String token) {
        if (token == null || token.isBlank()) {
            throw new UserExceptions.InvalidToken("Bearer token is required");
        }
        Claims claims = jwtTokenProvider.requireValidClaims(token);
        if (!tokenBlacklist.addToBlacklist(token)) {
            log.warn("Token for {} could not be revoked; it stays valid until expiry", claims.getSubject());
            return;
        }
        log.info("Logout for {}", claims.getSubject());
    }

    @Override
    public UserSummary profile(String email) {
        return userRepository.findByEmail(EmailAddresses.normalize(email))
                .filter(u -> !u.isDeleted())
                .map(UserSummary::from)
                .orElseThrow(() -> new UserExceptions.UserNotFound("User not found"));
    }

    private LoginResponse issueFor(User user) {
        return LoginResponse.builder()
                .accessToken(jwtTokenProvider.generateToken(user.getEmail()))
                .tokenType(TOKEN_TYPE)
                .expiresIn(jwtTokenProvider.getTokenValiditySeconds())
                .issuedAt(Instant.now(clock))
                .email(user.getEmail())
                .user(UserSummary.from(user))
                .build();
    }
}
