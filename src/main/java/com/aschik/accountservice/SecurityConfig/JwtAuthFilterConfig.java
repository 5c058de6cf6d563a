package com.aschik.accountservice.SecurityConfig;

import com.aschik.accountservice.config.AdminProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Bearer-token authentication. Account tokens resolve through the (cached)
 * UserDetailsService; admin tokens resolve to the configured static admin and
 * never touch the database.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilterConfig extends OncePerRequestFilter {

    private final JwtTokenProviderConfig jwtService;
    private final UserDetailsService userDetailsService;
    private final TokenBlacklistConfig blacklistService;
    private final AdminProperties adminProperties;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        final String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith("Bearer ")) {
            filterChain.doFilter(request, response);
            return;
        }
        final String token = authHeader.substring(7);

        // revoked tokens fall through unauthenticated; the entry point answers 401
        if (blacklistService.isBlacklisted(token)) {
            filterChain.doFilter(request, response);
            return;
        }

        try {
            final String email = jwtService.extractEmail(token);
            if (StringUtils.hasText(email) && SecurityContextHolder.getContext().getAuthentication() == null) {
                UserDetails userDetails = resolve(token, email);
                if (userDetails != null && jwtService.validateToken(token, userDetails)) {
                    SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
                    UsernamePasswordAuthenticationToken authToken =
                            new UsernamePasswordAuthenticationToken(userDetails, null, userDetails.getAuthorities());
                    authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                    securityContext.setAuthentication(authToken);
                    SecurityContextHolder.setContext(securityContext);
                }
            }
        } catch (IllegalArgumentException | UsernameNotFoundException ex) {
            log.debug("JWT authentication skipped: {}", ex.getMessage());
        }

        filterChain.doFilter(request, response);
    }

    private UserDetails resolve(String token, String email) {
        JwtTokenProviderConfig.TokenType type = jwtService.extractType(token)
                .orElse(JwtTokenProviderConfig.TokenType.USER);
        if (type == JwtTokenProviderConfig.TokenType.ADMIN) {
            if (!adminProperties.isConfigured() || !adminProperties.email().equalsIgnoreCase(email)) {
                return null;
            }
            return User.withUsername(adminProperties.email())
                    .password("")
                    .roles("ADMIN")
                    .build();
        }
        UserDetails user = userDetailsService.loadUserByUsername(email);
        return user.isEnabled() && user.isAccountNonLocked() ? user : null;
    }
}
