package com.aschik.accountservice.utils;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an id, echoed in {@code X-Request-Id} and copied into
 * success envelopes and problem documents. A well-formed caller-supplied id is kept.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    private static final int MAX_LENGTH = 64;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String id = request.getHeader(ErrorResponseWriter.REQUEST_ID_HEADER);
        if (!isAcceptable(id)) {
            id = UUID.randomUUID().toString();
        }
        request.setAttribute(ErrorResponseWriter.REQUEST_ID_ATTR, id);
        response.setHeader(ErrorResponseWriter.REQUEST_ID_HEADER, id);
        filterChain.doFilter(request, response);
    }

    static boolean isAcceptable(String id) {
        return StringUtils.hasText(id)
                && id.length() <= MAX_LENGTH
                && id.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-' || c == '_');
    }
}
