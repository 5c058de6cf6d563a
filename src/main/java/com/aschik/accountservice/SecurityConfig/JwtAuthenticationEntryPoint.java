package com.aschik.accountservice.SecurityConfig;

import com.aschik.accountservice.exception.ErrorCode;
import com.aschik.accountservice.exception.ProblemTypes;
import com.aschik.accountservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 401 Unauthorized for unauthenticated requests.
 * Adds RFC 6750 WWW-Authenticate hint when the client attempted Bearer auth.
 */
@Slf4j
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ErrorResponseWriter writer;

    public JwtAuthenticationEntryPoint(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void commence(@NonNull HttpServletRequest request,
                         @NonNull HttpServletResponse response,
                         @NonNull AuthenticationException authException) throws IOException {
        String ah = request.getHeader("Authorization");
        boolean bearer = ah != null && ah.startsWith("Bearer ");
        if (bearer) {
            response.setHeader("WWW-Authenticate", "Bearer error=\"invalid_token\"");
        }
        writer.write(
                request,
                response,
                HttpStatus.UNAUTHORIZED,
                bearer ? ErrorCode.INVALID_TOKEN : ErrorCode.UNAUTHORIZED,
                ProblemTypes.uri("unauthorized"),
                "Unauthorized",
                bearer ? "Invalid or expired token." : "Authentication is required to access this resource."
        );
    }
}
