package com.aschik.accountservice.SecurityConfig;

import com.aschik.accountservice.exception.ErrorCode;
import com.aschik.accountservice.exception.ProblemTypes;
import com.aschik.accountservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/** 403 for authenticated callers without the required role (e.g. a user token on /admin). */
@Component
public class JwtAccessDeniedHandler implements AccessDeniedHandler {

    private final ErrorResponseWriter writer;

    public JwtAccessDeniedHandler(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void handle(@NonNull HttpServletRequest request,
                       @NonNull HttpServletResponse response,
                       @NonNull AccessDeniedException accessDeniedException) throws IOException {
        writer.write(
                request,
                response,
                HttpStatus.FORBIDDEN,
                ErrorCode.FORBIDDEN,
                ProblemTypes.uri("forbidden"),
                "Forbidden",
                "You do not have permission to access this resource."
        );
    }
}
