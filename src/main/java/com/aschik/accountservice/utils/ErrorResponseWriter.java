package com.aschik.accountservice.utils;

import com.aschik.accountservice.exception.ErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Writes RFC 7807 problem bodies straight to the servlet response. Shared by the
 * MVC exception handler and the security entry points, which run outside MVC.
 */
@Component
public class ErrorResponseWriter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_ATTR   = "ACCOUNT_REQUEST_ID";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ErrorResponseWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      @NonNull ErrorCode code,
                      String type,              // e.g. "https://aschik.dev/problems/unauthorized"
                      @NonNull String title,
                      @NonNull String detail) throws IOException {

        if (resp.isCommitted()) return;

        ProblemDetail pd = ProblemDetail.forStatus(status);
        if (type != null && !type.isBlank()) {
            pd.setType(URI.create(type));
        }
        pd.setTitle(title);
        pd.setDetail(detail);
        pd.setInstance(URI.create(req.getRequestURI()));

        pd.setProperty("success", false);
        pd.setProperty("code", code.name());
        pd.setProperty("timestamp", OffsetDateTime.now(clock).toString());
        pd.setProperty("path", req.getRequestURI());
        pd.setProperty("requestId", resolveRequestId(req, resp));

        resp.setStatus(status.value());
        resp.setHeader("Cache-Control", "no-store");
        resp.setHeader("Pragma", "no-cache");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType("application/problem+json");

        objectMapper.writeValue(resp.getOutputStream(), pd);
    }

    private String resolveRequestId(HttpServletRequest req, HttpServletResponse resp) {
        String id = resp.getHeader(REQUEST_ID_HEADER);
        if (id == null || id.isBlank()) {
            id = req.getHeader(REQUEST_ID_HEADER);
        }
        if (id == null || id.isBlank()) {
            Object attr = req.getAttribute(REQUEST_ID_ATTR);
            if (attr instanceof String s && !s.isBlank()) {
                id = s;
            }
        }
        return id;
    }
}
