package com.aschik.accountservice.utils;

import com.aschik.accountservice.dto.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.core.io.Resource;
import org.springframework.data.domain.Page;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps successful JSON responses in {@link ApiResponse}:
 * <pre>
 * { "success": true, "code": "OK", "message": "...", "data": {...},
 *   "meta": {"requestId": "...", "page": ...}, "timestamp": "...Z" }
 * </pre>
 * Problem documents, non-2xx statuses, binary bodies and already-wrapped
 * responses pass through untouched.
 */
@RestControllerAdvice
public class SuccessEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    static final String SUCCESS_CODE = "OK";

    @Override
    public boolean supports(@NonNull MethodParameter returnType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        // decided in beforeBodyWrite, which sees the media type and body
        return true;
    }

    @Override
    public Object beforeBodyWrite(@Nullable Object body,
                                  @NonNull MethodParameter returnType,
                                  @NonNull MediaType selectedContentType,
                                  @NonNull Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  @NonNull ServerHttpRequest request,
                                  @NonNull ServerHttpResponse response) {

        if (body instanceof ProblemDetail) return body;
        if (!isJsonLike(selectedContentType)) return body;

        if (body instanceof ResponseEntity<?> entity) {
            if (!entity.getStatusCode().is2xxSuccessful()) return body;
            Object inner = entity.getBody();
            if (shouldSkip(inner)) return body;
            return ResponseEntity.status(entity.getStatusCode())
                    .headers(entity.getHeaders())
                    .body(wrap(inner, returnType, request, response));
        }

        if (shouldSkip(body)) return body;

        if (response instanceof ServletServerHttpResponse sResp) {
            HttpStatus resolved = HttpStatus.resolve(sResp.getServletResponse().getStatus());
            if (resolved != null && !resolved.is2xxSuccessful()) return body;
        }
        return wrap(body, returnType, request, response);
    }

    private ApiResponse<Object> wrap(Object data, MethodParameter returnType,
                                     ServerHttpRequest request, ServerHttpResponse response) {
        return ApiResponse.of(SUCCESS_CODE, resolveMessage(returnType), data, meta(data, request, response));
    }

    private boolean shouldSkip(@Nullable Object body) {
        return body == null
                || body instanceof ApiResponse<?>
                || body instanceof byte[]
                || body instanceof Resource
                || body instanceof StreamingResponseBody;
    }

    private boolean isJsonLike(@NonNull MediaType mt) {
        if (MediaType.APPLICATION_PROBLEM_JSON.includes(mt)) return false;
        if (MediaType.TEXT_EVENT_STREAM.includes(mt)) return false;
        if (MediaType.APPLICATION_OCTET_STREAM.includes(mt)) return false;
        return MediaType.APPLICATION_JSON.includes(mt) || mt.getSubtype().endsWith("+json");
    }

    /** {@link ResponseMessage} on the method, then on the controller, else "OK". */
    private String resolveMessage(@NonNull MethodParameter returnType) {
        ResponseMessage ann = returnType.getMethodAnnotation(ResponseMessage.class);
        if (ann == null) {
            ann = returnType.getContainingClass().getAnnotation(ResponseMessage.class);
        }
        return (ann != null && StringUtils.hasText(ann.value())) ? ann.value() : SUCCESS_CODE;
    }

    private @Nullable Map<String, Object> meta(@Nullable Object body, ServerHttpRequest req, ServerHttpResponse resp) {
        Map<String, Object> meta = new LinkedHashMap<>();
        String requestId = requestId(req, resp);
        if (StringUtils.hasText(requestId)) {
            meta.put("requestId", requestId);
        }
        if (body instanceof Page<?> page) {
            meta.put("page", page.getNumber());
            meta.put("size", page.getSize());
            meta.put("totalItems", page.getTotalElements());
            meta.put("totalPages", page.getTotalPages());
        }
        return meta.isEmpty() ? null : meta;
    }

    /** Request header, then response header, then the attribute set by the error writer. */
    private String requestId(ServerHttpRequest req, ServerHttpResponse resp) {
        String id = req.getHeaders().getFirst(ErrorResponseWriter.REQUEST_ID_HEADER);
        if (!StringUtils.hasText(id)) {
            id = resp.getHeaders().getFirst(ErrorResponseWriter.REQUEST_ID_HEADER);
        }
        if (!StringUtils.hasText(id) && req instanceof ServletServerHttpRequest sreq) {
            Object attr = sreq.getServletRequest().getAttribute(ErrorResponseWriter.REQUEST_ID_ATTR);
            if (attr instanceof String s && StringUtils.hasText(s)) id = s;
        }
        return id;
    }
}
