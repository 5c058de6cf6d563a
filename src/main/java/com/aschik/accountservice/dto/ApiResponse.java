package com.aschik.accountservice.dto;

import lombok.*;

import java.time.Instant;

/**
 * Generic success envelope written by {@code SuccessEnvelopeAdvice}.
 * Errors never use it; they are RFC 7807 problem documents.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ApiResponse<T> {

    @Builder.Default
    private boolean success = true;

    /** Application-level code, "OK" for success bodies. */
    private String code;

    private String message;

    private T data;

    /** Optional metadata (pagination, request id). */
    private Object meta;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static ApiResponse<Object> of(String code, String message, Object data, Object meta) {
        return ApiResponse.builder()
                .success(true)
                .code(code)
                .message(message)
                .data(data)
                .meta(meta)
                .build();
    }

    public static <U> ApiResponse<U> ok(String message, U data) {
        return ApiResponse.<U>builder()
                .success(true)
                .code("OK")
                .message(message)
                .data(data)
                .build();
    }
}
