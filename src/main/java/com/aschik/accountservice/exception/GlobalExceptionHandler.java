package com.aschik.accountservice.exception;

import com.aschik.accountservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.IOException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorResponseWriter writer;

    // ---------- Custom domain / API exceptions ----------

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        if (ex.getStatus().is5xxServerError()) {
            // infrastructure failure: full cause for ops, the detail stays generic
            log.error("{} on {}: {}", ex.code(), req.getRequestURI(), ex.getMessage(), ex.getCause());
        } else {
            log.debug("ApiException: status={}, code={}, detail={}", ex.getStatus(), ex.code(), ex.getMessage());
        }
        if (ex instanceof RequestExceptions.RateLimited limited) {
            resp.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(limited.getRetryAfterSeconds()));
        }
        writer.write(req, resp, ex.getStatus(), ex.getErrorCode(), ex.getType(), ex.getTitle(),
                safeDetail(ex.getMessage()));
    }

    // ---------- Validation & request-shape errors ----------

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public void handleMethodArgumentNotValid(@NonNull HttpServletRequest req,
                                             @NonNull HttpServletResponse resp,
                                             @NonNull MethodArgumentNotValidException ex) throws IOException {
        var details = ex.getBindingResult().getFieldErrors().stream()
                .limit(5) // keep payload small
                .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .collect(Collectors.joining("; "));
        validation(req, resp, details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public void handleConstraintViolation(@NonNull HttpServletRequest req,
                                          @NonNull HttpServletResponse resp,
                                          @NonNull ConstraintViolationException ex) throws IOException {
        var details = ex.getConstraintViolations().stream()
                .limit(5)
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())
                .collect(Collectors.joining("; "));
        validation(req, resp, details);
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, HttpMessageNotReadableException.class })
    public void handleBadRequest(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull Exception ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                ProblemTypes.uri("bad-request"),
                "Bad Request",
                "Malformed or missing request parameters.");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public void handleTypeMismatch(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull MethodArgumentTypeMismatchException ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                ProblemTypes.uri("type-mismatch"),
                "Type Mismatch",
                "Parameter '" + ex.getName() + "' has invalid type.");
    }

    // ---------- Uploads ----------

    @ExceptionHandler(MissingServletRequestPartException.class)
    public void handleMissingPart(@NonNull HttpServletRequest req,
                                  @NonNull HttpServletResponse resp,
                                  @NonNull MissingServletRequestPartException ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST, ErrorCode.NO_FILE_UPLOADED,
                ProblemTypes.uri("no-file-uploaded"),
                "No File Uploaded",
                "No file uploaded.");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public void handleUploadTooLarge(@NonNull HttpServletRequest req,
                                     @NonNull HttpServletResponse resp,
                                     @NonNull MaxUploadSizeExceededException ex) throws IOException {
        writer.write(req, resp, HttpStatus.PAYLOAD_TOO_LARGE, ErrorCode.FILE_TOO_LARGE,
                ProblemTypes.uri("payload-too-large"),
                "Payload Too Large",
                "Uploaded file exceeds the allowed size.");
    }

    // ---------- HTTP mapping errors (JSON, not HTML) ----------

    @ExceptionHandler({ NoHandlerFoundException.class, NoResourceFoundException.class })
    public void handleNoHandler(@NonNull HttpServletRequest req,
                                @NonNull HttpServletResponse resp,
                                @NonNull Exception ex) throws IOException {
        writer.write(req, resp, HttpStatus.NOT_FOUND, ErrorCode.NOT_FOUND,
                ProblemTypes.uri("not-found"),
                "Not Found",
                "No handler for " + req.getRequestURI());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public void handleMethodNotAllowed(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull HttpRequestMethodNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.METHOD_NOT_ALLOWED, ErrorCode.METHOD_NOT_ALLOWED,
                ProblemTypes.uri("method-not-allowed"),
                "Method Not Allowed",
                "HTTP method not supported for this endpoint.");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public void handleUnsupportedMediaType(@NonNull HttpServletRequest req,
                                           @NonNull HttpServletResponse resp,
                                           @NonNull HttpMediaTypeNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.UNSUPPORTED_MEDIA_TYPE, ErrorCode.UNSUPPORTED_MEDIA_TYPE,
                ProblemTypes.uri("unsupported-media-type"),
                "Unsupported Media Type",
                "Content type is not supported.");
    }

    // Method-security denials surface here before the security filter sees them.
    @ExceptionHandler(AccessDeniedException.class)
    public void handleAccessDenied(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull AccessDeniedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.FORBIDDEN, ErrorCode.FORBIDDEN,
                ProblemTypes.uri("forbidden"),
                "Forbidden",
                "You do not have permission to access this resource.");
    }

    // ---------- Data conflicts ----------

    @ExceptionHandler(DataIntegrityViolationException.class)
    public void handleDataIntegrity(@NonNull HttpServletRequest req,
                                    @NonNull HttpServletResponse resp,
                                    @NonNull DataIntegrityViolationException ex) throws IOException {
        log.debug("DataIntegrityViolation: {}", ex.getMostSpecificCause().getMessage());
        writer.write(req, resp, HttpStatus.CONFLICT, ErrorCode.CONFLICT,
                ProblemTypes.uri("conflict"),
                "Conflict",
                "A conflicting resource already exists or violates a constraint.");
    }

    // ---------- Fallback 500 ----------

    @ExceptionHandler(Exception.class)
    public void handleGeneric(@NonNull HttpServletRequest req,
                              @NonNull HttpServletResponse resp,
                              @NonNull Exception ex) throws IOException {
        log.error("Unhandled exception", ex);
        writer.write(req, resp, HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR,
                ProblemTypes.uri("internal-error"),
                "Internal Server Error",
                "An unexpected error occurred.");
    }

    // ---------- helpers ----------

    private void validation(HttpServletRequest req, HttpServletResponse resp, String details) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                ProblemTypes.uri("validation-error"),
                "Validation Error",
                details.isBlank() ? "Request validation failed." : details);
    }

    private String safeDetail(String s) {
        return (s == null || s.isBlank()) ? "Request could not be processed." : s;
    }
}
