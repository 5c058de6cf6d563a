package com.aschik.accountservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Problems with the incoming client request itself (malformed input, limits, media).
 *
 * Conventions:
 *  - type:  https://aschik.dev/problems/<slug>
 *  - detail: safe, non-sensitive explanation suitable for clients
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 – malformed email, short password, bad username and similar. */
    public static final class ValidationFailed extends ApiException {
        public ValidationFailed(String detail) {
            super(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                    "validation-error", "Validation Error", detail);
        }
    }

    /** 400 – multipart request without any file part. */
    public static final class NoFileUploaded extends ApiException {
        public NoFileUploaded(String detail) {
            super(HttpStatus.BAD_REQUEST, ErrorCode.NO_FILE_UPLOADED,
                    "no-file-uploaded", "No File Uploaded", detail);
        }
    }

    /** 400 – file content type outside the image allow-list. */
    public static final class InvalidFileType extends ApiException {
        public InvalidFileType(String detail) {
            super(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_FILE_TYPE,
                    "invalid-file-type", "Invalid File Type", detail);
        }
    }

    /** 400 – more files than a batch may carry. */
    public static final class TooManyFiles extends ApiException {
        public TooManyFiles(String detail) {
            super(HttpStatus.BAD_REQUEST, ErrorCode.TOO_MANY_FILES,
                    "too-many-files", "Too Many Files", detail);
        }
    }

    /** 413 – a single file exceeds the size limit. */
    public static final class PayloadTooLarge extends ApiException {
        public PayloadTooLarge(String detail) {
            super(HttpStatus.PAYLOAD_TOO_LARGE, ErrorCode.FILE_TOO_LARGE,
                    "payload-too-large", "Payload Too Large", detail);
        }
    }

    /** 429 – client exceeded a fixed-window limit. */
    @Getter
    public static final class RateLimited extends ApiException {
        private final long retryAfterSeconds;

        public RateLimited(String detail, long retryAfterSeconds) {
            super(HttpStatus.TOO_MANY_REQUESTS, ErrorCode.RATE_LIMITED,
                    "rate-limited", "Too Many Requests", detail);
            this.retryAfterSeconds = retryAfterSeconds;
        }
    }
}
