package com.aschik.accountservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Failures caused by external systems (object storage). Wrap low-level I/O or
 * client exceptions with an appropriate subclass; keep the detail free of
 * credentials and payloads.
 */
public final class ExternalExceptions {

    private ExternalExceptions() {}

    /** 503 – the storage back end is disabled or unreachable. */
    public static final class StorageUnavailable extends ApiException {
        public StorageUnavailable(String detail) {
            super(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.STORAGE_UNAVAILABLE,
                    "storage-unavailable", "Storage Unavailable", detail);
        }

        public StorageUnavailable(String detail, Throwable cause) {
            super(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.STORAGE_UNAVAILABLE,
                    "storage-unavailable", "Storage Unavailable", detail, cause);
        }
    }

    /** 502 – the storage back end rejected or failed the operation. */
    public static final class UpstreamBadGateway extends ApiException {
        public UpstreamBadGateway(String detail, Throwable cause) {
            super(HttpStatus.BAD_GATEWAY, ErrorCode.UPSTREAM_ERROR,
                    "upstream-bad-gateway", "Upstream Bad Gateway", detail, cause);
        }
    }
}
