package com.aschik.accountservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Failures of the passcode machinery. {@link InvalidOrExpiredCode} is deliberately
 * a single kind: wrong, expired and already-used codes are reported the same way.
 */
public final class OtpExceptions {

    private OtpExceptions() {}

    /** 400 – no outstanding code matches. */
    public static final class InvalidOrExpiredCode extends ApiException {
        public InvalidOrExpiredCode() {
            super(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_OR_EXPIRED_CODE,
                    "invalid-or-expired-code", "Invalid Or Expired Code", "Invalid or expired OTP");
        }
    }

    /** 500 – passcode table could not be read or written. */
    public static final class PasscodeStorageFailure extends ApiException {
        public PasscodeStorageFailure(String detail, Throwable cause) {
            super(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.STORAGE_ERROR,
                    "storage-error", "Storage Error", detail, cause);
        }
    }

    /** 500 – the code was stored but the message could not be handed to the mail transport. */
    public static final class DeliveryFailed extends ApiException {
        public DeliveryFailed(String detail, Throwable cause) {
            super(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.TRANSPORT_ERROR,
                    "delivery-failed", "Delivery Failed", detail, cause);
        }
    }
}
