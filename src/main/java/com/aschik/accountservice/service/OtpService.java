package com.aschik.accountservice.service;

import com.aschik.accountservice.dto.OtpIssueResult;
import com.aschik.accountservice.dto.PasscodeHistoryEntry;
import com.aschik.accountservice.entity.PasscodePurpose;

import java.util.List;

public interface OtpService {

    /**
     * Invalidates every outstanding code for (email, purpose), stores a fresh one
     * and mails it.
     *
     * @throws com.aschik.accountservice.exception.OtpExceptions.DeliveryFailed if the
     *         mail could not be handed off; the stored code stays valid
     */
    OtpIssueResult issue(String email, PasscodePurpose purpose);

    /**
     * Consumes a matching outstanding code.
     *
     * @throws com.aschik.accountservice.exception.OtpExceptions.InvalidOrExpiredCode for a
     *         wrong, expired, already used or cross-purpose code
     */
    void verify(String email, String code, PasscodePurpose purpose);

    List<PasscodeHistoryEntry> history(String email);
}
