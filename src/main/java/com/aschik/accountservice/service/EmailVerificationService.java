package com.aschik.accountservice.service;

import com.aschik.accountservice.dto.OtpIssueResult;
import com.aschik.accountservice.dto.VerificationStatus;

public interface EmailVerificationService {

    OtpIssueResult sendVerification(String email);

    VerificationStatus verifyEmail(String email, String code);

    VerificationStatus status(String email);
}
