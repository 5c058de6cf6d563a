package com.aschik.accountservice.controller;

import com.aschik.accountservice.SecurityConfig.RateLimit;
import com.aschik.accountservice.dto.EmailRequest;
import com.aschik.accountservice.dto.OtpIssueResult;
import com.aschik.accountservice.dto.VerificationStatus;
import com.aschik.accountservice.dto.VerifyEmailRequest;
import com.aschik.accountservice.service.EmailVerificationService;
import com.aschik.accountservice.utils.ResponseMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/otp")
@RequiredArgsConstructor
public class OtpController {

    private final EmailVerificationService emailVerificationService;

    @PostMapping("/send-verification")
    @RateLimit(RateLimit.Policy.OTP)
    @ResponseMessage("Verification code sent successfully")
    public OtpIssueResult sendVerification(@Valid @RequestBody EmailRequest request) {
        return emailVerificationService.sendVerification(request.getEmail());
    }

    @PostMapping("/verify-email")
    @RateLimit(RateLimit.Policy.OTP)
    @ResponseMessage("Email verified successfully")
    public VerificationStatus verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
        return emailVerificationService.verifyEmail(request.getEmail(), request.getOtp());
    }

    @GetMapping("/verification-status/{email}")
    @RateLimit(RateLimit.Policy.API)
    @ResponseMessage("Verification status retrieved")
    public VerificationStatus status(@PathVariable String email) {
        return emailVerificationService.status(email);
    }
}
