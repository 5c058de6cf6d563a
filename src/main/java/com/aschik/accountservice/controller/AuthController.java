package com.aschik.accountservice.controller;

import com.aschik.accountservice.SecurityConfig.RateLimit;
import com.aschik.accountservice.dto.*;
import com.aschik.accountservice.exception.UserExceptions;
import com.aschik.accountservice.service.AuthService;
import com.aschik.accountservice.service.PasswordResetService;
import com.aschik.accountservice.service.RegistrationService;
import com.aschik.accountservice.utils.ResponseMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    static final String RESET_REQUESTED_MESSAGE =
            "If an account with that email exists, a password reset code has been sent";

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;
    private final RegistrationService registrationService;
    private final PasswordResetService passwordResetService;

    @PostMapping("/signup")
    @RateLimit(RateLimit.Policy.SIGNUP)
    @ResponseMessage("User registered successfully. Please check your email for the verification code.")
    public ResponseEntity<RegistrationResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registrationService.registerUser(request));
    }

    @PostMapping("/signin")
    @RateLimit(RateLimit.Policy.LOGIN)
    @ResponseMessage("Login successful")
    public LoginResponse signin(@Valid @RequestBody LoginRequest request) {
        return authService.login(request);
    }

    @PostMapping("/refresh-token")
    @RateLimit(RateLimit.Policy.API)
    @ResponseMessage("Token refreshed")
    public LoginResponse refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return authService.refresh(request.getToken());
    }

    @PostMapping("/logout")
    public ApiResponse<Void> logout(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw new UserExceptions.InvalidToken("Bearer token is required");
        }
        authService.logout(authorization.substring(BEARER_PREFIX.length()).trim());
        return ApiResponse.ok("Logged out successfully", null);
    }

    @GetMapping("/profile")
    @ResponseMessage("Profile retrieved")
    public UserSummary profile(@AuthenticationPrincipal UserDetails principal) {
        return authService.profile(principal.getUsername());
    }

    @PostMapping("/forgot-password")
    @RateLimit(RateLimit.Policy.OTP)
    public ApiResponse<Void> forgotPassword(@Valid @RequestBody EmailRequest request) {
        passwordResetService.requestReset(request.getEmail());
        return ApiResponse.ok(RESET_REQUESTED_MESSAGE, null);
    }

    @PostMapping("/reset-password")
    @RateLimit(RateLimit.Policy.OTP)
    public ApiResponse<Void> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        passwordResetService.completeReset(request.getEmail(), request.getOtp(), request.getNewPassword());
        return ApiResponse.ok("Password reset successfully", null);
    }
}
