package com.aschik.accountservice.dto;

import com.aschik.accountservice.entity.PasscodePurpose;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/** Validity window of a freshly issued code. The code itself is never returned. */
@Data
@Builder
public class OtpIssueResult {
    private String email;
    private PasscodePurpose purpose;
    private int expiresInMinutes;
    private Instant expiresAt;
}
