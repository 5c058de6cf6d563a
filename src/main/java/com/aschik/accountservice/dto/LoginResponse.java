package com.aschik.accountservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Result of a sign-in or token refresh. Unverified accounts get
 * {@code requiresVerification=true} and no token.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginResponse {

    private String accessToken;
    private String tokenType;
    private Long expiresIn;
    private Instant issuedAt;
    private boolean requiresVerification;
    private String email;
    private UserSummary user;
}
