package com.aschik.accountservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegistrationResponse {
    private UserSummary user;
    /** False when the verification mail could not be sent; the account exists either way. */
    private boolean verificationSent;
}
