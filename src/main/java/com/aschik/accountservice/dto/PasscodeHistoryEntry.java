package com.aschik.accountservice.dto;

import com.aschik.accountservice.entity.Passcode;
import com.aschik.accountservice.entity.PasscodePurpose;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PasscodeHistoryEntry {
    private PasscodePurpose purpose;
    private Instant createdAt;
    private Instant expiresAt;
    private boolean used;
    private Instant usedAt;

    public static PasscodeHistoryEntry from(Passcode p) {
        return PasscodeHistoryEntry.builder()
                .purpose(p.getPurpose())
                .createdAt(p.getCreatedAt())
                .expiresAt(p.getExpiresAt())
                .used(p.isUsed())
                .usedAt(p.getUsedAt())
                .build();
    }
}
