package com.aschik.accountservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SystemStatus {
    private Instant serverTime;
    private long uptimeSeconds;
    private String javaVersion;
    private long heapUsedBytes;
    private long heapMaxBytes;
    private int availableProcessors;
    private long activeUsers;
    private boolean mailReachable;
    private boolean remoteStorageEnabled;
}
