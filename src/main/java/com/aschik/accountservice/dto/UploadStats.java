package com.aschik.accountservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class UploadStats {
    private String localDirectory;
    private long localFileCount;
    private long localTotalBytes;
    private long maxFileSizeBytes;
    private int maxFilesPerRequest;
    private List<String> allowedTypes;
    private boolean remoteEnabled;
    private String remoteBucket;
    private String remoteFolder;
}
