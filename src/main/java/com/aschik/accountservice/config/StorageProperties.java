package com.aschik.accountservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.util.List;

@ConfigurationProperties(prefix = "app.storage")
public record StorageProperties(
        @DefaultValue("5MB") DataSize maxFileSize,
        @DefaultValue("5") int maxFiles,
        @DefaultValue({"image/jpeg", "image/jpg", "image/png", "image/gif", "image/webp"}) List<String> allowedTypes,
        @DefaultValue Local local,
        @DefaultValue Remote remote
) {

    public record Local(
            @DefaultValue("uploads/images") String dir,
            @DefaultValue("http://localhost:8080") String publicBaseUrl
    ) {}

    public record Remote(
            @DefaultValue("false") boolean enabled,
            String url,
            String accessKey,
            String secretKey,
            @DefaultValue("account-uploads") String bucket,
            @DefaultValue("uploads") String folder
    ) {}
}
