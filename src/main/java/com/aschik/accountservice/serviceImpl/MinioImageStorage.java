package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.config.StorageProperties;
import com.aschik.accountservice.dto.ImageUploadResponse;
import com.aschik.accountservice.exception.ExternalExceptions;
import com.aschik.accountservice.exception.RequestExceptions;
import com.aschik.accountservice.service.ImageStorage;
import io.minio.BucketExistsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.InputStream;
import java.time.Clock;
import java.util.UUID;

/**
 * Images in a MinIO / S3-compatible bucket. Objects are keyed
 * {@code <folder>/<epochMillis>-<uuid>.<ext>}; the bucket is created on first use.
 */
@Slf4j
@Service
public class MinioImageStorage implements ImageStorage {

    private final StorageProperties.Remote remote;
    private final MinioClient client;
    private final Clock clock;
    private volatile boolean bucketReady;

    @Autowired
    public MinioImageStorage(StorageProperties properties, Clock clock) {
        this(properties, clock, buildClient(properties.remote()));
    }

    MinioImageStorage(StorageProperties properties, Clock clock, MinioClient client) {
        this.remote = properties.remote();
        this.clock = clock;
        this.client = client;
    }

    private static MinioClient buildClient(StorageProperties.Remote remote) {
        if (!remote.enabled() || !StringUtils.hasText(remote.url())) {
            return null;
        }
        return MinioClient.builder()
                .endpoint(remote.url())
                .credentials(remote.accessKey(), remote.secretKey())
                .build();
    }

    @Override
    public String name() {
        return "remote";
    }

    @Override
    public boolean isEnabled() {
        return client != null;
    }

    @Override
    public ImageUploadResponse store(MultipartFile file) {
        MinioClient minio = requireClient();
        String objectKey = remote.folder() + "/" + clock.millis() + "-" + UUID.randomUUID() + ImageFiles.extensionOf(file);
        try {
            ensureBucket(minio);
            try (InputStream is = file.getInputStream()) {
                minio.putObject(PutObjectArgs.builder()
                        .bucket(remote.bucket())
                        .object(objectKey)
                        .stream(is, file.getSize(), -1)
                        .contentType(file.getContentType())
                        .build());
            }
        } catch (Exception e) {
            throw new ExternalExceptions.UpstreamBadGateway("Failed to upload to remote storage", e);
        }
        log.info("Stored remote image {} ({} bytes)", objectKey, file.getSize());
        return ImageUploadResponse.builder()
                .id(objectKey)
                .url(objectUrl(objectKey))
                .originalName(file.getOriginalFilename())
                .contentType(file.getContentType())
                .size(file.getSize())
                .storage(name())
                .build();
    }

    @Override
    public void delete(String objectKey) {
        MinioClient minio = requireClient();
        if (!StringUtils.hasText(objectKey) || objectKey.contains("..")) {
            throw new RequestExceptions.ValidationFailed("Invalid object key");
        }
        try {
            minio.removeObject(RemoveObjectArgs.builder().bucket(remote.bucket()).object(objectKey).build());
        } catch (Exception e) {
            throw new ExternalExceptions.UpstreamBadGateway("Failed to delete from remote storage", e);
        }
        log.info("Deleted remote image {}", objectKey);
    }

    /** Round-trip to the bucket; used by the connectivity check. */
    public boolean ping() {
        MinioClient minio = requireClient();
        try {
            return minio.bucketExists(BucketExistsArgs.builder().bucket(remote.bucket()).build());
        } catch (Exception e) {
            throw new ExternalExceptions.StorageUnavailable("Remote storage unreachable", e);
        }
    }

    public String bucket() {
        return remote.bucket();
    }

    public String folder() {
        return remote.folder();
    }

    private void ensureBucket(MinioClient minio) throws Exception {
        if (bucketReady) return;
        boolean exists = minio.bucketExists(BucketExistsArgs.builder().bucket(remote.bucket()).build());
        if (!exists) {
            minio.makeBucket(MakeBucketArgs.builder().bucket(remote.bucket()).build());
            log.info("Created bucket {}", remote.bucket());
        }
        bucketReady = true;
    }

    private MinioClient requireClient() {
        if (client == null) {
            throw new ExternalExceptions.StorageUnavailable("Remote storage is not configured");
        }
        return client;
    }

    private String objectUrl(String objectKey) {
        String base = remote.url().endsWith("/") ? remote.url() : remote.url() + "/";
        return base + remote.bucket() + "/" + objectKey;
    }
}
