package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.config.StorageProperties;
import com.aschik.accountservice.config.WebConfig;
import com.aschik.accountservice.dto.ImageUploadResponse;
import com.aschik.accountservice.exception.ExternalExceptions;
import com.aschik.accountservice.exception.RequestExceptions;
import com.aschik.accountservice.exception.ResourceExceptions;
import com.aschik.accountservice.service.ImageStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.stream.Stream;

/**
 * Images on the local file system, served back under {@code /uploads/images/}.
 * Stored names are generated; the client's file name only contributes its extension.
 */
@Slf4j
@Service
public class LocalImageStorage implements ImageStorage {

    private final Path root;
    private final String publicBaseUrl;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public LocalImageStorage(StorageProperties properties, Clock clock) {
        this.root = Path.of(properties.local().dir()).toAbsolutePath().normalize();
        this.publicBaseUrl = trimTrailingSlash(properties.local().publicBaseUrl());
        this.clock = clock;
    }

    @Override
    public String name() {
        return "local";
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public ImageUploadResponse store(MultipartFile file) {
        String filename = "image-" + clock.millis() + "-" + random.nextInt(1_000_000_000) + ImageFiles.extensionOf(file);
        Path target = root.resolve(filename);
        try {
            Files.createDirectories(root);
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ExternalExceptions.StorageUnavailable("Failed to store file locally", e);
        }
        log.info("Stored local image {} ({} bytes)", filename, file.getSize());
        return ImageUploadResponse.builder()
                .id(filename)
                .url(publicBaseUrl + WebConfig.LOCAL_IMAGES_PATH + filename)
                .originalName(file.getOriginalFilename())
                .contentType(file.getContentType())
                .size(file.getSize())
                .storage(name())
                .build();
    }

    @Override
    public void delete(String filename) {
        Path target = resolveInsideRoot(filename);
        try {
            if (!Files.deleteIfExists(target)) {
                throw new ResourceExceptions.NotFound("File not found");
            }
        } catch (IOException e) {
            throw new ExternalExceptions.StorageUnavailable("Failed to delete file", e);
        }
        log.info("Deleted local image {}", filename);
    }

    public String directory() {
        return root.toString();
    }

    /** [fileCount, totalBytes] of the upload directory. */
    public long[] usage() {
        if (!Files.isDirectory(root)) {
            return new long[]{0, 0};
        }
        try (Stream<Path> files = Files.list(root)) {
            long[] acc = new long[2];
            files.filter(Files::isRegularFile).forEach(p -> {
                acc[0]++;
                acc[1] += p.toFile().length();
            });
            return acc;
        } catch (IOException e) {
            throw new ExternalExceptions.StorageUnavailable("Failed to read upload directory", e);
        }
    }

    private Path resolveInsideRoot(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new RequestExceptions.ValidationFailed("Filename is required");
        }
        Path target = root.resolve(filename).normalize();
        if (!root.equals(target.getParent())) {
            throw new RequestExceptions.ValidationFailed("Invalid filename");
        }
        return target;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
