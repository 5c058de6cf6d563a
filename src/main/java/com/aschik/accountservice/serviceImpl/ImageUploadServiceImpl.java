package com.aschik.accountservice.serviceImpl;

import com.aschik.accountservice.config.StorageProperties;
import com.aschik.accountservice.dto.ImageUploadResponse;
import com.aschik.accountservice.dto.UploadStats;
import com.aschik.accountservice.exception.ExternalExceptions;
import com.aschik.accountservice.exception.RequestExceptions;
import com.aschik.accountservice.service.ImageStorage;
import com.aschik.accountservice.service.ImageUploadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Locale;

/**
 * Validates uploads against the image policy, then hands them to a storage back end.
 * A batch is checked in full before the first file is written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImageUploadServiceImpl implements ImageUploadService {

    private final StorageProperties properties;
    private final LocalImageStorage localStorage;
    private final MinioImageStorage remoteStorage;

    @Override
    public ImageUploadResponse uploadLocal(MultipartFile file) {
        return store(localStorage, List.of(requirePresent(file))).get(0);
    }

    @Override
    public List<ImageUploadResponse> uploadLocal(List<MultipartFile> files) {
        return store(localStorage, files);
    }

    @Override
    public void deleteLocal(String filename) {
        localStorage.delete(filename);
    }

    @Override
    public ImageUploadResponse uploadRemote(MultipartFile file) {
        return store(remoteStorage, List.of(requirePresent(file))).get(0);
    }

    @Override
    public List<ImageUploadResponse> uploadRemote(List<MultipartFile> files) {
        return store(remoteStorage, files);
    }

    @Override
    public void deleteRemote(String objectKey) {
        remoteStorage.delete(objectKey);
    }

    @Override
    public String testRemote() {
        if (!remoteStorage.isEnabled()) {
            throw new ExternalExceptions.StorageUnavailable("Remote storage is not configured");
        }
        return remoteStorage.ping()
                ? "Remote storage reachable"
                : "Remote storage reachable; bucket will be created on first upload";
    }

    @Override
    public UploadStats stats() {
        long[] usage = localStorage.usage();
        return UploadStats.builder()
                .localDirectory(localStorage.directory())
                .localFileCount(usage[0])
                .localTotalBytes(usage[1])
                .maxFileSizeBytes(properties.maxFileSize().toBytes())
                .maxFilesPerRequest(properties.maxFiles())
                .allowedTypes(properties.allowedTypes())
                .remoteEnabled(remoteStorage.isEnabled())
                .remoteBucket(remoteStorage.isEnabled() ? remoteStorage.bucket() : null)
                .remoteFolder(remoteStorage.isEnabled() ? remoteStorage.folder() : null)
                .build();
    }

    private List<ImageUploadResponse> store(ImageStorage storage, List<MultipartFile> files) {
        validate(files);
        if (!storage.isEnabled()) {
            throw new ExternalExceptions.StorageUnavailable("Remote storage is not configured");
        }
        List<ImageUploadResponse> stored = files.stream().map(storage::store).toList();
        log.debug("Stored {} file(s) in {} storage", stored.size(), storage.name());
        return stored;
    }

    void validate(List<MultipartFile> files) {
        if (files == null || files.isEmpty() || files.stream().allMatch(f -> f == null || f.isEmpty())) {
            throw new RequestExceptions.NoFileUploaded("No file uploaded");
        }
        if (files.size() > properties.maxFiles()) {
            throw new RequestExceptions.TooManyFiles("Too many files. Maximum is " + properties.maxFiles() + " files.");
        }
        for (MultipartFile file : files) {
            requirePresent(file);
            String type = file.getContentType() == null ? "" : file.getContentType().toLowerCase(Locale.ROOT);
            if (!properties.allowedTypes().contains(type)) {
                throw new RequestExceptions.InvalidFileType("Only image files (JPEG, PNG, GIF, WebP) are allowed");
            }
            if (file.getSize() > properties.maxFileSize().toBytes()) {
                throw new RequestExceptions.PayloadTooLarge(
                        "File too large. Maximum size is " + properties.maxFileSize().toMegabytes() + "MB");
            }
        }
    }

    private MultipartFile requirePresent(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new RequestExceptions.NoFileUploaded("No file uploaded");
        }
        return file;
    }
}
