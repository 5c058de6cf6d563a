package com.aschik.accountservice.service;

import com.aschik.accountservice.dto.ImageUploadResponse;
import org.springframework.web.multipart.MultipartFile;

/** A place uploaded images end up. Files reaching here are already validated. */
public interface ImageStorage {

    String name();

    boolean isEnabled();

    ImageUploadResponse store(MultipartFile file);

    void delete(String id);
}
