package com.aschik.accountservice.service;

import com.aschik.accountservice.dto.ImageUploadResponse;
import com.aschik.accountservice.dto.UploadStats;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

public interface ImageUploadService {

    ImageUploadResponse uploadLocal(MultipartFile file);

    List<ImageUploadResponse> uploadLocal(List<MultipartFile> files);

    void deleteLocal(String filename);

    ImageUploadResponse uploadRemote(MultipartFile file);

    List<ImageUploadResponse> uploadRemote(List<MultipartFile> files);

    void deleteRemote(String objectKey);

    /** Connectivity probe for the remote store. */
    String testRemote();

    UploadStats stats();
}
