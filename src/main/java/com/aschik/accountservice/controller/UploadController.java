package com.aschik.accountservice.controller;

import com.aschik.accountservice.dto.ApiResponse;
import com.aschik.accountservice.dto.ImageUploadResponse;
import com.aschik.accountservice.dto.UploadStats;
import com.aschik.accountservice.service.ImageUploadService;
import com.aschik.accountservice.utils.ResponseMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/upload")
@RequiredArgsConstructor
public class UploadController {

    private final ImageUploadService imageUploadService;

    @PostMapping(value = "/local", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseMessage("Image uploaded successfully")
    public ImageUploadResponse uploadLocal(@RequestParam("image") MultipartFile image) {
        return imageUploadService.uploadLocal(image);
    }

    @PostMapping(value = "/local/multiple", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseMessage("Images uploaded successfully")
    public List<ImageUploadResponse> uploadLocalBatch(@RequestParam("images") List<MultipartFile> images) {
        return imageUploadService.uploadLocal(images);
    }

    @DeleteMapping("/local/{filename}")
    public ApiResponse<Void> deleteLocal(@PathVariable String filename) {
        imageUploadService.deleteLocal(filename);
        return ApiResponse.ok("Image deleted successfully", null);
    }

    @PostMapping(value = "/remote", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseMessage("Image uploaded successfully")
    public ImageUploadResponse uploadRemote(@RequestParam("image") MultipartFile image) {
        return imageUploadService.uploadRemote(image);
    }

    @PostMapping(value = "/remote/multiple", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseMessage("Images uploaded successfully")
    public List<ImageUploadResponse> uploadRemoteBatch(@RequestParam("images") List<MultipartFile> images) {
        return imageUploadService.uploadRemote(images);
    }

    // object keys contain slashes, so the whole remaining path is captured
    @DeleteMapping("/remote/{*objectKey}")
    public ApiResponse<Void> deleteRemote(@PathVariable String objectKey) {
        imageUploadService.deleteRemote(objectKey.startsWith("/") ? objectKey.substring(1) : objectKey);
        return ApiResponse.ok("Image deleted successfully", null);
    }

    @GetMapping("/remote/test")
    public Map<String, String> testRemote() {
        return Map.of("status", imageUploadService.testRemote());
    }

    @GetMapping("/stats")
    public UploadStats stats() {
        return imageUploadService.stats();
    }
}
