package com.aschik.accountservice.serviceImpl;

import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.util.Locale;
import java.util.Map;

final class ImageFiles {

    private static final Map<String, String> EXTENSION_BY_TYPE = Map.of(
            "image/jpeg", ".jpg",
            "image/jpg", ".jpg",
            "image/png", ".png",
            "image/gif", ".gif",
            "image/webp", ".webp"
    );

    private ImageFiles() {}

    /** Extension from the original name, falling back to the content type. */
    static String extensionOf(MultipartFile file) {
        String ext = StringUtils.getFilenameExtension(file.getOriginalFilename());
        if (StringUtils.hasText(ext) && ext.matches("[A-Za-z0-9]{1,5}")) {
            return "." + ext.toLowerCase(Locale.ROOT);
        }
        String type = file.getContentType() == null ? "" : file.getContentType().toLowerCase(Locale.ROOT);
        return EXTENSION_BY_TYPE.getOrDefault(type, "");
    }
}
