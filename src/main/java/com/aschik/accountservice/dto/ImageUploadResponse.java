package com.aschik.accountservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImageUploadResponse {
    /** Local file name or remote object key; the handle used for deletion. */
    private String id;
    private String url;
    private String originalName;
    private String contentType;
    private long size;
    private String storage;
}
