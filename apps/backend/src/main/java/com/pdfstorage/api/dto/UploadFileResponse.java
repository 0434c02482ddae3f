package com.pdfstorage.api.dto;

/**
 * 上传成功后返回给前端的信息
 */
public record UploadFileResponse(
        boolean success,
        String url      // raw.githubusercontent.com 上的直链，由 owner/repo/branch/path 直接拼出
) {}
