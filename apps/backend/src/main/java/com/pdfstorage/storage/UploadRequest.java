package com.pdfstorage.storage;

import java.nio.file.Path;

/**
 * 一次上传的临时数据：客户端声明的文件名与 MIME、大小，以及落盘的临时文件。
 * 临时文件归处理这次请求的链路独占，结束时必须删除。
 */
public record UploadRequest(
        String originalFilename,
        String contentType,
        long size,
        Path tempFile
) {}
