package com.pdfstorage.storage;

/**
 * 存储仓库 uploads 目录下的一个文件。sha 只在这一刻有效，删除前会重新读取。
 */
public record StoredFile(
        String name,
        String path,
        String downloadUrl,
        String sha
) {}
