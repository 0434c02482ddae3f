package com.pdfstorage.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents API 的一个条目（文件 / 目录 / 链接）。sha 是更新与删除时必须带上的乐观并发令牌。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentEntry(
        String type,
        String name,
        String path,
        String sha,
        Long size,
        @JsonProperty("download_url") String downloadUrl,
        @JsonProperty("html_url") String htmlUrl
) {
    public static final String TYPE_FILE = "file";

    public boolean isFile() {
        return TYPE_FILE.equals(type);
    }
}
