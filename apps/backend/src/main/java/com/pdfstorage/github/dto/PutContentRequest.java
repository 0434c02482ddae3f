package com.pdfstorage.github.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * PUT /repos/{owner}/{repo}/contents/{path}。content 为 Base64；覆盖已有文件时才需要 sha。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PutContentRequest(
        String message,
        String content,
        String sha,
        String branch
) {
    @Override
    public String toString() {
        return "PutContentRequest[message=" + message + ", contentLength="
                + (content == null ? 0 : content.length()) + ", sha=" + sha + ", branch=" + branch + "]";
    }
}
