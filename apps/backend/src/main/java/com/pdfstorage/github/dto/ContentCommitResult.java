package com.pdfstorage.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 内容写入 / 删除后返回的结果。删除时 content 为 null。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentCommitResult(
        ContentEntry content,
        CommitInfo commit
) {}
