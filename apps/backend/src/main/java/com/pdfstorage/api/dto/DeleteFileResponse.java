package com.pdfstorage.api.dto;

import com.pdfstorage.github.dto.CommitInfo;

public record DeleteFileResponse(
        boolean success,
        String file,
        CommitInfo commit
) {}
