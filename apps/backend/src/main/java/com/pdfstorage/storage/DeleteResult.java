package com.pdfstorage.storage;

import com.pdfstorage.github.dto.CommitInfo;

public record DeleteResult(String fileName, CommitInfo commit) {}
