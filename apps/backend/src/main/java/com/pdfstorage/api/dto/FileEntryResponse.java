package com.pdfstorage.api.dto;

public record FileEntryResponse(
        String name,
        String path,
        String url
) {}
