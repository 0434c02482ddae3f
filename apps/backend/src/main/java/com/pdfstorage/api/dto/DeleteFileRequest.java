package com.pdfstorage.api.dto;

public record DeleteFileRequest(String fileName) {}
