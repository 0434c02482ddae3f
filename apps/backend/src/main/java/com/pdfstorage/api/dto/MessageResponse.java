package com.pdfstorage.api.dto;

public record MessageResponse(String message) {}
