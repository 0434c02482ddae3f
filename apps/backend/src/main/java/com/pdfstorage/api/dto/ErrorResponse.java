package com.pdfstorage.api.dto;

public record ErrorResponse(String error) {}
