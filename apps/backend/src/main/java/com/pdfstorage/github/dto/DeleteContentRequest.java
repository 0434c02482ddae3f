package com.pdfstorage.github.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeleteContentRequest(
        String message,
        String sha,
        String branch
) {}
