package com.pdfstorage.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CommitInfo(
        String sha,
        String message,
        String url,
        @JsonProperty("html_url") String htmlUrl
) {}
