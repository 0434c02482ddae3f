package com.pdfstorage.github.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** POST /user/repos 请求体 */
public record CreateRepositoryRequest(
        String name,
        String description,
        @JsonProperty("private") boolean privateRepo
) {}
