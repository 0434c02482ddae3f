package com.pdfstorage.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * GET /user 的结果，会话里缓存一份；login 用来给存储仓库命名空间。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserProfile(
        String login,
        Long id,
        String name,
        String email,
        @JsonProperty("avatar_url") String avatarUrl,
        @JsonProperty("html_url") String htmlUrl
) implements Serializable {}
