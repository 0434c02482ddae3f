package com.pdfstorage.github.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * login/oauth/access_token 的响应。code 无效时 GitHub 仍返回 200，只是带 error 而没有 access_token。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessTokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        String scope,
        String error,
        @JsonProperty("error_description") String errorDescription
) {
    @Override
    public String toString() {
        return "AccessTokenResponse[tokenType=" + tokenType + ", scope=" + scope + ", error=" + error + "]";
    }
}
