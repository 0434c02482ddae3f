package com.pdfstorage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "github")
public class GitHubProperties {

    /** OAuth App 凭据，来自 GITHUB_CLIENT_ID / GITHUB_CLIENT_SECRET */
    private String clientId;
    private String clientSecret;

    private String apiBaseUrl = "https://api.github.com";
    private String oauthBaseUrl = "https://github.com";
    private String scope = "public_repo";

    /** 回调地址，默认 http://localhost:${server.port}/auth/github/callback */
    private String redirectUri;
}
