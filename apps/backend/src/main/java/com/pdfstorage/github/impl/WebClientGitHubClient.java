package com.pdfstorage.github.impl;

import com.pdfstorage.config.GitHubProperties;
import com.pdfstorage.github.GitHubApiException;
import com.pdfstorage.github.GitHubClient;
import com.pdfstorage.github.dto.AccessTokenResponse;
import com.pdfstorage.github.dto.ContentCommitResult;
import com.pdfstorage.github.dto.ContentEntry;
import com.pdfstorage.github.dto.CreateRepositoryRequest;
import com.pdfstorage.github.dto.DeleteContentRequest;
import com.pdfstorage.github.dto.GitHubRepo;
import com.pdfstorage.github.dto.PutContentRequest;
import com.pdfstorage.github.dto.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class WebClientGitHubClient implements GitHubClient {

    private final WebClient webClient;
    private final GitHubProperties props;

    public WebClientGitHubClient(@Qualifier("githubWebClient") WebClient webClient, GitHubProperties props) {
        this.webClient = webClient;
        this.props = props;
    }

    @Override
    public Mono<AccessTokenResponse> exchangeCode(String code) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("client_id", props.getClientId());
        body.put("client_secret", props.getClientSecret());
        body.put("code", code);

        return webClient.post()
                .uri(URI.create(stripTrailingSlash(props.getOauthBaseUrl()) + "/login/oauth/access_token"))
                .accept(MediaType.APPLICATION_JSON)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, WebClientGitHubClient::toApiException)
                .bodyToMono(AccessTokenResponse.class);
    }

    @Override
    public Mono<UserProfile> getAuthenticatedUser(String token) {
        return webClient.get()
                .uri("/user")
                .headers(h -> h.setBearerAuth(token))
                .retrieve()
                .onStatus(HttpStatusCode::isError, WebClientGitHubClient::toApiException)
                .bodyToMono(UserProfile.class);
    }

    @Override
    public Mono<GitHubRepo> getRepository(String token, String owner, String repo) {
        return webClient.get()
                .uri(b -> b.path("/repos/{owner}/{repo}").build(owner, repo))
                .headers(h -> h.setBearerAuth(token))
                .retrieve()
                .onStatus(HttpStatusCode::isError, WebClientGitHubClient::toApiException)
                .bodyToMono(GitHubRepo.class);
    }

    @Override
    public Mono<GitHubRepo> createRepository(String token, CreateRepositoryRequest request) {
        return webClient.post()
                .uri("/user/repos")
                .headers(h -> h.setBearerAuth(token))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, WebClientGitHubClient::toApiException)
                .bodyToMono(GitHubRepo.class);
    }

    @Override
    public Mono<List<ContentEntry>> listContents(String token, String owner, String repo, String path) {
        return webClient.get()
                .uri(b -> contentsUri(b, owner, repo, path))
                .headers(h -> h.setBearerAuth(token))
                .retrieve()
                .onStatus(HttpStatusCode::isError, WebClientGitHubClient::toApiException)
                .bodyToFlux(ContentEntry.class)
                .collectList();
    }

    @Override
    public Mono<ContentEntry> getContent(String token, String owner, String repo, String path) {
        return webClient.get()
                .uri(b -> contentsUri(b, owner, repo, path))
                .headers(h -> h.setBearerAuth(token))
                .retrieve()
                .onStatus(HttpStatusCode::isError, WebClientGitHubClient::toApiException)
                .bodyToMono(ContentEntry.class);
    }

    @Override
    public Mono<ContentCommitResult> putContent(String token, String owner, String repo, String path,
                                                PutContentRequest request) {
        return webClient.put()
                .uri(b -> contentsUri(b, owner, repo, path))
                .headers(h -> h.setBearerAuth(token))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, WebClientGitHubClient::toApiException)
                .bodyToMono(ContentCommitResult.class);
    }

    @Override
    public Mono<ContentCommitResult> deleteContent(String token, String owner, String repo, String path,
                                                   DeleteContentRequest request) {
        // DELETE 带请求体，只能走 method(...)
        return webClient.method(HttpMethod.DELETE)
                .uri(b -> contentsUri(b, owner, repo, path))
                .headers(h -> h.setBearerAuth(token))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, WebClientGitHubClient::toApiException)
                .bodyToMono(ContentCommitResult.class);
    }

    // ========= 工具方法 =========

    /**
     * 每个路径段都作为 URI 变量展开，保证文件名中的空格、括号等被完整编码，而 '/' 保留为分隔符。
     */
    static URI contentsUri(UriBuilder b, String owner, String repo, String path) {
        List<String> segments = new ArrayList<>(List.of("repos", owner, repo, "contents"));
        for (String s : path.split("/")) {
            if (!s.isEmpty()) segments.add(s);
        }
        StringBuilder template = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            template.append("/{s").append(i).append('}');
        }
        return b.path(template.toString()).build(segments.toArray());
    }

    private static Mono<? extends Throwable> toApiException(ClientResponse resp) {
        int status = resp.statusCode().value();
        return resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    log.debug("[github] error status={} body={}", status, body);
                    return new GitHubApiException(status, body);
                });
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
