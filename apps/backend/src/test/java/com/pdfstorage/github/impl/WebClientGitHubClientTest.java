package com.pdfstorage.github.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pdfstorage.config.GitHubProperties;
import com.pdfstorage.github.GitHubApiException;
import com.pdfstorage.github.dto.CreateRepositoryRequest;
import com.pdfstorage.github.dto.DeleteContentRequest;
import com.pdfstorage.github.dto.PutContentRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebClientGitHubClientTest {

    private static final Logger log = LoggerFactory.getLogger(WebClientGitHubClientTest.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<ClientRequest> requests = new ArrayList<>();
    private GitHubProperties props;

    @BeforeEach
    void setUp() {
        props = new GitHubProperties();
        props.setClientId("cid");
        props.setClientSecret("csecret");
        requests.clear();
    }

    private WebClientGitHubClient respondWith(HttpStatus status, String json) {
        WebClient webClient = WebClient.builder()
                .baseUrl(props.getApiBaseUrl())
                .exchangeFunction(req -> {
                    requests.add(req);
                    log.info("stub <- {} {}", req.method(), req.url());
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, "application/json")
                            .body(json)
                            .build());
                })
                .build();
        return new WebClientGitHubClient(webClient, props);
    }

    private ClientRequest onlyRequest() {
        assertEquals(1, requests.size());
        return requests.get(0);
    }

    private static JsonNode bodyOf(ClientRequest req) throws Exception {
        MockClientHttpRequest out = new MockClientHttpRequest(req.method(), req.url());
        req.body().insert(out, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return MAPPER.readTree(out.getBodyAsString().block());
    }

    @Test
    void exchangeCodePostsCredentialsToOAuthHost() throws Exception {
        WebClientGitHubClient client = respondWith(HttpStatus.OK,
                "{\"access_token\":\"gho_abc\",\"token_type\":\"bearer\",\"scope\":\"public_repo\"}");

        StepVerifier.create(client.exchangeCode("the-code"))
                .assertNext(resp -> {
                    assertEquals("gho_abc", resp.accessToken());
                    assertEquals("public_repo", resp.scope());
                })
                .verifyComplete();

        ClientRequest req = onlyRequest();
        assertEquals(HttpMethod.POST, req.method());
        assertEquals("github.com", req.url().getHost());
        assertEquals("/login/oauth/access_token", req.url().getPath());
        assertThat(req.headers().getAccept()).extracting(Object::toString).contains("application/json");
        JsonNode body = bodyOf(req);
        assertEquals("cid", body.get("client_id").asText());
        assertEquals("csecret", body.get("client_secret").asText());
        assertEquals("the-code", body.get("code").asText());
    }

    @Test
    void exchangeCodeWithBadCodeYieldsNoToken() {
        WebClientGitHubClient client = respondWith(HttpStatus.OK,
                "{\"error\":\"bad_verification_code\",\"error_description\":\"The code passed is incorrect or expired.\"}");

        StepVerifier.create(client.exchangeCode("stale"))
                .assertNext(resp -> {
                    assertEquals(null, resp.accessToken());
                    assertEquals("bad_verification_code", resp.error());
                })
                .verifyComplete();
    }

    @Test
    void getAuthenticatedUserSendsBearerTokenAndParsesProfile() {
        WebClientGitHubClient client = respondWith(HttpStatus.OK,
                "{\"login\":\"octocat\",\"id\":42,\"avatar_url\":\"https://avatars/x\",\"public_repos\":8}");

        StepVerifier.create(client.getAuthenticatedUser("tok-1"))
                .assertNext(user -> {
                    assertEquals("octocat", user.login());
                    assertEquals(42L, user.id());
                    assertEquals("https://avatars/x", user.avatarUrl());
                })
                .verifyComplete();

        ClientRequest req = onlyRequest();
        assertEquals("/user", req.url().getPath());
        assertEquals("Bearer tok-1", req.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void getRepositoryTranslatesNotFound() {
        WebClientGitHubClient client = respondWith(HttpStatus.NOT_FOUND, "{\"message\":\"Not Found\"}");

        StepVerifier.create(client.getRepository("tok", "octocat", "pdf-storage"))
                .expectErrorSatisfies(err -> {
                    assertTrue(err instanceof GitHubApiException);
                    GitHubApiException ex = (GitHubApiException) err;
                    assertEquals(404, ex.getStatus());
                    assertTrue(ex.isNotFound());
                    assertThat(ex.getResponseBody()).contains("Not Found");
                })
                .verify();

        assertEquals("/repos/octocat/pdf-storage", onlyRequest().url().getPath());
    }

    @Test
    void createRepositoryPostsVisibilityAndDescription() throws Exception {
        WebClientGitHubClient client = respondWith(HttpStatus.CREATED,
                "{\"name\":\"pdf-storage\",\"full_name\":\"octocat/pdf-storage\",\"private\":false,\"owner\":{\"login\":\"octocat\"}}");

        StepVerifier.create(client.createRepository("tok",
                        new CreateRepositoryRequest("pdf-storage", "My personal PDF storage", false)))
                .assertNext(repo -> {
                    assertEquals("octocat/pdf-storage", repo.fullName());
                    assertEquals("octocat", repo.owner().login());
                })
                .verifyComplete();

        ClientRequest req = onlyRequest();
        assertEquals(HttpMethod.POST, req.method());
        assertEquals("/user/repos", req.url().getPath());
        JsonNode body = bodyOf(req);
        assertEquals("pdf-storage", body.get("name").asText());
        assertEquals("My personal PDF storage", body.get("description").asText());
        assertEquals(false, body.get("private").asBoolean());
    }

    @Test
    void listContentsReturnsEveryEntry() {
        WebClientGitHubClient client = respondWith(HttpStatus.OK, """
                [
                  {"type":"file","name":"1-a.pdf","path":"uploads/1-a.pdf","sha":"s1",
                   "download_url":"https://raw.githubusercontent.com/octocat/pdf-storage/main/uploads/1-a.pdf"},
                  {"type":"dir","name":"nested","path":"uploads/nested","sha":"s2","download_url":null}
                ]
                """);

        StepVerifier.create(client.listContents("tok", "octocat", "pdf-storage", "uploads"))
                .assertNext(entries -> {
                    assertEquals(2, entries.size());
                    assertTrue(entries.get(0).isFile());
                    assertEquals("s1", entries.get(0).sha());
                    assertEquals("dir", entries.get(1).type());
                })
                .verifyComplete();

        assertEquals("/repos/octocat/pdf-storage/contents/uploads", onlyRequest().url().getRawPath());
    }

    @Test
    void getContentEncodesFileNameButKeepsSlashes() {
        WebClientGitHubClient client = respondWith(HttpStatus.OK,
                "{\"type\":\"file\",\"name\":\"1-my file.pdf\",\"path\":\"uploads/1-my file.pdf\",\"sha\":\"abc\"}");

        StepVerifier.create(client.getContent("tok", "octocat", "pdf-storage", "uploads/1-my file.pdf"))
                .assertNext(entry -> assertEquals("abc", entry.sha()))
                .verifyComplete();

        assertEquals("/repos/octocat/pdf-storage/contents/uploads/1-my%20file.pdf",
                onlyRequest().url().getRawPath());
    }

    @Test
    void putContentSendsBase64PayloadWithoutSha() throws Exception {
        WebClientGitHubClient client = respondWith(HttpStatus.CREATED,
                "{\"content\":{\"type\":\"file\",\"name\":\"1-a.pdf\",\"path\":\"uploads/1-a.pdf\",\"sha\":\"new\"},"
                        + "\"commit\":{\"sha\":\"c1\",\"message\":\"Upload a.pdf\"}}");

        StepVerifier.create(client.putContent("tok", "octocat", "pdf-storage", "uploads/1-a.pdf",
                        new PutContentRequest("Upload a.pdf", "JVBERi0=", null, null)))
                .assertNext(result -> {
                    assertEquals("new", result.content().sha());
                    assertEquals("c1", result.commit().sha());
                })
                .verifyComplete();

        ClientRequest req = onlyRequest();
        assertEquals(HttpMethod.PUT, req.method());
        JsonNode body = bodyOf(req);
        assertEquals("Upload a.pdf", body.get("message").asText());
        assertEquals("JVBERi0=", body.get("content").asText());
        assertThat(body.has("sha")).isFalse();
        assertThat(body.has("branch")).isFalse();
    }

    @Test
    void deleteContentSendsShaInRequestBody() throws Exception {
        WebClientGitHubClient client = respondWith(HttpStatus.OK,
                "{\"content\":null,\"commit\":{\"sha\":\"c2\",\"message\":\"Delete 1-a.pdf\"}}");

        StepVerifier.create(client.deleteContent("tok", "octocat", "pdf-storage", "uploads/1-a.pdf",
                        new DeleteContentRequest("Delete 1-a.pdf", "s1", null)))
                .assertNext(result -> {
                    assertEquals(null, result.content());
                    assertEquals("c2", result.commit().sha());
                })
                .verifyComplete();

        ClientRequest req = onlyRequest();
        assertEquals(HttpMethod.DELETE, req.method());
        JsonNode body = bodyOf(req);
        assertEquals("s1", body.get("sha").asText());
        assertEquals("Delete 1-a.pdf", body.get("message").asText());
    }

    @Test
    void conflictIsReportedAsConflict() {
        WebClientGitHubClient client = respondWith(HttpStatus.CONFLICT,
                "{\"message\":\"uploads/1-a.pdf does not match s1\"}");

        StepVerifier.create(client.deleteContent("tok", "octocat", "pdf-storage", "uploads/1-a.pdf",
                        new DeleteContentRequest("Delete 1-a.pdf", "s1", null)))
                .expectErrorSatisfies(err -> {
                    assertTrue(GitHubApiException.conflict(err));
                    assertThat(GitHubApiException.notFound(err)).isFalse();
                })
                .verify();
    }
}
