package com.pdfstorage.auth;

import com.pdfstorage.config.AppProperties;
import com.pdfstorage.config.GitHubProperties;
import com.pdfstorage.error.AuthExchangeException;
import com.pdfstorage.error.UpstreamFailureException;
import com.pdfstorage.github.GitHubClient;
import com.pdfstorage.provision.RepoProvisioner;
import com.pdfstorage.session.SessionContext;
import com.pdfstorage.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.WebSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * GitHub OAuth：code 换 token → 拉取用户信息 → 确保存储仓库 → 写会话。
 * 只有全部成功才写会话，中途失败不会留下半个会话。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OAuthExchangeService {

    static final String OAUTH_FAILED = "OAuth failed";

    private final GitHubClient gitHubClient;
    private final RepoProvisioner repoProvisioner;
    private final SessionStore sessionStore;
    private final GitHubProperties gitHubProps;
    private final AppProperties appProps;

    /** 跳转到 GitHub 授权页的地址 */
    public URI authorizeUri() {
        String base = gitHubProps.getOauthBaseUrl();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return UriComponentsBuilder.fromHttpUrl(base + "/login/oauth/authorize")
                .queryParam("client_id", gitHubProps.getClientId())
                .queryParam("scope", gitHubProps.getScope())
                .queryParam("redirect_uri", gitHubProps.getRedirectUri())
                .encode()
                .build()
                .toUri();
    }

    /**
     * 处理回调。成功时返回前端地址，由调用方 302 过去。
     */
    public Mono<URI> completeLogin(String code, WebSession session) {
        if (!StringUtils.hasText(code)) {
            log.warn("[oauth] callback without code");
            return Mono.error(new AuthExchangeException());
        }
        return gitHubClient.exchangeCode(code)
                .switchIfEmpty(Mono.error(AuthExchangeException::new))
                .flatMap(resp -> {
                    if (!StringUtils.hasText(resp.accessToken())) {
                        log.warn("[oauth] no access token returned error={} desc={}",
                                resp.error(), resp.errorDescription());
                        return Mono.<SessionContext>error(new AuthExchangeException());
                    }
                    String token = resp.accessToken();
                    return gitHubClient.getAuthenticatedUser(token)
                            .flatMap(user -> repoProvisioner.ensureStorageRepo(token, user.login())
                                    .flatMap(provisioned -> {
                                        log.info("[oauth] login={} repo={}", user.login(), provisioned.status());
                                        return sessionStore.write(session, token, user);
                                    }));
                })
                .onErrorMap(ex -> !(ex instanceof ResponseStatusException), ex -> {
                    log.error("[oauth] login failed err={}", ex.toString());
                    return new UpstreamFailureException(OAUTH_FAILED, ex);
                })
                .thenReturn(URI.create(appProps.getFrontendUrl()));
    }
}
