package com.pdfstorage.provision;

import com.pdfstorage.github.GitHubApiException;
import com.pdfstorage.github.GitHubClient;
import com.pdfstorage.github.dto.CreateRepositoryRequest;
import com.pdfstorage.storage.StorageProps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * 确保当前用户名下存在唯一的存储仓库，不存在就创建。
 * 并发首次登录时两边都可能去创建，创建返回“已存在”时重新查一次，查得到就按已存在处理。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepoProvisioner {

    private final GitHubClient gitHubClient;
    private final StorageProps props;

    public Mono<ProvisionResult> ensureStorageRepo(String token) {
        return gitHubClient.getAuthenticatedUser(token)
                .flatMap(user -> ensureStorageRepo(token, user.login()));
    }

    public Mono<ProvisionResult> ensureStorageRepo(String token, String ownerLogin) {
        String repo = props.getRepoName();
        return gitHubClient.getRepository(token, ownerLogin, repo)
                .map(r -> {
                    log.info("[provision] repo {}/{} already exists", ownerLogin, repo);
                    return new ProvisionResult(ProvisionResult.Status.EXISTING, ownerLogin);
                })
                .onErrorResume(GitHubApiException::notFound, ex -> create(token, ownerLogin));
    }

    private Mono<ProvisionResult> create(String token, String ownerLogin) {
        String repo = props.getRepoName();
        CreateRepositoryRequest request =
                new CreateRepositoryRequest(repo, props.getRepoDescription(), props.isPrivateRepo());
        return gitHubClient.createRepository(token, request)
                .map(r -> {
                    log.info("[provision] repo {}/{} created", ownerLogin, repo);
                    return new ProvisionResult(ProvisionResult.Status.CREATED, ownerLogin);
                })
                .onErrorResume(
                        ex -> ex instanceof GitHubApiException api && api.isAlreadyExists(),
                        ex -> recheck(token, ownerLogin, ex));
    }

    private Mono<ProvisionResult> recheck(String token, String ownerLogin, Throwable createError) {
        String repo = props.getRepoName();
        log.warn("[provision] create {}/{} rejected ({}), re-checking", ownerLogin, repo, createError.getMessage());
        return gitHubClient.getRepository(token, ownerLogin, props.getRepoName())
                .map(r -> new ProvisionResult(ProvisionResult.Status.EXISTING, ownerLogin))
                .onErrorResume(GitHubApiException::notFound, ex -> Mono.error(createError));
    }
}
