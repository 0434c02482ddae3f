package com.pdfstorage.github;

import com.pdfstorage.github.dto.AccessTokenResponse;
import com.pdfstorage.github.dto.ContentCommitResult;
import com.pdfstorage.github.dto.ContentEntry;
import com.pdfstorage.github.dto.CreateRepositoryRequest;
import com.pdfstorage.github.dto.DeleteContentRequest;
import com.pdfstorage.github.dto.GitHubRepo;
import com.pdfstorage.github.dto.PutContentRequest;
import com.pdfstorage.github.dto.UserProfile;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * GitHub REST API 的薄封装。所有远端错误都以 {@link GitHubApiException} 形式发出。
 */
public interface GitHubClient {

    /** 用 OAuth 回调里的 code 换 access token */
    Mono<AccessTokenResponse> exchangeCode(String code);

    /** GET /user */
    Mono<UserProfile> getAuthenticatedUser(String token);

    /** GET /repos/{owner}/{repo} */
    Mono<GitHubRepo> getRepository(String token, String owner, String repo);

    /** POST /user/repos */
    Mono<GitHubRepo> createRepository(String token, CreateRepositoryRequest request);

    /** 列目录：GET /repos/{owner}/{repo}/contents/{path}，path 必须是目录 */
    Mono<List<ContentEntry>> listContents(String token, String owner, String repo, String path);

    /** 单个文件的元数据（含 sha） */
    Mono<ContentEntry> getContent(String token, String owner, String repo, String path);

    /** 创建或覆盖文件 */
    Mono<ContentCommitResult> putContent(String token, String owner, String repo, String path,
                                         PutContentRequest request);

    /** 删除文件，必须带上当前 sha */
    Mono<ContentCommitResult> deleteContent(String token, String owner, String repo, String path,
                                            DeleteContentRequest request);
}
