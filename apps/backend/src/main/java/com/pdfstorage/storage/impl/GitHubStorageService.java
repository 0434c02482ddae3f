package com.pdfstorage.storage.impl;

import com.pdfstorage.error.NotFoundException;
import com.pdfstorage.error.UpstreamFailureException;
import com.pdfstorage.error.ValidationException;
import com.pdfstorage.github.GitHubApiException;
import com.pdfstorage.github.GitHubClient;
import com.pdfstorage.github.dto.ContentEntry;
import com.pdfstorage.github.dto.DeleteContentRequest;
import com.pdfstorage.github.dto.PutContentRequest;
import com.pdfstorage.session.SessionContext;
import com.pdfstorage.storage.DeleteResult;
import com.pdfstorage.storage.StorageProps;
import com.pdfstorage.storage.StorageService;
import com.pdfstorage.storage.StoredFile;
import com.pdfstorage.storage.UploadRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Service
public class GitHubStorageService implements StorageService {

    static final String UPLOAD_FAILED = "Upload failed";
    static final String LIST_FAILED = "Failed to fetch files";
    static final String DELETE_FAILED = "Failed to delete file";

    private final GitHubClient client;
    private final StorageProps props;
    private final Clock clock;

    @Autowired
    public GitHubStorageService(GitHubClient client, StorageProps props) {
        this(client, props, Clock.systemUTC());
    }

    GitHubStorageService(GitHubClient client, StorageProps props, Clock clock) {
        this.client = client;
        this.props = props;
        this.clock = clock;
    }

    /** 时间戳前缀避免重名，没有额外的冲突重试 */
    @Override
    public String buildUploadPath(String filename) {
        return props.getUploadFolder() + "/" + clock.millis() + "-" + filename;
    }

    /** 每个路径段单独编码，和 GitHub 返回的 download_url 形式一致 */
    @Override
    public String rawUrl(String owner, String path) {
        String base = props.getRawBaseUrl();
        StringBuilder url = new StringBuilder(base.endsWith("/") ? base.substring(0, base.length() - 1) : base);
        List<String> segments = new ArrayList<>(List.of(owner, props.getRepoName(), props.getBranch()));
        segments.addAll(List.of(path.split("/")));
        for (String s : segments) {
            if (s.isEmpty()) continue;
            url.append('/').append(UriUtils.encodePathSegment(s, StandardCharsets.UTF_8));
        }
        return url.toString();
    }

    // ========= 上传 =========

    @Override
    public Mono<StoredFile> upload(SessionContext session, UploadRequest request) {
        return Mono.usingWhen(
                Mono.just(request),
                req -> doUpload(session, req),
                this::discard,
                (req, err) -> discard(req),
                this::discard);
    }

    private Mono<StoredFile> doUpload(SessionContext session, UploadRequest req) {
        // 1. MIME 必须正好是 application/pdf
        if (!MediaType.APPLICATION_PDF_VALUE.equals(req.contentType())) {
            log.warn("[upload] rejected contentType={} file={}", req.contentType(), req.originalFilename());
            return Mono.error(new ValidationException("Only PDF files allowed"));
        }
        // 2. 大小不超过 GitHub 单文件上限
        if (req.size() > props.getMaxFileSizeBytes()) {
            log.warn("[upload] rejected size={} file={}", req.size(), req.originalFilename());
            return Mono.error(new ValidationException("File too large (max 100MB)"));
        }

        String owner = session.login();
        String filename = cleanFilename(req.originalFilename());
        String path = buildUploadPath(filename);

        return readBase64(req.tempFile())
                .flatMap(encoded -> client.putContent(session.accessToken(), owner, props.getRepoName(), path,
                        new PutContentRequest("Upload " + filename, encoded, null, null)))
                .map(result -> {
                    String sha = result.content() != null ? result.content().sha() : null;
                    String url = rawUrl(owner, path);
                    log.info("[upload] committed {}/{}/{} size={}", owner, props.getRepoName(), path, req.size());
                    return new StoredFile(path.substring(path.lastIndexOf('/') + 1), path, url, sha);
                })
                .onErrorMap(ex -> !(ex instanceof ResponseStatusException), ex -> {
                    log.error("[upload] failed path={} err={}", path, ex.toString());
                    return new UpstreamFailureException(UPLOAD_FAILED, ex);
                });
    }

    private Mono<String> readBase64(Path file) {
        return Mono.fromCallable(() -> Base64.getEncoder().encodeToString(Files.readAllBytes(file)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Void> discard(UploadRequest req) {
        return Mono.<Void>fromRunnable(() -> {
            if (req.tempFile() == null) return;
            try {
                Files.deleteIfExists(req.tempFile());
            } catch (IOException e) {
                log.warn("[upload] failed to delete temp file {}: {}", req.tempFile(), e.getMessage());
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /** 只保留文件名部分，避免客户端文件名带目录把文件写到上传目录之外 */
    static String cleanFilename(String original) {
        if (!StringUtils.hasText(original)) return "unnamed.pdf";
        String name = original.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1).trim();
        if (name.isEmpty() || name.equals("..") || name.equals(".")) return "unnamed.pdf";
        return name;
    }

    // ========= 列举 =========

    @Override
    public Mono<List<StoredFile>> listFiles(SessionContext session) {
        String owner = session.login();
        return client.listContents(session.accessToken(), owner, props.getRepoName(), props.getUploadFolder())
                .map(entries -> entries.stream()
                        .filter(ContentEntry::isFile)
                        .map(e -> new StoredFile(e.name(), e.path(), e.downloadUrl(), e.sha()))
                        .toList())
                // 目录还没建过（从未上传）和空仓库没法区分，统一当作空列表
                .onErrorResume(GitHubApiException::notFound, ex -> {
                    log.info("[files] {}/{}/{} not found, returning empty list",
                            owner, props.getRepoName(), props.getUploadFolder());
                    return Mono.just(List.of());
                })
                .onErrorMap(ex -> !(ex instanceof ResponseStatusException), ex -> {
                    log.error("[files] list failed owner={} err={}", owner, ex.toString());
                    return new UpstreamFailureException(LIST_FAILED, ex);
                });
    }

    // ========= 删除 =========

    @Override
    public Mono<DeleteResult> deleteFile(SessionContext session, String fileName) {
        return Mono.defer(() -> {
            validateFileName(fileName);
            String path = props.getUploadFolder() + "/" + fileName;
            AtomicInteger attempt = new AtomicInteger();
            long retries = Math.max(0, props.getDeleteMaxAttempts() - 1);

            return Mono.defer(() -> deleteOnce(session, fileName, path, attempt.incrementAndGet()))
                    .retryWhen(Retry.max(retries)
                            .filter(GitHubApiException::conflict)
                            .doBeforeRetry(s -> log.warn("[delete] conflict on {} (attempt {}), re-reading sha",
                                    path, s.totalRetries() + 1))
                            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                    .onErrorMap(ex -> !(ex instanceof ResponseStatusException), ex -> {
                        log.error("[delete] failed path={} err={}", path, ex.toString());
                        return new UpstreamFailureException(DELETE_FAILED, ex);
                    });
        });
    }

    private Mono<DeleteResult> deleteOnce(SessionContext session, String fileName, String path, int attempt) {
        String owner = session.login();
        String token = session.accessToken();
        log.info("[delete] {}/{}/{} attempt={}", owner, props.getRepoName(), path, attempt);

        return client.getContent(token, owner, props.getRepoName(), path)
                .onErrorMap(GitHubApiException::notFound, ex -> {
                    if (attempt == 1) {
                        return new NotFoundException("File not found");
                    }
                    // 冲突后重读发现文件已经没了：另一个并发删除先成功了，这次按冲突失败处理
                    log.warn("[delete] {} vanished after conflict, reporting concurrent modification", path);
                    return new UpstreamFailureException(DELETE_FAILED, ex);
                })
                .flatMap(entry -> client.deleteContent(token, owner, props.getRepoName(), path,
                        new DeleteContentRequest("Delete " + fileName, entry.sha(), null)))
                .map(result -> new DeleteResult(fileName, result.commit()));
    }

    private static void validateFileName(String fileName) {
        if (!StringUtils.hasText(fileName)) {
            throw new ValidationException("File name is required");
        }
        // 只需保证是上传目录下的单个文件名；名字中间的 ".." 不会跳出目录
        if (fileName.contains("/") || fileName.contains("\\") || fileName.equals(".") || fileName.equals("..")) {
            throw new ValidationException("Invalid file name");
        }
    }
}
