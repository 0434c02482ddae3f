package com.pdfstorage.github;

import lombok.Getter;

/**
 * GitHub 返回非 2xx 时抛出，保留状态码与原始响应体（只用于服务端日志）。
 */
@Getter
public class GitHubApiException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public GitHubApiException(int status, String responseBody) {
        super("GitHub API responded " + status);
        this.status = status;
        this.responseBody = responseBody;
    }

    public boolean isNotFound() {
        return status == 404;
    }

    public boolean isConflict() {
        return status == 409;
    }

    /** 创建仓库时重名：GitHub 用 422，少数情况 409 */
    public boolean isAlreadyExists() {
        return status == 409 || status == 422;
    }

    public static boolean notFound(Throwable t) {
        return t instanceof GitHubApiException ex && ex.isNotFound();
    }

    public static boolean conflict(Throwable t) {
        return t instanceof GitHubApiException ex && ex.isConflict();
    }

    @Override
    public String toString() {
        return "GitHubApiException[status=" + status + ", body=" + responseBody + "]";
    }
}
