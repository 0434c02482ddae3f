package com.pdfstorage.session;

import com.pdfstorage.github.dto.UserProfile;

import java.time.Instant;

/**
 * 一次受保护请求的身份上下文，由 {@link com.pdfstorage.auth.AuthGate} 从会话中取出后显式传给业务层。
 */
public record SessionContext(
        String accessToken,
        UserProfile user,
        Instant issuedAt
) {

    public String login() {
        return user.login();
    }

    @Override
    public String toString() {
        return "SessionContext[login=" + (user != null ? user.login() : null) + ", issuedAt=" + issuedAt + "]";
    }
}
