package com.pdfstorage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    /** 前端地址：CORS 允许的来源，也是登录成功后的跳转目标（FRONTEND_URL） */
    private String frontendUrl = "http://localhost:5173";

    private Session session = new Session();

    @Data
    public static class Session {
        /** Cookie 签名密钥，来自环境变量 SESSION_SECRET */
        private String secret;
        private String cookieName = "session";
        /** 会话固定有效期，从登录时刻起算 */
        private Duration ttl = Duration.ofHours(24);
        private boolean secureCookie = false;
        private String sameSite = "Lax";
    }
}
