package com.pdfstorage.config;

import com.pdfstorage.session.SignedCookieWebSessionIdResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.server.adapter.WebHttpHandlerBuilder;
import org.springframework.web.server.session.DefaultWebSessionManager;
import org.springframework.web.server.session.InMemoryWebSessionStore;
import org.springframework.web.server.session.WebSessionManager;

/**
 * 服务端 WebSession（内存存储）+ 带 HMAC 签名的 session cookie。
 */
@Slf4j
@Configuration
public class SessionConfig {

    @Bean
    public SignedCookieWebSessionIdResolver signedCookieWebSessionIdResolver(AppProperties props) {
        AppProperties.Session s = props.getSession();
        if (!StringUtils.hasText(s.getSecret())) {
            throw new IllegalStateException("app.session.secret (SESSION_SECRET) must be set");
        }
        SignedCookieWebSessionIdResolver resolver = new SignedCookieWebSessionIdResolver(s.getSecret());
        resolver.setCookieName(s.getCookieName());
        resolver.setCookieMaxAge(s.getTtl());
        resolver.addCookieInitializer(b -> b.secure(s.isSecureCookie()).sameSite(s.getSameSite()));
        return resolver;
    }

    @Bean(name = WebHttpHandlerBuilder.WEB_SESSION_MANAGER_BEAN_NAME)
    public WebSessionManager webSessionManager(SignedCookieWebSessionIdResolver resolver) {
        InMemoryWebSessionStore store = new InMemoryWebSessionStore();
        DefaultWebSessionManager manager = new DefaultWebSessionManager();
        manager.setSessionIdResolver(resolver);
        manager.setSessionStore(store);
        log.info("[session] in-memory session store, signed cookie '{}'", resolver.getCookieName());
        return manager;
    }
}
