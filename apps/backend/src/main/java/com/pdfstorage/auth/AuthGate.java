package com.pdfstorage.auth;

import com.pdfstorage.error.UnauthenticatedException;
import com.pdfstorage.session.SessionContext;
import com.pdfstorage.session.SessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.server.WebSession;
import reactor.core.publisher.Mono;

/**
 * 存储类接口的前置守卫：没有有效 token 时直接 401，不做任何后续工作。
 */
@Component
@RequiredArgsConstructor
public class AuthGate {

    private final SessionStore sessionStore;

    public Mono<SessionContext> require(WebSession session) {
        return sessionStore.read(session)
                .switchIfEmpty(Mono.error(UnauthenticatedException::new));
    }
}
