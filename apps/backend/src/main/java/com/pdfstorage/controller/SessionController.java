package com.pdfstorage.controller;

import com.pdfstorage.api.dto.MessageResponse;
import com.pdfstorage.auth.AuthGate;
import com.pdfstorage.github.dto.UserProfile;
import com.pdfstorage.session.SessionContext;
import com.pdfstorage.session.SessionStore;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.WebSession;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequiredArgsConstructor
public class SessionController {

    private final AuthGate authGate;
    private final SessionStore sessionStore;

    /** 直接返回登录时缓存的用户信息，不访问 GitHub */
    @Operation(summary = "当前登录用户")
    @GetMapping(value = "/me", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<UserProfile> me(WebSession session) {
        return authGate.require(session).map(SessionContext::user);
    }

    @Operation(summary = "退出登录")
    @PostMapping(value = "/logout", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<MessageResponse>> logout(WebSession session) {
        log.info("[session] logging out");
        return sessionStore.clear(session)
                .thenReturn(ResponseEntity.ok(new MessageResponse("logged out successfully")))
                .onErrorResume(ex -> {
                    log.warn("[session] logout failed: {}", ex.toString());
                    return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                            .body(new MessageResponse("Unable to logout currently, please try after some time.")));
                });
    }
}
