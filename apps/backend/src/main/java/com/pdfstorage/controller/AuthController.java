package com.pdfstorage.controller;

import com.pdfstorage.auth.OAuthExchangeService;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.WebSession;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/auth/github")
@RequiredArgsConstructor
public class AuthController {

    private final OAuthExchangeService oauth;

    @Operation(summary = "跳转到 GitHub 授权页")
    @GetMapping
    public ResponseEntity<Void> login() {
        return ResponseEntity.status(HttpStatus.FOUND).location(oauth.authorizeUri()).build();
    }

    @Operation(summary = "GitHub OAuth 回调：换 token、建仓库、写会话后跳回前端")
    @GetMapping("/callback")
    public Mono<ResponseEntity<Void>> callback(@RequestParam(value = "code", required = false) String code,
                                               WebSession session) {
        return oauth.completeLogin(code, session)
                .map(target -> ResponseEntity.status(HttpStatus.FOUND).location(target).<Void>build());
    }
}
