package com.pdfstorage.session;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.session.CookieWebSessionIdResolver;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Objects;

/**
 * Session cookie 形如 {@code <sessionId>.<hmac-sha256-hex>}。签名不对的 cookie 直接当作不存在。
 */
@Slf4j
public class SignedCookieWebSessionIdResolver extends CookieWebSessionIdResolver {

    private static final char SEPARATOR = '.';

    private final HmacUtils hmac;

    public SignedCookieWebSessionIdResolver(String secret) {
        this.hmac = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, Objects.requireNonNull(secret, "secret"));
    }

    @Override
    public List<String> resolveSessionIds(ServerWebExchange exchange) {
        return super.resolveSessionIds(exchange).stream()
                .map(this::unsign)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public void setSessionId(ServerWebExchange exchange, String id) {
        super.setSessionId(exchange, sign(id));
    }

    public String sign(String id) {
        return id + SEPARATOR + hmac.hmacHex(id);
    }

    /** 校验签名并还原 session id；不合法时返回 null */
    public String unsign(String value) {
        if (value == null) return null;
        int idx = value.lastIndexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1) {
            log.debug("[session] unsigned cookie ignored");
            return null;
        }
        String id = value.substring(0, idx);
        byte[] expected = hmac.hmacHex(id).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = value.substring(idx + 1).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, actual)) {
            log.warn("[session] cookie signature mismatch, ignoring");
            return null;
        }
        return id;
    }
}
