package com.pdfstorage.session;

import com.pdfstorage.config.AppProperties;
import com.pdfstorage.github.dto.UserProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.WebSession;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 会话读写。会话只保存 access token、缓存的用户信息和签发时间；
 * 有效期从签发时刻固定计算，与请求是否活跃无关。
 */
@Slf4j
@Component
public class SessionStore {

    static final String ATTR_TOKEN = "accessToken";
    static final String ATTR_USER = "user";
    static final String ATTR_ISSUED_AT = "issuedAt";

    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public SessionStore(AppProperties props) {
        this(props.getSession().getTtl(), Clock.systemUTC());
    }

    SessionStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /** 取出当前会话；没有 token 或已过期时为空，过期的会话顺带失效掉 */
    public Mono<SessionContext> read(WebSession session) {
        Map<String, Object> attrs = session.getAttributes();
        Object token = attrs.get(ATTR_TOKEN);
        Object user = attrs.get(ATTR_USER);
        Object issuedAt = attrs.get(ATTR_ISSUED_AT);
        if (!(token instanceof String t) || !StringUtils.hasText(t) || !(user instanceof UserProfile u)) {
            return Mono.empty();
        }
        Instant issued = issuedAt instanceof Instant i ? i : Instant.EPOCH;
        if (!clock.instant().isBefore(issued.plus(ttl))) {
            log.info("[session] expired login={} issuedAt={}", u.login(), issued);
            return session.invalidate().then(Mono.empty());
        }
        return Mono.just(new SessionContext(t, u, issued));
    }

    /** 登录成功后写入会话；先换一个新的 session id，防止会话固定 */
    public Mono<SessionContext> write(WebSession session, String accessToken, UserProfile user) {
        Instant now = clock.instant();
        return session.changeSessionId().then(Mono.fromSupplier(() -> {
            session.setMaxIdleTime(ttl);
            Map<String, Object> attrs = session.getAttributes();
            attrs.put(ATTR_TOKEN, accessToken);
            attrs.put(ATTR_USER, user);
            attrs.put(ATTR_ISSUED_AT, now);
            log.info("[session] login={} ttl={}", user.login(), ttl);
            return new SessionContext(accessToken, user, now);
        }));
    }

    public Mono<Void> clear(WebSession session) {
        return session.invalidate();
    }
}
