package com.pdfstorage.session;

import com.pdfstorage.github.dto.UserProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.server.WebSession;
import org.springframework.web.server.session.InMemoryWebSessionStore;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SessionStoreTest {

    private static final Instant LOGIN = Instant.parse("2024-05-01T10:00:00Z");
    private static final UserProfile OCTOCAT = new UserProfile("octocat", 1L, "Octo Cat", null, null, null);

    private final InMemoryWebSessionStore webSessions = new InMemoryWebSessionStore();
    private WebSession session;

    @BeforeEach
    void setUp() {
        session = webSessions.createWebSession().block();
    }

    private SessionStore storeAt(Instant now) {
        return new SessionStore(Duration.ofHours(24), Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void emptySessionHasNoContext() {
        StepVerifier.create(storeAt(LOGIN).read(session))
                .verifyComplete();
    }

    @Test
    void writeThenReadReturnsTokenAndCachedUser() {
        String idBefore = session.getId();
        StepVerifier.create(storeAt(LOGIN).write(session, "gho_token", OCTOCAT))
                .assertNext(ctx -> assertEquals("octocat", ctx.login()))
                .verifyComplete();

        assertThat(session.getId()).isNotEqualTo(idBefore);
        assertEquals(Duration.ofHours(24), session.getMaxIdleTime());

        StepVerifier.create(storeAt(LOGIN.plus(Duration.ofHours(23))).read(session))
                .assertNext(ctx -> {
                    assertEquals("gho_token", ctx.accessToken());
                    assertEquals(OCTOCAT, ctx.user());
                    assertEquals(LOGIN, ctx.issuedAt());
                })
                .verifyComplete();
    }

    @Test
    void sessionExpiresTwentyFourHoursAfterLoginRegardlessOfActivity() {
        storeAt(LOGIN).write(session, "gho_token", OCTOCAT).block();

        StepVerifier.create(storeAt(LOGIN.plus(Duration.ofHours(24))).read(session))
                .verifyComplete();

        assertThat(session.isExpired()).isTrue();
    }

    @Test
    void tokenIsNeverPrinted() {
        SessionContext ctx = new SessionContext("gho_secret", OCTOCAT, LOGIN);
        assertThat(ctx.toString()).doesNotContain("gho_secret").contains("octocat");
    }

    @Test
    void clearInvalidatesSession() {
        SessionStore store = storeAt(LOGIN);
        store.write(session, "gho_token", OCTOCAT).block();

        StepVerifier.create(store.clear(session)).verifyComplete();

        assertThat(session.getAttributes()).isEmpty();
        StepVerifier.create(store.read(session)).verifyComplete();
    }
}
