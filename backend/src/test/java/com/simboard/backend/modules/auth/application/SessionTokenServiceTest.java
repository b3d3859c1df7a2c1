package com.simboard.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import com.simboard.backend.modules.auth.application.SessionTokenService.InvalidSessionException;
import com.simboard.backend.modules.auth.application.SessionTokenService.ParsedSession;
import com.simboard.backend.modules.auth.infrastructure.jwt.SessionKeyProvider;

import org.junit.jupiter.api.Test;

class SessionTokenServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final SessionProperties PROPERTIES =
            new SessionProperties("unit-test-session-secret-with-at-least-32-bytes", "simboard_session", Duration.ofHours(1));

    @Test
    void issuedSessionParsesBackToUser() {
        SessionTokenService service = service(PROPERTIES, NOW);

        ParsedSession session = service.parse(service.issue(USER_ID));

        assertThat(session.userId()).isEqualTo(USER_ID);
        assertThat(session.expiresAt().toInstant()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    void expiredSessionIsRejected() {
        String token = service(PROPERTIES, NOW).issue(USER_ID);
        SessionTokenService later = service(PROPERTIES, NOW.plus(Duration.ofHours(2)));

        assertThatThrownBy(() -> later.parse(token)).isInstanceOf(InvalidSessionException.class);
    }

    @Test
    void sessionSignedWithAnotherKeyIsRejected() {
        SessionProperties other =
                new SessionProperties("another-session-secret-with-at-least-32-bytes!!", "simboard_session", Duration.ofHours(1));
        String forged = service(other, NOW).issue(USER_ID);

        assertThatThrownBy(() -> service(PROPERTIES, NOW).parse(forged)).isInstanceOf(InvalidSessionException.class);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> service(PROPERTIES, NOW).parse("not.a.jwt")).isInstanceOf(InvalidSessionException.class);
        assertThatThrownBy(() -> service(PROPERTIES, NOW).parse("")).isInstanceOf(InvalidSessionException.class);
    }

    private static SessionTokenService service(SessionProperties properties, Instant now) {
        return new SessionTokenService(new SessionKeyProvider(properties), properties, Clock.fixed(now, ZoneOffset.UTC));
    }
}
