package com.simboard.backend.modules.token.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.simboard.backend.modules.token.infrastructure.persistence.ApiTokenRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ApiTokenStoreTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T12:00:00Z");
    private static final UUID TOKEN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000c1");

    @Mock
    private ApiTokenRepository apiTokenRepository;

    private ApiTokenStore store;

    @BeforeEach
    void setUp() {
        store = new ApiTokenStore(apiTokenRepository, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    @Test
    void revokeReportsTransition() {
        when(apiTokenRepository.revokeIfActive(TOKEN_ID, NOW)).thenReturn(1);

        assertThat(store.revoke(TOKEN_ID)).isTrue();
        verify(apiTokenRepository, never()).existsById(TOKEN_ID);
    }

    @Test
    void revokingRevokedTokenSucceedsWithoutTransition() {
        when(apiTokenRepository.revokeIfActive(TOKEN_ID, NOW)).thenReturn(0);
        when(apiTokenRepository.existsById(TOKEN_ID)).thenReturn(true);

        assertThat(store.revoke(TOKEN_ID)).isFalse();
    }

    @Test
    void revokingUnknownTokenFails() {
        when(apiTokenRepository.revokeIfActive(TOKEN_ID, NOW)).thenReturn(0);
        when(apiTokenRepository.existsById(TOKEN_ID)).thenReturn(false);

        assertThatThrownBy(() -> store.revoke(TOKEN_ID)).isInstanceOf(ApiTokenNotFoundException.class);
    }

    @Test
    void listWithoutOwnerReturnsEverything() {
        ApiTokenSummary summary = new ApiTokenSummary(TOKEN_ID, "bot", UUID.randomUUID(), NOW, null, false);
        when(apiTokenRepository.findAllSummaries()).thenReturn(List.of(summary));

        assertThat(store.list(null)).containsExactly(summary);
        verify(apiTokenRepository, never()).findSummariesByOwner(any());
    }
}
