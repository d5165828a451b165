package com.webdynamo.contact_manager.service;

import com.webdynamo.contact_manager.config.SessionConfig;
import com.webdynamo.contact_manager.model.Session;
import com.webdynamo.contact_manager.model.User;
import com.webdynamo.contact_manager.repo.SessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private SessionRepository sessionRepository;
    @Mock
    private MetricsService metricsService;

    private SessionService sessionService;
    private User testUser;

    @BeforeEach
    void setUp() {
        // Clock and config are plain values, so build the service by hand instead of @InjectMocks
        SessionConfig config = new SessionConfig();
        config.setTtl(Duration.ofHours(2));
        sessionService = new SessionService(sessionRepository, config, Clock.fixed(NOW, ZoneOffset.UTC), metricsService);

        testUser = new User();
        testUser.setId(1L);
        testUser.setUsername("test");
    }

    @Test
    @DisplayName("issue - Should create a random token expiring after the configured TTL")
    void issue_ShouldSetTimestamps() {
        when(sessionRepository.save(any(Session.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Session first = sessionService.issue(testUser);
        Session second = sessionService.issue(testUser);

        LocalDateTime now = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
        assertThat(first.getToken()).isNotBlank();
        assertThat(first.getToken()).isNotEqualTo(second.getToken());
        assertThat(first.getUser()).isEqualTo(testUser);
        assertThat(first.getIssuedAt()).isEqualTo(now);
        assertThat(first.getExpiresAt()).isEqualTo(now.plusHours(2));
    }

    @Test
    @DisplayName("resolve - Should only look up sessions live at the current instant")
    void resolve_ShouldUseClock() {
        LocalDateTime now = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
        Session session = new Session("abc", testUser, now.minusHours(1), now.plusHours(1));
        when(sessionRepository.findByTokenAndExpiresAtAfter("abc", now)).thenReturn(Optional.of(session));

        assertThat(sessionService.resolve("abc")).contains(testUser);
    }

    @Test
    @DisplayName("resolve - Unknown or expired token resolves to nothing")
    void resolve_UnknownToken_ShouldBeEmpty() {
        when(sessionRepository.findByTokenAndExpiresAtAfter(eq("nope"), any())).thenReturn(Optional.empty());

        assertThat(sessionService.resolve("nope")).isEmpty();
    }

    @Test
    @DisplayName("revoke - Should report whether a session was deleted")
    void revoke_ShouldDeleteByToken() {
        when(sessionRepository.deleteByToken("abc")).thenReturn(1);
        when(sessionRepository.deleteByToken("gone")).thenReturn(0);

        assertThat(sessionService.revoke("abc")).isTrue();
        assertThat(sessionService.revoke("gone")).isFalse();
    }

    @Test
    @DisplayName("purgeExpired - Should delete sessions expired at the current instant")
    void purgeExpired_ShouldUseClock() {
        when(sessionRepository.deleteExpired(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC))).thenReturn(3);

        sessionService.purgeExpired();

        verify(sessionRepository).deleteExpired(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        verify(metricsService).recordSessionsPurged(3);
    }
}
