package com.webdynamo.contact_manager.service;

import com.webdynamo.contact_manager.config.SessionConfig;
import com.webdynamo.contact_manager.model.Session;
import com.webdynamo.contact_manager.model.User;
import com.webdynamo.contact_manager.repo.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues, resolves and revokes login tokens.
 * A user may hold several sessions; each token is revoked on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService {

    private final SessionRepository sessionRepository;
    private final SessionConfig sessionConfig;
    private final Clock clock;
    private final MetricsService metricsService;

    /**
     * Create a new session for the user
     *
     * @param user Authenticated user
     * @return Saved session holding the token to hand to the client
     */
    @Transactional
    public Session issue(User user) {
        LocalDateTime now = LocalDateTime.now(clock);

        Session session = new Session();
        session.setToken(UUID.randomUUID().toString());
        session.setUser(user);
        session.setIssuedAt(now);
        session.setExpiresAt(now.plus(sessionConfig.getTtl()));

        Session saved = sessionRepository.save(session);
        log.info("Issued session for user {} valid until {}", user.getUsername(), saved.getExpiresAt());
        return saved;
    }

    /**
     * Resolve a token to its user, if the session exists and has not expired
     */
    @Transactional(readOnly = true)
    public Optional<User> resolve(String token) {
        return sessionRepository.findByTokenAndExpiresAtAfter(token, LocalDateTime.now(clock))
                .map(Session::getUser);
    }

    /**
     * Delete the session behind the token
     *
     * @return true if a session was deleted
     */
    @Transactional
    public boolean revoke(String token) {
        boolean revoked = sessionRepository.deleteByToken(token) > 0;
        if (!revoked) {
            log.warn("Revoke requested for a token with no session");
        }
        return revoked;
    }

    /**
     * Auto-cleanup: delete expired sessions
     * Runs daily at 2:00 AM unless app.session.cleanup-cron says otherwise
     */
    @Scheduled(cron = "${app.session.cleanup-cron:0 0 2 * * *}")
    @Transactional
    public void purgeExpired() {
        int deleted = sessionRepository.deleteExpired(LocalDateTime.now(clock));
        metricsService.recordSessionsPurged(deleted);
        log.info("Purged {} expired sessions", deleted);
    }
}
