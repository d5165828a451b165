package com.webdynamo.contact_manager.repo;

import com.webdynamo.contact_manager.model.Session;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface SessionRepository extends JpaRepository<Session, String> {

    /**
     * Find a session that is still live at the given instant
     */
    Optional<Session> findByTokenAndExpiresAtAfter(String token, LocalDateTime now);

    @Modifying
    @Query("DELETE FROM Session s WHERE s.token = :token")
    int deleteByToken(@Param("token") String token);

    @Modifying
    @Query("DELETE FROM Session s WHERE s.expiresAt <= :now")
    int deleteExpired(@Param("now") LocalDateTime now);
}
