package com.webdynamo.contact_manager.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Login session. The token is the opaque credential clients send in the
 * Authorization header; logging out deletes the row.
 */
@Entity
@Table(name = "sessions", indexes = @Index(name = "idx_sessions_user_id", columnList = "user_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    @Id
    @Column(length = 100)
    private String token;

    @ManyToOne
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "issued_at", nullable = false)
    private LocalDateTime issuedAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;
}
