package com.demo.groupchat.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Membership of a user in a session. Never deleted: leaving or removal clears {@code active}.
 */
@Entity
@Table(name = "chat_participants",
    uniqueConstraints = @UniqueConstraint(name = "uq_participant_session_user",
        columnNames = {"sessionId", "userId"}),
    indexes = @Index(name = "idx_participants_user", columnList = "userId,active"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatParticipant implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long sessionId;

    @Column(nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private ParticipantRole role;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private Instant joinedAt;

    @PrePersist
    protected void onCreate() {
        if (joinedAt == null) {
            joinedAt = Instant.now();
        }
        if (role == null) {
            role = ParticipantRole.MEMBER;
        }
    }
}
