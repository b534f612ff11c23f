package com.demo.groupchat.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Chat Session Entity - a chat room with visibility, capacity and an owner
 */
@Entity
@Table(name = "chat_sessions", indexes = {
    @Index(name = "idx_chat_sessions_owner", columnList = "ownerId"),
    @Index(name = "idx_chat_sessions_type_active", columnList = "sessionType,active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_MAX_PARTICIPANTS = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 1000)
    private String description;

    @Column(nullable = false)
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, nullable = false)
    private SessionType sessionType;

    @Column(nullable = false)
    private int maxParticipants;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        if (title == null || title.isBlank()) {
            title = "New Chat";
        }
        if (sessionType == null) {
            sessionType = SessionType.PRIVATE;
        }
        if (maxParticipants <= 0) {
            maxParticipants = DEFAULT_MAX_PARTICIPANTS;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
