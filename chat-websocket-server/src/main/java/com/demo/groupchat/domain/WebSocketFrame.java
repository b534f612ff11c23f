package com.demo.groupchat.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One JSON frame on the chat stream.
 * <p>
 * {@code type}, {@code content}, {@code session_id} and {@code timestamp} are always written;
 * frames carrying a persisted message also carry its id, author and role.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebSocketFrame {

    private FrameType type;

    private String content;

    @JsonProperty("session_id")
    private Long sessionId;

    private Instant timestamp;

    @JsonProperty("message_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Long messageId;

    @JsonProperty("user_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Long userId;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private MessageRole role;

    // Factory methods
    public static WebSocketFrame welcome(Long sessionId) {
        String content = sessionId != null
            ? "Connected to chat session " + sessionId
            : "Connected to chat";
        return system(content, sessionId);
    }

    public static WebSocketFrame system(String content, Long sessionId) {
        return WebSocketFrame.builder()
            .type(FrameType.SYSTEM_MESSAGE)
            .content(content)
            .sessionId(sessionId)
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketFrame chatMessage(ChatMessage message) {
        return WebSocketFrame.builder()
            .type(FrameType.CHAT_MESSAGE)
            .content(message.getContent())
            .sessionId(message.getSessionId())
            .timestamp(message.getCreatedAt())
            .messageId(message.getId())
            .userId(message.getUserId())
            .role(message.getRole())
            .build();
    }

    public static WebSocketFrame pong() {
        return WebSocketFrame.builder()
            .type(FrameType.PONG)
            .content("pong")
            .timestamp(Instant.now())
            .build();
    }

    public static WebSocketFrame error(String errorMessage) {
        return WebSocketFrame.builder()
            .type(FrameType.ERROR)
            .content(errorMessage)
            .timestamp(Instant.now())
            .build();
    }
}
