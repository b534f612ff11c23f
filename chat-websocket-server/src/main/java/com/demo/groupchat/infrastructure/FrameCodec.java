package com.demo.groupchat.infrastructure;

import com.demo.groupchat.domain.FrameParseResult;
import com.demo.groupchat.domain.FrameType;
import com.demo.groupchat.domain.WebSocketFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * JSON codec for chat frames.
 * <p>
 * Inbound frames are read field by field so that a malformed frame yields an error reason
 * instead of an exception. A frame without {@code type} is treated as a chat message.
 */
@Slf4j
@Component
public class FrameCodec {

    public static final String INVALID_JSON = "Invalid JSON format";
    public static final String INVALID_FORMAT = "Invalid message format";
    public static final String INVALID_SESSION_ID = "Invalid session_id";

    private final ObjectMapper objectMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FrameParseResult parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Rejected non-JSON frame: {}", e.getOriginalMessage());
            return FrameParseResult.failure(INVALID_JSON);
        }

        if (root == null || !root.isObject()) {
            return FrameParseResult.failure(INVALID_FORMAT);
        }

        FrameType type = FrameType.CHAT_MESSAGE;
        JsonNode typeNode = root.get("type");
        if (typeNode != null && !typeNode.isNull()) {
            if (!typeNode.isTextual()) {
                return FrameParseResult.failure(INVALID_FORMAT);
            }
            Optional<FrameType> parsed = FrameType.fromValue(typeNode.asText());
            if (parsed.isEmpty() || !parsed.get().isInbound()) {
                log.debug("Rejected frame type: {}", typeNode.asText());
                return FrameParseResult.failure(INVALID_FORMAT);
            }
            type = parsed.get();
        }

        String content = null;
        JsonNode contentNode = root.get("content");
        if (contentNode != null && !contentNode.isNull()) {
            if (!contentNode.isTextual()) {
                return FrameParseResult.failure(INVALID_FORMAT);
            }
            content = contentNode.asText();
        }

        Long sessionId = null;
        JsonNode sessionNode = root.get("session_id");
        if (sessionNode != null && !sessionNode.isNull()) {
            if (sessionNode.isIntegralNumber() && sessionNode.canConvertToLong()) {
                sessionId = sessionNode.longValue();
            } else if (sessionNode.isTextual()) {
                try {
                    sessionId = Long.parseLong(sessionNode.asText().trim());
                } catch (NumberFormatException e) {
                    return FrameParseResult.failure(INVALID_SESSION_ID);
                }
            } else {
                return FrameParseResult.failure(INVALID_SESSION_ID);
            }
        }

        return FrameParseResult.success(WebSocketFrame.builder()
            .type(type)
            .content(content)
            .sessionId(sessionId)
            .timestamp(Instant.now())
            .build());
    }

    public String encode(WebSocketFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode frame of type " + frame.getType(), e);
        }
    }
}
