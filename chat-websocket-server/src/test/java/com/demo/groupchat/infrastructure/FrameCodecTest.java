package com.demo.groupchat.infrastructure;

import com.demo.groupchat.domain.ChatMessage;
import com.demo.groupchat.domain.FrameParseResult;
import com.demo.groupchat.domain.FrameType;
import com.demo.groupchat.domain.MessageRole;
import com.demo.groupchat.domain.WebSocketFrame;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class FrameCodecTest {

    private ObjectMapper objectMapper;
    private FrameCodec codec;

    @BeforeEach
    public void setup() {
        objectMapper = Jackson2ObjectMapperBuilder.json()
            .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
        codec = new FrameCodec(objectMapper);
    }

    @Test
    public void parsesChatMessage() {
        FrameParseResult result = codec.parse("{\"type\":\"chat_message\",\"content\":\"hi\",\"session_id\":7}");

        assertTrue(result.isValid());
        assertEquals(FrameType.CHAT_MESSAGE, result.getFrame().getType());
        assertEquals("hi", result.getFrame().getContent());
        assertEquals(7L, result.getFrame().getSessionId());
    }

    @Test
    public void missingTypeDefaultsToChatMessage() {
        FrameParseResult result = codec.parse("{\"content\":\"hello\"}");

        assertTrue(result.isValid());
        assertEquals(FrameType.CHAT_MESSAGE, result.getFrame().getType());
        assertNull(result.getFrame().getSessionId());
    }

    @Test
    public void acceptsNumericStringSessionId() {
        FrameParseResult result = codec.parse("{\"type\":\"ping\",\"session_id\":\"12\"}");

        assertTrue(result.isValid());
        assertEquals(FrameType.PING, result.getFrame().getType());
        assertEquals(12L, result.getFrame().getSessionId());
    }

    @Test
    public void rejectsNonJson() {
        FrameParseResult result = codec.parse("not json at all");

        assertFalse(result.isValid());
        assertEquals(FrameCodec.INVALID_JSON, result.getErrorMessage());
    }

    @Test
    public void rejectsNonObjectPayloads() {
        assertEquals(FrameCodec.INVALID_FORMAT, codec.parse("[1,2,3]").getErrorMessage());
        assertEquals(FrameCodec.INVALID_FORMAT, codec.parse("\"text\"").getErrorMessage());
    }

    @Test
    public void rejectsUnknownAndOutboundTypes() {
        assertEquals(FrameCodec.INVALID_FORMAT, codec.parse("{\"type\":\"reconnect\"}").getErrorMessage());
        assertEquals(FrameCodec.INVALID_FORMAT, codec.parse("{\"type\":\"pong\"}").getErrorMessage());
        assertEquals(FrameCodec.INVALID_FORMAT, codec.parse("{\"type\":42}").getErrorMessage());
    }

    @Test
    public void rejectsNonTextContent() {
        assertEquals(FrameCodec.INVALID_FORMAT, codec.parse("{\"content\":{\"a\":1}}").getErrorMessage());
    }

    @Test
    public void rejectsNonNumericSessionId() {
        assertEquals(FrameCodec.INVALID_SESSION_ID, codec.parse("{\"content\":\"x\",\"session_id\":\"abc\"}").getErrorMessage());
        assertEquals(FrameCodec.INVALID_SESSION_ID, codec.parse("{\"content\":\"x\",\"session_id\":1.5}").getErrorMessage());
    }

    @Test
    public void encodesPersistedMessageWithAuthorAndRole() throws Exception {
        ChatMessage message = ChatMessage.builder()
            .id(5L)
            .sessionId(3L)
            .userId(9L)
            .role(MessageRole.USER)
            .content("hi")
            .createdAt(Instant.parse("2024-01-01T10:00:00Z"))
            .build();

        JsonNode json = objectMapper.readTree(codec.encode(WebSocketFrame.chatMessage(message)));

        assertEquals("chat_message", json.get("type").asText());
        assertEquals("hi", json.get("content").asText());
        assertEquals(3L, json.get("session_id").asLong());
        assertEquals(5L, json.get("message_id").asLong());
        assertEquals(9L, json.get("user_id").asLong());
        assertEquals("user", json.get("role").asText());
        assertEquals("2024-01-01T10:00:00Z", json.get("timestamp").asText());
    }

    @Test
    public void assistantMessageOmitsAuthor() throws Exception {
        ChatMessage message = ChatMessage.builder()
            .id(6L)
            .sessionId(3L)
            .role(MessageRole.ASSISTANT)
            .content("reply")
            .createdAt(Instant.now())
            .build();

        JsonNode json = objectMapper.readTree(codec.encode(WebSocketFrame.chatMessage(message)));

        assertFalse(json.has("user_id"));
        assertEquals("assistant", json.get("role").asText());
    }

    @Test
    public void errorFrameCarriesNullSessionId() throws Exception {
        JsonNode json = objectMapper.readTree(codec.encode(WebSocketFrame.error("boom")));

        assertEquals("error", json.get("type").asText());
        assertEquals("boom", json.get("content").asText());
        assertTrue(json.has("session_id"));
        assertTrue(json.get("session_id").isNull());
    }
}
