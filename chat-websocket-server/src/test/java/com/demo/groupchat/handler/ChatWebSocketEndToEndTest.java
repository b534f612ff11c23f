package com.demo.groupchat.handler;

import com.demo.groupchat.domain.UserAccount;
import com.demo.groupchat.infrastructure.ConnectionRegistry;
import com.demo.groupchat.repository.ChatMessageRepository;
import com.demo.groupchat.repository.ChatParticipantRepository;
import com.demo.groupchat.repository.ChatSessionRepository;
import com.demo.groupchat.repository.UserAccountRepository;
import com.demo.groupchat.service.TokenAuthenticator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.*;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class ChatWebSocketEndToEndTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
        new ParameterizedTypeReference<>() {
        };

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TokenAuthenticator tokenAuthenticator;

    @Autowired
    private UserAccountRepository userRepository;

    @Autowired
    private ChatSessionRepository sessionRepository;

    @Autowired
    private ChatParticipantRepository participantRepository;

    @Autowired
    private ChatMessageRepository messageRepository;

    @Autowired
    private ConnectionRegistry connectionRegistry;

    private final List<WebSocketSession> openSessions = new ArrayList<>();

    private Long alice;
    private Long bob;

    @BeforeEach
    public void setup() {
        messageRepository.deleteAll();
        participantRepository.deleteAll();
        sessionRepository.deleteAll();
        userRepository.deleteAll();

        alice = userRepository.save(UserAccount.builder().username("alice").active(true).build()).getId();
        bob = userRepository.save(UserAccount.builder().username("bob").active(true).build()).getId();
    }

    @AfterEach
    public void teardown() throws Exception {
        for (WebSocketSession session : openSessions) {
            if (session.isOpen()) {
                session.close();
            }
        }
    }

    @Test
    public void messageReachesEveryParticipantFollowedByReply() throws Exception {
        Long sessionId = createPublicSession(alice, 2);
        ResponseEntity<Map<String, Object>> join = post("/api/chat/sessions/" + sessionId + "/join", bob, null);
        assertEquals(HttpStatus.OK, join.getStatusCode());

        RecordingClient aliceClient = connect(alice, sessionId);
        RecordingClient bobClient = connect(bob, sessionId);

        JsonNode welcome = aliceClient.next();
        assertEquals("system_message", welcome.get("type").asText());
        assertEquals("Connected to chat session " + sessionId, welcome.get("content").asText());
        bobClient.next();

        aliceClient.session.sendMessage(new TextMessage("{\"content\":\"hi\"}"));

        for (RecordingClient client : List.of(aliceClient, bobClient)) {
            JsonNode userFrame = client.next();
            assertEquals("chat_message", userFrame.get("type").asText());
            assertEquals("user", userFrame.get("role").asText());
            assertEquals("hi", userFrame.get("content").asText());
            assertEquals(alice.longValue(), userFrame.get("user_id").asLong());
            assertEquals(sessionId.longValue(), userFrame.get("session_id").asLong());

            JsonNode replyFrame = client.next();
            assertEquals("chat_message", replyFrame.get("type").asText());
            assertEquals("assistant", replyFrame.get("role").asText());
            assertFalse(replyFrame.get("content").asText().isBlank());
        }

        assertEquals(2, messageRepository.countBySessionId(sessionId));
    }

    @Test
    public void boundStreamIsRegisteredUntilTheClientCloses() throws Exception {
        Long sessionId = createPublicSession(alice, 5);
        post("/api/chat/sessions/" + sessionId + "/join", bob, null);
        assertEquals(0, connectionRegistry.sessionConnectionCount(bob, sessionId));
        assertEquals(0, connectionRegistry.connectionCount(bob));

        RecordingClient bobClient = connect(bob, sessionId);
        bobClient.next();

        assertEquals(1, connectionRegistry.sessionConnectionCount(bob, sessionId));
        assertEquals(1, connectionRegistry.connectionCount(bob));
        assertEquals(1, connectionRegistry.sessionWideConnectionCount(sessionId));

        bobClient.session.close();

        awaitZero(() -> connectionRegistry.sessionConnectionCount(bob, sessionId));
        assertEquals(0, connectionRegistry.connectionCount(bob));
        assertEquals(0, connectionRegistry.sessionWideConnectionCount(sessionId));
    }

    @Test
    public void sessionListAndDetailCarryCountsAndContents() {
        Long sessionId = createPublicSession(alice, 5);
        post("/api/chat/sessions/" + sessionId + "/join", bob, null);
        post("/api/chat/sessions/" + sessionId + "/messages", alice, Map.of("content", "first"));

        Map<String, Object> listing = get("/api/chat/sessions", bob).getBody();
        List<?> sessions = (List<?>) listing.get("sessions");
        assertEquals(1, sessions.size());
        Map<?, ?> summary = (Map<?, ?>) sessions.get(0);
        assertEquals("alice", summary.get("owner_username"));
        assertEquals(1, ((Number) summary.get("message_count")).intValue());
        assertEquals(2, ((Number) summary.get("participant_count")).intValue());

        ResponseEntity<Map<String, Object>> detail = get("/api/chat/sessions/" + sessionId, bob);
        assertEquals(HttpStatus.OK, detail.getStatusCode());
        assertEquals(Boolean.TRUE, detail.getBody().get("is_active"));
        assertEquals(2, ((Number) detail.getBody().get("participant_count")).intValue());
        assertEquals(2, ((List<?>) detail.getBody().get("participants")).size());
        List<?> messages = (List<?>) detail.getBody().get("messages");
        assertEquals(1, messages.size());
        assertEquals("first", ((Map<?, ?>) messages.get(0)).get("content"));
        assertEquals("alice", ((Map<?, ?>) messages.get(0)).get("username"));
    }

    @Test
    public void pingAndMalformedFramesOnlyAnswerTheSender() throws Exception {
        Long sessionId = createPublicSession(alice, 5);
        post("/api/chat/sessions/" + sessionId + "/join", bob, null);
        RecordingClient aliceClient = connect(alice, sessionId);
        RecordingClient bobClient = connect(bob, sessionId);
        aliceClient.next();
        bobClient.next();

        aliceClient.session.sendMessage(new TextMessage("{\"type\":\"ping\"}"));
        assertEquals("pong", aliceClient.next().get("type").asText());

        aliceClient.session.sendMessage(new TextMessage("{{{"));
        JsonNode error = aliceClient.next();
        assertEquals("error", error.get("type").asText());
        assertEquals("Invalid JSON format", error.get("content").asText());

        assertNull(bobClient.poll(300));
        assertTrue(aliceClient.session.isOpen());
    }

    @Test
    public void restPostIsFannedOutToLiveConnections() throws Exception {
        Long sessionId = createPublicSession(alice, 5);
        post("/api/chat/sessions/" + sessionId + "/join", bob, null);
        RecordingClient bobClient = connect(bob, sessionId);
        bobClient.next();

        ResponseEntity<Map<String, Object>> posted =
            post("/api/chat/sessions/" + sessionId + "/messages", alice, Map.of("content", "via rest"));
        assertEquals(HttpStatus.CREATED, posted.getStatusCode());

        JsonNode frame = bobClient.next();
        assertEquals("via rest", frame.get("content").asText());
        assertEquals(alice.longValue(), frame.get("user_id").asLong());
    }

    @Test
    public void badTokenIsClosedWithPolicyViolation() throws Exception {
        RecordingClient client = connectRaw("ws://localhost:" + port + "/ws/chat?token=not-a-token");

        CloseStatus status = client.closed.get(5, TimeUnit.SECONDS);
        assertEquals(CloseStatus.POLICY_VIOLATION.getCode(), status.getCode());
        assertNull(client.poll(100), "no welcome before the close");
    }

    @Test
    public void nonParticipantCannotBindToSession() throws Exception {
        Long sessionId = createPublicSession(alice, 5);

        RecordingClient client = connectRaw(url(bob, String.valueOf(sessionId)));
        assertEquals(CloseStatus.POLICY_VIOLATION.getCode(), client.closed.get(5, TimeUnit.SECONDS).getCode());

        RecordingClient garbled = connectRaw(url(alice, "abc"));
        assertEquals(CloseStatus.POLICY_VIOLATION.getCode(), garbled.closed.get(5, TimeUnit.SECONDS).getCode());
    }

    @Test
    public void restRequiresBearerToken() {
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
            "/api/chat/sessions", HttpMethod.GET, HttpEntity.EMPTY, JSON_MAP);

        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
    }

    @Test
    public void healthReportsDatabase() {
        ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
            "/health", HttpMethod.GET, HttpEntity.EMPTY, JSON_MAP);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("connected", response.getBody().get("database"));
        assertTrue(response.getBody().containsKey("redis"));
    }

    // Helpers

    private Long createPublicSession(Long ownerId, int maxParticipants) {
        ResponseEntity<Map<String, Object>> created = post("/api/chat/sessions", ownerId, Map.of(
            "title", "Team chat",
            "session_type", "public",
            "max_participants", maxParticipants));
        assertEquals(HttpStatus.CREATED, created.getStatusCode());
        return ((Number) created.getBody().get("id")).longValue();
    }

    private ResponseEntity<Map<String, Object>> post(String path, Long userId, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokenAuthenticator.generateToken(userId));
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(path, HttpMethod.POST, new HttpEntity<>(body, headers), JSON_MAP);
    }

    private ResponseEntity<Map<String, Object>> get(String path, Long userId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokenAuthenticator.generateToken(userId));
        return restTemplate.exchange(path, HttpMethod.GET, new HttpEntity<>(headers), JSON_MAP);
    }

    private static void awaitZero(IntSupplier count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (count.getAsInt() != 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertEquals(0, count.getAsInt());
    }

    private String url(Long userId, String sessionId) {
        return "ws://localhost:" + port + "/ws/chat?token=" + tokenAuthenticator.generateToken(userId)
            + "&session_id=" + sessionId;
    }

    private RecordingClient connect(Long userId, Long sessionId) throws Exception {
        return connectRaw(url(userId, String.valueOf(sessionId)));
    }

    private RecordingClient connectRaw(String url) throws Exception {
        RecordingClient client = new RecordingClient();
        client.session = new StandardWebSocketClient().execute(client, url).get(5, TimeUnit.SECONDS);
        openSessions.add(client.session);
        return client;
    }

    private class RecordingClient extends TextWebSocketHandler {
        private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        private final CompletableFuture<CloseStatus> closed = new CompletableFuture<>();
        private WebSocketSession session;

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            frames.add(message.getPayload());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closed.complete(status);
        }

        JsonNode next() throws Exception {
            JsonNode frame = poll(5000);
            assertNotNull(frame, "expected a frame");
            return frame;
        }

        JsonNode poll(long timeoutMs) throws Exception {
            String payload = frames.poll(timeoutMs, TimeUnit.MILLISECONDS);
            return payload != null ? objectMapper.readTree(payload) : null;
        }
    }
}
