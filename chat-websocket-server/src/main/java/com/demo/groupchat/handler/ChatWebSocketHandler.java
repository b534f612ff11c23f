package com.demo.groupchat.handler;

import com.demo.groupchat.domain.UserAccount;
import com.demo.groupchat.domain.WebSocketFrame;
import com.demo.groupchat.infrastructure.ChatOrchestrator;
import com.demo.groupchat.infrastructure.ConnectionRegistry;
import com.demo.groupchat.infrastructure.FrameCodec;
import com.demo.groupchat.infrastructure.WebSocketConnection;
import com.demo.groupchat.service.ChatSessionService;
import com.demo.groupchat.service.MetricsService;
import com.demo.groupchat.service.TokenAuthenticator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.Optional;

/**
 * WebSocket endpoint for chat clients.
 * <p>
 * Connect with {@code ?token=<jwt>} and optionally {@code &session_id=<id>} to bind the connection
 * to one chat session. Handshake failures close with 1008.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ATTRIBUTE = "chat.connection";

    private final TokenAuthenticator tokenAuthenticator;
    private final ChatSessionService chatSessionService;
    private final ConnectionRegistry connectionRegistry;
    private final ChatOrchestrator chatOrchestrator;
    private final FrameCodec frameCodec;
    private final MetricsService metricsService;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public ChatWebSocketHandler(TokenAuthenticator tokenAuthenticator,
                                ChatSessionService chatSessionService,
                                ConnectionRegistry connectionRegistry,
                                ChatOrchestrator chatOrchestrator,
                                FrameCodec frameCodec,
                                MetricsService metricsService,
                                @Value("${chat.websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                                @Value("${chat.websocket.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.tokenAuthenticator = tokenAuthenticator;
        this.chatSessionService = chatSessionService;
        this.connectionRegistry = connectionRegistry;
        this.chatOrchestrator = chatOrchestrator;
        this.frameCodec = frameCodec;
        this.metricsService = metricsService;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        MultiValueMap<String, String> params = queryParams(wsSession);

        Optional<UserAccount> user = tokenAuthenticator.authenticate(params.getFirst("token"));
        if (user.isEmpty()) {
            log.warn("WebSocket authentication failed: wsId={}", wsSession.getId());
            metricsService.recordWebSocketConnection(null, false);
            wsSession.close(CloseStatus.POLICY_VIOLATION.withReason("Authentication failed"));
            return;
        }
        Long userId = user.get().getId();

        Long sessionId = null;
        String rawSessionId = params.getFirst("session_id");
        if (rawSessionId != null && !rawSessionId.isBlank()) {
            try {
                sessionId = Long.parseLong(rawSessionId.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid session_id on handshake: wsId={}, value={}", wsSession.getId(), rawSessionId);
                metricsService.recordWebSocketConnection(userId, false);
                wsSession.close(CloseStatus.POLICY_VIOLATION.withReason("Invalid session_id"));
                return;
            }

            if (!chatSessionService.canView(sessionId, userId)) {
                log.warn("Session access denied on handshake: userId={}, sessionId={}", userId, sessionId);
                metricsService.recordWebSocketConnection(userId, false);
                wsSession.close(CloseStatus.POLICY_VIOLATION.withReason("Session access denied"));
                return;
            }
        }

        WebSocketConnection connection =
            new WebSocketConnection(wsSession, userId, sessionId, sendTimeLimitMs, bufferSizeLimit);
        wsSession.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
        connectionRegistry.register(connection, userId, sessionId);
        metricsService.recordWebSocketConnection(userId, true);

        log.info("WebSocket connected: wsId={}, userId={}, sessionId={}", wsSession.getId(), userId, sessionId);

        if (!connectionRegistry.sendToConnection(connection, frameCodec.encode(WebSocketFrame.welcome(sessionId)))) {
            release(connection);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        WebSocketConnection connection = connectionOf(wsSession);
        if (connection == null) {
            log.warn("Frame on unregistered WebSocket ignored: wsId={}", wsSession.getId());
            return;
        }
        chatOrchestrator.handleFrame(connection, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.warn("WebSocket transport error: wsId={}, error={}", wsSession.getId(), exception.getMessage());
        metricsService.recordError("TRANSPORT_ERROR", "WebSocketHandler");

        WebSocketConnection connection = connectionOf(wsSession);
        if (connection != null) {
            release(connection);
        }
        if (wsSession.isOpen()) {
            try {
                wsSession.close(CloseStatus.SERVER_ERROR);
            } catch (IOException e) {
                log.debug("Failed to close WebSocket after transport error: wsId={}", wsSession.getId(), e);
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        log.info("WebSocket closed: wsId={}, status={}", wsSession.getId(), status);

        WebSocketConnection connection = connectionOf(wsSession);
        if (connection != null) {
            release(connection);
        }
    }

    private void release(WebSocketConnection connection) {
        if (!connection.markReleased()) {
            return;
        }
        connectionRegistry.unregister(connection, connection.getUserId(), connection.getChatSessionId());
        metricsService.recordWebSocketDisconnection(connection.getUserId());
    }

    private static WebSocketConnection connectionOf(WebSocketSession wsSession) {
        Object attribute = wsSession.getAttributes().get(CONNECTION_ATTRIBUTE);
        return attribute instanceof WebSocketConnection connection ? connection : null;
    }

    private static MultiValueMap<String, String> queryParams(WebSocketSession wsSession) {
        if (wsSession.getUri() == null) {
            return UriComponentsBuilder.newInstance().build().getQueryParams();
        }
        return UriComponentsBuilder.fromUri(wsSession.getUri()).build().getQueryParams();
    }
}
