package com.demo.groupchat.infrastructure;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A WebSocket session bound to its authenticated user and optional chat session.
 * <p>
 * Writes go through a {@link ConcurrentWebSocketSessionDecorator}, so broadcasts from other
 * connections' threads and replies from the owning thread never interleave on the wire.
 */
@Slf4j
@Getter
public class WebSocketConnection implements LiveConnection {

    private final String id;
    private final Long userId;
    private final Long chatSessionId;
    private final Instant connectedAt;
    private final WebSocketSession wsSession;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean released = new AtomicBoolean(false);

    public WebSocketConnection(WebSocketSession wsSession,
                               Long userId,
                               Long chatSessionId,
                               int sendTimeLimitMs,
                               int bufferSizeLimit) {
        this.id = wsSession.getId();
        this.userId = userId;
        this.chatSessionId = chatSessionId;
        this.connectedAt = Instant.now();
        this.wsSession = new ConcurrentWebSocketSessionDecorator(wsSession, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public boolean isOpen() {
        return wsSession.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        wsSession.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close(CloseStatus status) {
        try {
            if (wsSession.isOpen()) {
                wsSession.close(status);
            }
        } catch (IOException e) {
            log.debug("Failed to close connection: wsId={}, status={}", id, status, e);
        }
    }

    /**
     * True exactly once, for whichever cleanup path gets here first
     */
    public boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "WebSocketConnection{id=" + id + ", userId=" + userId + ", chatSessionId=" + chatSessionId + "}";
    }
}
