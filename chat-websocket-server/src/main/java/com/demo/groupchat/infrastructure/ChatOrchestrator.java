package com.demo.groupchat.infrastructure;

import com.demo.groupchat.domain.*;
import com.demo.groupchat.service.ChatSessionService;
import com.demo.groupchat.service.MetricsService;
import com.demo.groupchat.service.ResponseGenerationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Handles one inbound frame of a live connection.
 * <p>
 * A chat message is persisted and fanned out before the reply is generated, and the reply is
 * fanned out as a second frame. Frames of one connection are handled on that connection's thread,
 * so the user message always reaches listeners before the reply. Any failure is turned into an
 * {@code error} frame for the sender; the connection stays open.
 */
@Service
@Slf4j
public class ChatOrchestrator {

    static final String CONTENT_REQUIRED = "Message content is required";
    static final String NO_TARGET_SESSION = "No target session specified";
    static final String ACCESS_DENIED = "Session not found or access denied";
    static final String SERVER_ERROR = "Server error: unable to process message";

    private final FrameCodec frameCodec;
    private final ConnectionRegistry connectionRegistry;
    private final ChatSessionService chatSessionService;
    private final ResponseGenerationService responseGenerationService;
    private final MetricsService metricsService;
    private final int historyWindow;

    public ChatOrchestrator(FrameCodec frameCodec,
                            ConnectionRegistry connectionRegistry,
                            ChatSessionService chatSessionService,
                            ResponseGenerationService responseGenerationService,
                            MetricsService metricsService,
                            @Value("${chat.history.window:10}") int historyWindow) {
        this.frameCodec = frameCodec;
        this.connectionRegistry = connectionRegistry;
        this.chatSessionService = chatSessionService;
        this.responseGenerationService = responseGenerationService;
        this.metricsService = metricsService;
        this.historyWindow = historyWindow;
    }

    public void handleFrame(LiveConnection connection, String payload) {
        try {
            FrameParseResult parsed = frameCodec.parse(payload);
            if (!parsed.isValid()) {
                metricsService.recordFrameReceived("invalid");
                replyError(connection, parsed.getErrorMessage());
                return;
            }

            WebSocketFrame frame = parsed.getFrame();
            metricsService.recordFrameReceived(frame.getType().getValue());

            switch (frame.getType()) {
                case CHAT_MESSAGE:
                    handleChatMessage(connection, frame);
                    break;
                case PING:
                    reply(connection, WebSocketFrame.pong());
                    break;
                default:
                    replyError(connection, FrameCodec.INVALID_FORMAT);
            }

        } catch (Exception e) {
            log.error("Error handling frame: wsId={}, userId={}", connection.getId(), connection.getUserId(), e);
            metricsService.recordError("FRAME_PROCESSING_ERROR", "ChatOrchestrator");
            replyError(connection, SERVER_ERROR);
        }
    }

    private void handleChatMessage(LiveConnection connection, WebSocketFrame frame) {
        String content = frame.getContent();
        if (content == null || content.isBlank()) {
            replyError(connection, CONTENT_REQUIRED);
            return;
        }

        Long targetSessionId = frame.getSessionId() != null ? frame.getSessionId() : connection.getChatSessionId();
        if (targetSessionId == null) {
            replyError(connection, NO_TARGET_SESSION);
            return;
        }

        Optional<ChatMessage> userMessage =
            chatSessionService.postUserMessage(targetSessionId, connection.getUserId(), content);
        if (userMessage.isEmpty()) {
            log.info("Message refused: userId={}, sessionId={}", connection.getUserId(), targetSessionId);
            replyError(connection, ACCESS_DENIED);
            return;
        }

        fanOut(connection, targetSessionId, userMessage.get());

        List<HistoryEntry> history = chatSessionService.getRecentHistory(targetSessionId, historyWindow).stream()
            .map(HistoryEntry::of)
            .toList();
        String reply = responseGenerationService.generate(history, content);

        chatSessionService.postAssistantMessage(targetSessionId, reply)
            .ifPresentOrElse(
                assistantMessage -> fanOut(connection, targetSessionId, assistantMessage),
                () -> log.info("Reply dropped, session closed meanwhile: sessionId={}", targetSessionId));
    }

    /**
     * Broadcast to the session; a sender whose connection is bound elsewhere gets its own copy
     */
    private void fanOut(LiveConnection sender, Long sessionId, ChatMessage message) {
        String json = frameCodec.encode(WebSocketFrame.chatMessage(message));
        int delivered = connectionRegistry.broadcastToSession(sessionId, json);
        log.debug("Message {} delivered to {} connections of session {}", message.getId(), delivered, sessionId);

        if (!Objects.equals(sender.getChatSessionId(), sessionId)) {
            send(sender, json);
        }
    }

    private void replyError(LiveConnection connection, String errorMessage) {
        reply(connection, WebSocketFrame.error(errorMessage));
    }

    private void reply(LiveConnection connection, WebSocketFrame frame) {
        send(connection, frameCodec.encode(frame));
    }

    private void send(LiveConnection connection, String json) {
        if (!connectionRegistry.sendToConnection(connection, json)) {
            connectionRegistry.unregister(connection, connection.getUserId(), connection.getChatSessionId());
        }
    }
}
