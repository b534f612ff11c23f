package com.demo.groupchat.controller;

import com.demo.groupchat.domain.*;
import com.demo.groupchat.infrastructure.ConnectionRegistry;
import com.demo.groupchat.infrastructure.FrameCodec;
import com.demo.groupchat.service.ChatSessionService;
import com.demo.groupchat.service.TokenAuthenticator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Session lifecycle over HTTP.
 * Every call carries {@code Authorization: Bearer <jwt>}; rejected operations leave state untouched.
 */
@Slf4j
@RestController
@RequestMapping("/api/chat/sessions")
@CrossOrigin(origins = "*")
public class ChatSessionController {

    private static final int MAX_PAGE_SIZE = 100;

    private final ChatSessionService chatSessionService;
    private final TokenAuthenticator tokenAuthenticator;
    private final ConnectionRegistry connectionRegistry;
    private final FrameCodec frameCodec;

    public ChatSessionController(ChatSessionService chatSessionService,
                                 TokenAuthenticator tokenAuthenticator,
                                 ConnectionRegistry connectionRegistry,
                                 FrameCodec frameCodec) {
        this.chatSessionService = chatSessionService;
        this.tokenAuthenticator = tokenAuthenticator;
        this.connectionRegistry = connectionRegistry;
        this.frameCodec = frameCodec;
    }

    /**
     * Create session
     * POST /api/chat/sessions
     */
    @PostMapping
    public ResponseEntity<?> createSession(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                           @RequestBody SessionRequest request) {
        return withUser(authorization, userId -> {
            ValidationResult validation = request.validate();
            if (!validation.isValid()) {
                return badRequest(validation.getErrorMessage());
            }
            ChatSession session = chatSessionService.createSession(userId, request);
            return ResponseEntity.status(HttpStatus.CREATED).body(detailsOrSession(session, userId));
        });
    }

    /**
     * Sessions the caller participates in
     * GET /api/chat/sessions
     */
    @GetMapping
    public ResponseEntity<?> getUserSessions(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                             @RequestParam(defaultValue = "0") int page,
                                             @RequestParam(defaultValue = "20") int size) {
        return withUser(authorization, userId -> {
            List<Map<String, Object>> sessions = chatSessionService.getUserSessionSummaries(userId, pageOf(page), sizeOf(size))
                .stream().map(ChatSessionController::summaryView).toList();
            return ResponseEntity.ok(Map.of("sessions", sessions, "page", pageOf(page), "size", sizeOf(size)));
        });
    }

    /**
     * Public sessions the caller can still join
     * GET /api/chat/sessions/public
     */
    @GetMapping("/public")
    public ResponseEntity<?> getPublicSessions(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                               @RequestParam(defaultValue = "0") int page,
                                               @RequestParam(defaultValue = "20") int size) {
        return withUser(authorization, userId -> {
            List<Map<String, Object>> sessions = chatSessionService.getPublicSessionSummaries(userId, pageOf(page), sizeOf(size))
                .stream().map(ChatSessionController::summaryView).toList();
            return ResponseEntity.ok(Map.of(
                "sessions", sessions,
                "total", chatSessionService.countPublicSessions(userId),
                "page", pageOf(page),
                "size", sizeOf(size)));
        });
    }

    /**
     * Session with its active participants and recent messages
     * GET /api/chat/sessions/{id}
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<?> getSession(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                        @PathVariable Long sessionId) {
        return withUser(authorization, userId -> chatSessionService.getSessionDetails(sessionId, userId)
            .<ResponseEntity<?>>map(details -> ResponseEntity.ok(detailView(details)))
            .orElseGet(() -> notFound()));
    }

    @PutMapping("/{sessionId}")
    public ResponseEntity<?> updateSession(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                           @PathVariable Long sessionId,
                                           @RequestBody SessionRequest request) {
        return withUser(authorization, userId -> {
            ValidationResult validation = request.validate();
            if (!validation.isValid()) {
                return badRequest(validation.getErrorMessage());
            }
            return chatSessionService.updateSession(sessionId, userId, request)
                .<ResponseEntity<?>>map(session -> ResponseEntity.ok(detailsOrSession(session, userId)))
                .orElseGet(() -> forbidden());
        });
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<?> deleteSession(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                           @PathVariable Long sessionId) {
        return withUser(authorization, userId -> chatSessionService.deleteSession(sessionId, userId)
            ? ResponseEntity.noContent().build()
            : forbidden());
    }

    // ===== Participants =====

    @PostMapping("/{sessionId}/join")
    public ResponseEntity<?> joinSession(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         @PathVariable Long sessionId) {
        return withUser(authorization, userId -> chatSessionService.joinSession(sessionId, userId)
            .<ResponseEntity<?>>map(participant -> ResponseEntity.ok(participantView(participant)))
            .orElseGet(() -> conflict("Unable to join session")));
    }

    @PostMapping("/{sessionId}/leave")
    public ResponseEntity<?> leaveSession(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                          @PathVariable Long sessionId) {
        return withUser(authorization, userId -> chatSessionService.leaveSession(sessionId, userId)
            ? ResponseEntity.noContent().build()
            : forbidden());
    }

    @PostMapping("/{sessionId}/invite")
    public ResponseEntity<?> inviteUser(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                        @PathVariable Long sessionId,
                                        @RequestBody InviteRequest request) {
        return withUser(authorization, userId -> {
            if (request.getUserId() == null) {
                return badRequest("user_id is required");
            }
            return chatSessionService.inviteUser(sessionId, userId, request)
                .<ResponseEntity<?>>map(participant -> ResponseEntity.ok(participantView(participant)))
                .orElseGet(() -> conflict("Unable to invite user"));
        });
    }

    @PutMapping("/{sessionId}/participants/{targetUserId}/role")
    public ResponseEntity<?> updateParticipantRole(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                   @PathVariable Long sessionId,
                                                   @PathVariable Long targetUserId,
                                                   @RequestBody RoleChangeRequest request) {
        return withUser(authorization, userId -> {
            if (request.getRole() == null) {
                return badRequest("role is required");
            }
            return chatSessionService.updateParticipantRole(sessionId, userId, targetUserId, request.getRole())
                .<ResponseEntity<?>>map(participant -> ResponseEntity.ok(participantView(participant)))
                .orElseGet(() -> forbidden());
        });
    }

    @DeleteMapping("/{sessionId}/participants/{targetUserId}")
    public ResponseEntity<?> removeParticipant(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                               @PathVariable Long sessionId,
                                               @PathVariable Long targetUserId) {
        return withUser(authorization, userId -> chatSessionService.removeParticipant(sessionId, userId, targetUserId)
            ? ResponseEntity.noContent().build()
            : forbidden());
    }

    @GetMapping("/{sessionId}/participants")
    public ResponseEntity<?> getParticipants(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                             @PathVariable Long sessionId) {
        return withUser(authorization, userId -> chatSessionService.getParticipants(sessionId, userId)
            .<ResponseEntity<?>>map(participants -> ResponseEntity.ok(Map.of("participants",
                participants.stream().map(ChatSessionController::participantView).toList())))
            .orElseGet(() -> notFound()));
    }

    // ===== Messages =====

    /**
     * Post a message; it is fanned out to every live connection bound to the session
     * POST /api/chat/sessions/{id}/messages
     */
    @PostMapping("/{sessionId}/messages")
    public ResponseEntity<?> postMessage(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         @PathVariable Long sessionId,
                                         @RequestBody MessageRequest request) {
        return withUser(authorization, userId -> {
            if (request.getContent() == null || request.getContent().isBlank()) {
                return badRequest("content is required");
            }
            Optional<ChatMessage> message = chatSessionService.postUserMessage(sessionId, userId, request.getContent());
            if (message.isEmpty()) {
                return forbidden();
            }
            int delivered = connectionRegistry.broadcastToSession(sessionId,
                frameCodec.encode(WebSocketFrame.chatMessage(message.get())));
            log.info("REST message posted: sessionId={}, userId={}, delivered={}", sessionId, userId, delivered);
            return ResponseEntity.status(HttpStatus.CREATED).body(messageView(message.get()));
        });
    }

    @GetMapping("/{sessionId}/messages")
    public ResponseEntity<?> getMessages(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                         @PathVariable Long sessionId,
                                         @RequestParam(defaultValue = "0") int page,
                                         @RequestParam(defaultValue = "50") int size) {
        return withUser(authorization, userId -> chatSessionService.getSessionMessages(sessionId, userId, pageOf(page), sizeOf(size))
            .<ResponseEntity<?>>map(messages -> ResponseEntity.ok(Map.of(
                "messages", messages.stream().map(ChatSessionController::messageView).toList(),
                "total", chatSessionService.countMessages(sessionId),
                "page", pageOf(page),
                "size", sizeOf(size))))
            .orElseGet(() -> notFound()));
    }

    // Helper methods

    private ResponseEntity<?> withUser(String authorization, Function<Long, ResponseEntity<?>> action) {
        Optional<Long> userId = tokenAuthenticator.authenticate(authorization).map(UserAccount::getId);
        if (userId.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("error", "Unauthorized"));
        }

        try {
            return action.apply(userId.get());
        } catch (Exception e) {
            log.error("Error handling chat session request: userId={}", userId.get(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Internal server error"));
        }
    }

    private Map<String, Object> detailsOrSession(ChatSession session, Long userId) {
        return chatSessionService.getSessionDetails(session.getId(), userId)
            .map(ChatSessionController::detailView)
            .orElseGet(() -> sessionView(session));
    }

    private static ResponseEntity<?> badRequest(String detail) {
        return ResponseEntity.badRequest().body(Map.of("error", "Bad request", "detail", detail));
    }

    private static ResponseEntity<?> forbidden() {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "Operation not permitted"));
    }

    private static ResponseEntity<?> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Session not found or access denied"));
    }

    private static ResponseEntity<?> conflict(String error) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", error));
    }

    private static int pageOf(int page) {
        return Math.max(page, 0);
    }

    private static int sizeOf(int size) {
        return Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
    }

    static Map<String, Object> sessionView(ChatSession session) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", session.getId());
        view.put("title", session.getTitle());
        view.put("description", session.getDescription());
        view.put("owner_id", session.getOwnerId());
        view.put("session_type", session.getSessionType());
        view.put("max_participants", session.getMaxParticipants());
        view.put("created_at", session.getCreatedAt());
        view.put("updated_at", session.getUpdatedAt());
        return view;
    }

    static Map<String, Object> summaryView(SessionSummary summary) {
        Map<String, Object> view = sessionView(summary.getSession());
        view.put("owner_username", summary.getOwnerUsername());
        view.put("message_count", summary.getMessageCount());
        view.put("participant_count", summary.getParticipantCount());
        return view;
    }

    static Map<String, Object> detailView(SessionDetails details) {
        Map<String, Object> view = sessionView(details.getSession());
        view.put("owner_username", details.getOwnerUsername());
        view.put("is_active", details.getSession().isActive());
        view.put("participant_count", details.getParticipantCount());
        view.put("participants", details.getParticipants().stream()
            .map(participant -> {
                Map<String, Object> entry = participantView(participant);
                entry.put("username", details.usernameOf(participant.getUserId()));
                entry.put("is_active", participant.isActive());
                return entry;
            })
            .toList());
        view.put("messages", details.getMessages().stream()
            .map(message -> {
                Map<String, Object> entry = messageView(message);
                entry.put("username", details.usernameOf(message.getUserId()));
                return entry;
            })
            .toList());
        return view;
    }

    static Map<String, Object> participantView(ChatParticipant participant) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("session_id", participant.getSessionId());
        view.put("user_id", participant.getUserId());
        view.put("role", participant.getRole());
        view.put("joined_at", participant.getJoinedAt());
        return view;
    }

    static Map<String, Object> messageView(ChatMessage message) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", message.getId());
        view.put("session_id", message.getSessionId());
        view.put("user_id", message.getUserId());
        view.put("role", message.getRole());
        view.put("content", message.getContent());
        view.put("created_at", message.getCreatedAt());
        return view;
    }
}
