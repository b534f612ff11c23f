package com.demo.groupchat.service;

import com.demo.groupchat.domain.*;
import com.demo.groupchat.repository.ChatMessageRepository;
import com.demo.groupchat.repository.ChatParticipantRepository;
import com.demo.groupchat.repository.ChatSessionRepository;
import com.demo.groupchat.repository.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.*;
import java.util.function.Consumer;

/**
 * Session and participant state transitions.
 * <p>
 * Every operation loads the acting participant fresh and checks it against
 * {@link SessionAccessPolicy} before mutating anything. Rejections are reported as an empty
 * result (or {@code false}) and leave all rows untouched.
 */
@Service
@Slf4j
public class ChatSessionService {

    static final int DETAIL_MESSAGE_LIMIT = 100;

    private final ChatSessionRepository sessionRepository;
    private final ChatParticipantRepository participantRepository;
    private final ChatMessageRepository messageRepository;
    private final UserAccountRepository userRepository;
    private final TransactionTemplate transactionTemplate;

    // Optional: Kafka event publisher (null if Kafka is disabled)
    private final EventPublisher eventPublisher;

    public ChatSessionService(ChatSessionRepository sessionRepository,
                              ChatParticipantRepository participantRepository,
                              ChatMessageRepository messageRepository,
                              UserAccountRepository userRepository,
                              PlatformTransactionManager transactionManager,
                              @Autowired(required = false) EventPublisher eventPublisher) {
        this.sessionRepository = sessionRepository;
        this.participantRepository = participantRepository;
        this.messageRepository = messageRepository;
        this.userRepository = userRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.eventPublisher = eventPublisher;
    }

    // ===== Sessions =====

    /**
     * Create a session together with its owner participant; both rows commit or neither does.
     */
    @Transactional
    public ChatSession createSession(Long ownerId, SessionRequest request) {
        ChatSession session = ChatSession.builder()
                .title(request.getTitle())
                .description(request.getDescription())
                .ownerId(ownerId)
                .sessionType(request.getSessionType() != null ? request.getSessionType() : SessionType.PRIVATE)
                .maxParticipants(request.getMaxParticipants() != null
                        ? request.getMaxParticipants()
                        : ChatSession.DEFAULT_MAX_PARTICIPANTS)
                .active(true)
                .build();
        session = sessionRepository.save(session);

        participantRepository.save(ChatParticipant.builder()
                .sessionId(session.getId())
                .userId(ownerId)
                .role(ParticipantRole.OWNER)
                .active(true)
                .build());

        log.info("Session created: sessionId={}, ownerId={}, type={}, maxParticipants={}",
                session.getId(), ownerId, session.getSessionType(), session.getMaxParticipants());

        ChatSession created = session;
        publishAfterCommit(publisher -> publisher.publishSessionCreated(created));
        return session;
    }

    /**
     * Session if it is active and the user may view it
     */
    @Transactional(readOnly = true)
    public Optional<ChatSession> getSession(Long sessionId, Long userId) {
        if (!canView(sessionId, userId)) {
            return Optional.empty();
        }
        return sessionRepository.findByIdAndActiveTrue(sessionId);
    }

    @Transactional(readOnly = true)
    public List<ChatSession> getUserSessions(Long userId, int page, int size) {
        return sessionRepository.findByParticipant(userId, PageRequest.of(page, size));
    }

    @Transactional(readOnly = true)
    public List<ChatSession> getPublicSessions(Long userId, int page, int size) {
        return sessionRepository.findJoinable(SessionType.PUBLIC, userId, PageRequest.of(page, size));
    }

    /**
     * The caller's sessions with owner name, message count and active participant count
     */
    @Transactional(readOnly = true)
    public List<SessionSummary> getUserSessionSummaries(Long userId, int page, int size) {
        return summarize(getUserSessions(userId, page, size));
    }

    @Transactional(readOnly = true)
    public List<SessionSummary> getPublicSessionSummaries(Long userId, int page, int size) {
        return summarize(getPublicSessions(userId, page, size));
    }

    /**
     * A visible session with its active participants and the most recent messages, oldest first
     */
    @Transactional(readOnly = true)
    public Optional<SessionDetails> getSessionDetails(Long sessionId, Long userId) {
        Optional<ChatSession> session = getSession(sessionId, userId);
        if (session.isEmpty()) {
            return Optional.empty();
        }

        List<ChatParticipant> participants = participantRepository.findBySessionIdAndActiveTrueOrderByJoinedAtAsc(sessionId);
        List<ChatMessage> messages = getRecentHistory(sessionId, DETAIL_MESSAGE_LIMIT);

        Set<Long> userIds = new HashSet<>();
        userIds.add(session.get().getOwnerId());
        participants.forEach(p -> userIds.add(p.getUserId()));
        messages.forEach(m -> userIds.add(m.getUserId()));

        return Optional.of(SessionDetails.builder()
                .session(session.get())
                .participants(participants)
                .messages(messages)
                .usernames(usernames(userIds))
                .build());
    }

    @Transactional(readOnly = true)
    public long countPublicSessions(Long userId) {
        return sessionRepository.countJoinable(SessionType.PUBLIC, userId);
    }

    /**
     * Update title, description, type or capacity (owner or admin). Capacity may not drop
     * below the current number of active participants.
     */
    @Transactional
    public Optional<ChatSession> updateSession(Long sessionId, Long userId, SessionRequest request) {
        Optional<ChatSession> session = sessionRepository.findByIdAndActiveTrue(sessionId);
        if (session.isEmpty()
                || !SessionAccessPolicy.canAdminister(participantRepository.findBySessionIdAndUserId(sessionId, userId))) {
            log.debug("Session update rejected: sessionId={}, userId={}", sessionId, userId);
            return Optional.empty();
        }

        ChatSession target = session.get();
        if (request.getMaxParticipants() != null) {
            long current = participantRepository.countBySessionIdAndActiveTrue(sessionId);
            if (request.getMaxParticipants() < current) {
                log.debug("Session update rejected, capacity below participants: sessionId={}, requested={}, current={}",
                        sessionId, request.getMaxParticipants(), current);
                return Optional.empty();
            }
            target.setMaxParticipants(request.getMaxParticipants());
        }
        if (request.getTitle() != null) {
            target.setTitle(request.getTitle());
        }
        if (request.getDescription() != null) {
            target.setDescription(request.getDescription());
        }
        if (request.getSessionType() != null) {
            target.setSessionType(request.getSessionType());
        }

        log.info("Session updated: sessionId={}, userId={}", sessionId, userId);
        return Optional.of(sessionRepository.save(target));
    }

    /**
     * Soft delete (owner only). Rows are kept; the session simply stops accepting anything.
     */
    @Transactional
    public boolean deleteSession(Long sessionId, Long userId) {
        Optional<ChatSession> session = sessionRepository.findByIdAndActiveTrue(sessionId);
        if (session.isEmpty()
                || !SessionAccessPolicy.isOwner(participantRepository.findBySessionIdAndUserId(sessionId, userId))) {
            log.debug("Session delete rejected: sessionId={}, userId={}", sessionId, userId);
            return false;
        }

        ChatSession target = session.get();
        target.setActive(false);
        sessionRepository.save(target);
        log.info("Session deleted: sessionId={}, userId={}", sessionId, userId);

        publishAfterCommit(publisher -> publisher.publishSessionDeleted(sessionId, userId));
        return true;
    }

    // ===== Participants =====

    /**
     * Join a public session as member. A previously left row is reactivated in place.
     * A concurrent join losing the unique-constraint race observes the winner's row and is
     * rejected like any other duplicate.
     */
    public Optional<ChatParticipant> joinSession(Long sessionId, Long userId) {
        try {
            Optional<ChatParticipant> joined = transactionTemplate.execute(status -> doJoin(sessionId, userId));
            joined.ifPresent(p -> publishParticipantChange(p, "JOINED", userId));
            return joined;
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent join resolved to existing participant: sessionId={}, userId={}", sessionId, userId);
            return Optional.empty();
        }
    }

    private Optional<ChatParticipant> doJoin(Long sessionId, Long userId) {
        Optional<ChatSession> session = sessionRepository.findActiveForUpdate(sessionId);
        if (session.isEmpty() || session.get().getSessionType() != SessionType.PUBLIC) {
            log.debug("Join rejected, session not open for joining: sessionId={}, userId={}", sessionId, userId);
            return Optional.empty();
        }

        Optional<ChatParticipant> existing = participantRepository.findBySessionIdAndUserId(sessionId, userId);
        if (existing.map(ChatParticipant::isActive).orElse(false)) {
            log.debug("Join rejected, already a participant: sessionId={}, userId={}", sessionId, userId);
            return Optional.empty();
        }
        if (atCapacity(session.get())) {
            log.debug("Join rejected, session full: sessionId={}, userId={}", sessionId, userId);
            return Optional.empty();
        }

        ChatParticipant participant = existing.orElseGet(() -> ChatParticipant.builder()
                .sessionId(sessionId)
                .userId(userId)
                .build());
        participant.setRole(ParticipantRole.MEMBER);
        participant.setActive(true);
        participant = participantRepository.saveAndFlush(participant);

        log.info("User joined session: sessionId={}, userId={}, reactivated={}",
                sessionId, userId, existing.isPresent());
        return Optional.of(participant);
    }

    /**
     * Invite an active user (owner or admin only). Ownership cannot be granted by invitation.
     * A previously removed row is reactivated with the requested role.
     */
    public Optional<ChatParticipant> inviteUser(Long sessionId, Long inviterId, InviteRequest request) {
        try {
            Optional<ChatParticipant> invited = transactionTemplate.execute(status -> doInvite(sessionId, inviterId, request));
            invited.ifPresent(p -> publishParticipantChange(p, "INVITED", inviterId));
            return invited;
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent invite resolved to existing participant: sessionId={}, userId={}",
                    sessionId, request.getUserId());
            return Optional.empty();
        }
    }

    private Optional<ChatParticipant> doInvite(Long sessionId, Long inviterId, InviteRequest request) {
        ParticipantRole role = request.getRole() != null ? request.getRole() : ParticipantRole.MEMBER;
        if (request.getUserId() == null || role == ParticipantRole.OWNER) {
            return Optional.empty();
        }

        Optional<ChatSession> session = sessionRepository.findActiveForUpdate(sessionId);
        if (session.isEmpty()
                || !SessionAccessPolicy.canAdminister(participantRepository.findBySessionIdAndUserId(sessionId, inviterId))) {
            log.debug("Invite rejected: sessionId={}, inviterId={}", sessionId, inviterId);
            return Optional.empty();
        }
        if (userRepository.findByIdAndActiveTrue(request.getUserId()).isEmpty()) {
            log.debug("Invite rejected, unknown or inactive user: sessionId={}, userId={}",
                    sessionId, request.getUserId());
            return Optional.empty();
        }

        Optional<ChatParticipant> existing = participantRepository.findBySessionIdAndUserId(sessionId, request.getUserId());
        if (existing.map(ChatParticipant::isActive).orElse(false)) {
            log.debug("Invite rejected, already a participant: sessionId={}, userId={}", sessionId, request.getUserId());
            return Optional.empty();
        }
        if (atCapacity(session.get())) {
            log.debug("Invite rejected, session full: sessionId={}, userId={}", sessionId, request.getUserId());
            return Optional.empty();
        }

        ChatParticipant participant = existing.orElseGet(() -> ChatParticipant.builder()
                .sessionId(sessionId)
                .userId(request.getUserId())
                .build());
        participant.setRole(role);
        participant.setActive(true);
        participant = participantRepository.saveAndFlush(participant);

        log.info("User invited: sessionId={}, userId={}, role={}, inviterId={}",
                sessionId, request.getUserId(), role, inviterId);
        return Optional.of(participant);
    }

    /**
     * Change a participant's role. Granting {@code owner} hands ownership over: the acting owner
     * becomes admin in the same transaction, so a session keeps exactly one owner.
     */
    @Transactional
    public Optional<ChatParticipant> updateParticipantRole(Long sessionId, Long actorId,
                                                           Long targetUserId, ParticipantRole newRole) {
        Optional<ChatSession> session = sessionRepository.findByIdAndActiveTrue(sessionId);
        Optional<ChatParticipant> actor = participantRepository.findBySessionIdAndUserId(sessionId, actorId);
        Optional<ChatParticipant> target = participantRepository.findBySessionIdAndUserId(sessionId, targetUserId);

        if (session.isEmpty() || !SessionAccessPolicy.canChangeRole(actor, target, newRole)) {
            log.debug("Role change rejected: sessionId={}, actorId={}, targetUserId={}, role={}",
                    sessionId, actorId, targetUserId, newRole);
            return Optional.empty();
        }

        ChatParticipant updated = target.get();
        updated.setRole(newRole);
        updated = participantRepository.save(updated);

        if (newRole == ParticipantRole.OWNER) {
            ChatParticipant previousOwner = actor.get();
            previousOwner.setRole(ParticipantRole.ADMIN);
            participantRepository.save(previousOwner);

            ChatSession transferred = session.get();
            transferred.setOwnerId(targetUserId);
            sessionRepository.save(transferred);
            log.info("Ownership transferred: sessionId={}, from={}, to={}", sessionId, actorId, targetUserId);
        }

        log.info("Participant role changed: sessionId={}, userId={}, role={}, actorId={}",
                sessionId, targetUserId, newRole, actorId);
        publishParticipantChange(updated, "ROLE_CHANGED", actorId);
        return Optional.of(updated);
    }

    @Transactional
    public boolean removeParticipant(Long sessionId, Long actorId, Long targetUserId) {
        Optional<ChatSession> session = sessionRepository.findByIdAndActiveTrue(sessionId);
        Optional<ChatParticipant> actor = participantRepository.findBySessionIdAndUserId(sessionId, actorId);
        Optional<ChatParticipant> target = participantRepository.findBySessionIdAndUserId(sessionId, targetUserId);

        if (session.isEmpty() || !SessionAccessPolicy.canRemove(actor, target)) {
            log.debug("Remove rejected: sessionId={}, actorId={}, targetUserId={}", sessionId, actorId, targetUserId);
            return false;
        }

        ChatParticipant removed = target.get();
        removed.setActive(false);
        participantRepository.save(removed);

        log.info("Participant removed: sessionId={}, userId={}, actorId={}", sessionId, targetUserId, actorId);
        publishParticipantChange(removed, "REMOVED", actorId);
        return true;
    }

    @Transactional
    public boolean leaveSession(Long sessionId, Long userId) {
        Optional<ChatParticipant> participant = participantRepository.findBySessionIdAndUserId(sessionId, userId);
        if (!SessionAccessPolicy.canLeave(participant)) {
            log.debug("Leave rejected: sessionId={}, userId={}", sessionId, userId);
            return false;
        }

        ChatParticipant left = participant.get();
        left.setActive(false);
        participantRepository.save(left);

        log.info("Participant left: sessionId={}, userId={}", sessionId, userId);
        publishParticipantChange(left, "LEFT", userId);
        return true;
    }

    /**
     * Active participants, visible to anyone who can view the session
     */
    @Transactional(readOnly = true)
    public Optional<List<ChatParticipant>> getParticipants(Long sessionId, Long userId) {
        if (!canView(sessionId, userId)) {
            return Optional.empty();
        }
        return Optional.of(participantRepository.findBySessionIdAndActiveTrueOrderByJoinedAtAsc(sessionId));
    }

    /**
     * Raw participant row, whatever its active flag
     */
    @Transactional(readOnly = true)
    public Optional<ChatParticipant> findParticipant(Long sessionId, Long userId) {
        return participantRepository.findBySessionIdAndUserId(sessionId, userId);
    }

    @Transactional(readOnly = true)
    public boolean canView(Long sessionId, Long userId) {
        return SessionAccessPolicy.isOpen(sessionRepository.findById(sessionId))
                && SessionAccessPolicy.canView(participantRepository.findBySessionIdAndUserId(sessionId, userId));
    }

    @Transactional(readOnly = true)
    public boolean canPost(Long sessionId, Long userId) {
        return SessionAccessPolicy.isOpen(sessionRepository.findById(sessionId))
                && SessionAccessPolicy.canPost(participantRepository.findBySessionIdAndUserId(sessionId, userId));
    }

    // ===== Messages =====

    /**
     * Persist a message authored by a participant allowed to post
     */
    @Transactional
    public Optional<ChatMessage> postUserMessage(Long sessionId, Long userId, String content) {
        if (content == null || content.isBlank() || !canPost(sessionId, userId)) {
            log.debug("Message rejected: sessionId={}, userId={}", sessionId, userId);
            return Optional.empty();
        }
        return Optional.of(saveMessage(sessionId, userId, MessageRole.USER, content));
    }

    /**
     * Persist a generated reply; it carries no author
     */
    @Transactional
    public Optional<ChatMessage> postAssistantMessage(Long sessionId, String content) {
        if (!SessionAccessPolicy.isOpen(sessionRepository.findById(sessionId))) {
            log.debug("Assistant message dropped, session closed: sessionId={}", sessionId);
            return Optional.empty();
        }
        return Optional.of(saveMessage(sessionId, null, MessageRole.ASSISTANT, content));
    }

    @Transactional(readOnly = true)
    public Optional<List<ChatMessage>> getSessionMessages(Long sessionId, Long userId, int page, int size) {
        if (!canView(sessionId, userId)) {
            return Optional.empty();
        }
        return Optional.of(messageRepository.findBySessionIdOrderByCreatedAtAscIdAsc(sessionId, PageRequest.of(page, size)));
    }

    /**
     * The last {@code limit} messages of a session, oldest first
     */
    @Transactional(readOnly = true)
    public List<ChatMessage> getRecentHistory(Long sessionId, int limit) {
        List<ChatMessage> newestFirst = new ArrayList<>(
                messageRepository.findBySessionIdOrderByCreatedAtDescIdDesc(sessionId, PageRequest.of(0, limit)));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Transactional(readOnly = true)
    public long countMessages(Long sessionId) {
        return messageRepository.countBySessionId(sessionId);
    }

    private ChatMessage saveMessage(Long sessionId, Long userId, MessageRole role, String content) {
        ChatMessage message = messageRepository.save(ChatMessage.builder()
                .sessionId(sessionId)
                .userId(userId)
                .role(role)
                .content(content)
                .build());
        log.debug("Message saved: messageId={}, sessionId={}, role={}", message.getId(), sessionId, role);

        publishAfterCommit(publisher -> publisher.publishChatMessage(message));
        return message;
    }

    private List<SessionSummary> summarize(List<ChatSession> sessions) {
        if (sessions.isEmpty()) {
            return List.of();
        }

        List<Long> sessionIds = sessions.stream().map(ChatSession::getId).toList();
        Map<Long, Long> messageCounts = countsBySession(messageRepository.countBySessionIds(sessionIds));
        Map<Long, Long> participantCounts = countsBySession(participantRepository.countActiveBySessionIds(sessionIds));
        Map<Long, String> owners = usernames(sessions.stream().map(ChatSession::getOwnerId).toList());

        return sessions.stream()
                .map(session -> SessionSummary.builder()
                        .session(session)
                        .ownerUsername(owners.get(session.getOwnerId()))
                        .messageCount(messageCounts.getOrDefault(session.getId(), 0L))
                        .participantCount(participantCounts.getOrDefault(session.getId(), 0L))
                        .build())
                .toList();
    }

    private static Map<Long, Long> countsBySession(List<Object[]> rows) {
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : rows) {
            counts.put(((Number) row[0]).longValue(), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private Map<Long, String> usernames(Collection<Long> userIds) {
        List<Long> ids = userIds.stream().filter(Objects::nonNull).distinct().toList();
        Map<Long, String> names = new HashMap<>();
        userRepository.findAllById(ids).forEach(user -> names.put(user.getId(), user.getUsername()));
        return names;
    }

    private boolean atCapacity(ChatSession session) {
        return participantRepository.countBySessionIdAndActiveTrue(session.getId()) >= session.getMaxParticipants();
    }

    private void publishParticipantChange(ChatParticipant participant, String change, Long actorId) {
        publishAfterCommit(publisher -> publisher.publishParticipantChanged(participant, change, actorId));
    }

    /**
     * Events describe committed state only: inside a transaction they wait for its commit and are
     * dropped on rollback.
     */
    private void publishAfterCommit(Consumer<EventPublisher> publish) {
        if (eventPublisher == null) {
            return;
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publish.accept(eventPublisher);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publish.accept(eventPublisher);
            }
        });
    }
}
