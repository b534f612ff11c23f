package com.demo.groupchat.service;

import com.demo.groupchat.domain.ChatMessage;
import com.demo.groupchat.domain.ChatParticipant;
import com.demo.groupchat.domain.ChatSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes chat domain events to Kafka for audit and analytics consumers.
 * <p>
 * Optional: only created with {@code spring.kafka.enabled=true}. Publishing is fire-and-forget,
 * a failed send is logged and counted but never reaches the caller.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class EventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;

    @Value("${kafka.topics.chat-events:chat-events}")
    private String chatEventsTopic;

    public EventPublisher(KafkaTemplate<String, Object> kafkaTemplate, MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
    }

    public void publishSessionCreated(ChatSession session) {
        Map<String, Object> event = baseEvent("SESSION_CREATED", session.getId());
        event.put("ownerId", session.getOwnerId());
        event.put("sessionType", session.getSessionType().getValue());
        event.put("maxParticipants", session.getMaxParticipants());

        publishEvent(String.valueOf(session.getId()), event, "SESSION_CREATED");
    }

    public void publishSessionDeleted(Long sessionId, Long userId) {
        Map<String, Object> event = baseEvent("SESSION_DELETED", sessionId);
        event.put("userId", userId);

        publishEvent(String.valueOf(sessionId), event, "SESSION_DELETED");
    }

    /**
     * Join, invite, role change, removal or leave
     */
    public void publishParticipantChanged(ChatParticipant participant, String change, Long actorId) {
        Map<String, Object> event = baseEvent("PARTICIPANT_CHANGED", participant.getSessionId());
        event.put("change", change);
        event.put("userId", participant.getUserId());
        event.put("actorId", actorId);
        event.put("role", participant.getRole().getValue());
        event.put("active", participant.isActive());

        publishEvent(String.valueOf(participant.getSessionId()), event, "PARTICIPANT_CHANGED");
    }

    public void publishChatMessage(ChatMessage message) {
        Map<String, Object> event = baseEvent("CHAT_MESSAGE", message.getSessionId());
        event.put("messageId", message.getId());
        event.put("userId", message.getUserId());
        event.put("role", message.getRole().getValue());
        event.put("contentLength", message.getContent() != null ? message.getContent().length() : 0);

        publishEvent(String.valueOf(message.getSessionId()), event, "CHAT_MESSAGE");
    }

    private Map<String, Object> baseEvent(String eventType, Long sessionId) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("sessionId", sessionId);
        return event;
    }

    private void publishEvent(String key, Object event, String eventType) {
        try {
            CompletableFuture<SendResult<String, Object>> future =
                kafkaTemplate.send(chatEventsTopic, key, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published: type={}, topic={}, partition={}, offset={}",
                        eventType, chatEventsTopic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, chatEventsTopic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                }
            });

        } catch (Exception e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}
