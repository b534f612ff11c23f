package com.demo.groupchat.service;

import com.demo.groupchat.domain.ChatParticipant;
import com.demo.groupchat.domain.ParticipantRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class EventPublisherTest {

    private KafkaTemplate<String, Object> kafkaTemplate;
    private MetricsService metricsService;
    private EventPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setup() {
        kafkaTemplate = mock(KafkaTemplate.class);
        metricsService = new MetricsService();
        publisher = new EventPublisher(kafkaTemplate, metricsService);
        ReflectionTestUtils.setField(publisher, "chatEventsTopic", "chat-events");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void participantChangeIsKeyedBySession() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        ChatParticipant participant = ChatParticipant.builder()
            .sessionId(5L).userId(9L).role(ParticipantRole.MEMBER).active(true).build();

        publisher.publishParticipantChanged(participant, "JOINED", 9L);

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("chat-events"), eq("5"), event.capture());
        Map<String, Object> body = (Map<String, Object>) event.getValue();
        assertEquals("PARTICIPANT_CHANGED", body.get("eventType"));
        assertEquals("JOINED", body.get("change"));
        assertEquals("member", body.get("role"));
    }

    @Test
    public void failuresAreCountedNotThrown() {
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(failed);

        publisher.publishSessionDeleted(5L, 1L);

        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("no metadata"));
        assertDoesNotThrow(() -> publisher.publishSessionDeleted(6L, 1L));

        assertEquals(2, metricsService.getCounterValue("errors.KAFKA_PUBLISH_ERROR"));
    }
}
