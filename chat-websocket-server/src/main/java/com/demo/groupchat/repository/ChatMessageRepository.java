package com.demo.groupchat.repository;

import com.demo.groupchat.domain.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Append-only message store
 */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    /**
     * Transcript page, oldest first
     */
    List<ChatMessage> findBySessionIdOrderByCreatedAtAscIdAsc(Long sessionId, Pageable pageable);

    /**
     * Most recent messages, newest first
     */
    List<ChatMessage> findBySessionIdOrderByCreatedAtDescIdDesc(Long sessionId, Pageable pageable);

    long countBySessionId(Long sessionId);

    /**
     * (sessionId, count) rows; sessions without messages are absent
     */
    @Query("SELECT m.sessionId, COUNT(m) FROM ChatMessage m WHERE m.sessionId IN :sessionIds GROUP BY m.sessionId")
    List<Object[]> countBySessionIds(@Param("sessionIds") Collection<Long> sessionIds);
}
