package com.demo.groupchat.repository;

import com.demo.groupchat.domain.ChatParticipant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ChatParticipantRepository extends JpaRepository<ChatParticipant, Long> {

    /**
     * Participant row regardless of its active flag
     */
    Optional<ChatParticipant> findBySessionIdAndUserId(Long sessionId, Long userId);

    List<ChatParticipant> findBySessionIdAndActiveTrueOrderByJoinedAtAsc(Long sessionId);

    long countBySessionIdAndActiveTrue(Long sessionId);

    @Query("SELECT cp.sessionId, COUNT(cp) FROM ChatParticipant cp " +
           "WHERE cp.sessionId IN :sessionIds AND cp.active = true " +
           "GROUP BY cp.sessionId")
    List<Object[]> countActiveBySessionIds(@Param("sessionIds") Collection<Long> sessionIds);
}
