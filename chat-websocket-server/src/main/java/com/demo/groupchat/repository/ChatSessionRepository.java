package com.demo.groupchat.repository;

import com.demo.groupchat.domain.ChatSession;
import com.demo.groupchat.domain.SessionType;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for ChatSession persistence
 */
@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSession, Long> {

    Optional<ChatSession> findByIdAndActiveTrue(Long id);

    /**
     * Load an active session holding a row lock until the surrounding transaction ends.
     * Serializes capacity checks of concurrent joins and invites.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT cs FROM ChatSession cs WHERE cs.id = :id AND cs.active = true")
    Optional<ChatSession> findActiveForUpdate(@Param("id") Long id);

    /**
     * Active sessions the user currently participates in, most recently updated first
     */
    @Query("SELECT cs FROM ChatSession cs, ChatParticipant cp " +
           "WHERE cp.sessionId = cs.id " +
           "AND cp.userId = :userId " +
           "AND cp.active = true " +
           "AND cs.active = true " +
           "ORDER BY cs.updatedAt DESC")
    List<ChatSession> findByParticipant(@Param("userId") Long userId, Pageable pageable);

    /**
     * Public sessions the user has not (actively) joined
     */
    @Query("SELECT cs FROM ChatSession cs " +
           "WHERE cs.sessionType = :type " +
           "AND cs.active = true " +
           "AND cs.id NOT IN (SELECT cp.sessionId FROM ChatParticipant cp " +
           "                  WHERE cp.userId = :userId AND cp.active = true) " +
           "ORDER BY cs.createdAt DESC")
    List<ChatSession> findJoinable(@Param("type") SessionType type,
                                   @Param("userId") Long userId,
                                   Pageable pageable);

    @Query("SELECT COUNT(cs) FROM ChatSession cs " +
           "WHERE cs.sessionType = :type " +
           "AND cs.active = true " +
           "AND cs.id NOT IN (SELECT cp.sessionId FROM ChatParticipant cp " +
           "                  WHERE cp.userId = :userId AND cp.active = true)")
    long countJoinable(@Param("type") SessionType type, @Param("userId") Long userId);
}
