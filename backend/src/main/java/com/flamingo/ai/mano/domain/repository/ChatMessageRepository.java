package com.flamingo.ai.mano.domain.repository;

import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.enums.MessageRole;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for conversation messages. */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  /** Messages of one author kind inside a trailing window, newest first. */
  List<ChatMessage> findByUserIdAndRoleAndCreatedAtAfterOrderByCreatedAtDesc(
      String userId, MessageRole role, LocalDateTime since);

  /** All messages of a user inside a trailing window, newest first. */
  List<ChatMessage> findByUserIdAndCreatedAtAfterOrderByCreatedAtDesc(
      String userId, LocalDateTime since);

  @Query(
      "SELECT m FROM ChatMessage m WHERE m.userId = :userId AND m.personId = :personId "
          + "AND m.role = :role AND m.createdAt > :since ORDER BY m.createdAt DESC")
  List<ChatMessage> findPersonMessagesSince(
      @Param("userId") String userId,
      @Param("personId") UUID personId,
      @Param("role") MessageRole role,
      @Param("since") LocalDateTime since,
      Pageable pageable);

  Optional<ChatMessage> findFirstByUserIdAndPersonIdOrderByCreatedAtDesc(
      String userId, UUID personId);

  boolean existsByUserIdAndPersonIdAndRoleAndCreatedAtAfter(
      String userId, UUID personId, MessageRole role, LocalDateTime since);

  /** Most recent messages of a person conversation. */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.userId = :userId AND m.personId = :personId "
          + "ORDER BY m.createdAt DESC")
  List<ChatMessage> findRecentByPerson(
      @Param("userId") String userId, @Param("personId") UUID personId, Pageable pageable);

  /** Most recent messages of a topic conversation. */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.userId = :userId AND m.topicId = :topicId "
          + "ORDER BY m.createdAt DESC")
  List<ChatMessage> findRecentByTopic(
      @Param("userId") String userId, @Param("topicId") UUID topicId, Pageable pageable);

  /** Most recent messages of the general conversation (no person, no topic). */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.userId = :userId AND m.personId IS NULL "
          + "AND m.topicId IS NULL ORDER BY m.createdAt DESC")
  List<ChatMessage> findRecentGeneral(@Param("userId") String userId, Pageable pageable);

  /** Messages of the same person close in time to an anchor message, excluding the anchor. */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.userId = :userId AND m.personId = :personId "
          + "AND m.id <> :excludeId AND m.createdAt BETWEEN :from AND :to "
          + "ORDER BY m.createdAt DESC")
  List<ChatMessage> findAdjacentMessages(
      @Param("userId") String userId,
      @Param("personId") UUID personId,
      @Param("excludeId") UUID excludeId,
      @Param("from") LocalDateTime from,
      @Param("to") LocalDateTime to,
      Pageable pageable);

  /** Messages not yet embedded, oldest first. */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.userId = :userId AND m.embedded = false "
          + "ORDER BY m.createdAt ASC")
  List<ChatMessage> findUnembedded(@Param("userId") String userId, Pageable pageable);

  @Transactional
  @Modifying
  @Query("UPDATE ChatMessage m SET m.embedded = true WHERE m.id IN :ids")
  int markEmbedded(@Param("ids") List<UUID> ids);

  default List<ChatMessage> findRecentByPerson(String userId, UUID personId, int limit) {
    return findRecentByPerson(userId, personId, Pageable.ofSize(limit));
  }

  default List<ChatMessage> findRecentByTopic(String userId, UUID topicId, int limit) {
    return findRecentByTopic(userId, topicId, Pageable.ofSize(limit));
  }
}
