package com.flamingo.ai.mano.domain.entity;

import com.flamingo.ai.mano.domain.enums.MessageRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A single message of a coaching conversation. A conversation is either about a person
 * ({@code personId} set) or about a free-form topic ({@code topicId} set).
 */
@Entity
@Table(
    name = "messages",
    indexes = {
      @Index(name = "idx_messages_user_created", columnList = "user_id,created_at"),
      @Index(name = "idx_messages_person_created", columnList = "person_id,created_at")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(name = "person_id")
  private UUID personId;

  @Column(name = "topic_id")
  private UUID topicId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MessageRole role;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String content;

  /** Whether the message has been embedded and indexed for semantic search. */
  @Builder.Default private boolean embedded = false;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }

  public boolean isFromUser() {
    return role == MessageRole.USER;
  }
}
