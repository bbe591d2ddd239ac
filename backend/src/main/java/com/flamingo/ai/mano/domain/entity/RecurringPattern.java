package com.flamingo.ai.mano.domain.entity;

import com.flamingo.ai.mano.domain.converter.StringListConverter;
import com.flamingo.ai.mano.domain.enums.PatternType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A recurring challenge, topic, relationship or communication pattern mined from conversations.
 * Similar detections are merged into an existing row instead of creating a new one.
 */
@Entity
@Table(name = "recurring_patterns")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecurringPattern {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Enumerated(EnumType.STRING)
  @Column(name = "pattern_type", nullable = false)
  private PatternType patternType;

  @Column(name = "pattern_description", columnDefinition = "TEXT", nullable = false)
  private String patternDescription;

  @Builder.Default private int frequency = 1;

  @Column(name = "last_occurrence", nullable = false)
  private LocalDateTime lastOccurrence;

  @Convert(converter = StringListConverter.class)
  @Column(name = "people_involved", columnDefinition = "TEXT")
  @Builder.Default
  private List<String> peopleInvolved = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(name = "context_keywords", columnDefinition = "TEXT")
  @Builder.Default
  private List<String> contextKeywords = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(name = "suggested_actions", columnDefinition = "TEXT")
  @Builder.Default
  private List<String> suggestedActions = new ArrayList<>();

  @Column(name = "confidence_score")
  @Builder.Default
  private double confidenceScore = 0.5;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at")
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    if (createdAt == null) {
      createdAt = now;
    }
    if (lastOccurrence == null) {
      lastOccurrence = now;
    }
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /**
   * Records another occurrence of this pattern: bumps frequency and recency, raises confidence by
   * {@code confidenceIncrement} (capped at 1.0) and adds any newly involved people.
   */
  public void recordOccurrence(
      LocalDateTime occurredAt, double confidenceIncrement, List<String> additionalPeople) {
    this.frequency++;
    this.lastOccurrence = occurredAt;
    this.confidenceScore = Math.min(1.0, confidenceScore + confidenceIncrement);
    if (additionalPeople != null && !additionalPeople.isEmpty()) {
      Set<String> merged = new LinkedHashSet<>(peopleInvolved != null ? peopleInvolved : List.of());
      merged.addAll(additionalPeople);
      this.peopleInvolved = new ArrayList<>(merged);
    }
  }

  public boolean involves(String personId) {
    return peopleInvolved != null && peopleInvolved.contains(personId);
  }
}
