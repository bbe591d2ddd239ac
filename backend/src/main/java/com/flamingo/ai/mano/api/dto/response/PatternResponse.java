package com.flamingo.ai.mano.api.dto.response;

import com.flamingo.ai.mano.domain.entity.RecurringPattern;
import com.flamingo.ai.mano.domain.enums.PatternType;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a recurring pattern. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternResponse {

  private UUID id;
  private PatternType patternType;
  private String description;
  private int frequency;
  private double confidenceScore;
  private List<String> peopleInvolved;
  private List<String> contextKeywords;
  private List<String> suggestedActions;
  private LocalDateTime lastOccurrence;

  public static PatternResponse fromEntity(RecurringPattern pattern) {
    return PatternResponse.builder()
        .id(pattern.getId())
        .patternType(pattern.getPatternType())
        .description(pattern.getPatternDescription())
        .frequency(pattern.getFrequency())
        .confidenceScore(pattern.getConfidenceScore())
        .peopleInvolved(List.copyOf(pattern.getPeopleInvolved()))
        .contextKeywords(List.copyOf(pattern.getContextKeywords()))
        .suggestedActions(List.copyOf(pattern.getSuggestedActions()))
        .lastOccurrence(pattern.getLastOccurrence())
        .build();
  }
}
