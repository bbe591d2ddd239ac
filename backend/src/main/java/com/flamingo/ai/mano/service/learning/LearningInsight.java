package com.flamingo.ai.mano.service.learning;

import com.flamingo.ai.mano.domain.enums.PatternType;
import com.flamingo.ai.mano.domain.enums.Priority;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/** Advice derived from a recurring pattern. */
public record LearningInsight(
    UUID patternId,
    PatternType patternType,
    String insight,
    List<String> actionableSuggestions,
    Priority priority,
    double relevanceScore,
    int frequency,
    List<String> peopleInvolved,
    LocalDateTime lastOccurrence) {}
