package com.flamingo.ai.mano.agent.dto;

import java.util.List;

/** Structured output of PatternInsightAgent. */
public record PatternInsightResult(
    String insight, List<String> actionableSuggestions, String priority, Double relevanceScore) {}
