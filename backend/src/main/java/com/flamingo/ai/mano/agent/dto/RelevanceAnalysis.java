package com.flamingo.ai.mano.agent.dto;

import java.util.List;

/** Structured output of RelevanceAnalysisAgent. */
public record RelevanceAnalysis(
    Double relevanceScore,
    String contextMatch,
    String relationshipToQuery,
    List<String> actionableInsights) {}
