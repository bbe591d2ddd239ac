package com.flamingo.ai.mano.agent.dto;

import java.util.List;

/** Structured output of ConversationStarterAgent. */
public record ConversationStarterResult(
    String title,
    String description,
    List<String> suggestedQuestions,
    String priority,
    Double relevance) {}
