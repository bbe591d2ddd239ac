package com.flamingo.ai.mano.agent.dto;

import java.util.List;

/** Structured output of FollowUpAgent. */
public record FollowUpResult(
    Boolean needsFollowup,
    String title,
    String description,
    List<String> steps,
    String context,
    String urgency,
    Double relevance) {}
