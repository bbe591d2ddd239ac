package com.flamingo.ai.mano.service.detection;

import com.flamingo.ai.mano.domain.enums.RelationshipType;

/**
 * A person mentioned in a message who is not on the roster yet.
 *
 * @param name capitalised candidate name
 * @param role role text when the message states one, otherwise null
 * @param relationshipHint relationship implied by the phrasing, otherwise null
 * @param confidence detection confidence in [0, 1]
 * @param context the phrase the name was found in
 * @param aiScore model plausibility score (1-10), null when the model was not consulted
 */
public record DetectedPerson(
    String name,
    String role,
    RelationshipType relationshipHint,
    double confidence,
    String context,
    Integer aiScore) {

  public DetectedPerson withConfidence(double value) {
    return new DetectedPerson(name, role, relationshipHint, value, context, aiScore);
  }

  public DetectedPerson withAiScore(int score, double value) {
    return new DetectedPerson(name, role, relationshipHint, value, context, score);
  }

  /** Keeps the stronger candidate, filling in role and relationship from the weaker one. */
  DetectedPerson mergeWith(DetectedPerson other) {
    DetectedPerson stronger = other.confidence > confidence ? other : this;
    DetectedPerson weaker = stronger == this ? other : this;
    return new DetectedPerson(
        stronger.name,
        stronger.role != null ? stronger.role : weaker.role,
        stronger.relationshipHint != null ? stronger.relationshipHint : weaker.relationshipHint,
        stronger.confidence,
        stronger.context,
        stronger.aiScore);
  }
}
