package com.flamingo.ai.mano.service.context.model;

import com.flamingo.ai.mano.domain.enums.RelationshipType;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.Builder;

/** Roster entry as seen by the context engine. {@code lastContact} is null without messages. */
@Builder
public record PersonSummary(
    UUID id,
    String name,
    String role,
    RelationshipType relationshipType,
    LocalDateTime lastContact,
    List<String> recentThemes) {

  public PersonSummary {
    recentThemes = recentThemes == null ? List.of() : List.copyOf(recentThemes);
  }
}
