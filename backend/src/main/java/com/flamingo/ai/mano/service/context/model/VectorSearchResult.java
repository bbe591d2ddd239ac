package com.flamingo.ai.mano.service.context.model;

import com.flamingo.ai.mano.domain.enums.MessageRole;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;

/** A past message returned by similarity search, with a similarity in [0, 1]. */
@Builder(toBuilder = true)
public record VectorSearchResult(
    UUID id,
    String content,
    UUID personId,
    MessageRole messageType,
    LocalDateTime createdAt,
    double similarity,
    Map<String, Object> metadata) {

  public VectorSearchResult {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public VectorSearchResult withSimilarity(double value) {
    return toBuilder().similarity(value).build();
  }
}
