package com.flamingo.ai.mano.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A conversation message stored in Elasticsearch together with its embedding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEmbeddingDocument {

  /** Message ID (from the ChatMessage entity). */
  private String id;

  private String userId;

  /** Person the conversation is about, null for topic conversations. */
  private String personId;

  private String topicId;

  /** USER or ASSISTANT. */
  private String role;

  private String content;

  private List<Float> embedding;

  /** Creation time in epoch milliseconds. */
  private Long createdAt;

  /** Cosine similarity to the query, set by searches. */
  @Builder.Default private double similarity = 0.0;
}
