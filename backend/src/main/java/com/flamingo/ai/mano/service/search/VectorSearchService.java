package com.flamingo.ai.mano.service.search;

import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.enums.MessageRole;
import com.flamingo.ai.mano.elasticsearch.MessageEmbeddingDocument;
import com.flamingo.ai.mano.elasticsearch.MessageEmbeddingIndexService;
import com.flamingo.ai.mano.exception.SearchException;
import com.flamingo.ai.mano.service.context.model.VectorSearchResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embedding plus similarity search over past messages. Every method degrades to an empty result
 * when the embedding model or the index is unavailable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorSearchService {

  private final EmbeddingService embeddingService;
  private final MessageEmbeddingIndexService indexService;
  private final MeterRegistry meterRegistry;

  public List<Float> embed(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    try {
      return embeddingService.embedText(text);
    } catch (RuntimeException e) {
      log.warn("Embedding unavailable: {}", e.getMessage());
      meterRegistry.counter("vector_search.failures", "stage", "embed").increment();
      return List.of();
    }
  }

  /**
   * Returns messages similar to {@code vector}, most similar first.
   *
   * @param personId restricts results to one person's conversations when not null
   */
  public List<VectorSearchResult> similaritySearch(
      String userId, List<Float> vector, UUID personId, double threshold, int limit) {
    if (vector == null || vector.isEmpty()) {
      return List.of();
    }
    try {
      return indexService.vectorSearch(userId, personId, vector, threshold, limit).stream()
          .map(this::toResult)
          .filter(r -> r.id() != null && r.similarity() >= threshold)
          .sorted(Comparator.comparingDouble(VectorSearchResult::similarity).reversed())
          .limit(limit)
          .toList();
    } catch (RuntimeException e) {
      log.warn("Vector search unavailable: {}", e.getMessage());
      meterRegistry.counter("vector_search.failures", "stage", "search").increment();
      return List.of();
    }
  }

  public List<VectorSearchResult> search(
      String userId, String text, UUID personId, double threshold, int limit) {
    return similaritySearch(userId, embed(text), personId, threshold, limit);
  }

  /**
   * Embeds and indexes messages.
   *
   * @return ids of the messages that were indexed
   * @throws SearchException when the batch could not be embedded or indexed
   */
  public List<UUID> index(List<ChatMessage> messages) {
    if (messages.isEmpty()) {
      return List.of();
    }
    List<List<Float>> vectors =
        embeddingService.embedTexts(messages.stream().map(ChatMessage::getContent).toList());
    if (vectors.size() != messages.size()) {
      throw new SearchException(
          "Got " + vectors.size() + " embeddings for " + messages.size() + " messages");
    }

    List<MessageEmbeddingDocument> documents = new ArrayList<>(messages.size());
    for (int i = 0; i < messages.size(); i++) {
      ChatMessage message = messages.get(i);
      documents.add(
          MessageEmbeddingDocument.builder()
              .id(message.getId().toString())
              .userId(message.getUserId())
              .personId(message.getPersonId() != null ? message.getPersonId().toString() : null)
              .topicId(message.getTopicId() != null ? message.getTopicId().toString() : null)
              .role(message.getRole().name())
              .content(message.getContent())
              .createdAt(toEpochMillis(message.getCreatedAt()))
              .embedding(vectors.get(i))
              .build());
    }
    int indexed = indexService.indexMessages(documents);
    if (indexed != documents.size()) {
      throw new SearchException("Indexed " + indexed + " of " + documents.size() + " messages");
    }
    return messages.stream().map(ChatMessage::getId).toList();
  }

  private VectorSearchResult toResult(MessageEmbeddingDocument document) {
    Map<String, Object> metadata = new HashMap<>();
    if (document.getTopicId() != null) {
      metadata.put("topicId", document.getTopicId());
    }
    return VectorSearchResult.builder()
        .id(parseUuid(document.getId()))
        .content(document.getContent() != null ? document.getContent() : "")
        .personId(parseUuid(document.getPersonId()))
        .messageType(parseRole(document.getRole()))
        .createdAt(
            document.getCreatedAt() != null
                ? LocalDateTime.ofInstant(
                    Instant.ofEpochMilli(document.getCreatedAt()), ZoneId.systemDefault())
                : null)
        .similarity(document.getSimilarity())
        .metadata(metadata)
        .build();
  }

  private long toEpochMillis(LocalDateTime createdAt) {
    if (createdAt == null) {
      return System.currentTimeMillis();
    }
    return createdAt.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
  }

  private UUID parseUuid(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException e) {
      log.debug("Ignoring malformed id in search hit: {}", value);
      return null;
    }
  }

  private MessageRole parseRole(String value) {
    return "ASSISTANT".equalsIgnoreCase(value) ? MessageRole.ASSISTANT : MessageRole.USER;
  }
}
