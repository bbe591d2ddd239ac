package com.flamingo.ai.mano.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index of embedded conversation messages.
 *
 * <p>Searches use kNN over a cosine dense_vector field. Elasticsearch reports cosine scores as
 * {@code (1 + cos) / 2}; results are converted back to cosine similarity before they are returned.
 */
@Service
@Slf4j
public class MessageEmbeddingIndexService {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;

  @Value("${app.elasticsearch.message-index-name:mano-message-embeddings}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  public MessageEmbeddingIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn("Elasticsearch client not available, skipping message index initialization");
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch message index: {}", indexName);
      }
    } catch (Exception e) {
      // Semantic search degrades to empty results until the index is reachable.
      log.warn("Could not check/create Elasticsearch message index: {}", e.getMessage());
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("userId", Property.of(p -> p.keyword(k -> k)));
    properties.put("personId", Property.of(p -> p.keyword(k -> k)));
    properties.put("topicId", Property.of(p -> p.keyword(k -> k)));
    properties.put("role", Property.of(p -> p.keyword(k -> k)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("createdAt", Property.of(p -> p.long_(l -> l)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d -> d.dims(vectorDimensions).index(true).similarity(DenseVectorSimilarity.Cosine)))));

    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(indexName)
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /** Bulk indexes embedded messages. */
  @Timed(value = "message_embedding.index", description = "Time to index message embeddings")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "indexMessagesFallback")
  public int indexMessages(List<MessageEmbeddingDocument> documents) {
    if (documents.isEmpty()) {
      return 0;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (MessageEmbeddingDocument document : documents) {
        bulkBuilder.operations(
            op ->
                op.index(
                    idx -> idx.index(indexName).id(document.getId()).document(toSource(document))));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      long failed = response.items().stream().filter(item -> item.error() != null).count();
      if (failed > 0) {
        log.warn("{} of {} message embeddings failed to index", failed, documents.size());
      }
      int indexed = documents.size() - (int) failed;
      meterRegistry.counter("message_embedding.indexed").increment(indexed);
      return indexed;
    } catch (IOException e) {
      throw new IllegalStateException("Failed to index message embeddings", e);
    }
  }

  @SuppressWarnings("unused")
  private int indexMessagesFallback(List<MessageEmbeddingDocument> documents, Throwable t) {
    log.warn("Message embedding indexing fallback triggered: {}", t.getMessage());
    meterRegistry.counter("message_embedding.index.fallback").increment();
    return 0;
  }

  /**
   * Finds messages of a user whose embeddings are closest to {@code queryEmbedding}.
   *
   * @param userId owner of the messages
   * @param personId restricts the search to one person's conversations when not null
   * @param queryEmbedding the query vector
   * @param minSimilarity minimum cosine similarity of returned hits
   * @param limit maximum number of hits
   */
  @Timed(value = "message_embedding.vector_search", description = "Time to search embeddings")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  @SuppressWarnings({"rawtypes", "unchecked"})
  public List<MessageEmbeddingDocument> vectorSearch(
      String userId, UUID personId, List<Float> queryEmbedding, double minSimilarity, int limit) {
    List<Query> filters = new ArrayList<>();
    filters.add(Query.of(q -> q.term(t -> t.field("userId").value(userId))));
    if (personId != null) {
      filters.add(Query.of(q -> q.term(t -> t.field("personId").value(personId.toString()))));
    }

    SearchRequest searchRequest =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field("embedding")
                                .queryVector(queryEmbedding)
                                .k(limit)
                                .numCandidates(Math.max(limit * 2, 50))
                                .similarity((float) minSimilarity)
                                .filter(f -> f.bool(b -> b.filter(filters))))
                    .size(limit));

    try {
      SearchResponse<Map> response = elasticsearchClient.search(searchRequest, Map.class);
      List<MessageEmbeddingDocument> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        MessageEmbeddingDocument document = fromSource(hit.source());
        document.setId(hit.id());
        double score = hit.score() != null ? hit.score() : 0.0;
        document.setSimilarity(Math.max(0.0, Math.min(1.0, 2 * score - 1)));
        results.add(document);
      }
      meterRegistry.counter("message_embedding.vector_search").increment();
      return results;
    } catch (IOException e) {
      throw new IllegalStateException("Vector search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<MessageEmbeddingDocument> vectorSearchFallback(
      String userId,
      UUID personId,
      List<Float> queryEmbedding,
      double minSimilarity,
      int limit,
      Throwable t) {
    log.warn("Message vector search fallback triggered: {}", t.getMessage());
    meterRegistry.counter("message_embedding.vector_search.fallback").increment();
    return List.of();
  }

  private Map<String, Object> toSource(MessageEmbeddingDocument document) {
    Map<String, Object> source = new HashMap<>();
    source.put("userId", document.getUserId());
    source.put("personId", document.getPersonId());
    source.put("topicId", document.getTopicId());
    source.put("role", document.getRole());
    source.put("content", document.getContent());
    source.put("createdAt", document.getCreatedAt());
    source.put("embedding", document.getEmbedding());
    return source;
  }

  private MessageEmbeddingDocument fromSource(Map<String, Object> source) {
    Object createdAt = source.get("createdAt");
    return MessageEmbeddingDocument.builder()
        .userId((String) source.get("userId"))
        .personId((String) source.get("personId"))
        .topicId((String) source.get("topicId"))
        .role((String) source.get("role"))
        .content((String) source.get("content"))
        .createdAt(createdAt instanceof Number n ? n.longValue() : null)
        .build();
  }
}
