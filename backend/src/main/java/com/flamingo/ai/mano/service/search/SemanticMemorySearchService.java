package com.flamingo.ai.mano.service.search;

import com.flamingo.ai.mano.agent.AgentInvoker;
import com.flamingo.ai.mano.agent.AgentResult;
import com.flamingo.ai.mano.agent.QueryExpansionAgent;
import com.flamingo.ai.mano.agent.RelevanceAnalysisAgent;
import com.flamingo.ai.mano.agent.SemanticPatternAgent;
import com.flamingo.ai.mano.agent.dto.RelevanceAnalysis;
import com.flamingo.ai.mano.agent.dto.SemanticPatternsResult;
import com.flamingo.ai.mano.config.EngineConfig;
import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.enums.ManagementIntent;
import com.flamingo.ai.mano.domain.enums.SemanticPatternType;
import com.flamingo.ai.mano.domain.enums.TrendDirection;
import com.flamingo.ai.mano.domain.repository.ChatMessageRepository;
import com.flamingo.ai.mano.service.context.model.EnhancedSearchResult;
import com.flamingo.ai.mano.service.context.model.SemanticContext;
import com.flamingo.ai.mano.service.context.model.SemanticPattern;
import com.flamingo.ai.mano.service.context.model.VectorSearchResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

/**
 * Finds past conversations related to the current question.
 *
 * <p>Pipeline: optional query expansion, vector similarity search, per-hit relevance analysis,
 * same-person messages around each top hit, and cross-conversation pattern detection. Each model
 * step falls back locally, so a failing model still yields the raw vector search output.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticMemorySearchService {

  static final String PERSON_HINTS = "management, leadership, team dynamics";
  static final String TEAM_HINTS =
      "team collaboration, similar challenges, role matching, people search";
  static final String BASIC_MATCH = "Basic similarity match";
  static final String RELATED_CONVERSATION = "Related conversation";

  private static final int SNIPPET_LENGTH = 200;
  private static final DateTimeFormatter SNIPPET_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

  private final VectorSearchService vectorSearchService;
  private final ChatMessageRepository chatMessageRepository;
  private final QueryExpansionAgent queryExpansionAgent;
  private final RelevanceAnalysisAgent relevanceAnalysisAgent;
  private final SemanticPatternAgent semanticPatternAgent;
  private final AgentInvoker agentInvoker;
  private final EngineConfig engineConfig;
  private final MeterRegistry meterRegistry;

  /** Whether {@code query} is long enough to be worth a semantic search. */
  public boolean isSearchable(String query) {
    return query != null && query.trim().length() > engineConfig.getSearch().getMinQueryLength();
  }

  /**
   * Builds the semantic part of a management context.
   *
   * @param scopePersonId person the conversation is about, or null for topic conversations
   * @return the semantic context, or null when the query is too short to search
   */
  @Timed(value = "semantic_search.context", description = "Time to build semantic context")
  public SemanticContext search(String userId, String query, UUID scopePersonId) {
    if (!isSearchable(query)) {
      log.debug("Query too short for semantic search, skipping");
      return null;
    }
    EngineConfig.Search config = engineConfig.getSearch();
    try {
      SearchScope scope =
          scopePersonId != null ? SearchScope.person(config) : SearchScope.team(config);
      List<EnhancedSearchResult> ranked = enhancedSearch(userId, query, scopePersonId, scope);
      List<SemanticPattern> patterns = detectPatterns(query, ranked);

      List<VectorSearchResult> similar =
          ranked.stream()
              .limit(config.getContextLimit())
              .map(r -> r.result().withSimilarity(r.relevanceScore()))
              .toList();

      List<VectorSearchResult> crossPerson = List.of();
      if (scopePersonId != null) {
        crossPerson =
            enhancedSearch(userId, query, null, SearchScope.team(config)).stream()
                .filter(r -> !scopePersonId.equals(r.result().personId()))
                .limit(config.getContextLimit())
                .map(r -> r.result().withSimilarity(r.relevanceScore()))
                .toList();
      }
      return new SemanticContext(similar, crossPerson, patterns);
    } catch (RuntimeException e) {
      log.warn("Enhanced semantic search failed, using basic vector search: {}", e.getMessage());
      meterRegistry.counter("semantic_search.fallback").increment();
      return basicSearch(userId, query, scopePersonId);
    }
  }

  /** Vector search only, without any model-assisted step. */
  public SemanticContext basicSearch(String userId, String query, UUID scopePersonId) {
    EngineConfig.Search config = engineConfig.getSearch();
    List<Float> vector = vectorSearchService.embed(query);
    List<VectorSearchResult> similar =
        vectorSearchService
            .similaritySearch(
                userId,
                vector,
                scopePersonId,
                config.getDefaultThreshold(),
                config.getDefaultLimit())
            .stream()
            .limit(config.getContextLimit())
            .toList();
    List<VectorSearchResult> crossPerson = List.of();
    if (scopePersonId != null) {
      crossPerson =
          vectorSearchService
              .similaritySearch(
                  userId, vector, null, config.getDefaultThreshold(), config.getDefaultLimit())
              .stream()
              .filter(r -> !scopePersonId.equals(r.personId()))
              .limit(config.getContextLimit())
              .toList();
    }
    return new SemanticContext(similar, crossPerson, List.of());
  }

  /**
   * Searches with vocabulary biased towards a management concern, e.g. coaching moments.
   *
   * @param scopePersonId optional person scope
   */
  public List<EnhancedSearchResult> searchWithManagementIntent(
      String userId, String query, ManagementIntent intent, UUID scopePersonId) {
    if (!isSearchable(query)) {
      return List.of();
    }
    EngineConfig.Search config = engineConfig.getSearch();
    SearchScope scope =
        new SearchScope(
            config.getDefaultThreshold(),
            config.getDefaultLimit(),
            String.join(", ", intent.getKeywords()));
    return enhancedSearch(userId, query, scopePersonId, scope);
  }

  List<EnhancedSearchResult> enhancedSearch(
      String userId, String query, UUID scopePersonId, SearchScope scope) {
    EngineConfig.Search config = engineConfig.getSearch();
    String searchQuery = expandQuery(query, scope.hints());

    List<VectorSearchResult> hits =
        vectorSearchService.search(
            userId, searchQuery, scopePersonId, scope.threshold(), scope.limit());
    if (hits.isEmpty()) {
      return List.of();
    }

    List<EnhancedSearchResult> ranked = new ArrayList<>(hits.size());
    for (VectorSearchResult hit : hits) {
      ranked.add(analyseRelevance(query, hit));
    }
    ranked.sort(Comparator.comparingDouble(EnhancedSearchResult::relevanceScore).reversed());

    List<EnhancedSearchResult> results = new ArrayList<>(ranked.size());
    for (int i = 0; i < ranked.size() && i < config.getResultLimit(); i++) {
      EnhancedSearchResult result = ranked.get(i);
      if (i < config.getConnectedTopResults()) {
        result = result.withConnectedConversations(findConnectedConversations(userId, result));
      }
      results.add(result);
    }
    return results;
  }

  String expandQuery(String query, String hints) {
    if (!engineConfig.getSearch().isQueryExpansionEnabled() || hints == null || hints.isBlank()) {
      return query;
    }
    AgentResult<String> result =
        agentInvoker.invoke(
            "query_expansion", () -> queryExpansionAgent.expand(query, hints), s -> !s.isBlank());
    return result.value().map(String::trim).orElse(query);
  }

  private EnhancedSearchResult analyseRelevance(String query, VectorSearchResult hit) {
    if (!engineConfig.getSearch().isAiRerankingEnabled()) {
      return basicResult(hit);
    }
    AgentResult<RelevanceAnalysis> result =
        agentInvoker.invoke(
            "relevance_analysis",
            () ->
                relevanceAnalysisAgent.analyse(
                    query, hit.content(), String.format("%.2f", hit.similarity())),
            a -> a.relevanceScore() != null && a.relevanceScore() >= 0 && a.relevanceScore() <= 1);

    return result
        .value()
        .map(
            analysis ->
                new EnhancedSearchResult(
                    hit,
                    analysis.relevanceScore(),
                    Objects.requireNonNullElse(analysis.contextMatch(), BASIC_MATCH),
                    Objects.requireNonNullElse(
                        analysis.relationshipToQuery(), RELATED_CONVERSATION),
                    analysis.actionableInsights(),
                    List.of()))
        .orElseGet(() -> basicResult(hit));
  }

  private EnhancedSearchResult basicResult(VectorSearchResult hit) {
    return new EnhancedSearchResult(
        hit, hit.similarity(), BASIC_MATCH, RELATED_CONVERSATION, List.of(), List.of());
  }

  private List<VectorSearchResult> findConnectedConversations(
      String userId, EnhancedSearchResult result) {
    VectorSearchResult hit = result.result();
    if (hit.personId() == null || hit.createdAt() == null) {
      return List.of();
    }
    EngineConfig.Search config = engineConfig.getSearch();
    try {
      List<ChatMessage> adjacent =
          chatMessageRepository.findAdjacentMessages(
              userId,
              hit.personId(),
              hit.id(),
              hit.createdAt().minusDays(config.getAdjacentDays()),
              hit.createdAt().plusDays(config.getAdjacentDays()),
              Pageable.ofSize(config.getConnectedLimit()));
      return adjacent.stream().map(this::toConnectedResult).toList();
    } catch (RuntimeException e) {
      log.warn("Could not load connected conversations for {}: {}", hit.id(), e.getMessage());
      return List.of();
    }
  }

  private VectorSearchResult toConnectedResult(ChatMessage message) {
    return VectorSearchResult.builder()
        .id(message.getId())
        .content(message.getContent())
        .personId(message.getPersonId())
        .messageType(message.getRole())
        .createdAt(message.getCreatedAt())
        .similarity(0.0)
        .build();
  }

  List<SemanticPattern> detectPatterns(String query, List<EnhancedSearchResult> ranked) {
    EngineConfig.Search config = engineConfig.getSearch();
    if (ranked.size() < config.getPatternMinResults()) {
      return List.of();
    }
    StringBuilder snippets = new StringBuilder();
    int index = 1;
    int snippetCount = Math.min(ranked.size(), config.getPatternSnippetLimit());
    for (EnhancedSearchResult result : ranked.subList(0, snippetCount)) {
      VectorSearchResult hit = result.result();
      snippets.append(index++).append(". ");
      if (hit.createdAt() != null) {
        snippets.append('[').append(hit.createdAt().format(SNIPPET_DATE)).append("] ");
      }
      snippets.append(truncate(hit.content(), SNIPPET_LENGTH)).append('\n');
    }

    AgentResult<SemanticPatternsResult> result =
        agentInvoker.invoke(
            "semantic_patterns",
            () -> semanticPatternAgent.detect(query, snippets.toString()),
            r -> r.patterns() != null);
    if (!result.isSuccess()) {
      return List.of();
    }

    List<UUID> supporting =
        ranked.stream()
            .limit(config.getPatternSupportLimit())
            .map(r -> r.result().id())
            .filter(Objects::nonNull)
            .toList();
    return result.value().orElseThrow().patterns().stream()
        .map(p -> toSemanticPattern(p, supporting))
        .flatMap(Optional::stream)
        .limit(2)
        .toList();
  }

  private Optional<SemanticPattern> toSemanticPattern(
      SemanticPatternsResult.DetectedPattern pattern, List<UUID> supporting) {
    if (pattern == null || pattern.description() == null || pattern.description().isBlank()) {
      return Optional.empty();
    }
    Optional<SemanticPatternType> type = SemanticPatternType.fromValue(pattern.type());
    if (type.isEmpty()) {
      return Optional.empty();
    }
    double confidence =
        pattern.confidence() != null ? Math.max(0.0, Math.min(1.0, pattern.confidence())) : 0.5;
    return Optional.of(
        new SemanticPattern(
            type.get(),
            pattern.description(),
            supporting,
            confidence,
            TrendDirection.fromValue(pattern.trend())));
  }

  private static String truncate(String text, int length) {
    if (text == null) {
      return "";
    }
    return text.length() > length ? text.substring(0, length) + "..." : text;
  }

  /** Threshold, result cap and expansion hints of one search. */
  record SearchScope(double threshold, int limit, String hints) {

    static SearchScope person(EngineConfig.Search config) {
      return new SearchScope(config.getPersonThreshold(), config.getPersonLimit(), PERSON_HINTS);
    }

    static SearchScope team(EngineConfig.Search config) {
      return new SearchScope(
          config.getCrossPersonThreshold(), config.getCrossPersonLimit(), TEAM_HINTS);
    }
  }
}
