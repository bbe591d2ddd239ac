package com.flamingo.ai.mano.service.context;

import com.flamingo.ai.mano.cache.CacheKeys;
import com.flamingo.ai.mano.cache.ContextCache;
import com.flamingo.ai.mano.config.EngineConfig;
import com.flamingo.ai.mano.service.context.model.ConversationPatterns;
import com.flamingo.ai.mano.service.context.model.ConversationTarget;
import com.flamingo.ai.mano.service.context.model.ConversationTheme;
import com.flamingo.ai.mano.service.context.model.ManagementContext;
import com.flamingo.ai.mano.service.context.model.PersonSummary;
import com.flamingo.ai.mano.service.context.model.SemanticContext;
import com.flamingo.ai.mano.service.insight.ProactiveInsightService;
import com.flamingo.ai.mano.service.search.SemanticMemorySearchService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Builds the per-turn {@link ManagementContext}.
 *
 * <p>The roster, theme, challenge and discussion-pattern reads and the semantic search run
 * concurrently. A branch that fails or exceeds its deadline contributes an empty value; building
 * the context never fails.
 */
@Service
@Slf4j
public class ManagementContextService {

  private final TeamThemeAggregator aggregator;
  private final SemanticMemorySearchService semanticSearchService;
  private final ProactiveInsightService proactiveInsightService;
  private final ContextCache contextCache;
  private final EngineConfig engineConfig;
  private final Executor contextExecutor;
  private final MeterRegistry meterRegistry;

  public ManagementContextService(
      TeamThemeAggregator aggregator,
      SemanticMemorySearchService semanticSearchService,
      ProactiveInsightService proactiveInsightService,
      ContextCache contextCache,
      EngineConfig engineConfig,
      @Qualifier("contextExecutor") Executor contextExecutor,
      MeterRegistry meterRegistry) {
    this.aggregator = aggregator;
    this.semanticSearchService = semanticSearchService;
    this.proactiveInsightService = proactiveInsightService;
    this.contextCache = contextCache;
    this.engineConfig = engineConfig;
    this.contextExecutor = contextExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Builds the context for one turn.
   *
   * @param userId the manager
   * @param target who or what the conversation is about
   * @param query the current message; semantic search runs only for long enough queries
   */
  @Timed(value = "context.build", description = "Time to build management context")
  public ManagementContext buildContext(String userId, ConversationTarget target, String query) {
    if (userId == null || userId.isBlank()) {
      log.warn("buildContext called without user id, returning empty context");
      return ManagementContext.empty();
    }
    ConversationTarget effectiveTarget = target != null ? target : ConversationTarget.general();
    Duration timeout = engineConfig.getAggregation().getBranchTimeout();

    CompletableFuture<List<PersonSummary>> people =
        branch("people", () -> aggregator.loadPeople(userId), List.of(), timeout);
    CompletableFuture<List<ConversationTheme>> themes =
        branch("themes", () -> aggregator.loadThemes(userId), List.of(), timeout);
    CompletableFuture<List<String>> challenges =
        branch("challenges", () -> aggregator.loadChallenges(userId), List.of(), timeout);
    CompletableFuture<ConversationPatterns> patterns =
        branch(
            "patterns",
            () -> aggregator.loadConversationPatterns(userId),
            ConversationPatterns.EMPTY,
            timeout);
    CompletableFuture<SemanticContext> semantic =
        semanticSearchService.isSearchable(query)
            ? branch(
                "semantic",
                () -> searchCached(userId, query, effectiveTarget),
                null,
                engineConfig.getAggregation().getSemanticTimeout())
            : CompletableFuture.completedFuture(null);

    CompletableFuture.allOf(people, themes, challenges, patterns, semantic).join();

    List<PersonSummary> roster = people.join();
    return ManagementContext.builder()
        .people(roster)
        .teamSize(aggregator.teamSize(roster))
        .recentThemes(themes.join())
        .currentChallenges(challenges.join())
        .conversationPatterns(patterns.join())
        .semanticContext(semantic.join())
        .build();
  }

  /** Builds the context and attaches proactive insights. */
  public ManagementContext buildContextWithInsights(
      String userId, ConversationTarget target, String query) {
    ManagementContext context = buildContext(userId, target, query);
    if (userId == null || userId.isBlank()) {
      return context;
    }
    try {
      return context.toBuilder()
          .proactiveInsights(proactiveInsightService.generate(userId, context))
          .build();
    } catch (RuntimeException e) {
      log.warn("Proactive insights unavailable for user {}: {}", userId, e.getMessage());
      return context.toBuilder().proactiveInsights(List.of()).build();
    }
  }

  private SemanticContext searchCached(String userId, String query, ConversationTarget target) {
    return contextCache.getOrCompute(
        CacheKeys.semantic(userId, query, target.scopePersonId()),
        engineConfig.getCache().getSemanticTtl(),
        () -> semanticSearchService.search(userId, query, target.scopePersonId()));
  }

  private <T> CompletableFuture<T> branch(
      String name, Supplier<T> supplier, T fallback, Duration timeout) {
    return CompletableFuture.supplyAsync(supplier, contextExecutor)
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(
            error -> {
              log.warn("Context branch '{}' degraded to empty: {}", name, error.toString());
              meterRegistry.counter("context.branch.fallback", "branch", name).increment();
              return fallback;
            });
  }
}
