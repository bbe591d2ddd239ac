package com.flamingo.ai.mano.service.learning;

import com.flamingo.ai.mano.agent.AgentInvoker;
import com.flamingo.ai.mano.agent.AgentResult;
import com.flamingo.ai.mano.agent.ConversationAnalysisAgent;
import com.flamingo.ai.mano.agent.PatternInsightAgent;
import com.flamingo.ai.mano.agent.dto.ConversationAnalysis;
import com.flamingo.ai.mano.agent.dto.PatternInsightResult;
import com.flamingo.ai.mano.config.EngineConfig;
import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.entity.RecurringPattern;
import com.flamingo.ai.mano.domain.enums.PatternType;
import com.flamingo.ai.mano.domain.enums.Priority;
import com.flamingo.ai.mano.domain.repository.RecurringPatternRepository;
import com.flamingo.ai.mano.service.context.model.ConversationTarget;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Learns recurring patterns from finished conversations and turns the frequent ones into advice.
 *
 * <p>A pattern similar enough to an existing pattern of the same kind is merged into it, so the
 * same challenge seen twice becomes one row with frequency 2.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LearningService {

  private static final List<String> DEFAULT_SUGGESTIONS =
      List.of(
          "Reflect on what tends to trigger this pattern",
          "Raise it in your next 1:1 and agree on one concrete change");

  private final RecurringPatternRepository patternRepository;
  private final ConversationAnalysisAgent conversationAnalysisAgent;
  private final PatternInsightAgent patternInsightAgent;
  private final AgentInvoker agentInvoker;
  private final EngineConfig engineConfig;
  private final MeterRegistry meterRegistry;
  private final TransactionOperations transactionOperations;

  /**
   * Extracts patterns from a conversation and stores or merges them.
   *
   * @param userId the manager
   * @param history the conversation, oldest first
   * @param scopePersonId the person the conversation is about, or null
   * @param target the conversation target, used to name the subject
   * @return the stored or merged patterns
   */
  public List<RecurringPattern> recordFromConversation(
      String userId, List<ChatMessage> history, UUID scopePersonId, ConversationTarget target) {
    EngineConfig.Learning config = engineConfig.getLearning();
    if (history == null || history.size() < config.getMinHistorySize()) {
      log.debug("Skipping pattern learning for user {}: conversation too short", userId);
      return List.of();
    }
    String subject = subjectOf(target);
    AgentResult<ConversationAnalysis> result =
        agentInvoker.invoke(
            "conversation-analysis",
            () -> conversationAnalysisAgent.analyse(subject, transcript(history)));
    if (result.value().isEmpty()) {
      return List.of();
    }

    boolean general = target == null || target.isGeneral() || scopePersonId == null;
    List<String> people = general ? List.of() : List.of(scopePersonId.toString());
    List<RecurringPattern> stored = new ArrayList<>();
    for (PatternCandidate candidate : candidates(result.value().get(), people)) {
      stored.add(storeRecurringPattern(userId, candidate));
    }
    log.debug("Recorded {} patterns for user {}", stored.size(), userId);
    return stored;
  }

  /** Builds challenge, relationship and communication candidates from an analysis. */
  List<PatternCandidate> candidates(ConversationAnalysis analysis, List<String> people) {
    int minLength = engineConfig.getLearning().getMinDescriptionLength();
    List<String> themes = analysis.themesOrEmpty();
    List<String> suggestions = analysis.learningOpportunitiesOrEmpty();
    List<String> challengeKeywords =
        Stream.concat(themes.stream(), analysis.communicationPatternsOrEmpty().stream()).toList();

    List<PatternCandidate> candidates = new ArrayList<>();
    for (String challenge : analysis.challengesOrEmpty()) {
      if (isDescriptive(challenge, minLength)) {
        candidates.add(
            new PatternCandidate(
                PatternType.CHALLENGE,
                challenge.trim(),
                challengeKeywords,
                0.7,
                people,
                suggestions));
      }
    }
    for (String relationship : analysis.relationshipsOrEmpty()) {
      if (isDescriptive(relationship, minLength)) {
        candidates.add(
            new PatternCandidate(
                PatternType.RELATIONSHIP, relationship.trim(), themes, 0.6, people, suggestions));
      }
    }
    for (String communication : analysis.communicationPatternsOrEmpty()) {
      if (isDescriptive(communication, minLength)) {
        candidates.add(
            new PatternCandidate(
                PatternType.COMMUNICATION,
                communication.trim(),
                themes,
                0.5,
                people,
                suggestions));
      }
    }
    return candidates;
  }

  /**
   * Merges the candidate into a similar pattern of the same kind, or inserts a new one. The lookup
   * and the write run in one transaction.
   */
  public RecurringPattern storeRecurringPattern(String userId, PatternCandidate candidate) {
    return transactionOperations.execute(status -> mergeOrInsert(userId, candidate));
  }

  private RecurringPattern mergeOrInsert(String userId, PatternCandidate candidate) {
    EngineConfig.Learning config = engineConfig.getLearning();
    Optional<RecurringPattern> similar = findSimilarPattern(userId, candidate);
    if (similar.isPresent()) {
      RecurringPattern existing = similar.get();
      existing.recordOccurrence(
          LocalDateTime.now(), config.getConfidenceIncrement(), candidate.people());
      meterRegistry.counter("learning.patterns", "outcome", "merged").increment();
      log.debug(
          "Merged {} pattern {} (frequency {})",
          candidate.type(),
          existing.getId(),
          existing.getFrequency());
      return patternRepository.save(existing);
    }

    RecurringPattern pattern =
        RecurringPattern.builder()
            .userId(userId)
            .patternType(candidate.type())
            .patternDescription(candidate.description())
            .frequency(1)
            .lastOccurrence(LocalDateTime.now())
            .peopleInvolved(new ArrayList<>(candidate.people()))
            .contextKeywords(new ArrayList<>(candidate.keywords()))
            .suggestedActions(new ArrayList<>(candidate.suggestedActions()))
            .confidenceScore(candidate.confidence())
            .build();
    meterRegistry.counter("learning.patterns", "outcome", "created").increment();
    return patternRepository.save(pattern);
  }

  /** The most similar existing pattern of the same kind above the merge threshold. */
  Optional<RecurringPattern> findSimilarPattern(String userId, PatternCandidate candidate) {
    double threshold = engineConfig.getLearning().getMergeThreshold();
    RecurringPattern best = null;
    double bestScore = threshold;
    for (RecurringPattern existing :
        patternRepository.findByUserIdAndPatternType(userId, candidate.type())) {
      double score = similarity(existing, candidate);
      if (score > bestScore) {
        best = existing;
        bestScore = score;
      }
    }
    return Optional.ofNullable(best);
  }

  private double similarity(RecurringPattern existing, PatternCandidate candidate) {
    if (existing.getPatternDescription() != null
        && existing.getPatternDescription().equalsIgnoreCase(candidate.description())) {
      return 1.0;
    }
    return keywordSimilarity(existing.getContextKeywords(), candidate.keywords());
  }

  /** Overlap of two keyword sets relative to the larger set, case-insensitive. */
  static double keywordSimilarity(List<String> first, List<String> second) {
    Set<String> a = normalize(first);
    Set<String> b = normalize(second);
    int larger = Math.max(a.size(), b.size());
    if (larger == 0) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    return (double) intersection.size() / larger;
  }

  /**
   * Advice for frequent patterns, most relevant first.
   *
   * @param personId restricts to patterns involving this person when not null
   */
  public List<LearningInsight> getInsights(String userId, UUID personId) {
    EngineConfig.Learning config = engineConfig.getLearning();
    List<RecurringPattern> patterns =
        patternRepository.findByUserIdAndFrequencyGreaterThanEqualOrderByLastOccurrenceDesc(
            userId, config.getMinFrequencyForInsights(), Pageable.unpaged());
    return patterns.stream()
        .filter(pattern -> personId == null || pattern.involves(personId.toString()))
        .limit(config.getInsightPatternLimit())
        .map(this::toInsight)
        .sorted(Comparator.comparingDouble(LearningInsight::relevanceScore).reversed())
        .toList();
  }

  /** Patterns involving a person, most recent first. */
  public List<RecurringPattern> getPersonPatterns(String userId, UUID personId) {
    return patternRepository.findByUserIdInvolvingPerson(userId, personId);
  }

  /** All patterns of a user, most recent first. */
  public List<RecurringPattern> getPatterns(String userId) {
    return patternRepository.findByUserIdOrderByLastOccurrenceDesc(userId);
  }

  private LearningInsight toInsight(RecurringPattern pattern) {
    AgentResult<PatternInsightResult> result =
        agentInvoker.invoke(
            "pattern-insight",
            () ->
                patternInsightAgent.explain(
                    label(pattern.getPatternType()),
                    pattern.getPatternDescription(),
                    pattern.getFrequency(),
                    String.format(Locale.ROOT, "%.2f", pattern.getConfidenceScore()),
                    String.join(", ", pattern.getContextKeywords())),
            value -> value.insight() != null && !value.insight().isBlank());
    return result
        .value()
        .map(value -> fromAgent(pattern, value))
        .orElseGet(() -> templateInsight(pattern));
  }

  private LearningInsight fromAgent(RecurringPattern pattern, PatternInsightResult value) {
    List<String> suggestions =
        value.actionableSuggestions() != null && !value.actionableSuggestions().isEmpty()
            ? value.actionableSuggestions().stream().limit(3).toList()
            : fallbackSuggestions(pattern);
    double relevance = value.relevanceScore() != null ? clamp(value.relevanceScore()) : 0.5;
    return new LearningInsight(
        pattern.getId(),
        pattern.getPatternType(),
        value.insight().trim(),
        suggestions,
        Priority.fromValue(value.priority(), Priority.MEDIUM),
        relevance,
        pattern.getFrequency(),
        List.copyOf(pattern.getPeopleInvolved()),
        pattern.getLastOccurrence());
  }

  private LearningInsight templateInsight(RecurringPattern pattern) {
    String insight =
        String.format(
            Locale.ROOT,
            "Recurring %s: %s (seen %d times)",
            label(pattern.getPatternType()),
            pattern.getPatternDescription(),
            pattern.getFrequency());
    return new LearningInsight(
        pattern.getId(),
        pattern.getPatternType(),
        insight,
        fallbackSuggestions(pattern),
        Priority.MEDIUM,
        clamp(pattern.getConfidenceScore()),
        pattern.getFrequency(),
        List.copyOf(pattern.getPeopleInvolved()),
        pattern.getLastOccurrence());
  }

  private List<String> fallbackSuggestions(RecurringPattern pattern) {
    List<String> actions = pattern.getSuggestedActions();
    return actions != null && !actions.isEmpty()
        ? actions.stream().limit(3).toList()
        : DEFAULT_SUGGESTIONS;
  }

  private static String subjectOf(ConversationTarget target) {
    if (target == null || target.name() == null) {
      return "general management";
    }
    return switch (target.type()) {
      case SELF -> "the manager's own growth";
      case PERSON, GENERAL -> target.name();
    };
  }

  private static String transcript(List<ChatMessage> history) {
    return history.stream()
        .map(message -> (message.isFromUser() ? "Manager: " : "Mano: ") + message.getContent())
        .collect(Collectors.joining("\n"));
  }

  private static boolean isDescriptive(String text, int minLength) {
    return text != null && text.trim().length() > minLength;
  }

  private static Set<String> normalize(List<String> keywords) {
    Set<String> result = new HashSet<>();
    if (keywords != null) {
      for (String keyword : keywords) {
        if (keyword != null && !keyword.isBlank()) {
          result.add(keyword.trim().toLowerCase(Locale.ROOT));
        }
      }
    }
    return result;
  }

  private static String label(PatternType type) {
    return type.name().toLowerCase(Locale.ROOT);
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
