package com.flamingo.ai.mano.service.learning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.mano.agent.AgentInvoker;
import com.flamingo.ai.mano.agent.ConversationAnalysisAgent;
import com.flamingo.ai.mano.agent.PatternInsightAgent;
import com.flamingo.ai.mano.agent.dto.ConversationAnalysis;
import com.flamingo.ai.mano.agent.dto.PatternInsightResult;
import com.flamingo.ai.mano.config.EngineConfig;
import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.entity.RecurringPattern;
import com.flamingo.ai.mano.domain.enums.ConversationType;
import com.flamingo.ai.mano.domain.enums.MessageRole;
import com.flamingo.ai.mano.domain.enums.PatternType;
import com.flamingo.ai.mano.domain.enums.Priority;
import com.flamingo.ai.mano.domain.repository.RecurringPatternRepository;
import com.flamingo.ai.mano.service.context.model.ConversationTarget;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LearningServiceTest {

  private static final String USER_ID = "user-1";

  @Mock private RecurringPatternRepository patternRepository;
  @Mock private ConversationAnalysisAgent analysisAgent;
  @Mock private PatternInsightAgent insightAgent;

  private EngineConfig engineConfig;
  private SimpleMeterRegistry meterRegistry;
  private LearningService learningService;

  /** Rows "persisted" through the mocked repository. */
  private final List<RecurringPattern> stored = new ArrayList<>();

  private final AtomicInteger transactions = new AtomicInteger();
  private final AtomicBoolean inTransaction = new AtomicBoolean();

  /** One entry per repository write: whether it ran inside a transaction. */
  private final List<Boolean> writesInTransaction = new ArrayList<>();

  private final TransactionOperations recordingTransactions =
      new TransactionOperations() {
        @Override
        public <T> T execute(TransactionCallback<T> action) {
          transactions.incrementAndGet();
          inTransaction.set(true);
          try {
            return action.doInTransaction(new SimpleTransactionStatus());
          } finally {
            inTransaction.set(false);
          }
        }
      };

  @BeforeEach
  void setUp() {
    engineConfig = new EngineConfig();
    meterRegistry = new SimpleMeterRegistry();
    learningService =
        new LearningService(
            patternRepository,
            analysisAgent,
            insightAgent,
            new AgentInvoker(meterRegistry),
            engineConfig,
            meterRegistry,
            recordingTransactions);

    when(patternRepository.findByUserIdAndPatternType(eq(USER_ID), any()))
        .thenAnswer(
            inv ->
                stored.stream()
                    .filter(p -> p.getPatternType() == inv.getArgument(1))
                    .toList());
    when(patternRepository.save(any(RecurringPattern.class)))
        .thenAnswer(
            inv -> {
              RecurringPattern pattern = inv.getArgument(0);
              writesInTransaction.add(inTransaction.get());
              if (pattern.getId() == null) {
                pattern.setId(UUID.randomUUID());
                stored.add(pattern);
              }
              return pattern;
            });
  }

  private static List<String> keywords(String... words) {
    return List.of(words);
  }

  private static PatternCandidate challenge(String description, List<String> keywords) {
    return new PatternCandidate(
        PatternType.CHALLENGE, description, keywords, 0.7, List.of(), List.of("Align early"));
  }

  private static ChatMessage message(MessageRole role, String content) {
    return ChatMessage.builder().userId(USER_ID).role(role).content(content).build();
  }

  @Nested
  @DisplayName("storeRecurringPattern")
  class StoreTests {

    @Test
    @DisplayName("should merge a candidate with enough keyword overlap into the existing row")
    void shouldMergeSimilarPattern() {
      List<String> first =
          keywords(
              "stakeholder", "conflict", "roadmap", "priorities", "pressure", "deadline",
              "escalation", "alignment", "scope", "budget");
      List<String> second =
          keywords(
              "stakeholder", "conflict", "roadmap", "priorities", "pressure", "deadline",
              "escalation", "hiring", "morale", "offsite");

      RecurringPattern created =
          learningService.storeRecurringPattern(
              USER_ID, challenge("conflict with stakeholder", first));
      RecurringPattern merged =
          learningService.storeRecurringPattern(
              USER_ID, challenge("stakeholder disagreement on roadmap", second));

      assertThat(stored).hasSize(1);
      assertThat(merged.getId()).isEqualTo(created.getId());
      assertThat(merged.getFrequency()).isEqualTo(2);
      assertThat(merged.getConfidenceScore()).isCloseTo(0.8, within(1e-9));
      assertThat(meterRegistry.counter("learning.patterns", "outcome", "merged").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should insert a new row when overlap is at or below the threshold")
    void shouldInsertDissimilarPattern() {
      learningService.storeRecurringPattern(
          USER_ID, challenge("conflict with stakeholder", keywords("a", "b", "c", "d", "e")));
      learningService.storeRecurringPattern(
          USER_ID, challenge("hiring backlog", keywords("a", "b", "c", "x", "y")));

      assertThat(stored).hasSize(2);
      assertThat(stored).allSatisfy(p -> assertThat(p.getFrequency()).isEqualTo(1));
    }

    @Test
    @DisplayName("should treat the same description as the same pattern")
    void shouldMergeEqualDescriptions() {
      learningService.storeRecurringPattern(USER_ID, challenge("Scope creep", keywords("a")));
      learningService.storeRecurringPattern(USER_ID, challenge("scope creep", keywords("z")));

      assertThat(stored).singleElement().satisfies(p -> assertThat(p.getFrequency()).isEqualTo(2));
    }

    @Test
    @DisplayName("should never merge patterns of different kinds")
    void shouldKeepKindsApart() {
      learningService.storeRecurringPattern(USER_ID, challenge("Scope creep", keywords("a")));
      learningService.storeRecurringPattern(
          USER_ID,
          new PatternCandidate(
              PatternType.COMMUNICATION, "Scope creep", keywords("a"), 0.5, List.of(), List.of()));

      assertThat(stored).hasSize(2);
    }

    @Test
    @DisplayName("should add newly involved people and cap confidence at one")
    void shouldMergePeopleAndCapConfidence() {
      String personId = UUID.randomUUID().toString();
      RecurringPattern existing =
          RecurringPattern.builder()
              .id(UUID.randomUUID())
              .userId(USER_ID)
              .patternType(PatternType.CHALLENGE)
              .patternDescription("Scope creep")
              .confidenceScore(0.95)
              .lastOccurrence(LocalDateTime.now().minusDays(3))
              .build();
      stored.add(existing);

      learningService.storeRecurringPattern(
          USER_ID,
          new PatternCandidate(
              PatternType.CHALLENGE,
              "Scope creep",
              keywords("a"),
              0.7,
              List.of(personId),
              List.of()));

      assertThat(existing.getConfidenceScore()).isEqualTo(1.0);
      assertThat(existing.getPeopleInvolved()).containsExactly(personId);
    }
  }

  @Test
  @DisplayName("keywordSimilarity should divide the overlap by the larger set")
  void shouldComputeKeywordSimilarity() {
    assertThat(LearningService.keywordSimilarity(keywords("A", "b"), keywords("a", "B", "c", "d")))
        .isEqualTo(0.5);
    assertThat(LearningService.keywordSimilarity(List.of(), List.of())).isZero();
    assertThat(LearningService.keywordSimilarity(null, keywords("a"))).isZero();
  }

  @Nested
  @DisplayName("recordFromConversation")
  class RecordTests {

    private final UUID personId = UUID.randomUUID();
    private final ConversationTarget personTarget =
        new ConversationTarget(
            ConversationType.PERSON, personId, null, "Sarah", "Engineer", null);

    private List<ChatMessage> history(int size) {
      List<ChatMessage> history = new ArrayList<>();
      for (int i = 0; i < size; i++) {
        history.add(
            message(i % 2 == 0 ? MessageRole.USER : MessageRole.ASSISTANT, "Message " + i));
      }
      return history;
    }

    @Test
    @DisplayName("should skip conversations shorter than the minimum")
    void shouldSkipShortConversations() {
      List<RecurringPattern> patterns =
          learningService.recordFromConversation(USER_ID, history(3), personId, personTarget);

      assertThat(patterns).isEmpty();
      verify(analysisAgent, never()).analyse(anyString(), anyString());
    }

    @Test
    @DisplayName("should store challenge, relationship and communication patterns")
    void shouldStoreCandidates() {
      when(analysisAgent.analyse(eq("Sarah"), anyString()))
          .thenReturn(
              new ConversationAnalysis(
                  List.of("deadlines", "ownership"),
                  List.of("Missed sprint deadlines", "ok"),
                  List.of("Trust is growing with Sarah"),
                  List.of("Prefers async updates"),
                  List.of(),
                  List.of("Agree on a definition of done")));

      List<RecurringPattern> patterns =
          learningService.recordFromConversation(USER_ID, history(4), personId, personTarget);

      assertThat(patterns)
          .extracting(RecurringPattern::getPatternType)
          .containsExactly(
              PatternType.CHALLENGE, PatternType.RELATIONSHIP, PatternType.COMMUNICATION);
      RecurringPattern challenge = patterns.get(0);
      assertThat(challenge.getContextKeywords())
          .containsExactly("deadlines", "ownership", "Prefers async updates");
      assertThat(challenge.getPeopleInvolved()).containsExactly(personId.toString());
      assertThat(challenge.getSuggestedActions()).containsExactly("Agree on a definition of done");
      assertThat(challenge.getConfidenceScore()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("should write each pattern inside its own transaction")
    void shouldStoreEachPatternTransactionally() {
      when(analysisAgent.analyse(anyString(), anyString()))
          .thenReturn(
              new ConversationAnalysis(
                  List.of("deadlines"),
                  List.of("Missed sprint deadlines"),
                  List.of("Trust is growing with Sarah"),
                  null,
                  null,
                  null));

      List<RecurringPattern> patterns =
          learningService.recordFromConversation(USER_ID, history(4), personId, personTarget);

      assertThat(patterns).hasSize(2);
      assertThat(transactions).hasValue(2);
      assertThat(writesInTransaction).hasSize(2).containsOnly(true);
    }

    @Test
    @DisplayName("should not attribute general conversations to a person")
    void shouldLeavePeopleEmptyForGeneralConversations() {
      when(analysisAgent.analyse(anyString(), anyString()))
          .thenReturn(
              new ConversationAnalysis(
                  List.of("hiring"), List.of("Hiring pipeline is slow"), null, null, null, null));

      List<RecurringPattern> patterns =
          learningService.recordFromConversation(
              USER_ID, history(4), null, ConversationTarget.general());

      assertThat(patterns)
          .singleElement()
          .satisfies(p -> assertThat(p.getPeopleInvolved()).isEmpty());
    }

    @Test
    @DisplayName("should store nothing when the analysis fails")
    void shouldStoreNothingOnFailure() {
      when(analysisAgent.analyse(anyString(), anyString()))
          .thenThrow(new IllegalStateException("unavailable"));

      List<RecurringPattern> patterns =
          learningService.recordFromConversation(USER_ID, history(6), personId, personTarget);

      assertThat(patterns).isEmpty();
      assertThat(stored).isEmpty();
    }
  }

  @Nested
  @DisplayName("getInsights")
  class InsightTests {

    private RecurringPattern frequent(String description, double confidence, String personId) {
      return RecurringPattern.builder()
          .id(UUID.randomUUID())
          .userId(USER_ID)
          .patternType(PatternType.CHALLENGE)
          .patternDescription(description)
          .frequency(3)
          .confidenceScore(confidence)
          .peopleInvolved(personId != null ? new ArrayList<>(List.of(personId)) : new ArrayList<>())
          .lastOccurrence(LocalDateTime.now())
          .build();
    }

    @Test
    @DisplayName("should fall back to a template insight when the model fails")
    void shouldUseTemplateOnFailure() {
      when(patternRepository.findByUserIdAndFrequencyGreaterThanEqualOrderByLastOccurrenceDesc(
              eq(USER_ID), anyInt(), any()))
          .thenReturn(List.of(frequent("Scope creep", 0.8, null)));
      when(insightAgent.explain(anyString(), anyString(), anyInt(), anyString(), anyString()))
          .thenThrow(new IllegalStateException("down"));

      List<LearningInsight> insights = learningService.getInsights(USER_ID, null);

      assertThat(insights)
          .singleElement()
          .satisfies(
              insight -> {
                assertThat(insight.insight())
                    .isEqualTo("Recurring challenge: Scope creep (seen 3 times)");
                assertThat(insight.priority()).isEqualTo(Priority.MEDIUM);
                assertThat(insight.relevanceScore()).isEqualTo(0.8);
                assertThat(insight.actionableSuggestions()).isNotEmpty();
              });
    }

    @Test
    @DisplayName("should use model advice and sort by relevance")
    void shouldSortModelInsights() {
      RecurringPattern a = frequent("Scope creep", 0.5, null);
      RecurringPattern b = frequent("Missed deadlines", 0.5, null);
      when(patternRepository.findByUserIdAndFrequencyGreaterThanEqualOrderByLastOccurrenceDesc(
              eq(USER_ID), anyInt(), any()))
          .thenReturn(List.of(a, b));
      when(insightAgent.explain(anyString(), eq("Scope creep"), anyInt(), anyString(), anyString()))
          .thenReturn(
              new PatternInsightResult(
                  "Scope keeps growing", List.of("Freeze scope"), "low", 0.3));
      when(insightAgent.explain(
              anyString(), eq("Missed deadlines"), anyInt(), anyString(), anyString()))
          .thenReturn(new PatternInsightResult("Deadlines slip", List.of(), "high", 0.9));

      List<LearningInsight> insights = learningService.getInsights(USER_ID, null);

      assertThat(insights)
          .extracting(LearningInsight::insight)
          .containsExactly("Deadlines slip", "Scope keeps growing");
      assertThat(insights.get(0).priority()).isEqualTo(Priority.HIGH);
      assertThat(insights.get(1).actionableSuggestions()).containsExactly("Freeze scope");
    }

    @Test
    @DisplayName("should restrict insights to patterns involving the person")
    void shouldFilterByPerson() {
      UUID personId = UUID.randomUUID();
      when(patternRepository.findByUserIdAndFrequencyGreaterThanEqualOrderByLastOccurrenceDesc(
              eq(USER_ID), anyInt(), any()))
          .thenReturn(
              List.of(
                  frequent("Scope creep", 0.5, personId.toString()),
                  frequent("Missed deadlines", 0.5, null)));
      when(insightAgent.explain(anyString(), anyString(), anyInt(), anyString(), anyString()))
          .thenThrow(new IllegalStateException("down"));

      assertThat(learningService.getInsights(USER_ID, personId))
          .extracting(LearningInsight::patternId)
          .hasSize(1);
    }
  }
}
