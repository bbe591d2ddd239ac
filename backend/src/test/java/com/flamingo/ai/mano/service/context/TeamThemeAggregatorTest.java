package com.flamingo.ai.mano.service.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.mano.cache.ContextCache;
import com.flamingo.ai.mano.config.EngineConfig;
import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.entity.Person;
import com.flamingo.ai.mano.domain.enums.MessageRole;
import com.flamingo.ai.mano.domain.enums.RelationshipType;
import com.flamingo.ai.mano.domain.repository.ChatMessageRepository;
import com.flamingo.ai.mano.domain.repository.PersonRepository;
import com.flamingo.ai.mano.service.context.model.ConversationPatterns;
import com.flamingo.ai.mano.service.context.model.CrossPersonMention;
import com.flamingo.ai.mano.service.context.model.PersonSummary;
import com.flamingo.ai.mano.service.context.model.TeamSize;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TeamThemeAggregatorTest {

  private static final String USER_ID = "user-1";

  @Mock private PersonRepository personRepository;
  @Mock private ChatMessageRepository chatMessageRepository;

  private TeamThemeAggregator aggregator;

  private Person sarah;
  private Person tom;
  private Person self;

  @BeforeEach
  void setUp() {
    EngineConfig engineConfig = new EngineConfig();
    ContextCache contextCache =
        new ContextCache(100, Ticker.systemTicker(), new SimpleMeterRegistry());
    aggregator =
        new TeamThemeAggregator(
            personRepository,
            chatMessageRepository,
            new ThemeExtractor(),
            new ChallengeDetector(),
            contextCache,
            engineConfig);

    sarah = person("Sarah Chen", RelationshipType.DIRECT_REPORT, false);
    tom = person("Tom", RelationshipType.STAKEHOLDER, false);
    self = person("Me", RelationshipType.SELF, true);
  }

  private static Person person(String name, RelationshipType relationship, boolean isSelf) {
    return Person.builder()
        .id(UUID.randomUUID())
        .userId(USER_ID)
        .name(name)
        .relationshipType(relationship)
        .self(isSelf)
        .build();
  }

  private static ChatMessage message(UUID personId, String content) {
    return ChatMessage.builder()
        .id(UUID.randomUUID())
        .userId(USER_ID)
        .personId(personId)
        .role(MessageRole.USER)
        .content(content)
        .createdAt(LocalDateTime.now().minusDays(1))
        .build();
  }

  @Nested
  @DisplayName("loadPeople")
  class LoadPeopleTests {

    @Test
    @DisplayName("should exclude the self entry and summarize last contact and themes")
    void shouldSummarizeRoster() {
      ChatMessage last = message(sarah.getId(), "Talked about her career goals");
      when(personRepository.findByUserIdOrderByNameAsc(USER_ID))
          .thenReturn(List.of(self, sarah, tom));
      when(chatMessageRepository.findFirstByUserIdAndPersonIdOrderByCreatedAtDesc(
              USER_ID, sarah.getId()))
          .thenReturn(Optional.of(last));
      when(chatMessageRepository.findFirstByUserIdAndPersonIdOrderByCreatedAtDesc(
              USER_ID, tom.getId()))
          .thenReturn(Optional.empty());
      when(chatMessageRepository.findPersonMessagesSince(
              eq(USER_ID), eq(sarah.getId()), eq(MessageRole.USER), any(), any()))
          .thenReturn(List.of(last));
      when(chatMessageRepository.findPersonMessagesSince(
              eq(USER_ID), eq(tom.getId()), eq(MessageRole.USER), any(), any()))
          .thenReturn(List.of());

      List<PersonSummary> people = aggregator.loadPeople(USER_ID);

      assertThat(people).extracting(PersonSummary::name).containsExactly("Sarah Chen", "Tom");
      assertThat(people.get(0).lastContact()).isEqualTo(last.getCreatedAt());
      assertThat(people.get(0).recentThemes()).containsExactly("goals", "career");
      assertThat(people.get(1).lastContact()).isNull();
    }

    @Test
    @DisplayName("should serve the second read from cache")
    void shouldCacheRoster() {
      when(personRepository.findByUserIdOrderByNameAsc(USER_ID)).thenReturn(List.of());

      aggregator.loadPeople(USER_ID);
      aggregator.loadPeople(USER_ID);

      verify(personRepository, times(1)).findByUserIdOrderByNameAsc(USER_ID);
    }
  }

  @Test
  @DisplayName("teamSize should count each relationship kind")
  void shouldCountTeamSize() {
    List<PersonSummary> people =
        List.of(
            PersonSummary.builder().relationshipType(RelationshipType.DIRECT_REPORT).build(),
            PersonSummary.builder().relationshipType(RelationshipType.DIRECT_REPORT).build(),
            PersonSummary.builder().relationshipType(RelationshipType.STAKEHOLDER).build(),
            PersonSummary.builder().relationshipType(RelationshipType.PEER).build());

    TeamSize size = aggregator.teamSize(people);

    assertThat(size).isEqualTo(new TeamSize(2, 1, 0, 1));
    assertThat(size.total()).isEqualTo(4);
  }

  @Test
  @DisplayName("loadChallenges should detect labels in the challenge window")
  void shouldLoadChallenges() {
    when(chatMessageRepository.findByUserIdAndRoleAndCreatedAtAfterOrderByCreatedAtDesc(
            eq(USER_ID), eq(MessageRole.USER), any()))
        .thenReturn(List.of(message(null, "I feel overwhelmed by the workload")));

    assertThat(aggregator.loadChallenges(USER_ID)).containsExactly("Workload Management");
  }

  @Nested
  @DisplayName("loadConversationPatterns")
  class ConversationPatternsTests {

    @Test
    @DisplayName("should rank people by message count and find cross-person mentions")
    void shouldComputePatterns() {
      List<ChatMessage> window =
          List.of(
              message(tom.getId(), "Tom wants sarah to lead the project demo"),
              message(sarah.getId(), "Project planning"),
              message(tom.getId(), "Project timeline with Tom"),
              message(tom.getId(), "Budget review"));
      when(chatMessageRepository.findByUserIdAndCreatedAtAfterOrderByCreatedAtDesc(
              eq(USER_ID), any()))
          .thenReturn(window);
      when(personRepository.findByUserIdOrderByNameAsc(USER_ID))
          .thenReturn(List.of(self, sarah, tom));

      ConversationPatterns patterns = aggregator.loadConversationPatterns(USER_ID);

      assertThat(patterns.mostDiscussed()).containsExactly(tom.getId(), sarah.getId());
      assertThat(patterns.trendingTopics()).contains("project");
      assertThat(patterns.crossPersonMentions())
          .singleElement()
          .satisfies(
              mention -> {
                assertThat(mention.personId()).isEqualTo(sarah.getId());
                assertThat(mention.mentionedInConversations()).containsExactly(tom.getId());
                assertThat(mention.mentionCount()).isEqualTo(1);
              });
    }

    @Test
    @DisplayName("should not count a person's own conversation as a mention")
    void shouldIgnoreOwnConversation() {
      List<CrossPersonMention> mentions =
          aggregator.findCrossPersonMentions(
              List.of(sarah), List.of(message(sarah.getId(), "Sarah is doing well")));

      assertThat(mentions).isEmpty();
    }
  }
}
