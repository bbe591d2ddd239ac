package com.flamingo.ai.mano.service.context;

import com.flamingo.ai.mano.cache.CacheKeys;
import com.flamingo.ai.mano.cache.ContextCache;
import com.flamingo.ai.mano.config.EngineConfig;
import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.entity.Person;
import com.flamingo.ai.mano.domain.enums.MessageRole;
import com.flamingo.ai.mano.domain.repository.ChatMessageRepository;
import com.flamingo.ai.mano.domain.repository.PersonRepository;
import com.flamingo.ai.mano.service.context.model.ConversationPatterns;
import com.flamingo.ai.mano.service.context.model.ConversationTheme;
import com.flamingo.ai.mano.service.context.model.CrossPersonMention;
import com.flamingo.ai.mano.service.context.model.PersonSummary;
import com.flamingo.ai.mano.service.context.model.TeamSize;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads the roster, recent themes, current challenges and discussion patterns of a manager. Each
 * read is cached per user with its own TTL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TeamThemeAggregator {

  private final PersonRepository personRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final ThemeExtractor themeExtractor;
  private final ChallengeDetector challengeDetector;
  private final ContextCache contextCache;
  private final EngineConfig engineConfig;

  /** Team members other than the manager's own self entry, with last contact and topics. */
  @Transactional(readOnly = true)
  public List<PersonSummary> loadPeople(String userId) {
    return contextCache.getOrCompute(
        CacheKeys.people(userId),
        engineConfig.getCache().getPeopleTtl(),
        () ->
            personRepository.findByUserIdOrderByNameAsc(userId).stream()
                .filter(person -> !person.isSelf())
                .map(person -> summarize(userId, person))
                .toList());
  }

  private PersonSummary summarize(String userId, Person person) {
    EngineConfig.Aggregation config = engineConfig.getAggregation();
    LocalDateTime lastContact =
        chatMessageRepository
            .findFirstByUserIdAndPersonIdOrderByCreatedAtDesc(userId, person.getId())
            .map(ChatMessage::getCreatedAt)
            .orElse(null);
    List<ChatMessage> recent =
        chatMessageRepository.findPersonMessagesSince(
            userId,
            person.getId(),
            MessageRole.USER,
            LocalDateTime.now().minusDays(config.getPersonThemeWindowDays()),
            Pageable.ofSize(config.getPersonThemeMessageLimit()));
    return PersonSummary.builder()
        .id(person.getId())
        .name(person.getName())
        .role(person.getRole())
        .relationshipType(person.getRelationshipType())
        .lastContact(lastContact)
        .recentThemes(themeExtractor.extractLabels(recent, config.getMaxPersonThemes()))
        .build();
  }

  /** Head-count per relationship kind. */
  public TeamSize teamSize(List<PersonSummary> people) {
    int directReports = 0;
    int stakeholders = 0;
    int managers = 0;
    int peers = 0;
    for (PersonSummary person : people) {
      if (person.relationshipType() == null) {
        continue;
      }
      switch (person.relationshipType()) {
        case DIRECT_REPORT -> directReports++;
        case STAKEHOLDER -> stakeholders++;
        case MANAGER -> managers++;
        case PEER -> peers++;
        default -> {
          // self entries are not part of the team
        }
      }
    }
    return new TeamSize(directReports, stakeholders, managers, peers);
  }

  /** Most frequent themes in the manager's own messages of the theme window. */
  @Transactional(readOnly = true)
  public List<ConversationTheme> loadThemes(String userId) {
    EngineConfig.Aggregation config = engineConfig.getAggregation();
    return contextCache.getOrCompute(
        CacheKeys.themes(userId),
        engineConfig.getCache().getThemesTtl(),
        () ->
            themeExtractor.extract(
                userMessagesSince(userId, config.getThemeWindowDays()),
                config.getMaxThemes(),
                config.getMaxThemeExamples()));
  }

  /** Challenge labels found in the manager's own messages of the challenge window. */
  @Transactional(readOnly = true)
  public List<String> loadChallenges(String userId) {
    return contextCache.getOrCompute(
        CacheKeys.challenges(userId),
        engineConfig.getCache().getChallengesTtl(),
        () ->
            challengeDetector.detect(
                userMessagesSince(userId, engineConfig.getAggregation().getChallengeWindowDays())));
  }

  /** Who is discussed most, trending themes and roster members named in other conversations. */
  @Transactional(readOnly = true)
  public ConversationPatterns loadConversationPatterns(String userId) {
    return contextCache.getOrCompute(
        CacheKeys.patterns(userId),
        engineConfig.getCache().getPatternsTtl(),
        () -> computeConversationPatterns(userId));
  }

  private ConversationPatterns computeConversationPatterns(String userId) {
    EngineConfig.Aggregation config = engineConfig.getAggregation();
    List<ChatMessage> messages =
        chatMessageRepository.findByUserIdAndCreatedAtAfterOrderByCreatedAtDesc(
            userId, LocalDateTime.now().minusDays(config.getPatternWindowDays()));

    Map<UUID, Integer> countsByPerson = new LinkedHashMap<>();
    for (ChatMessage message : messages) {
      if (message.getPersonId() != null) {
        countsByPerson.merge(message.getPersonId(), 1, Integer::sum);
      }
    }
    List<UUID> mostDiscussed =
        countsByPerson.entrySet().stream()
            .sorted(Map.Entry.<UUID, Integer>comparingByValue().reversed())
            .limit(config.getMostDiscussedLimit())
            .map(Map.Entry::getKey)
            .toList();

    List<String> trendingTopics =
        themeExtractor.extractLabels(messages, config.getTrendingTopicLimit());

    List<CrossPersonMention> mentions =
        findCrossPersonMentions(personRepository.findByUserIdOrderByNameAsc(userId), messages);
    return new ConversationPatterns(mostDiscussed, trendingTopics, mentions);
  }

  List<CrossPersonMention> findCrossPersonMentions(
      List<Person> roster, List<ChatMessage> messages) {
    List<CrossPersonMention> mentions = new ArrayList<>();
    for (Person person : roster) {
      if (person.isSelf() || person.getName() == null) {
        continue;
      }
      String firstName = person.getName().trim().split("\\s+")[0];
      if (firstName.length() < 2) {
        continue;
      }
      Pattern namePattern =
          Pattern.compile("\\b" + Pattern.quote(firstName) + "\\b", Pattern.CASE_INSENSITIVE);
      Set<UUID> conversations = new LinkedHashSet<>();
      int count = 0;
      for (ChatMessage message : messages) {
        UUID conversationPerson = message.getPersonId();
        if (conversationPerson == null
            || conversationPerson.equals(person.getId())
            || message.getContent() == null) {
          continue;
        }
        if (namePattern.matcher(message.getContent()).find()) {
          conversations.add(conversationPerson);
          count++;
        }
      }
      if (count > 0) {
        mentions.add(
            new CrossPersonMention(
                person.getId(), person.getName(), new ArrayList<>(conversations), count));
      }
    }
    mentions.sort(Comparator.comparingInt(CrossPersonMention::mentionCount).reversed());
    return mentions;
  }

  private List<ChatMessage> userMessagesSince(String userId, int days) {
    return chatMessageRepository
        .findByUserIdAndRoleAndCreatedAtAfterOrderByCreatedAtDesc(
            userId, MessageRole.USER, LocalDateTime.now().minusDays(days))
        .stream()
        .filter(Objects::nonNull)
        .toList();
  }
}
