package com.flamingo.ai.mano.service.insight;

import com.flamingo.ai.mano.agent.AgentInvoker;
import com.flamingo.ai.mano.agent.AgentResult;
import com.flamingo.ai.mano.agent.ConversationStarterAgent;
import com.flamingo.ai.mano.agent.FollowUpAgent;
import com.flamingo.ai.mano.agent.TeamInsightAgent;
import com.flamingo.ai.mano.agent.dto.ConversationStarterResult;
import com.flamingo.ai.mano.agent.dto.FollowUpResult;
import com.flamingo.ai.mano.agent.dto.TeamInsightsResult;
import com.flamingo.ai.mano.config.EngineConfig;
import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.entity.Person;
import com.flamingo.ai.mano.domain.enums.InsightType;
import com.flamingo.ai.mano.domain.enums.MessageRole;
import com.flamingo.ai.mano.domain.enums.Priority;
import com.flamingo.ai.mano.domain.repository.ChatMessageRepository;
import com.flamingo.ai.mano.domain.repository.PersonRepository;
import com.flamingo.ai.mano.exception.PersonNotFoundException;
import com.flamingo.ai.mano.service.context.model.ConversationTheme;
import com.flamingo.ai.mano.service.context.model.ManagementContext;
import com.flamingo.ai.mano.service.context.model.PersonSummary;
import com.flamingo.ai.mano.service.learning.LearningInsight;
import com.flamingo.ai.mano.service.learning.LearningService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Generates conversation starters, follow-up reminders, pattern alerts and team-level insights.
 *
 * <p>Each source is independent. A source that fails contributes nothing; the others still run.
 * The combined list is ranked by priority weight times relevance and capped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProactiveInsightService {

  static final List<String> FOLLOW_UP_KEYWORDS =
      List.of("follow up", "check in", "next week", "will do", "action", "commit", "plan to");

  private static final double STARTER_RELEVANCE = 0.6;
  private static final double FOLLOW_UP_RELEVANCE = 0.7;
  private static final double TEAM_RELEVANCE = 0.6;
  private static final List<String> DEFAULT_STARTER_QUESTIONS =
      List.of(
          "What has been on your mind since we last talked?",
          "Is there anything blocking you that I can help with?",
          "What would make the next few weeks a success for you?");

  private final ChatMessageRepository chatMessageRepository;
  private final PersonRepository personRepository;
  private final LearningService learningService;
  private final ConversationStarterAgent conversationStarterAgent;
  private final FollowUpAgent followUpAgent;
  private final TeamInsightAgent teamInsightAgent;
  private final AgentInvoker agentInvoker;
  private final EngineConfig engineConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Insights for the manager's whole team.
   *
   * @param context the context already built for this turn
   */
  public List<ProactiveInsight> generate(String userId, ManagementContext context) {
    List<ProactiveInsight> insights = new ArrayList<>();
    insights.addAll(safely("starters", () -> conversationStarters(userId, context)));
    insights.addAll(safely("follow_ups", () -> followUps(userId, null, context.people())));
    insights.addAll(safely("pattern_alerts", () -> patternAlerts(userId)));
    insights.addAll(safely("team", () -> teamInsights(context)));
    return rank(insights);
  }

  /** A starter and outstanding follow-ups for one person. */
  @Transactional(readOnly = true)
  public List<ProactiveInsight> generateForPerson(String userId, UUID personId) {
    Person person =
        personRepository
            .findByIdAndUserId(personId, userId)
            .orElseThrow(() -> new PersonNotFoundException(personId));
    PersonSummary summary =
        PersonSummary.builder()
            .id(person.getId())
            .name(person.getName())
            .role(person.getRole())
            .relationshipType(person.getRelationshipType())
            .lastContact(
                chatMessageRepository
                    .findFirstByUserIdAndPersonIdOrderByCreatedAtDesc(userId, personId)
                    .map(ChatMessage::getCreatedAt)
                    .orElse(null))
            .build();

    List<ProactiveInsight> insights = new ArrayList<>();
    insights.add(starterFor(summary, List.of()));
    insights.addAll(safely("follow_ups", () -> followUps(userId, personId, List.of(summary))));
    return rank(insights);
  }

  List<ProactiveInsight> conversationStarters(String userId, ManagementContext context) {
    EngineConfig.Insights config = engineConfig.getInsights();
    LocalDateTime since = LocalDateTime.now().minusDays(config.getInactivityDays());
    List<String> themes =
        context.recentThemes().stream().map(ConversationTheme::theme).limit(3).toList();
    return context.people().stream()
        .filter(
            person ->
                !chatMessageRepository.existsByUserIdAndPersonIdAndRoleAndCreatedAtAfter(
                    userId, person.id(), MessageRole.USER, since))
        .sorted(
            Comparator.comparing(
                PersonSummary::lastContact, Comparator.nullsFirst(Comparator.naturalOrder())))
        .limit(config.getStarterLimit())
        .map(person -> starterFor(person, themes))
        .toList();
  }

  private ProactiveInsight starterFor(PersonSummary person, List<String> themes) {
    String days = daysSince(person.lastContact());
    String role = Objects.requireNonNullElse(person.role(), "Team member");
    String relationship =
        person.relationshipType() != null ? person.relationshipType().getLabel() : "colleague";
    AgentResult<ConversationStarterResult> result =
        agentInvoker.invoke(
            "conversation-starter",
            () ->
                conversationStarterAgent.suggest(
                    person.name(), role, relationship, days, String.join(", ", themes)),
            value -> value.title() != null && !value.title().isBlank());

    ProactiveInsight.ProactiveInsightBuilder builder =
        baseInsight("starter_" + person.id() + "_" + System.currentTimeMillis())
            .type(InsightType.CONVERSATION_STARTER)
            .personId(person.id())
            .personName(person.name());
    return result
        .value()
        .map(
            value ->
                builder
                    .title(value.title())
                    .description(Objects.requireNonNullElse(value.description(), ""))
                    .actionableSteps(
                        value.suggestedQuestions() != null
                            ? value.suggestedQuestions()
                            : DEFAULT_STARTER_QUESTIONS)
                    .priority(Priority.fromValue(value.priority(), Priority.MEDIUM))
                    .relevanceScore(
                        value.relevance() != null ? clamp(value.relevance()) : STARTER_RELEVANCE)
                    .build())
        .orElseGet(
            () ->
                builder
                    .title("Reconnect with " + person.name())
                    .description(starterDescription(person.name(), days))
                    .actionableSteps(DEFAULT_STARTER_QUESTIONS)
                    .priority(Priority.MEDIUM)
                    .relevanceScore(STARTER_RELEVANCE)
                    .build());
  }

  /**
   * Follow-ups implied by the assistant's recent replies.
   *
   * @param personId restricts to one person's conversations when not null
   */
  List<ProactiveInsight> followUps(String userId, UUID personId, List<PersonSummary> people) {
    EngineConfig.Insights config = engineConfig.getInsights();
    LocalDateTime since = LocalDateTime.now().minusDays(config.getFollowUpDays());
    Map<UUID, String> names =
        people.stream()
            .filter(person -> person.id() != null)
            .collect(Collectors.toMap(PersonSummary::id, PersonSummary::name, (a, b) -> a));

    List<ChatMessage> candidates =
        chatMessageRepository
            .findByUserIdAndRoleAndCreatedAtAfterOrderByCreatedAtDesc(
                userId, MessageRole.ASSISTANT, since)
            .stream()
            .filter(message -> personId == null || personId.equals(message.getPersonId()))
            .limit(config.getFollowUpScanLimit())
            .filter(message -> mentionsFollowUp(message.getContent()))
            .limit(config.getFollowUpLimit())
            .toList();

    List<ProactiveInsight> insights = new ArrayList<>();
    for (ChatMessage message : candidates) {
      AgentResult<FollowUpResult> result =
          agentInvoker.invoke(
              "follow-up",
              () -> followUpAgent.review(message.getContent(), daysSince(message.getCreatedAt())),
              value -> value.needsFollowup() != null);
      result
          .value()
          .filter(value -> Boolean.TRUE.equals(value.needsFollowup()))
          .map(value -> toFollowUp(message, value, names))
          .ifPresent(insights::add);
    }
    return insights;
  }

  private ProactiveInsight toFollowUp(
      ChatMessage message, FollowUpResult value, Map<UUID, String> names) {
    String description = Objects.requireNonNullElse(value.description(), "");
    if (value.context() != null && !value.context().isBlank()) {
      description = description.isEmpty() ? value.context() : description + " " + value.context();
    }
    return baseInsight("followup_" + message.getId())
        .type(InsightType.FOLLOW_UP)
        .title(Objects.requireNonNullElse(value.title(), "Follow up on earlier advice"))
        .description(description)
        .priority(Priority.fromValue(value.urgency(), Priority.MEDIUM))
        .personId(message.getPersonId())
        .personName(message.getPersonId() != null ? names.get(message.getPersonId()) : null)
        .actionableSteps(value.steps())
        .relevanceScore(value.relevance() != null ? clamp(value.relevance()) : FOLLOW_UP_RELEVANCE)
        .build();
  }

  List<ProactiveInsight> patternAlerts(String userId) {
    EngineConfig.Insights config = engineConfig.getInsights();
    return learningService.getInsights(userId, null).stream()
        .filter(insight -> insight.priority() == Priority.HIGH)
        .filter(insight -> insight.relevanceScore() > config.getPatternAlertMinRelevance())
        .limit(config.getPatternAlertLimit())
        .map(this::toPatternAlert)
        .toList();
  }

  private ProactiveInsight toPatternAlert(LearningInsight insight) {
    return baseInsight("pattern_" + insight.patternId())
        .type(InsightType.PATTERN_ALERT)
        .title("Recurring " + insight.patternType().name().toLowerCase(Locale.ROOT) + " pattern")
        .description(insight.insight())
        .priority(insight.priority())
        .actionableSteps(insight.actionableSuggestions())
        .relevanceScore(insight.relevanceScore())
        .build();
  }

  List<ProactiveInsight> teamInsights(ManagementContext context) {
    if (context.people().size() < engineConfig.getInsights().getMinTeamSizeForTeamInsights()) {
      return List.of();
    }
    String team =
        context.people().stream()
            .map(
                person ->
                    "- "
                        + person.name()
                        + " ("
                        + Objects.requireNonNullElse(person.role(), "Team member")
                        + ", "
                        + (person.relationshipType() != null
                            ? person.relationshipType().getLabel()
                            : "colleague")
                        + ")")
            .collect(Collectors.joining("\n"));
    String themes =
        context.recentThemes().stream()
            .map(ConversationTheme::theme)
            .collect(Collectors.joining(", "));
    String challenges = String.join(", ", context.currentChallenges());

    AgentResult<TeamInsightsResult> result =
        agentInvoker.invoke(
            "team-insight",
            () -> teamInsightAgent.analyse(team, themes, challenges),
            value -> value.insights() != null);
    long now = System.currentTimeMillis();
    List<ProactiveInsight> insights = new ArrayList<>();
    List<TeamInsightsResult.TeamInsight> items =
        result.value().map(TeamInsightsResult::insights).orElse(List.of());
    for (int i = 0; i < items.size(); i++) {
      TeamInsightsResult.TeamInsight item = items.get(i);
      if (item == null || item.title() == null || item.title().isBlank()) {
        continue;
      }
      insights.add(
          baseInsight("team_" + i + "_" + now)
              .type(teamInsightType(item.type()))
              .title(item.title())
              .description(Objects.requireNonNullElse(item.description(), ""))
              .priority(Priority.fromValue(item.priority(), Priority.MEDIUM))
              .actionableSteps(item.steps())
              .relevanceScore(item.relevance() != null ? clamp(item.relevance()) : TEAM_RELEVANCE)
              .build());
    }
    return insights;
  }

  private List<ProactiveInsight> rank(List<ProactiveInsight> insights) {
    return insights.stream()
        .sorted(Comparator.comparingDouble(ProactiveInsight::rankScore).reversed())
        .limit(engineConfig.getInsights().getMaxInsights())
        .toList();
  }

  private List<ProactiveInsight> safely(String source, Supplier<List<ProactiveInsight>> supplier) {
    try {
      return supplier.get();
    } catch (RuntimeException e) {
      log.warn("Insight source '{}' failed: {}", source, e.getMessage());
      meterRegistry.counter("insights.source.failures", "source", source).increment();
      return List.of();
    }
  }

  private ProactiveInsight.ProactiveInsightBuilder baseInsight(String id) {
    LocalDateTime now = LocalDateTime.now();
    Duration lifetime = engineConfig.getInsights().getInsightLifetime();
    return ProactiveInsight.builder().id(id).createdAt(now).expiresAt(now.plus(lifetime));
  }

  private static boolean mentionsFollowUp(String content) {
    if (content == null) {
      return false;
    }
    String lower = content.toLowerCase(Locale.ROOT);
    return FOLLOW_UP_KEYWORDS.stream().anyMatch(lower::contains);
  }

  private static InsightType teamInsightType(String value) {
    return "growth_opportunity".equalsIgnoreCase(Optional.ofNullable(value).orElse("").trim())
        ? InsightType.GROWTH_OPPORTUNITY
        : InsightType.PREVENTIVE_ACTION;
  }

  private static String daysSince(LocalDateTime time) {
    if (time == null) {
      return "never";
    }
    long days = Duration.between(time, LocalDateTime.now()).toDays();
    return days + (days == 1 ? " day" : " days");
  }

  private static String starterDescription(String name, String days) {
    if ("never".equals(days)) {
      return "You haven't discussed " + name + " yet. A short check-in can set a good baseline.";
    }
    return "It has been " + days + " since you last discussed " + name + ". Consider checking in.";
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
