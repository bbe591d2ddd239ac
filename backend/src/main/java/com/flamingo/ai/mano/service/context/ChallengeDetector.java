package com.flamingo.ai.mano.service.context;

import com.flamingo.ai.mano.domain.entity.ChatMessage;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Detects management challenges from a fixed label to keyword table. */
@Component
public class ChallengeDetector {

  /** A challenge label and the phrases that signal it. */
  public record ChallengeRule(String label, List<String> keywords) {

    boolean matches(String lowerCaseText) {
      return keywords.stream().anyMatch(lowerCaseText::contains);
    }
  }

  public static final List<ChallengeRule> RULES =
      List.of(
          new ChallengeRule(
              "Team Communication",
              List.of("miscommunication", "unclear", "confusion", "alignment")),
          new ChallengeRule(
              "Workload Management", List.of("overwhelmed", "too much", "burnout", "capacity")),
          new ChallengeRule(
              "Performance Issues",
              List.of("underperforming", "concerns", "improvement", "not meeting")),
          new ChallengeRule(
              "Process Problems", List.of("inefficient", "broken process", "bottleneck", "delays")),
          new ChallengeRule(
              "Stakeholder Management",
              List.of("stakeholder pressure", "expectations", "demands")));

  /** Returns each label at most once, in table order, if any of its keywords occurs. */
  public List<String> detect(List<ChatMessage> messages) {
    String corpus =
        messages.stream()
            .map(ChatMessage::getContent)
            .filter(Objects::nonNull)
            .collect(Collectors.joining(" "))
            .toLowerCase(Locale.ROOT);
    if (corpus.isBlank()) {
      return List.of();
    }
    return RULES.stream().filter(rule -> rule.matches(corpus)).map(ChallengeRule::label).toList();
  }
}
