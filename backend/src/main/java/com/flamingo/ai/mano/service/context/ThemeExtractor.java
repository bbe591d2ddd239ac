package com.flamingo.ai.mano.service.context;

import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.service.context.model.ConversationTheme;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Keyword-table theme detection. A message counts once towards every theme whose keyword it
 * contains (case-insensitive substring match).
 */
@Component
public class ThemeExtractor {

  /** Theme labels, each matched by its own name. Order breaks frequency ties. */
  public static final List<String> THEMES =
      List.of(
          "performance",
          "feedback",
          "goals",
          "career",
          "development",
          "project",
          "deadline",
          "communication",
          "team",
          "workload",
          "process",
          "meeting",
          "stakeholder",
          "priority",
          "decision",
          "hiring",
          "training",
          "conflict",
          "motivation",
          "strategy");

  static final int EXAMPLE_LENGTH = 100;

  /**
   * Counts theme mentions across {@code messages}.
   *
   * @param messages messages to scan, newest first so examples are the most recent ones
   * @param maxThemes number of themes to keep
   * @param maxExamples number of snippets to keep per theme
   * @return themes sorted by descending frequency
   */
  public List<ConversationTheme> extract(
      List<ChatMessage> messages, int maxThemes, int maxExamples) {
    Map<String, ThemeAccumulator> accumulators = new LinkedHashMap<>();
    for (ChatMessage message : messages) {
      if (message.getContent() == null) {
        continue;
      }
      String content = message.getContent().toLowerCase(Locale.ROOT);
      for (String theme : THEMES) {
        if (content.contains(theme)) {
          accumulators
              .computeIfAbsent(theme, ThemeAccumulator::new)
              .add(message, maxExamples);
        }
      }
    }

    return accumulators.values().stream()
        .sorted(Comparator.comparingInt(ThemeAccumulator::frequency).reversed())
        .limit(maxThemes)
        .map(ThemeAccumulator::toTheme)
        .toList();
  }

  /** Theme labels only, most frequent first. */
  public List<String> extractLabels(List<ChatMessage> messages, int maxThemes) {
    return extract(messages, maxThemes, 0).stream().map(ConversationTheme::theme).toList();
  }

  /** Theme labels found in free text, in table order. */
  public List<String> labelsIn(String text) {
    if (text == null) {
      return List.of();
    }
    String lower = text.toLowerCase(Locale.ROOT);
    return THEMES.stream().filter(lower::contains).toList();
  }

  private static final class ThemeAccumulator {
    private final String theme;
    private final List<String> examples = new ArrayList<>();
    private final Set<String> people = new LinkedHashSet<>();
    private int frequency;
    private LocalDateTime lastMentioned;

    ThemeAccumulator(String theme) {
      this.theme = theme;
    }

    void add(ChatMessage message, int maxExamples) {
      frequency++;
      if (examples.size() < maxExamples) {
        String content = message.getContent();
        examples.add(
            content.length() > EXAMPLE_LENGTH ? content.substring(0, EXAMPLE_LENGTH) : content);
      }
      if (message.getPersonId() != null) {
        people.add(message.getPersonId().toString());
      }
      if (message.getCreatedAt() != null
          && (lastMentioned == null || message.getCreatedAt().isAfter(lastMentioned))) {
        lastMentioned = message.getCreatedAt();
      }
    }

    int frequency() {
      return frequency;
    }

    ConversationTheme toTheme() {
      return new ConversationTheme(
          theme, frequency, new ArrayList<>(people), lastMentioned, examples);
    }
  }
}
