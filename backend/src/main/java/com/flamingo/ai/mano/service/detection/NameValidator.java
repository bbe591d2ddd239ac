package com.flamingo.ai.mano.service.detection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Filters capitalised words that look like names but are calendar words, products or nouns. */
@Component
public class NameValidator {

  private static final Pattern NAME_TOKEN =
      Pattern.compile("^[A-Z\\u00C0-\\u017F][a-zA-Z\\u00C0-\\u017F'-]*$");
  private static final Pattern DIGIT = Pattern.compile("\\d");

  static final Set<String> COMMON_WORDS =
      Set.of(
          // calendar
          "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
          "january", "february", "march", "april", "may", "june", "july", "august",
          "september", "october", "november", "december", "today", "tomorrow", "yesterday",
          // pronouns and determiners
          "i", "me", "my", "we", "us", "our", "you", "your", "he", "she", "they", "them",
          "his", "her", "their", "it", "its", "this", "that", "these", "those", "there",
          "here", "what", "when", "where", "who", "why", "how", "the", "a", "an", "and",
          "but", "or", "so", "if", "then", "also", "just", "everyone", "someone", "anyone",
          "nobody", "everybody",
          // work nouns
          "team", "manager", "boss", "meeting", "project", "company", "office", "client",
          "customer", "board", "management", "leadership", "engineering", "product", "sales",
          "marketing", "finance", "hr", "legal", "support", "operations", "design", "staff",
          "report", "review", "sprint", "standup", "roadmap", "budget", "quarter", "week",
          "month", "year", "morning", "afternoon", "evening",
          // words that double as names
          "will", "rose", "grace", "hope",
          // abstract nouns that open sentences like "Alignment is a problem"
          "alignment", "communication", "feedback", "performance", "workload", "priority",
          "priorities", "process", "strategy", "hiring", "training", "conflict", "motivation",
          "morale", "burnout", "capacity", "culture", "delivery", "quality", "scope",
          "deadline", "progress", "growth", "onboarding", "planning", "visibility", "ownership",
          "accountability", "collaboration", "trust", "retention", "velocity", "everything",
          "nothing", "something", "honestly", "overall", "transparency", "execution",
          // products and platforms
          "google", "microsoft", "slack", "zoom", "teams", "excel", "word", "powerpoint",
          "outlook", "jira", "confluence", "notion", "github", "linkedin", "apple", "amazon");

  /** Whether the text is a plausible person name. */
  public boolean isValidName(String name) {
    if (name == null) {
      return false;
    }
    String trimmed = name.trim();
    if (trimmed.length() < 2 || trimmed.length() > 30 || DIGIT.matcher(trimmed).find()) {
      return false;
    }
    String[] tokens = trimmed.split("\\s+");
    for (String token : tokens) {
      if (!NAME_TOKEN.matcher(token).matches()) {
        return false;
      }
      if (token.length() > 1 && token.equals(token.toUpperCase(Locale.ROOT))) {
        return false;
      }
    }
    return !isCommonWord(tokens[0]);
  }

  /**
   * Removes common words around a captured name, so "Then Sarah" and "Sarah Monday" both become
   * "Sarah".
   */
  public String stripCommonWords(String name) {
    List<String> kept = new ArrayList<>();
    for (String token : name.trim().split("\\s+")) {
      if (isCommonWord(token)) {
        if (kept.isEmpty()) {
          continue;
        }
        break;
      }
      kept.add(token);
    }
    return String.join(" ", kept);
  }

  /** Upper-cases the first letter of each name part and lower-cases the rest. */
  public String capitalizeName(String name) {
    String lower = name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length());
    boolean startOfPart = true;
    for (char c : lower.toCharArray()) {
      result.append(startOfPart ? Character.toUpperCase(c) : c);
      startOfPart = c == ' ' || c == '-' || c == '\'';
    }
    return result.toString();
  }

  private boolean isCommonWord(String token) {
    return COMMON_WORDS.contains(token.toLowerCase(Locale.ROOT));
  }
}
