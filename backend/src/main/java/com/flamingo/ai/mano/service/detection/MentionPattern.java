package com.flamingo.ai.mano.service.detection;

import com.flamingo.ai.mano.domain.enums.RelationshipType;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A phrase pattern that introduces a person. Group 1 always captures the name. Lead-in phrases
 * are case-insensitive while names must start with an upper-case letter.
 *
 * @param label short name used in logs
 * @param regex compiled pattern
 * @param baseConfidence confidence assigned to a match before validation
 * @param relationship relationship implied by the phrase, or null
 * @param roleGroup capture group holding a role, or 0
 * @param relationshipGroup capture group holding a relationship word, or 0
 */
public record MentionPattern(
    String label,
    Pattern regex,
    double baseConfidence,
    RelationshipType relationship,
    int roleGroup,
    int relationshipGroup) {

  /** One or two capitalised words, e.g. "Sarah" or "Sarah Chen". */
  static final String NAME = "(\\p{Lu}[\\p{L}'-]+(?:[ ]\\p{Lu}[\\p{L}'-]+)?)";

  public static final List<MentionPattern> DEFAULT_PATTERNS =
      List.of(
          new MentionPattern(
              "collaboration",
              Pattern.compile(
                  "(?i:\\b(?:work(?:ing|ed)?|collaborat(?:e|ing|ed)|partner(?:ing|ed)?"
                      + "|team(?:ing)?\\s+up|paired)\\s+with)\\s+"
                      + NAME),
              0.7,
              RelationshipType.PEER,
              0,
              0),
          new MentionPattern(
              "manager",
              Pattern.compile(
                  "(?i:\\b(?:my|our)\\s+(?:manager|boss|supervisor|skip[- ]level)"
                      + "|\\breports?\\s+to|\\breporting\\s+to|\\bled\\s+by|\\blead\\s+by),?\\s+"
                      + NAME),
              0.8,
              RelationshipType.MANAGER,
              0,
              0),
          new MentionPattern(
              "direct_report",
              Pattern.compile(
                  "(?i:\\bI\\s+manage|\\bmanaging|\\bmy\\s+(?:team\\s+member|direct\\s+report)"
                      + "|\\bdirect\\s+report),?\\s+"
                      + NAME),
              0.8,
              RelationshipType.DIRECT_REPORT,
              0,
              0),
          new MentionPattern(
              "appositive",
              Pattern.compile(
                  "\\b"
                      + NAME
                      + ",\\s+(?i:(?:my|our)\\s+(direct\\s+report|report|manager|boss|supervisor"
                      + "|peer|colleague|teammate|stakeholder))\\b"),
              0.8,
              null,
              0,
              2),
          new MentionPattern(
              "role_in_parentheses",
              Pattern.compile("\\b" + NAME + "\\s+\\(([^()]{2,40})\\)"),
              0.9,
              null,
              2,
              0),
          new MentionPattern(
              "role_statement",
              Pattern.compile(
                  "\\b"
                      + NAME
                      + "\\s+(?i:is\\s+(?:a|an|the|our|my)|works\\s+as\\s+(?:a|an|the)?)\\s+"
                      + "([a-z][a-zA-Z -]{2,40}?)(?=[.,;!?]|$)"),
              0.9,
              null,
              2,
              0),
          new MentionPattern(
              "joint",
              Pattern.compile("\\b" + NAME + "\\s+(?i:and\\s+(?:I|me|myself))\\b"),
              0.6,
              RelationshipType.PEER,
              0,
              0),
          new MentionPattern(
              "meeting",
              Pattern.compile(
                  "(?i:(?:\\bmeeting|\\bmet|\\b1:1|\\bone-on-one|\\b1-on-1|\\bcatch-up|\\bsync)"
                      + "\\s+with|\\btalked\\s+(?:to|with)|\\bspoke\\s+(?:to|with)"
                      + "|\\bdiscussed\\s+with|\\bcalled|\\bchatted\\s+with)\\s+"
                      + NAME),
              0.7,
              RelationshipType.STAKEHOLDER,
              0,
              0),
          new MentionPattern(
              "discussed_with",
              Pattern.compile("(?i:\\bdiscussed\\b[^.?!]{1,60}?\\bwith)\\s+" + NAME),
              0.7,
              RelationshipType.STAKEHOLDER,
              0,
              0),
          new MentionPattern(
              "email",
              Pattern.compile("(?i:\\bemail(?:ed)?|\\bmessaged|\\bpinged)\\s+" + NAME),
              0.7,
              RelationshipType.STAKEHOLDER,
              0,
              0),
          new MentionPattern(
              "hyphenated",
              Pattern.compile(
                  "\\b(\\p{Lu}[\\p{L}']+-\\p{Lu}[\\p{L}']+)"
                      + "\\s+(?i:is|was|has|will|said|mentioned)\\b"),
              0.8,
              null,
              0,
              0));

  /** Single fallback pattern used when the full battery cannot run. */
  public static final MentionPattern BASIC_FALLBACK =
      new MentionPattern(
          "basic",
          Pattern.compile("(?i:\\bwork(?:ing)?\\s+with)\\s+" + NAME),
          0.7,
          RelationshipType.PEER,
          0,
          0);

  /** Maps a relationship word from an appositive phrase to a relationship kind. */
  static RelationshipType relationshipFromWord(String word) {
    if (word == null) {
      return null;
    }
    String normalized = word.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    return switch (normalized) {
      case "direct report", "report" -> RelationshipType.DIRECT_REPORT;
      case "manager", "boss", "supervisor" -> RelationshipType.MANAGER;
      case "peer", "colleague", "teammate" -> RelationshipType.PEER;
      case "stakeholder" -> RelationshipType.STAKEHOLDER;
      default -> null;
    };
  }
}
