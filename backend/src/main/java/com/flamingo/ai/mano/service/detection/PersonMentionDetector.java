package com.flamingo.ai.mano.service.detection;

import com.flamingo.ai.mano.agent.AgentInvoker;
import com.flamingo.ai.mano.agent.AgentResult;
import com.flamingo.ai.mano.agent.PersonValidationAgent;
import com.flamingo.ai.mano.agent.dto.PersonValidationResult;
import com.flamingo.ai.mano.config.EngineConfig;
import com.flamingo.ai.mano.domain.enums.DetectionMethod;
import com.flamingo.ai.mano.domain.enums.RelationshipType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds people mentioned in a manager's message who are not on the roster yet.
 *
 * <p>Detection is tiered. Phrase patterns propose candidates, {@link NameValidator} removes
 * non-names and a context bonus rewards work vocabulary. When enabled, a model then scores each
 * candidate and only plausible ones survive. If the model is unavailable the pattern result is
 * used as is; if the pattern battery itself fails a single basic pattern runs instead.
 */
@Service
@Slf4j
public class PersonMentionDetector {

  static final Set<String> WORK_CONTEXT_KEYWORDS =
      Set.of(
          "work", "manage", "report", "team", "colleague", "boss", "staff", "meeting",
          "discuss", "talk", "call", "email", "collaborate");

  private static final int VALIDATION_KEY_PREFIX = 100;
  private static final int CONTEXT_SNIPPET_LENGTH = 80;

  private final NameValidator nameValidator;
  private final PersonValidationAgent personValidationAgent;
  private final AgentInvoker agentInvoker;
  private final EngineConfig engineConfig;
  private final MeterRegistry meterRegistry;
  private final Cache<String, PersonValidationResult> validationCache;

  public PersonMentionDetector(
      NameValidator nameValidator,
      PersonValidationAgent personValidationAgent,
      AgentInvoker agentInvoker,
      EngineConfig engineConfig,
      MeterRegistry meterRegistry) {
    this.nameValidator = nameValidator;
    this.personValidationAgent = personValidationAgent;
    this.agentInvoker = agentInvoker;
    this.engineConfig = engineConfig;
    this.meterRegistry = meterRegistry;
    EngineConfig.Detection config = engineConfig.getDetection();
    this.validationCache =
        Caffeine.newBuilder()
            .maximumSize(config.getValidationCacheSize())
            .expireAfterWrite(config.getValidationCacheTtl())
            .build();
  }

  /**
   * Detects people in {@code message}.
   *
   * @param userId the manager, used for logging
   * @param message the manager's message
   * @param existingNames roster names to ignore
   * @return candidates at or above the confidence floor, highest confidence first
   */
  @Timed(value = "person.detection", description = "Time to detect people in a message")
  public PersonDetectionResult detect(
      String userId, String message, Collection<String> existingNames) {
    if (message == null || message.isBlank()) {
      return PersonDetectionResult.empty(DetectionMethod.PATTERN_ONLY);
    }
    Collection<String> known = existingNames != null ? existingNames : List.of();

    List<DetectedPerson> candidates;
    try {
      candidates = detectWithPatterns(message, known);
    } catch (RuntimeException e) {
      log.warn("Pattern detection failed for user {}, using basic fallback", userId, e);
      return finish(basicFallback(message, known), DetectionMethod.BASIC_FALLBACK);
    }

    if (candidates.isEmpty()
        || !engineConfig.getDetection().isAiValidationEnabled()
        || personValidationAgent == null) {
      return finish(candidates, DetectionMethod.PATTERN_ONLY);
    }

    AgentResult<PersonValidationResult> validation = validate(message, candidates);
    if (validation.value().isEmpty()) {
      log.debug("Validation unavailable for user {}, keeping pattern candidates", userId);
      return finish(candidates, DetectionMethod.PATTERN_ONLY);
    }
    return finish(
        applyValidation(candidates, validation.value().get()), DetectionMethod.AI_VALIDATED);
  }

  /** Runs the full pattern battery with name validation and the context bonus. */
  List<DetectedPerson> detectWithPatterns(String message, Collection<String> existingNames) {
    Map<String, DetectedPerson> byName = new LinkedHashMap<>();
    for (MentionPattern pattern : MentionPattern.DEFAULT_PATTERNS) {
      collect(pattern, message, existingNames, byName);
    }
    double bonus = hasWorkContext(message) ? engineConfig.getDetection().getContextBonus() : 0.0;
    return byName.values().stream()
        .map(person -> person.withConfidence(Math.min(person.confidence() + bonus, 1.0)))
        .toList();
  }

  /** Single-pattern scan used when the battery cannot run. */
  List<DetectedPerson> basicFallback(String message, Collection<String> existingNames) {
    Map<String, DetectedPerson> byName = new LinkedHashMap<>();
    try {
      collect(MentionPattern.BASIC_FALLBACK, message, existingNames, byName);
    } catch (RuntimeException e) {
      log.warn("Basic person detection failed: {}", e.getMessage());
      return List.of();
    }
    return new ArrayList<>(byName.values());
  }

  private void collect(
      MentionPattern pattern,
      String message,
      Collection<String> existingNames,
      Map<String, DetectedPerson> byName) {
    Matcher matcher = pattern.regex().matcher(message);
    while (matcher.find()) {
      String raw = nameValidator.stripCommonWords(matcher.group(1));
      if (!nameValidator.isValidName(raw)) {
        continue;
      }
      String name = nameValidator.capitalizeName(raw);
      if (isKnown(name, existingNames)) {
        continue;
      }
      DetectedPerson candidate =
          new DetectedPerson(
              name,
              group(matcher, pattern.roleGroup()),
              relationshipOf(pattern, matcher),
              pattern.baseConfidence(),
              snippet(matcher.group()),
              null);
      byName.merge(name.toLowerCase(Locale.ROOT), candidate, DetectedPerson::mergeWith);
    }
  }

  private RelationshipType relationshipOf(MentionPattern pattern, Matcher matcher) {
    if (pattern.relationshipGroup() > 0) {
      return MentionPattern.relationshipFromWord(matcher.group(pattern.relationshipGroup()));
    }
    return pattern.relationship();
  }

  private AgentResult<PersonValidationResult> validate(
      String message, List<DetectedPerson> candidates) {
    String key = validationKey(message, candidates);
    PersonValidationResult cached = validationCache.getIfPresent(key);
    if (cached != null) {
      meterRegistry.counter("person.validation.cache", "result", "hit").increment();
      return new AgentResult.Success<>(cached);
    }
    meterRegistry.counter("person.validation.cache", "result", "miss").increment();
    String names =
        candidates.stream().map(DetectedPerson::name).collect(Collectors.joining(", "));
    AgentResult<PersonValidationResult> result =
        agentInvoker.invoke(
            "person-validation",
            () -> personValidationAgent.validate(message, names),
            value -> value.validations() != null);
    result.value().ifPresent(value -> validationCache.put(key, value));
    return result;
  }

  private List<DetectedPerson> applyValidation(
      List<DetectedPerson> candidates, PersonValidationResult validation) {
    Map<String, Integer> scores = new HashMap<>();
    for (PersonValidationResult.NameScore score : validation.validations()) {
      if (score != null && score.name() != null && score.score() != null) {
        scores.put(score.name().trim().toLowerCase(Locale.ROOT), score.score());
      }
    }
    int minScore = engineConfig.getDetection().getAiMinScore();
    List<DetectedPerson> validated = new ArrayList<>();
    for (DetectedPerson candidate : candidates) {
      Integer score = scores.get(candidate.name().toLowerCase(Locale.ROOT));
      if (score == null || score < minScore) {
        log.debug("Candidate '{}' rejected by validation (score {})", candidate.name(), score);
        continue;
      }
      double confidence = Math.min(candidate.confidence() + score / 10.0 * 0.3, 1.0);
      validated.add(candidate.withAiScore(score, confidence));
    }
    return validated;
  }

  private PersonDetectionResult finish(List<DetectedPerson> candidates, DetectionMethod method) {
    double floor = engineConfig.getDetection().getConfidenceFloor();
    Map<String, DetectedPerson> unique = new LinkedHashMap<>();
    candidates.stream()
        .filter(person -> person.confidence() >= floor)
        .sorted(Comparator.comparingDouble(DetectedPerson::confidence).reversed())
        .forEach(person -> unique.putIfAbsent(person.name().toLowerCase(Locale.ROOT), person));
    meterRegistry
        .counter("person.detection.runs", "method", method.name().toLowerCase(Locale.ROOT))
        .increment();
    return new PersonDetectionResult(new ArrayList<>(unique.values()), method);
  }

  private boolean isKnown(String name, Collection<String> existingNames) {
    String lower = name.toLowerCase(Locale.ROOT);
    for (String existing : existingNames) {
      if (existing == null) {
        continue;
      }
      String known = existing.trim().toLowerCase(Locale.ROOT);
      if (known.equals(lower) || known.split("\\s+")[0].equals(lower)) {
        return true;
      }
    }
    return false;
  }

  private boolean hasWorkContext(String message) {
    String lower = message.toLowerCase(Locale.ROOT);
    return WORK_CONTEXT_KEYWORDS.stream().anyMatch(lower::contains);
  }

  private String validationKey(String message, List<DetectedPerson> candidates) {
    String prefix = message.substring(0, Math.min(message.length(), VALIDATION_KEY_PREFIX));
    String names =
        candidates.stream()
            .map(person -> person.name().toLowerCase(Locale.ROOT))
            .sorted()
            .collect(Collectors.joining(","));
    return prefix + "|" + names;
  }

  private static String group(Matcher matcher, int index) {
    if (index <= 0) {
      return null;
    }
    String value = matcher.group(index);
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static String snippet(String text) {
    String trimmed = Objects.requireNonNullElse(text, "").trim();
    return trimmed.length() > CONTEXT_SNIPPET_LENGTH
        ? trimmed.substring(0, CONTEXT_SNIPPET_LENGTH)
        : trimmed;
  }
}
