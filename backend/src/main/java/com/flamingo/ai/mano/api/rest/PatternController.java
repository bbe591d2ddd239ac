package com.flamingo.ai.mano.api.rest;

import com.flamingo.ai.mano.api.dto.response.PatternResponse;
import com.flamingo.ai.mano.domain.entity.RecurringPattern;
import com.flamingo.ai.mano.service.learning.LearningInsight;
import com.flamingo.ai.mano.service.learning.LearningService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Recurring patterns learned from conversations and the advice derived from them. */
@RestController
@RequestMapping("/api/patterns")
@RequiredArgsConstructor
public class PatternController {

  private final LearningService learningService;

  @GetMapping
  public ResponseEntity<List<PatternResponse>> listPatterns(
      @RequestParam String userId, @RequestParam(required = false) UUID personId) {
    List<RecurringPattern> patterns =
        personId != null
            ? learningService.getPersonPatterns(userId, personId)
            : learningService.getPatterns(userId);
    return ResponseEntity.ok(patterns.stream().map(PatternResponse::fromEntity).toList());
  }

  @GetMapping("/insights")
  public ResponseEntity<List<LearningInsight>> getPatternInsights(
      @RequestParam String userId, @RequestParam(required = false) UUID personId) {
    return ResponseEntity.ok(learningService.getInsights(userId, personId));
  }
}
