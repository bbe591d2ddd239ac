package com.flamingo.ai.mano.api.rest;

import com.flamingo.ai.mano.service.context.ManagementContextService;
import com.flamingo.ai.mano.service.context.model.ConversationTarget;
import com.flamingo.ai.mano.service.context.model.ManagementContext;
import com.flamingo.ai.mano.service.insight.ProactiveInsight;
import com.flamingo.ai.mano.service.insight.ProactiveInsightService;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Proactive insights for the whole team or a single person. */
@RestController
@RequestMapping("/api/insights")
@RequiredArgsConstructor
public class InsightController {

  private final ManagementContextService managementContextService;
  private final ProactiveInsightService proactiveInsightService;

  @GetMapping
  public ResponseEntity<List<ProactiveInsight>> getInsights(
      @RequestParam String userId, @RequestParam(required = false) UUID personId) {
    if (personId != null) {
      return ResponseEntity.ok(proactiveInsightService.generateForPerson(userId, personId));
    }
    ManagementContext context =
        managementContextService.buildContextWithInsights(
            userId, ConversationTarget.general(), null);
    return ResponseEntity.ok(Objects.requireNonNullElse(context.proactiveInsights(), List.of()));
  }
}
