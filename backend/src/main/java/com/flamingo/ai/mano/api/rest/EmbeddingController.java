package com.flamingo.ai.mano.api.rest;

import com.flamingo.ai.mano.service.task.EmbeddingBackfillService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Triggers embedding of messages that are not searchable yet. */
@RestController
@RequestMapping("/api/embeddings")
@RequiredArgsConstructor
@Slf4j
public class EmbeddingController {

  private final EmbeddingBackfillService embeddingBackfillService;

  @PostMapping("/backfill")
  public ResponseEntity<Map<String, Object>> scheduleBackfill(@RequestParam String userId) {
    log.info("Embedding backfill requested for user {}", userId);
    boolean scheduled = embeddingBackfillService.scheduleBackfill(userId);
    return ResponseEntity.status(scheduled ? HttpStatus.ACCEPTED : HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("userId", userId, "scheduled", scheduled));
  }
}
