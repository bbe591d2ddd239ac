package com.flamingo.ai.mano.api.rest;

import com.flamingo.ai.mano.api.dto.response.ContextPreviewResponse;
import com.flamingo.ai.mano.service.chat.ConversationTargetService;
import com.flamingo.ai.mano.service.context.ManagementContextService;
import com.flamingo.ai.mano.service.context.model.ConversationTarget;
import com.flamingo.ai.mano.service.context.model.ManagementContext;
import com.flamingo.ai.mano.service.prompt.ContextFormatter;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Shows the management context Mano would use for a message. */
@RestController
@RequestMapping("/api/context")
@RequiredArgsConstructor
public class ContextController {

  private final ConversationTargetService targetService;
  private final ManagementContextService managementContextService;
  private final ContextFormatter contextFormatter;

  /**
   * Builds a context preview.
   *
   * @param userId the manager
   * @param personId person conversation, optional
   * @param topicId topic conversation, optional
   * @param query message to search past discussions with, optional
   */
  @GetMapping
  public ResponseEntity<ContextPreviewResponse> previewContext(
      @RequestParam String userId,
      @RequestParam(required = false) UUID personId,
      @RequestParam(required = false) UUID topicId,
      @RequestParam(required = false) String query) {
    ConversationTarget target = targetService.resolve(userId, personId, topicId);
    ManagementContext context = managementContextService.buildContext(userId, target, query);
    String formatted = contextFormatter.formatContext(context, target.type(), target.name());
    return ResponseEntity.ok(ContextPreviewResponse.from(target.type(), context, formatted));
  }
}
