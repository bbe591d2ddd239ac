package com.flamingo.ai.mano.service.context.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A discussion theme detected in a window of messages.
 *
 * @param theme theme label from the keyword table
 * @param frequency number of messages mentioning the theme
 * @param peopleInvolved ids of the people whose conversations mention it
 * @param lastMentioned most recent message mentioning it
 * @param examples up to three message snippets
 */
public record ConversationTheme(
    String theme,
    int frequency,
    List<String> peopleInvolved,
    LocalDateTime lastMentioned,
    List<String> examples) {

  public ConversationTheme {
    peopleInvolved = peopleInvolved == null ? List.of() : List.copyOf(peopleInvolved);
    examples = examples == null ? List.of() : List.copyOf(examples);
  }
}
