package com.flamingo.ai.mano.service.context;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.enums.MessageRole;
import com.flamingo.ai.mano.service.context.model.ConversationTheme;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ThemeExtractorTest {

  private final ThemeExtractor extractor = new ThemeExtractor();

  private static ChatMessage message(String content) {
    return ChatMessage.builder()
        .userId("user-1")
        .role(MessageRole.USER)
        .content(content)
        .createdAt(LocalDateTime.now())
        .build();
  }

  @Test
  @DisplayName("should count theme mentions and sort by descending frequency")
  void shouldCountAndSortThemes() {
    List<ChatMessage> messages = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      messages.add(message("We talked about performance again"));
    }
    for (int i = 0; i < 2; i++) {
      messages.add(message("The deadline is slipping"));
    }
    for (int i = 0; i < 4; i++) {
      messages.add(message("Nothing notable today"));
    }

    List<ConversationTheme> themes = extractor.extract(messages, 5, 3);

    assertThat(themes).hasSize(2);
    assertThat(themes.get(0).theme()).isEqualTo("performance");
    assertThat(themes.get(0).frequency()).isEqualTo(4);
    assertThat(themes.get(1).theme()).isEqualTo("deadline");
    assertThat(themes.get(1).frequency()).isEqualTo(2);
  }

  @Test
  @DisplayName("should cap the result at the requested number of themes")
  void shouldCapThemes() {
    List<ChatMessage> messages =
        List.of(
            message("performance feedback goals career development project deadline"),
            message("communication team workload process meeting"));

    assertThat(extractor.extract(messages, 5, 3)).hasSize(5);
  }

  @Test
  @DisplayName("should count a message once per theme and match case-insensitively")
  void shouldCountMessageOncePerTheme() {
    List<ConversationTheme> themes =
        extractor.extract(List.of(message("FEEDBACK on feedback about Feedback")), 5, 3);

    assertThat(themes).singleElement().satisfies(t -> assertThat(t.frequency()).isEqualTo(1));
  }

  @Test
  @DisplayName("should keep at most the requested examples, truncated, and the people involved")
  void shouldCollectExamplesAndPeople() {
    UUID personId = UUID.randomUUID();
    String longText = "performance " + "x".repeat(200);
    List<ChatMessage> messages = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      ChatMessage m = message(longText);
      m.setPersonId(personId);
      messages.add(m);
    }

    ConversationTheme theme = extractor.extract(messages, 5, 3).get(0);

    assertThat(theme.examples()).hasSize(3);
    assertThat(theme.examples().get(0)).hasSize(ThemeExtractor.EXAMPLE_LENGTH);
    assertThat(theme.peopleInvolved()).containsExactly(personId.toString());
    assertThat(theme.lastMentioned()).isNotNull();
  }

  @Test
  @DisplayName("should return no themes for an empty window")
  void shouldHandleEmptyInput() {
    assertThat(extractor.extract(List.of(), 5, 3)).isEmpty();
    assertThat(extractor.labelsIn(null)).isEmpty();
  }

  @Test
  @DisplayName("should list labels found in free text in table order")
  void shouldFindLabelsInText() {
    assertThat(extractor.labelsIn("Hiring plan and a conflict about the project"))
        .containsExactly("project", "hiring", "conflict");
  }
}
