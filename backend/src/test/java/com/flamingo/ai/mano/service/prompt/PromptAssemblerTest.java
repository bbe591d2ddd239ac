package com.flamingo.ai.mano.service.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.entity.UserProfile;
import com.flamingo.ai.mano.domain.enums.ConversationType;
import com.flamingo.ai.mano.domain.enums.MessageRole;
import com.flamingo.ai.mano.domain.enums.RelationshipType;
import com.flamingo.ai.mano.service.context.model.ConversationTarget;
import com.flamingo.ai.mano.service.context.model.ManagementContext;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PromptAssemblerTest {

  private final PromptAssembler assembler = new PromptAssembler(new ContextFormatter());

  private final ConversationTarget sarah =
      new ConversationTarget(
          ConversationType.PERSON,
          UUID.randomUUID(),
          null,
          "Sarah",
          null,
          RelationshipType.DIRECT_REPORT);

  private final UserProfile profile =
      UserProfile.builder()
          .userId("user-1")
          .callName("Alex")
          .jobRole("Engineering Manager")
          .company("Acme")
          .profileContext("Leads two platform teams.")
          .build();

  private static ChatMessage message(MessageRole role, String content) {
    return ChatMessage.builder().userId("user-1").role(role).content(content).build();
  }

  @Test
  @DisplayName("should fill every placeholder of the person template")
  void shouldRenderPersonPrompt() {
    String prompt =
        assembler.render(
            sarah,
            ManagementContext.empty(),
            List.of(
                message(MessageRole.USER, "How do I support Sarah?"),
                message(MessageRole.ASSISTANT, "Start with a 1:1.")),
            profile);

    assertThat(prompt)
        .contains("You are speaking with Alex, Engineering Manager at Acme.")
        .contains("Name: Sarah")
        .contains("Role: Team member")
        .contains("Relationship: direct_report")
        .contains("Manager: How do I support Sarah?\nMano: Start with a 1:1.")
        .contains("Profile Context for Alex:\nLeads two platform teams.")
        .contains("more than just Sarah")
        .doesNotContain("{name}")
        .doesNotContain("{management_context}")
        .doesNotContain("{conversation_history}");
  }

  @Test
  @DisplayName("should leave the profile section out of general prompts")
  void shouldOmitProfileForGeneralPrompt() {
    String prompt =
        assembler.render(
            ConversationTarget.general(), ManagementContext.empty(), List.of(), profile);

    assertThat(prompt)
        .contains("strategic thinking and leadership")
        .doesNotContain("Profile Context for");
  }

  @Test
  @DisplayName("should use the self template for self conversations")
  void shouldRenderSelfPrompt() {
    ConversationTarget self =
        new ConversationTarget(
            ConversationType.SELF, UUID.randomUUID(), null, "Me", null, RelationshipType.SELF);

    String prompt = assembler.render(self, ManagementContext.empty(), List.of(), null);

    assertThat(prompt)
        .contains("self-reflection and personal growth")
        .contains("You are speaking with a manager.");
  }

  @Test
  @DisplayName("should not expand placeholders that appear inside substituted values")
  void shouldSubstituteInSinglePass() {
    String prompt =
        assembler.render(
            ConversationTarget.general(),
            ManagementContext.empty(),
            List.of(message(MessageRole.USER, "What does {name} mean in a template?")),
            null);

    assertThat(prompt).contains("Manager: What does {name} mean in a template?");
  }

  @Nested
  @DisplayName("helpers")
  class HelperTests {

    @Test
    @DisplayName("historyText should keep only the last ten messages")
    void shouldTrimHistory() {
      List<ChatMessage> history = new ArrayList<>();
      for (int i = 0; i < 12; i++) {
        history.add(message(MessageRole.USER, "m" + i));
      }

      String text = assembler.historyText(history);

      assertThat(text.split("\n")).hasSize(PromptAssembler.HISTORY_LIMIT);
      assertThat(text).startsWith("Manager: m2").endsWith("Manager: m11");
    }

    @Test
    @DisplayName("userContext should degrade gracefully for partial profiles")
    void shouldBuildUserContext() {
      UserProfile nameOnly = UserProfile.builder().userId("user-1").callName("Alex").build();

      assertThat(assembler.userContext(nameOnly)).isEqualTo("You are speaking with Alex.");
      assertThat(assembler.userContext(null)).isEqualTo("You are speaking with a manager.");
    }
  }
}
