package com.flamingo.ai.mano.service.detection;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class NameValidatorTest {

  private final NameValidator validator = new NameValidator();

  @Nested
  @DisplayName("isValidName")
  class IsValidNameTests {

    @ParameterizedTest
    @ValueSource(strings = {"Sarah", "Sarah Chen", "Mary-Jane", "O'Brien", "José"})
    @DisplayName("should accept plausible names")
    void shouldAcceptNames(String name) {
      assertThat(validator.isValidName(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(
        strings = {
          "Monday", "May", "Slack", "Team", "The Board", "NASA", "R2d2", "sarah", "A", "Alignment"
        })
    @DisplayName("should reject calendar words, products, acronyms and lower-case words")
    void shouldRejectNonNames(String name) {
      assertThat(validator.isValidName(name)).isFalse();
    }

    @Test
    @DisplayName("should reject null and overly long text")
    void shouldRejectNullAndLongText() {
      assertThat(validator.isValidName(null)).isFalse();
      assertThat(validator.isValidName("Abcdefghijklmnop Qrstuvwxyzabcdefg")).isFalse();
    }
  }

  @Nested
  @DisplayName("stripCommonWords")
  class StripCommonWordsTests {

    @Test
    @DisplayName("should drop leading common words")
    void shouldDropLeadingWords() {
      assertThat(validator.stripCommonWords("Then Bob")).isEqualTo("Bob");
    }

    @Test
    @DisplayName("should cut at the first trailing common word")
    void shouldCutTrailingWords() {
      assertThat(validator.stripCommonWords("Sarah Monday")).isEqualTo("Sarah");
    }

    @Test
    @DisplayName("should return an empty string when only common words remain")
    void shouldReturnEmptyForCommonWordsOnly() {
      assertThat(validator.stripCommonWords("Jira")).isEmpty();
    }
  }

  @Test
  @DisplayName("capitalizeName should normalise case of each name part")
  void shouldCapitalizeName() {
    assertThat(validator.capitalizeName("mary-jane  o'brien")).isEqualTo("Mary-Jane O'Brien");
    assertThat(validator.capitalizeName("SARAH chen")).isEqualTo("Sarah Chen");
  }
}
