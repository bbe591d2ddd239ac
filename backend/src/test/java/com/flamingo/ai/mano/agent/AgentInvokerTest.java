package com.flamingo.ai.mano.agent;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.JsonParseException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AgentInvokerTest {

  private SimpleMeterRegistry meterRegistry;
  private AgentInvoker invoker;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    invoker = new AgentInvoker(meterRegistry);
  }

  private double calls(String agent, String outcome) {
    return meterRegistry.counter("agent.calls", "agent", agent, "outcome", outcome).count();
  }

  @Test
  @DisplayName("should wrap a valid response in Success")
  void shouldReturnSuccess() {
    AgentResult<String> result = invoker.invoke("test", () -> "ok");

    assertThat(result).isInstanceOf(AgentResult.Success.class);
    assertThat(result.value()).contains("ok");
    assertThat(result.describe()).isEqualTo("ok");
    assertThat(calls("test", "success")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should report a null response as a parse failure")
  void shouldTreatNullAsParseFailure() {
    AgentResult<String> result = invoker.invoke("test", () -> null);

    assertThat(result).isInstanceOf(AgentResult.ParseFailure.class);
    assertThat(result.value()).isEmpty();
  }

  @Test
  @DisplayName("should report a response rejected by the validator as a parse failure")
  void shouldTreatRejectedOutputAsParseFailure() {
    AgentResult<Integer> result = invoker.invoke("score", () -> 42, score -> score <= 10);

    assertThat(result).isInstanceOf(AgentResult.ParseFailure.class);
    assertThat(calls("score", "parse_failure")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should classify a JSON error in the cause chain as a parse failure")
  void shouldClassifyJsonErrorsAsParseFailure() {
    AgentResult<String> result =
        invoker.invoke(
            "test",
            () -> {
              throw new IllegalStateException(
                  "could not map", new JsonParseException(null, "Unexpected character"));
            });

    assertThat(result).isInstanceOf(AgentResult.ParseFailure.class);
  }

  @Test
  @DisplayName("should not treat an unrelated exception as a parse failure because of its name")
  void shouldClassifyByExceptionTypeOnly() {
    AgentResult<String> result =
        invoker.invoke(
            "test",
            () -> {
              throw new ConfigParsingException("bad proxy settings");
            });

    assertThat(result).isInstanceOf(AgentResult.ServiceFailure.class);
    assertThat(calls("test", "service_failure")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should classify other errors as service failures without throwing")
  void shouldClassifyOtherErrorsAsServiceFailure() {
    AgentResult<String> result =
        invoker.invoke(
            "test",
            () -> {
              throw new IllegalStateException("connection refused");
            });

    assertThat(result).isInstanceOf(AgentResult.ServiceFailure.class);
    assertThat(result.describe()).contains("connection refused");
    assertThat(calls("test", "service_failure")).isEqualTo(1.0);
  }

  /** A service error whose class name happens to mention parsing. */
  private static class ConfigParsingException extends RuntimeException {
    ConfigParsingException(String message) {
      super(message);
    }
  }
}
