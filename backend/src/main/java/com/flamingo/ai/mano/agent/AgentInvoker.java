package com.flamingo.ai.mano.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.langchain4j.service.output.OutputParsingException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs agent calls and turns their outcome into an {@link AgentResult}. Exceptions never escape:
 * output that cannot be parsed becomes a {@link AgentResult.ParseFailure}, everything else a
 * {@link AgentResult.ServiceFailure}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentInvoker {

  private final MeterRegistry meterRegistry;

  public <T> AgentResult<T> invoke(String agentName, Supplier<T> call) {
    return invoke(agentName, call, value -> true);
  }

  /**
   * Invokes {@code call} and validates its output.
   *
   * @param agentName name used for logs and metrics
   * @param call the agent call
   * @param validator output check; a rejected output is reported as a parse failure
   */
  public <T> AgentResult<T> invoke(String agentName, Supplier<T> call, Predicate<T> validator) {
    AgentResult<T> result;
    try {
      T value = call.get();
      if (value == null) {
        result = new AgentResult.ParseFailure<>("empty response");
      } else if (!validator.test(value)) {
        result = new AgentResult.ParseFailure<>("response failed validation");
      } else {
        result = new AgentResult.Success<>(value);
      }
    } catch (RuntimeException e) {
      result =
          isParseError(e)
              ? new AgentResult.ParseFailure<>(e.getMessage())
              : new AgentResult.ServiceFailure<>(e);
    }

    String outcome =
        result instanceof AgentResult.Success
            ? "success"
            : result instanceof AgentResult.ParseFailure ? "parse_failure" : "service_failure";
    meterRegistry.counter("agent.calls", "agent", agentName, "outcome", outcome).increment();
    if (!result.isSuccess()) {
      log.warn("Agent {} failed: {}", agentName, result.describe());
    }
    return result;
  }

  private boolean isParseError(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof JsonProcessingException
          || current instanceof OutputParsingException) {
        return true;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return false;
  }
}
