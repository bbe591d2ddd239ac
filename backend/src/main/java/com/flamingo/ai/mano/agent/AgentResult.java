package com.flamingo.ai.mano.agent;

import java.util.Optional;

/**
 * Outcome of a structured model call. Callers branch on the variant right after the call so
 * nothing downstream sees an unvalidated model response.
 *
 * @param <T> the structured output type
 */
public sealed interface AgentResult<T>
    permits AgentResult.Success, AgentResult.ParseFailure, AgentResult.ServiceFailure {

  /** The call succeeded and the output passed validation. */
  record Success<T>(T output) implements AgentResult<T> {}

  /** The model answered, but the output was missing, malformed or failed validation. */
  record ParseFailure<T>(String reason) implements AgentResult<T> {}

  /** The model could not be reached, timed out or returned an error. */
  record ServiceFailure<T>(Throwable cause) implements AgentResult<T> {}

  default boolean isSuccess() {
    return this instanceof Success;
  }

  default Optional<T> value() {
    if (this instanceof Success<T> success) {
      return Optional.of(success.output());
    }
    return Optional.empty();
  }

  /** Short description of the failure, or {@code "ok"}. */
  default String describe() {
    if (this instanceof ParseFailure<T> parseFailure) {
      return "parse failure: " + parseFailure.reason();
    }
    if (this instanceof ServiceFailure<T> serviceFailure) {
      return "service failure: " + serviceFailure.cause().getMessage();
    }
    return "ok";
  }
}
