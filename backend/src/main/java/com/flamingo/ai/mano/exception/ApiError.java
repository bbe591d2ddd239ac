package com.flamingo.ai.mano.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String PERSON_NOT_FOUND = "PERSON_001";
  public static final String TOPIC_NOT_FOUND = "TOPIC_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Short id that also appears in the server log. */
  private final String errorId;

  private final String code;

  /** Message safe to show to the manager. */
  private final String message;

  private final Instant timestamp;

  private final String path;
}
