package com.flamingo.ai.mano.exception;

/** Thrown when the chat model cannot answer a coaching turn. */
public class LlmServiceException extends RuntimeException {

  private static final String UNAVAILABLE =
      "Mano is temporarily unavailable. Please try again later.";
  private static final String BUSY = "Mano is busy right now. Please try again in a moment.";

  private final boolean rateLimited;

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.rateLimited = isRateLimit(cause);
  }

  public LlmServiceException(String message, boolean rateLimited) {
    super(message);
    this.rateLimited = rateLimited;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return rateLimited ? BUSY : UNAVAILABLE;
  }

  private static boolean isRateLimit(Throwable cause) {
    String message = cause != null ? cause.getMessage() : null;
    return message != null && (message.contains("429") || message.contains("rate limit"));
  }
}
