package com.flamingo.ai.mano.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for SSE streaming chunks. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamChunkResponse {

  /** Event type: token, done, error. */
  private String eventType;

  private Object data;

  public static StreamChunkResponse token(String content) {
    return StreamChunkResponse.builder().eventType("token").data(new TokenData(content)).build();
  }

  public static StreamChunkResponse done(String messageId, int completionTokens) {
    return StreamChunkResponse.builder()
        .eventType("done")
        .data(new DoneData(messageId, completionTokens))
        .build();
  }

  public static StreamChunkResponse error(String errorId, String message) {
    return StreamChunkResponse.builder()
        .eventType("error")
        .data(new ErrorData(errorId, message))
        .build();
  }

  /** Token event data. */
  @Data
  @AllArgsConstructor
  public static class TokenData {
    private String content;
  }

  /** Done event data; {@code messageId} is the saved reply. */
  @Data
  @AllArgsConstructor
  public static class DoneData {
    private String messageId;
    private int completionTokens;
  }

  /** Error event data. */
  @Data
  @AllArgsConstructor
  public static class ErrorData {
    private String errorId;
    private String message;
  }
}
