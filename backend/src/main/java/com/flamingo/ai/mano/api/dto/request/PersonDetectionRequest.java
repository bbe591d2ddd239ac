package com.flamingo.ai.mano.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for detecting people mentioned in a message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonDetectionRequest {

  @NotBlank(message = "User id is required")
  private String userId;

  @NotBlank(message = "Message is required")
  @Size(max = 10000, message = "Message must not exceed 10000 characters")
  private String message;

  /** Names to ignore. When null the user's roster is used. */
  private List<String> existingNames;
}
