package com.flamingo.ai.mano.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Profile details of the manager, used to personalise prompts. */
@Entity
@Table(name = "user_profiles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfile {

  @Id
  @Column(name = "user_id")
  private String userId;

  @Column(name = "call_name")
  private String callName;

  @Column(name = "job_role")
  private String jobRole;

  private String company;

  /** Free-form background the manager wrote about themselves. */
  @Column(name = "profile_context", columnDefinition = "TEXT")
  private String profileContext;
}
