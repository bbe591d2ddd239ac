package com.flamingo.ai.mano.domain.enums;

/** Template variant selected for a conversation. */
public enum ConversationType {
  /** Conversation about a specific team member. */
  PERSON,

  /** Self-reflection conversation about the manager. */
  SELF,

  /** Free-form topic conversation. */
  GENERAL
}
