package com.flamingo.ai.mano.domain.enums;

/** Author of a conversation message. */
public enum MessageRole {
  /** Message written by the manager. */
  USER,

  /** Reply produced by the coach. */
  ASSISTANT
}
