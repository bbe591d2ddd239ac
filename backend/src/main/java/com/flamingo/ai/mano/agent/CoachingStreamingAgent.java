package com.flamingo.ai.mano.agent;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.service.TokenStream;
import java.util.List;

/**
 * Streams the coach's reply. The system prompt is rendered per turn from the management context,
 * so the caller passes the complete message list instead of relying on annotations.
 */
public interface CoachingStreamingAgent {

  TokenStream chat(List<ChatMessage> messages);
}
